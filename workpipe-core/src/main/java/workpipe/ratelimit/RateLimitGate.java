package workpipe.ratelimit;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.logging.Logger;

/**
 * Gates calls to a rate-limited external service through a {@link RateLimiter}.
 *
 * <p>Each attempt waits for the domain's next request slot, runs the call and reports the
 * outcome. A {@link RateLimitedException} backs the domain off and is retried inline up to
 * {@code maxRetries} times, waiting the server's {@code Retry-After} or the
 * {@link ExponentialBackoff} delay for that attempt. Other exceptions are reported as
 * ordinary failures and rethrown immediately.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class RateLimitGate {
  private static final Logger logger = Logger.getLogger(RateLimitGate.class.getName());

  private final RateLimiter limiter;
  private final int maxRetries;
  private final ExponentialBackoff backoff;

  private RateLimitGate(Builder builder) {
    this.limiter = Objects.requireNonNull(builder.limiter, "limiter");
    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    this.maxRetries = builder.maxRetries;
    this.backoff = builder.backoff != null ? builder.backoff : new ExponentialBackoff(1000L, 60_000L);
  }

  public static Builder builder() {
    return new Builder();
  }

  public RateLimiter limiter() {
    return limiter;
  }

  /**
   * Runs {@code call} against {@code domain}.
   *
   * @throws RateLimitedException if the call was still rate limited after all retries
   * @throws InterruptedException if interrupted while waiting for a slot or a retry
   * @throws Exception            whatever the call threw otherwise
   */
  public <T> T call(String domain, Callable<T> call) throws Exception {
    Objects.requireNonNull(domain, "domain");
    Objects.requireNonNull(call, "call");
    for (int attempt = 0; ; attempt++) {
      limiter.acquire(domain);
      try {
        T result = call.call();
        limiter.recordSuccess(domain);
        return result;
      } catch (RateLimitedException e) {
        limiter.recordRateLimit(domain, e.retryAfter().orElse(null));
        if (attempt >= maxRetries) {
          throw e;
        }
        long waitMs = backoff.delayMs(attempt);
        if (e.retryAfter().isPresent()) {
          waitMs = Math.min(e.retryAfter().get().toMillis(), limiter.config().retryAfterCap().toMillis());
        }
        logger.warning("Rate limited by " + e.backend() + " for " + domain + ", retry "
            + (attempt + 1) + "/" + maxRetries + " in " + waitMs + "ms");
        Thread.sleep(waitMs);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw e;
      } catch (Exception e) {
        limiter.recordFailure(domain, false);
        throw e;
      }
    }
  }

  public static final class Builder {
    private RateLimiter limiter;
    private int maxRetries = 3;
    private ExponentialBackoff backoff;

    private Builder() {
    }

    public Builder limiter(RateLimiter limiter) {
      this.limiter = limiter;
      return this;
    }

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder backoff(ExponentialBackoff backoff) {
      this.backoff = backoff;
      return this;
    }

    public RateLimitGate build() {
      return new RateLimitGate(this);
    }
  }
}
