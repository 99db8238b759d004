package workpipe.ratelimit;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Thrown by a call to an external service that refused the request because of rate
 * limiting (HTTP 429, 503, or a provider-specific quota error).
 *
 * <p>{@link RateLimitGate} routes it to {@link RateLimiter#recordRateLimit} instead of
 * treating it as an ordinary item failure.
 */
public class RateLimitedException extends RuntimeException {

  private final String backend;
  private final Duration retryAfter;

  /**
   * @param backend    name of the service that throttled the call
   * @param retryAfter server-requested wait, or {@code null} if none was given
   */
  public RateLimitedException(String backend, Duration retryAfter) {
    this(backend, retryAfter, "Rate limited by " + backend
        + (retryAfter != null ? " (retry after " + retryAfter + ")" : ""));
  }

  public RateLimitedException(String backend, Duration retryAfter, String message) {
    super(message);
    this.backend = Objects.requireNonNull(backend, "backend");
    if (retryAfter != null && retryAfter.isNegative()) {
      throw new IllegalArgumentException("retryAfter must not be negative");
    }
    this.retryAfter = retryAfter;
  }

  public String backend() {
    return backend;
  }

  public Optional<Duration> retryAfter() {
    return Optional.ofNullable(retryAfter);
  }
}
