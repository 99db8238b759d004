package workpipe.ratelimit;

import java.util.Objects;

/**
 * Throttling state for one domain. Instances are immutable; backends store the value
 * returned by a {@link RateLimitBackend#update} mutation.
 *
 * @param domain               the domain (host name)
 * @param currentDelayMs       minimum spacing between requests
 * @param lastRequestAtMs      epoch millis of the last reserved request slot, 0 if none
 * @param consecutiveSuccesses successes since the last failure or recovery step
 * @param inBackoff            whether the delay was raised by a rate-limit signal
 * @param totalRequests        requests made against the domain
 * @param rateLimitHits        rate-limit signals observed
 */
public record DomainRateState(
    String domain,
    long currentDelayMs,
    long lastRequestAtMs,
    int consecutiveSuccesses,
    boolean inBackoff,
    long totalRequests,
    long rateLimitHits) {

  public DomainRateState {
    Objects.requireNonNull(domain, "domain");
    if (currentDelayMs < 0) {
      throw new IllegalArgumentException("currentDelayMs must be >= 0");
    }
  }

  public static DomainRateState initial(String domain, long baseDelayMs) {
    return new DomainRateState(domain, baseDelayMs, 0L, 0, false, 0L, 0L);
  }

  /**
   * Returns how long a request issued at {@code nowMs} must wait for its slot.
   */
  public long waitTimeMs(long nowMs) {
    if (lastRequestAtMs == 0L) {
      return 0L;
    }
    return Math.max(0L, lastRequestAtMs + currentDelayMs - nowMs);
  }

  /** Reserves a request slot at {@code slotMs}. */
  public DomainRateState withRequestAt(long slotMs) {
    return new DomainRateState(domain, currentDelayMs, slotMs, consecutiveSuccesses, inBackoff,
        totalRequests + 1, rateLimitHits);
  }

  public DomainRateState withDelay(long delayMs, boolean backoff) {
    return new DomainRateState(domain, delayMs, lastRequestAtMs, consecutiveSuccesses, backoff,
        totalRequests, rateLimitHits);
  }

  public DomainRateState withConsecutiveSuccesses(int successes) {
    return new DomainRateState(domain, currentDelayMs, lastRequestAtMs, successes, inBackoff,
        totalRequests, rateLimitHits);
  }

  public DomainRateState withRateLimitHit() {
    return new DomainRateState(domain, currentDelayMs, lastRequestAtMs, 0, true,
        totalRequests, rateLimitHits + 1);
  }
}
