package workpipe.ratelimit;

import java.time.Duration;

/**
 * Bounded exponential backoff for inline retries that are not tied to a domain's state.
 *
 * <p>Delay formula: {@code min(baseMs * 2^attempt, capMs)}, starting at attempt 0.
 */
public final class ExponentialBackoff {
  private final long baseMs;
  private final long capMs;

  /**
   * @param baseMs delay for attempt 0 (milliseconds)
   * @param capMs  maximum delay (milliseconds)
   */
  public ExponentialBackoff(long baseMs, long capMs) {
    if (baseMs <= 0) {
      throw new IllegalArgumentException("baseMs must be > 0, got: " + baseMs);
    }
    if (capMs < baseMs) {
      throw new IllegalArgumentException("capMs must be >= baseMs, got: " + capMs);
    }
    this.baseMs = baseMs;
    this.capMs = capMs;
  }

  public long delayMs(int attempt) {
    if (attempt < 0) {
      throw new IllegalArgumentException("attempt must be >= 0, got: " + attempt);
    }
    if (attempt >= 62) {
      return capMs;
    }
    long shift = 1L << attempt;
    // Overflow guard: once the multiplier alone exceeds the cap ratio, return the cap
    if (shift > capMs / baseMs) {
      return capMs;
    }
    return Math.min(capMs, baseMs * shift);
  }

  public Duration delay(int attempt) {
    return Duration.ofMillis(delayMs(attempt));
  }
}
