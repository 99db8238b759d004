package workpipe.ratelimit;

import java.time.Duration;

/**
 * Read-only view of a domain's throttling state.
 */
public record DomainStats(Duration currentDelay, boolean inBackoff, long totalRequests, long rateLimitHits) {

  static DomainStats of(DomainRateState state) {
    return new DomainStats(Duration.ofMillis(state.currentDelayMs()), state.inBackoff(),
        state.totalRequests(), state.rateLimitHits());
  }
}
