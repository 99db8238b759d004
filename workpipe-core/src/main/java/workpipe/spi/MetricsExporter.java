package workpipe.spi;

/**
 * Observability hook for exporting pipeline and rate-limit counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer or another monitoring system.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of items a stage processed and completed.
     *
     * @param stage stage name
     */
    void incrementItemSucceeded(String stage);

    /**
     * Increments the count of items a stage failed.
     *
     * @param stage stage name
     */
    void incrementItemFailed(String stage);

    /**
     * Increments the count of items a stage skipped, including lost claim races.
     *
     * @param stage stage name
     */
    void incrementItemSkipped(String stage);

    /**
     * Increments the count of progress events dropped because the event channel was full.
     */
    void incrementEventsDropped();

    /**
     * Records the number of items still claimable for a stage.
     *
     * @param stage   stage name
     * @param backlog remaining items (always non-negative)
     */
    void recordBacklog(String stage, long backlog);

    /**
     * Increments the count of rate-limit signals observed for a domain.
     *
     * @param domain the throttled domain
     */
    default void incrementRateLimitHit(String domain) {
    }

    /**
     * Records the current request delay for a domain.
     *
     * @param domain  the domain
     * @param delayMs delay in milliseconds
     */
    default void recordDomainDelayMs(String domain, long delayMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementItemSucceeded(String stage) {
        }

        @Override
        public void incrementItemFailed(String stage) {
        }

        @Override
        public void incrementItemSkipped(String stage) {
        }

        @Override
        public void incrementEventsDropped() {
        }

        @Override
        public void recordBacklog(String stage, long backlog) {
        }
    }
}
