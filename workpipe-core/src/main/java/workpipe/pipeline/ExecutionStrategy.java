package workpipe.pipeline;

/**
 * How {@link PipelineRunner} drives its stages.
 */
public enum ExecutionStrategy {
    /** Drain each stage over the whole backlog before starting the next. */
    WIDE,
    /**
     * Drive chunks through the stage sequence; deferred stages run concurrently and
     * consume what upstream stages produce.
     */
    DEEP
}
