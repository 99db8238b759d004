package workpipe.pipeline;

/**
 * A self-contained unit of pipeline work, such as text extraction, OCR or summarization.
 *
 * <p>A stage owns its work queue: each {@link #runChunk} call fetches a batch, claims each
 * item, processes it, completes or fails the claim and emits one event per transition.
 *
 * @see AbstractWorkQueueStage
 */
public interface PipelineStage {

    String name();

    /**
     * Returns {@code true} when the stage is dominated by remote or rate-limited I/O.
     * Deferred stages run concurrently under {@link ExecutionStrategy#DEEP}.
     */
    default boolean isDeferred() {
        return false;
    }

    /**
     * Estimates the number of items this stage can still claim.
     */
    long count();

    /**
     * Processes at most {@code chunkSize} items, and at most {@code remainingLimit} when it
     * is positive.
     *
     * @param chunkSize      maximum batch size, {@code > 0}
     * @param remainingLimit items left under the run's limit; {@code 0} means unlimited
     * @param events         sink for progress events
     * @return counts for this chunk; {@code processed()} never exceeds the requested size
     * @throws PipelineException on infrastructure errors that abort the chunk
     */
    ChunkResult runChunk(int chunkSize, long remainingLimit, EventSink events);

    /**
     * Starts the next {@link #runChunk} from the beginning of the backlog. Called by the
     * runner before each stage pass and whenever a deferred stage rechecks for new work.
     */
    default void reset() {
    }
}
