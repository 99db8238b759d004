package workpipe.pipeline;

/**
 * Outcome of one {@link PipelineStage#runChunk} call.
 *
 * @param succeeded items processed and completed
 * @param failed    items whose processing failed
 * @param skipped   items skipped, including lost claim races
 * @param hasMore   whether the stage may have more work
 */
public record ChunkResult(int succeeded, int failed, int skipped, boolean hasMore) {

    private static final ChunkResult EMPTY = new ChunkResult(0, 0, 0, false);

    public ChunkResult {
        if (succeeded < 0 || failed < 0 || skipped < 0) {
            throw new IllegalArgumentException("counts must be >= 0");
        }
    }

    public static ChunkResult empty() {
        return EMPTY;
    }

    /** Returns {@code succeeded + failed + skipped}. */
    public int processed() {
        return succeeded + failed + skipped;
    }
}
