package workpipe.pipeline;

/**
 * Totals for one stage over a runner pass.
 *
 * @param remaining claimable items left when the stage finished
 */
public record StageSummary(String stage, long succeeded, long failed, long skipped, long remaining) {

    public long processed() {
        return succeeded + failed + skipped;
    }
}
