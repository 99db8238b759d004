package workpipe.pipeline;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Result of one {@link PipelineRunner#run} call.
 *
 * @param strategy    strategy the run used
 * @param stages      per-stage totals, in stage order
 * @param elapsed     wall-clock duration of the run
 * @param interrupted whether the run stopped early because of a shutdown request
 */
public record PipelineReport(
        ExecutionStrategy strategy,
        List<StageSummary> stages,
        Duration elapsed,
        boolean interrupted) {

    public PipelineReport {
        stages = List.copyOf(stages);
    }

    public Optional<StageSummary> stage(String name) {
        return stages.stream().filter(s -> s.stage().equals(name)).findFirst();
    }

    public long totalSucceeded() {
        return stages.stream().mapToLong(StageSummary::succeeded).sum();
    }

    public long totalFailed() {
        return stages.stream().mapToLong(StageSummary::failed).sum();
    }

    public long totalSkipped() {
        return stages.stream().mapToLong(StageSummary::skipped).sum();
    }
}
