package workpipe.pipeline;

import java.util.Objects;

/**
 * Progress event emitted by stages and the runner.
 *
 * <p>Events are plain immutable data so they can cross the bounded {@link EventChannel}
 * to a single consumer thread.
 */
public sealed interface PipelineEvent {

    String stage();

    record StageStarted(String stage, long totalItems) implements PipelineEvent {
        public StageStarted {
            Objects.requireNonNull(stage, "stage");
        }
    }

    record ItemStarted(String stage, String itemId, String label) implements PipelineEvent {
        public ItemStarted {
            Objects.requireNonNull(stage, "stage");
            Objects.requireNonNull(itemId, "itemId");
        }
    }

    /**
     * @param detail optional summary of the result, may be {@code null}
     */
    record ItemCompleted(String stage, String itemId, String detail) implements PipelineEvent {
        public ItemCompleted {
            Objects.requireNonNull(stage, "stage");
            Objects.requireNonNull(itemId, "itemId");
        }
    }

    record ItemSkipped(String stage, String itemId) implements PipelineEvent {
        public ItemSkipped {
            Objects.requireNonNull(stage, "stage");
            Objects.requireNonNull(itemId, "itemId");
        }
    }

    record ItemFailed(String stage, String itemId, String error) implements PipelineEvent {
        public ItemFailed {
            Objects.requireNonNull(stage, "stage");
            Objects.requireNonNull(itemId, "itemId");
        }
    }

    /**
     * @param remaining claimable items left after the stage finished
     */
    record StageCompleted(String stage, long succeeded, long failed, long skipped, long remaining)
            implements PipelineEvent {
        public StageCompleted {
            Objects.requireNonNull(stage, "stage");
        }
    }
}
