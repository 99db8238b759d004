package workpipe.pipeline;

import workpipe.queue.WorkQueueException;

import java.util.Objects;

/**
 * Unchecked exception that aborts the current chunk or run.
 *
 * <p>{@link Kind#WORK_QUEUE} wraps a transient {@link WorkQueueException}; the scheduled
 * runner logs it and resumes on the next run from persisted backlog state.
 */
public class PipelineException extends RuntimeException {

    public enum Kind {
        WORK_QUEUE,
        OTHER
    }

    private final Kind kind;

    public PipelineException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static PipelineException workQueue(String stage, WorkQueueException cause) {
        return new PipelineException(Kind.WORK_QUEUE,
                "Work queue error in stage " + stage + ": " + cause.getMessage(), cause);
    }

    public static PipelineException other(String message, Throwable cause) {
        return new PipelineException(Kind.OTHER, message, cause);
    }

    public Kind kind() {
        return kind;
    }
}
