package workpipe.queue;

import java.util.Objects;

/**
 * Unchecked exception raised by {@link WorkQueue} operations.
 *
 * <p>{@link Kind#ALREADY_CLAIMED} is contention, not a failure: callers skip the item.
 * {@link Kind#DATABASE} and {@link Kind#CONNECTION} are transient infrastructure errors that
 * abort the current chunk; the next run re-derives its work from the persisted backlog.
 */
public class WorkQueueException extends RuntimeException {

    public enum Kind {
        DATABASE,
        ALREADY_CLAIMED,
        NOT_FOUND,
        CONNECTION,
        OTHER
    }

    private final Kind kind;

    public WorkQueueException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public WorkQueueException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static WorkQueueException alreadyClaimed(String itemKey) {
        return new WorkQueueException(Kind.ALREADY_CLAIMED, "Item already claimed: " + itemKey);
    }

    public static WorkQueueException notFound(String message) {
        return new WorkQueueException(Kind.NOT_FOUND, message);
    }

    public static WorkQueueException database(String message, Throwable cause) {
        return new WorkQueueException(Kind.DATABASE, message, cause);
    }

    public static WorkQueueException connection(String message, Throwable cause) {
        return new WorkQueueException(Kind.CONNECTION, message, cause);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isAlreadyClaimed() {
        return kind == Kind.ALREADY_CLAIMED;
    }

    /**
     * Returns {@code true} for store and connectivity errors that a later run may not hit.
     */
    public boolean isTransient() {
        return kind == Kind.DATABASE || kind == Kind.CONNECTION;
    }
}
