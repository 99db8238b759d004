package workpipe.queue;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Proof of a successful claim, consumed by exactly one of
 * {@link WorkQueue#complete} or {@link WorkQueue#fail}.
 *
 * <p>Closing a handle that was never consumed only logs a warning. The claim itself stays
 * live until the backend's claim-expiry window passes; use {@link ClaimScope} to make sure
 * every exit path resolves the claim.
 *
 * @param <T> item type
 */
public final class WorkHandle<T> implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(WorkHandle.class.getName());

    private final T item;
    private final ClaimId claimId;
    private final AtomicBoolean consumed = new AtomicBoolean();

    public WorkHandle(T item, ClaimId claimId) {
        this.item = Objects.requireNonNull(item, "item");
        this.claimId = Objects.requireNonNull(claimId, "claimId");
    }

    public T item() {
        return item;
    }

    public ClaimId claimId() {
        return claimId;
    }

    public boolean isConsumed() {
        return consumed.get();
    }

    /**
     * Marks this handle consumed. Called by queue implementations at the start of
     * {@code complete} and {@code fail}.
     *
     * @throws IllegalStateException if the handle was already consumed
     */
    public void consume() {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("Work handle already consumed: " + claimId);
        }
    }

    @Override
    public void close() {
        if (!consumed.get()) {
            logger.warning("Work handle " + claimId + " closed without complete or fail;"
                    + " the claim stays live until it expires");
        }
    }

    @Override
    public String toString() {
        return "WorkHandle{" + claimId + ", consumed=" + consumed.get() + "}";
    }
}
