package workpipe.queue;

import java.util.List;

/**
 * Claim/complete/fail lifecycle over a backlog of work items.
 *
 * <p>Claims are exclusive and time-bounded: an item claimed but never completed or failed
 * becomes claimable again once the backend's claim-expiry window passes, even if the
 * claiming process died. A failed item becomes claimable again after
 * {@link WorkFilter#retryInterval()}. Completion is terminal for a
 * {@code (workType, item, version)}.
 *
 * <p>Callers must persist their result before calling {@link #complete}, so a crash between
 * the two steps never hides a finished result behind a live claim.
 *
 * @param <T> item type
 * @see InMemoryWorkQueue
 */
public interface WorkQueue<T> {

    /**
     * Estimates the number of claimable items. Not an exact guarantee for a later claim.
     */
    long count(WorkFilter filter);

    /**
     * Fetches up to {@code limit} claimable items, oldest first.
     *
     * @param filter selection criteria
     * @param limit  maximum number of items
     * @param cursor value from {@link #cursorOf} for the last item of the previous batch,
     *               or {@code null} to start from the oldest item
     * @return items in deterministic order; empty when the backlog is exhausted
     * @throws WorkQueueException on store failures
     */
    List<T> fetchBatch(WorkFilter filter, int limit, String cursor);

    default List<T> fetchBatch(WorkFilter filter, int limit) {
        return fetchBatch(filter, limit, null);
    }

    /**
     * Atomically claims {@code item} for {@code filter}'s work type and version.
     *
     * @return a handle that must be passed to exactly one of {@link #complete} or {@link #fail}
     * @throws WorkQueueException with {@link WorkQueueException.Kind#ALREADY_CLAIMED} if another
     *                            live claim, or a completion, already exists
     */
    WorkHandle<T> claim(T item, WorkFilter filter);

    /**
     * Releases the claim and marks the item done.
     *
     * @throws IllegalStateException if the handle was already consumed
     */
    void complete(WorkHandle<T> handle);

    /**
     * Releases the claim and records {@code error}.
     *
     * @param requeue request immediate redelivery; polling backends ignore it and rely on
     *                the retry interval
     * @throws IllegalStateException if the handle was already consumed
     */
    void fail(WorkHandle<T> handle, String error, boolean requeue);

    /**
     * Returns an opaque cursor positioned after {@code item}, or {@code null} when the
     * backend pages natively.
     */
    default String cursorOf(T item) {
        return null;
    }
}
