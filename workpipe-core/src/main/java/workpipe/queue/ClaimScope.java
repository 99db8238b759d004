package workpipe.queue;

import java.util.Objects;

/**
 * Runs work under a claim and resolves the claim on every exit path.
 *
 * <p>A task that returns normally completes the claim; any exception, including
 * interruption, fails it with the exception's message and is rethrown. If resolving the
 * claim itself fails, that error is attached as suppressed to the task's exception.
 *
 * <pre>{@code
 * try (WorkHandle<Doc> handle = queue.claim(doc, filter)) {
 *   String summary = ClaimScope.call(queue, handle, d -> summarizer.summarize(d));
 * }
 * }</pre>
 */
public final class ClaimScope {

    /**
     * Work performed while holding a claim.
     *
     * @param <T> item type
     * @param <R> result type
     */
    @FunctionalInterface
    public interface ClaimedTask<T, R> {
        R run(T item) throws Exception;
    }

    private ClaimScope() {
    }

    /**
     * Runs {@code task} on the claimed item, then completes or fails the claim.
     *
     * @return the task's result
     * @throws Exception whatever the task threw, after the claim was failed
     */
    public static <T, R> R call(WorkQueue<T> queue, WorkHandle<T> handle, ClaimedTask<? super T, R> task)
            throws Exception {
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(task, "task");
        R result;
        try {
            result = task.run(handle.item());
        } catch (Throwable t) {
            failQuietly(queue, handle, t);
            throw t;
        }
        queue.complete(handle);
        return result;
    }

    private static <T> void failQuietly(WorkQueue<T> queue, WorkHandle<T> handle, Throwable cause) {
        if (handle.isConsumed()) {
            return;
        }
        try {
            queue.fail(handle, describe(cause), false);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    static String describe(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isEmpty() ? t.getClass().getName() : message;
    }
}
