package workpipe.pipeline;

import workpipe.queue.WorkFilter;
import workpipe.queue.WorkHandle;
import workpipe.queue.WorkQueue;
import workpipe.queue.WorkQueueException;
import workpipe.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link PipelineStage} backed by a {@link WorkQueue}.
 *
 * <p>Each chunk fetches a batch, then for every item: claims it (a lost race counts as
 * skipped), emits {@link PipelineEvent.ItemStarted}, runs {@link #process} and completes or
 * fails the claim. Item failures are recorded through {@link WorkQueue#fail} and never abort
 * the chunk. Transient queue errors abort the chunk with a {@link PipelineException}.
 *
 * <p>With {@link #concurrency()} above 1, items of a chunk run on a stage-owned pool. Each
 * item is bounded by {@link #itemTimeout()} from the moment its worker picks it up; a
 * timed-out item is interrupted, its claim is failed and it is reported failed once. Items
 * still queued when workers stay stuck past the timeout are left unclaimed for a later
 * chunk.
 *
 * @param <T> item type
 */
public abstract class AbstractWorkQueueStage<T> implements PipelineStage, AutoCloseable {
    private static final Logger logger = Logger.getLogger(AbstractWorkQueueStage.class.getName());

    public static final Duration DEFAULT_ITEM_TIMEOUT = Duration.ofMinutes(10);

    private enum Outcome { SUCCEEDED, FAILED, SKIPPED, NOT_STARTED }

    /**
     * Per-item state shared by the worker and the thread waiting on it. Exactly one of them
     * wins {@link #resolve()} and reports the item's outcome.
     */
    private static final class ItemRun {
        private static final int QUEUED = 0;
        private static final int RUNNING = 1;
        private static final int RESOLVED = 2;

        private final AtomicInteger state = new AtomicInteger(QUEUED);
        private final CountDownLatch started = new CountDownLatch(1);
        private volatile long startedNanos;

        boolean begin() {
            startedNanos = System.nanoTime();
            if (!state.compareAndSet(QUEUED, RUNNING)) {
                return false;
            }
            started.countDown();
            return true;
        }

        boolean awaitStart(long nanos) throws InterruptedException {
            return started.await(nanos, TimeUnit.NANOSECONDS);
        }

        boolean abandon() {
            return state.compareAndSet(QUEUED, RESOLVED);
        }

        boolean resolve() {
            return state.compareAndSet(RUNNING, RESOLVED);
        }

        long startedNanos() {
            return startedNanos;
        }
    }

    private record Processed(String detail, boolean skipped) {
    }

    private final String name;
    private final WorkQueue<T> queue;
    private final WorkFilter filter;

    private volatile String cursor;
    private ExecutorService pool;

    protected AbstractWorkQueueStage(String name, WorkQueue<T> queue, WorkFilter filter) {
        this.name = Objects.requireNonNull(name, "name");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.filter = Objects.requireNonNull(filter, "filter");
    }

    /**
     * Processes one claimed item and persists its result. Runs before the claim is
     * completed.
     *
     * @return optional detail for {@link PipelineEvent.ItemCompleted}, may be {@code null}
     * @throws SkipItemException if the item needs no work
     * @throws Exception         to fail the item
     */
    protected abstract String process(T item) throws Exception;

    /** Stable identifier of {@code item} used in events. */
    protected abstract String itemId(T item);

    /** Human-readable label for {@link PipelineEvent.ItemStarted}. */
    protected String label(T item) {
        return itemId(item);
    }

    /** Number of items of one chunk processed in parallel. */
    protected int concurrency() {
        return 1;
    }

    /** Upper bound for one item when {@link #concurrency()} is above 1. */
    protected Duration itemTimeout() {
        return DEFAULT_ITEM_TIMEOUT;
    }

    @Override
    public String name() {
        return name;
    }

    public WorkFilter filter() {
        return filter;
    }

    protected WorkQueue<T> queue() {
        return queue;
    }

    @Override
    public long count() {
        try {
            return queue.count(filter);
        } catch (WorkQueueException e) {
            throw PipelineException.workQueue(name, e);
        }
    }

    @Override
    public void reset() {
        cursor = null;
    }

    @Override
    public ChunkResult runChunk(int chunkSize, long remainingLimit, EventSink events) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        Objects.requireNonNull(events, "events");
        int batchLimit = remainingLimit > 0 ? (int) Math.min(chunkSize, remainingLimit) : chunkSize;

        List<T> items;
        try {
            items = queue.fetchBatch(filter, batchLimit, cursor);
        } catch (WorkQueueException e) {
            throw PipelineException.workQueue(name, e);
        }
        if (items.isEmpty()) {
            return ChunkResult.empty();
        }
        String chunkStart = cursor;
        cursor = queue.cursorOf(items.get(items.size() - 1));

        List<Outcome> outcomes = concurrency() > 1
                ? processConcurrently(items, events)
                : processSequentially(items, events);

        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        int firstNotStarted = -1;
        for (int i = 0; i < outcomes.size(); i++) {
            switch (outcomes.get(i)) {
                case SUCCEEDED -> succeeded++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
                case NOT_STARTED -> {
                    if (firstNotStarted < 0) {
                        firstNotStarted = i;
                    }
                }
            }
        }
        if (firstNotStarted >= 0) {
            // Unstarted items were never claimed; page back so the next chunk sees them
            cursor = firstNotStarted == 0 ? chunkStart : queue.cursorOf(items.get(firstNotStarted - 1));
            return new ChunkResult(succeeded, failed, skipped, true);
        }
        return new ChunkResult(succeeded, failed, skipped, items.size() >= batchLimit);
    }

    private List<Outcome> processSequentially(List<T> items, EventSink events) {
        List<Outcome> outcomes = new ArrayList<>(items.size());
        for (T item : items) {
            ItemRun run = new ItemRun();
            run.begin();
            outcomes.add(processOne(item, events, run));
        }
        return outcomes;
    }

    private List<Outcome> processConcurrently(List<T> items, EventSink events) {
        ExecutorService executor = pool();
        List<ItemRun> runs = new ArrayList<>(items.size());
        List<Future<Outcome>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            ItemRun run = new ItemRun();
            runs.add(run);
            futures.add(executor.submit(() -> run.begin() ? processOne(item, events, run) : Outcome.NOT_STARTED));
        }
        long timeoutNanos = itemTimeout().toNanos();
        long startWaitNanos = timeoutNanos;
        List<Outcome> outcomes = new ArrayList<>(items.size());
        PipelineException infrastructure = null;
        for (int i = 0; i < futures.size(); i++) {
            Future<Outcome> future = futures.get(i);
            ItemRun run = runs.get(i);
            String id = itemId(items.get(i));
            try {
                if (!run.awaitStart(startWaitNanos) && run.abandon()) {
                    // Workers are still busy with items that ignore interruption
                    future.cancel(false);
                    outcomes.add(Outcome.NOT_STARTED);
                    startWaitNanos = 0L;
                    continue;
                }
                outcomes.add(awaitItem(future, run, timeoutNanos, id, events));
            } catch (ExecutionException e) {
                if (e.getCause() instanceof PipelineException pe) {
                    if (infrastructure == null) infrastructure = pe; else infrastructure.addSuppressed(pe);
                } else {
                    throw PipelineException.other("Stage " + name + " worker failed", e.getCause());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw PipelineException.other("Stage " + name + " interrupted", e);
            }
        }
        if (infrastructure != null) {
            throw infrastructure;
        }
        return outcomes;
    }

    private Outcome awaitItem(Future<Outcome> future, ItemRun run, long timeoutNanos, String id, EventSink events)
            throws ExecutionException, InterruptedException {
        long waitNanos = run.startedNanos() + timeoutNanos - System.nanoTime();
        try {
            return future.get(Math.max(0L, waitNanos), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            if (!run.resolve()) {
                // The worker resolved the item while the wait expired
                return future.get();
            }
            future.cancel(true);
            logger.warning("Stage " + name + " item " + id + " timed out after " + itemTimeout());
            events.emit(new PipelineEvent.ItemFailed(name, id, timeoutMessage()));
            return Outcome.FAILED;
        }
    }

    private Outcome processOne(T item, EventSink events, ItemRun run) {
        String id = itemId(item);
        WorkHandle<T> handle;
        try {
            handle = queue.claim(item, filter);
        } catch (WorkQueueException e) {
            if (e.isTransient()) {
                throw PipelineException.workQueue(name, e);
            }
            if (!run.resolve()) {
                return Outcome.FAILED;
            }
            logger.fine("Stage " + name + " skipped " + id + ": " + e.getMessage());
            events.emit(new PipelineEvent.ItemSkipped(name, id));
            return Outcome.SKIPPED;
        }

        try (handle) {
            events.emit(new PipelineEvent.ItemStarted(name, id, label(item)));
            Processed processed;
            try {
                processed = invoke(handle.item());
            } catch (Exception e) {
                if (!run.resolve()) {
                    failTimedOut(handle, id);
                    return Outcome.FAILED;
                }
                queue.fail(handle, describe(e), false);
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                return failed(id, e, events);
            }
            if (!run.resolve()) {
                failTimedOut(handle, id);
                return Outcome.FAILED;
            }
            queue.complete(handle);
            if (processed.skipped()) {
                events.emit(new PipelineEvent.ItemSkipped(name, id));
                return Outcome.SKIPPED;
            }
            events.emit(new PipelineEvent.ItemCompleted(name, id, processed.detail()));
            return Outcome.SUCCEEDED;
        } catch (WorkQueueException e) {
            if (e.isTransient()) {
                throw PipelineException.workQueue(name, e);
            }
            return failed(id, e, events);
        }
    }

    private Processed invoke(T item) throws Exception {
        try {
            return new Processed(process(item), false);
        } catch (SkipItemException skip) {
            return new Processed(skip.getMessage(), true);
        }
    }

    /** Records the timeout on a claim whose outcome the waiting thread already reported. */
    private void failTimedOut(WorkHandle<T> handle, String id) {
        boolean interrupted = Thread.interrupted();
        try {
            queue.fail(handle, timeoutMessage(), false);
        } catch (WorkQueueException e) {
            logger.log(Level.WARNING, "Stage " + name + " could not fail timed-out item " + id
                    + "; its claim stays live until it expires", e);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private String timeoutMessage() {
        return "timed out after " + itemTimeout();
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isEmpty() ? e.getClass().getName() : message;
    }

    private Outcome failed(String id, Exception e, EventSink events) {
        String error = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
        logger.log(Level.FINE, "Stage " + name + " failed " + id, e);
        events.emit(new PipelineEvent.ItemFailed(name, id, error));
        return Outcome.FAILED;
    }

    private synchronized ExecutorService pool() {
        if (pool == null) {
            pool = Executors.newFixedThreadPool(concurrency(), new DaemonThreadFactory("stage-" + name));
        }
        return pool;
    }

    /**
     * Shuts down the stage's worker pool, if one was started.
     */
    @Override
    public synchronized void close() {
        if (pool != null) {
            pool.shutdownNow();
            pool = null;
        }
    }
}
