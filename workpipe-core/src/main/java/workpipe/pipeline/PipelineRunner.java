package workpipe.pipeline;

import workpipe.spi.MetricsExporter;
import workpipe.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives an ordered list of {@link PipelineStage}s until their backlog is exhausted or the
 * per-stage item limit is reached.
 *
 * <p>Two strategies:
 * <ul>
 *   <li><b>{@link ExecutionStrategy#WIDE WIDE}</b>: each stage is drained chunk by chunk
 *       before the next one starts.
 *   <li><b>{@link ExecutionStrategy#DEEP DEEP}</b>: non-deferred stages before the first
 *       deferred stage run chunk by chunk, interleaved, on the calling thread. Every
 *       deferred stage runs concurrently as a consumer loop on its own thread, rechecking
 *       for new work while upstream stages still produce. Non-deferred stages after the
 *       first deferred stage are drained once the consumers finish.
 * </ul>
 *
 * <p>A stage's loop ends when a chunk reports no more work, processes nothing, or the
 * limit is used up. Item outcomes are counted into {@link MetricsExporter} from the
 * events stages emit.
 *
 * <p>{@link #shutdown()} lets the in-flight chunk finish and starts no new chunk.
 * {@link #start} schedules repeated runs; a failed run is logged and the next one resumes
 * from the persisted backlog.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class PipelineRunner implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(PipelineRunner.class.getName());

    public static final int DEFAULT_CHUNK_SIZE = 50;
    public static final long DEFAULT_RECHECK_INTERVAL_MS = 200;

    private final List<PipelineStage> stages;
    private final int chunkSize;
    private final long limit;
    private final long recheckIntervalMs;
    private final long shutdownTimeoutMs;
    private final MetricsExporter metrics;

    private final AtomicBoolean running = new AtomicBoolean();
    private volatile boolean stopping;
    private volatile PipelineReport lastReport;
    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> scheduledRun;

    private PipelineRunner(Builder builder) {
        if (builder.stages.isEmpty()) {
            throw new IllegalArgumentException("At least one stage is required");
        }
        if (builder.chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        if (builder.limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0 (0 = unlimited)");
        }
        if (builder.recheckIntervalMs <= 0) {
            throw new IllegalArgumentException("recheckIntervalMs must be > 0");
        }
        this.stages = List.copyOf(builder.stages);
        this.chunkSize = builder.chunkSize;
        this.limit = builder.limit;
        this.recheckIntervalMs = builder.recheckIntervalMs;
        this.shutdownTimeoutMs = builder.shutdownTimeoutMs;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<PipelineStage> stages() {
        return stages;
    }

    /**
     * Runs all stages once under {@code strategy}.
     *
     * @param sink receives progress events; use an {@link EventChannel} to decouple slow consumers
     * @return per-stage totals
     * @throws PipelineException     if a stage hit an infrastructure error
     * @throws IllegalStateException if the runner was shut down or a run is already in progress
     */
    public PipelineReport run(ExecutionStrategy strategy, EventSink sink) {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(sink, "sink");
        if (stopping) {
            throw new IllegalStateException("PipelineRunner has been shut down");
        }
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A pipeline run is already in progress");
        }
        long startedAt = System.nanoTime();
        try {
            Pass pass = new Pass(new MetricsSink(sink, metrics));
            List<StageSummary> summaries = strategy == ExecutionStrategy.DEEP ? runDeep(pass) : runWide(pass);
            PipelineReport report = new PipelineReport(strategy, summaries,
                    Duration.ofNanos(System.nanoTime() - startedAt), stopping);
            lastReport = report;
            return report;
        } finally {
            running.set(false);
        }
    }

    /**
     * Schedules {@link #run} every {@code interval} (fixed delay), starting immediately.
     * Subsequent calls are no-ops if already started.
     */
    public synchronized void start(ExecutionStrategy strategy, EventSink sink, Duration interval) {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        if (stopping) {
            throw new IllegalStateException("PipelineRunner has been shut down");
        }
        if (scheduledRun != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("runner"));
        scheduledRun = scheduler.scheduleWithFixedDelay(() -> runScheduled(strategy, sink),
                0L, interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Executes one scheduled run, logging instead of propagating failures.
     */
    void runScheduled(ExecutionStrategy strategy, EventSink sink) {
        if (stopping) {
            return;
        }
        try {
            PipelineReport report = run(strategy, sink);
            if (report.totalSucceeded() + report.totalFailed() > 0) {
                logger.info("Pipeline run finished in " + report.elapsed().toMillis() + "ms: succeeded="
                        + report.totalSucceeded() + ", failed=" + report.totalFailed()
                        + ", skipped=" + report.totalSkipped());
            }
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Pipeline run failed", t);
        }
    }

    /**
     * Returns the report of the most recent completed run, or {@code null}.
     */
    public PipelineReport lastReport() {
        return lastReport;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Requests a graceful stop: the in-flight chunk finishes, no new chunk or scheduled run
     * starts. Further {@link #run} calls fail.
     */
    public void shutdown() {
        stopping = true;
        ScheduledFuture<?> task = scheduledRun;
        if (task != null) {
            task.cancel(false);
        }
    }

    public boolean isShutdown() {
        return stopping;
    }

    /**
     * Shuts down, waits up to the shutdown timeout for a scheduled run in progress, then
     * closes every stage that is {@link AutoCloseable}.
     */
    @Override
    public synchronized void close() {
        shutdown();
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                    logger.warning("Shutdown timeout exceeded; interrupting pipeline run");
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        for (PipelineStage stage : stages) {
            if (stage instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Failed to close stage " + stage.name(), e);
                }
            }
        }
    }

    private List<StageSummary> runWide(Pass pass) {
        List<StageSummary> summaries = new ArrayList<>(stages.size());
        for (PipelineStage stage : stages) {
            if (pass.halted()) {
                break;
            }
            summaries.add(drainStage(stage, new Tally(), pass));
        }
        return summaries;
    }

    private List<StageSummary> runDeep(Pass pass) {
        int firstDeferred = -1;
        for (int i = 0; i < stages.size(); i++) {
            if (stages.get(i).isDeferred()) {
                firstDeferred = i;
                break;
            }
        }
        if (firstDeferred < 0) {
            return runWide(pass);
        }

        List<PipelineStage> producers = stages.subList(0, firstDeferred);
        List<PipelineStage> deferred = new ArrayList<>();
        List<PipelineStage> trailing = new ArrayList<>();
        for (PipelineStage stage : stages.subList(firstDeferred, stages.size())) {
            (stage.isDeferred() ? deferred : trailing).add(stage);
        }
        Map<PipelineStage, Tally> tallies = new IdentityHashMap<>();
        stages.forEach(s -> tallies.put(s, new Tally()));
        Map<PipelineStage, StageSummary> summaries = new IdentityHashMap<>();

        AtomicBoolean producing = new AtomicBoolean(true);
        ExecutorService consumers = Executors.newFixedThreadPool(deferred.size(),
                new DaemonThreadFactory("deferred"));
        List<Future<?>> futures = new ArrayList<>(deferred.size());
        try {
            for (PipelineStage stage : deferred) {
                beginStage(stage, pass);
                futures.add(consumers.submit(() -> consume(stage, tallies.get(stage), producing, pass)));
            }
            for (PipelineStage stage : producers) {
                beginStage(stage, pass);
            }
            produce(producers, tallies, pass);
        } catch (RuntimeException e) {
            pass.fail(e);
            throw e;
        } finally {
            producing.set(false);
            awaitConsumers(futures, pass);
            consumers.shutdownNow();
        }

        for (PipelineStage stage : producers) {
            summaries.put(stage, finishStage(stage, tallies.get(stage), pass));
        }
        for (PipelineStage stage : deferred) {
            summaries.put(stage, finishStage(stage, tallies.get(stage), pass));
        }
        RuntimeException failure = pass.failure.get();
        if (failure != null) {
            throw failure;
        }
        for (PipelineStage stage : trailing) {
            if (pass.halted()) {
                break;
            }
            summaries.put(stage, drainStage(stage, tallies.get(stage), pass));
        }

        List<StageSummary> ordered = new ArrayList<>(stages.size());
        for (PipelineStage stage : stages) {
            StageSummary summary = summaries.get(stage);
            if (summary != null) {
                ordered.add(summary);
            }
        }
        return ordered;
    }

    private void produce(List<PipelineStage> producers, Map<PipelineStage, Tally> tallies, Pass pass) {
        boolean more = !producers.isEmpty();
        while (more && !pass.halted()) {
            more = false;
            for (PipelineStage stage : producers) {
                Tally tally = tallies.get(stage);
                long remaining = remainingFor(tally);
                if (remaining < 0) {
                    continue;
                }
                ChunkResult result = stage.runChunk(chunkSize, remaining, pass.sink);
                tally.add(result);
                if (result.hasMore() && result.processed() > 0) {
                    more = true;
                }
            }
        }
    }

    private void consume(PipelineStage stage, Tally tally, AtomicBoolean producing, Pass pass) {
        boolean finalPass = false;
        try {
            while (!pass.halted()) {
                long remaining = remainingFor(tally);
                if (remaining < 0) {
                    break;
                }
                boolean upstreamDone = !producing.get();
                ChunkResult result = stage.runChunk(chunkSize, remaining, pass.sink);
                tally.add(result);
                if (result.hasMore() && result.processed() > 0) {
                    continue;
                }
                if (upstreamDone && finalPass) {
                    break;
                }
                // Items upstream finished may sort before the cursor
                stage.reset();
                if (upstreamDone) {
                    finalPass = true;
                    continue;
                }
                Thread.sleep(recheckIntervalMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            pass.fail(e);
            throw e;
        }
    }

    private void awaitConsumers(List<Future<?>> futures, Pass pass) {
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                pass.fail(cause instanceof RuntimeException re
                        ? re : PipelineException.other("Deferred stage failed", cause));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pass.fail(PipelineException.other("Interrupted while waiting for deferred stages", e));
                futures.forEach(f -> f.cancel(true));
                return;
            }
        }
    }

    private StageSummary drainStage(PipelineStage stage, Tally tally, Pass pass) {
        beginStage(stage, pass);
        while (!pass.halted()) {
            long remaining = remainingFor(tally);
            if (remaining < 0) {
                break;
            }
            ChunkResult result = stage.runChunk(chunkSize, remaining, pass.sink);
            tally.add(result);
            if (!result.hasMore() || result.processed() == 0) {
                break;
            }
        }
        return finishStage(stage, tally, pass);
    }

    private void beginStage(PipelineStage stage, Pass pass) {
        stage.reset();
        long total = stage.count();
        metrics.recordBacklog(stage.name(), total);
        pass.sink.emit(new PipelineEvent.StageStarted(stage.name(), total));
    }

    private StageSummary finishStage(PipelineStage stage, Tally tally, Pass pass) {
        long remaining;
        try {
            remaining = stage.count();
            metrics.recordBacklog(stage.name(), remaining);
        } catch (PipelineException e) {
            logger.log(Level.WARNING, "Could not count remaining items for stage " + stage.name(), e);
            remaining = -1L;
        }
        StageSummary summary = tally.summary(stage.name(), remaining);
        pass.sink.emit(new PipelineEvent.StageCompleted(stage.name(),
                summary.succeeded(), summary.failed(), summary.skipped(), remaining));
        logger.fine("Stage " + stage.name() + " finished: " + summary);
        return summary;
    }

    /**
     * Returns the limit to pass to the next chunk: 0 when unlimited, -1 when used up.
     */
    private long remainingFor(Tally tally) {
        if (limit == 0L) {
            return 0L;
        }
        long left = limit - tally.processed();
        return left > 0 ? left : -1L;
    }

    private final class Pass {
        final EventSink sink;
        final AtomicReference<RuntimeException> failure = new AtomicReference<>();

        Pass(EventSink sink) {
            this.sink = sink;
        }

        boolean halted() {
            return stopping || failure.get() != null;
        }

        void fail(RuntimeException e) {
            if (!failure.compareAndSet(null, e) && failure.get() != e) {
                failure.get().addSuppressed(e);
            }
        }
    }

    private static final class Tally {
        final AtomicLong succeeded = new AtomicLong();
        final AtomicLong failed = new AtomicLong();
        final AtomicLong skipped = new AtomicLong();

        void add(ChunkResult result) {
            succeeded.addAndGet(result.succeeded());
            failed.addAndGet(result.failed());
            skipped.addAndGet(result.skipped());
        }

        long processed() {
            return succeeded.get() + failed.get() + skipped.get();
        }

        StageSummary summary(String stage, long remaining) {
            return new StageSummary(stage, succeeded.get(), failed.get(), skipped.get(), remaining);
        }
    }

    private record MetricsSink(EventSink delegate, MetricsExporter metrics) implements EventSink {
        @Override
        public void emit(PipelineEvent event) {
            if (event instanceof PipelineEvent.ItemCompleted e) {
                metrics.incrementItemSucceeded(e.stage());
            } else if (event instanceof PipelineEvent.ItemFailed e) {
                metrics.incrementItemFailed(e.stage());
            } else if (event instanceof PipelineEvent.ItemSkipped e) {
                metrics.incrementItemSkipped(e.stage());
            }
            delegate.emit(event);
        }
    }

    /** Builder for {@link PipelineRunner}. */
    public static final class Builder {
        private final List<PipelineStage> stages = new ArrayList<>();
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private long limit;
        private long recheckIntervalMs = DEFAULT_RECHECK_INTERVAL_MS;
        private long shutdownTimeoutMs = 30_000;
        private MetricsExporter metrics;

        private Builder() {
        }

        /** Appends a stage; stages run in the order they are added. */
        public Builder stage(PipelineStage stage) {
            stages.add(Objects.requireNonNull(stage, "stage"));
            return this;
        }

        public Builder stages(List<? extends PipelineStage> stages) {
            stages.forEach(this::stage);
            return this;
        }

        /** Maximum items per {@link PipelineStage#runChunk} call. */
        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        /** Maximum items each stage processes per run; 0 means unlimited. */
        public Builder limit(long limit) {
            this.limit = limit;
            return this;
        }

        /** How often an idle deferred stage rechecks for upstream output. */
        public Builder recheckIntervalMs(long recheckIntervalMs) {
            this.recheckIntervalMs = recheckIntervalMs;
            return this;
        }

        public Builder shutdownTimeoutMs(long shutdownTimeoutMs) {
            this.shutdownTimeoutMs = shutdownTimeoutMs;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public PipelineRunner build() {
            return new PipelineRunner(this);
        }
    }
}
