package workpipe.pipeline;

import workpipe.queue.Doc;
import workpipe.queue.InMemoryWorkQueue;
import workpipe.queue.WorkFilter;
import workpipe.queue.WorkQueueException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AbstractWorkQueueStageTest {
    private static final WorkFilter EXTRACT = WorkFilter.of("extract");

    private InMemoryWorkQueue<Doc> queue;
    private final List<PipelineEvent> events = new CopyOnWriteArrayList<>();
    private final EventSink sink = events::add;
    private DocStage stage;

    @BeforeEach
    void setUp() {
        queue = Doc.queueBuilder().build();
        for (int i = 1; i <= 5; i++) {
            queue.add(Doc.of("doc-" + i));
        }
    }

    @AfterEach
    void tearDown() {
        if (stage != null) {
            stage.close();
        }
    }

    @Test
    void processesBacklogInChunks() {
        stage = new DocStage("extract", queue, EXTRACT, doc -> "ok");

        ChunkResult first = stage.runChunk(3, 0, sink);
        ChunkResult second = stage.runChunk(3, 0, sink);
        ChunkResult third = stage.runChunk(3, 0, sink);

        assertEquals(new ChunkResult(3, 0, 0, true), first);
        assertEquals(new ChunkResult(2, 0, 0, false), second);
        assertEquals(ChunkResult.empty(), third);
        assertEquals(0, stage.count());
        assertEquals(5, events.stream().filter(e -> e instanceof PipelineEvent.ItemStarted).count());
        assertEquals(5, events.stream().filter(e -> e instanceof PipelineEvent.ItemCompleted).count());
    }

    @Test
    void remainingLimitCapsTheBatch() {
        stage = new DocStage("extract", queue, EXTRACT, doc -> "ok");

        ChunkResult result = stage.runChunk(10, 2, sink);

        assertEquals(2, result.processed());
        assertTrue(result.hasMore());
        assertEquals(3, stage.count());
    }

    @Test
    void failedItemDoesNotAbortChunk() {
        stage = new DocStage("extract", queue, EXTRACT, doc -> {
            if (doc.id().equals("doc-2")) {
                throw new IOException("unreadable file");
            }
            return "ok";
        });

        ChunkResult result = stage.runChunk(10, 0, sink);

        assertEquals(4, result.succeeded());
        assertEquals(1, result.failed());
        assertEquals("unreadable file", queue.lastError("doc-2", EXTRACT));
        PipelineEvent.ItemFailed failed = events.stream()
                .filter(e -> e instanceof PipelineEvent.ItemFailed)
                .map(e -> (PipelineEvent.ItemFailed) e)
                .findFirst().orElseThrow();
        assertEquals("doc-2", failed.itemId());
        assertEquals("unreadable file", failed.error());
    }

    @Test
    void skipCompletesClaimWithoutCountingSuccess() {
        stage = new DocStage("extract", queue, EXTRACT, doc -> {
            if (doc.id().equals("doc-1")) {
                throw new SkipItemException("already has text");
            }
            return "ok";
        });

        ChunkResult result = stage.runChunk(10, 0, sink);

        assertEquals(4, result.succeeded());
        assertEquals(1, result.skipped());
        assertTrue(events.contains(new PipelineEvent.ItemSkipped("extract", "doc-1")));
        stage.reset();
        assertEquals(ChunkResult.empty(), stage.runChunk(10, 0, sink));
    }

    @Test
    void lostClaimRaceCountsAsSkipped() {
        FlakyQueue<Doc> flaky = new FlakyQueue<>(queue, Doc::id)
                .failClaim("doc-3", WorkQueueException.alreadyClaimed("doc-3"));
        stage = new DocStage("extract", flaky, EXTRACT, doc -> "ok");

        ChunkResult result = stage.runChunk(10, 0, sink);

        assertEquals(new ChunkResult(4, 0, 1, false), result);
        assertFalse(events.contains(new PipelineEvent.ItemStarted("extract", "doc-3", "doc-3")));
    }

    @Test
    void transientQueueErrorAbortsChunk() {
        FlakyQueue<Doc> flaky = new FlakyQueue<>(queue, Doc::id)
                .failClaim("doc-2", WorkQueueException.database("deadlock", null));
        stage = new DocStage("extract", flaky, EXTRACT, doc -> "ok");

        PipelineException e = assertThrows(PipelineException.class, () -> stage.runChunk(10, 0, sink));

        assertEquals(PipelineException.Kind.WORK_QUEUE, e.kind());
        assertInstanceOf(WorkQueueException.class, e.getCause());
    }

    @Test
    void processesChunkConcurrently() {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        for (int i = 6; i <= 8; i++) {
            queue.add(Doc.of("doc-" + i));
        }
        stage = new DocStage("summarize", queue, WorkFilter.of("summarize"), doc -> {
            int now = active.incrementAndGet();
            maxActive.accumulateAndGet(now, Math::max);
            Thread.sleep(50);
            active.decrementAndGet();
            return "ok";
        }).concurrency(4);

        ChunkResult result = stage.runChunk(8, 0, sink);

        assertEquals(8, result.succeeded());
        assertTrue(maxActive.get() > 1, "expected parallel processing, max was " + maxActive.get());
        assertTrue(maxActive.get() <= 4);
    }

    @Test
    void timedOutItemCountsAsFailed() throws InterruptedException {
        WorkFilter summarize = WorkFilter.of("summarize");
        stage = new DocStage("summarize", queue, summarize, doc -> {
            if (doc.id().equals("doc-1")) {
                Thread.sleep(10_000);
            }
            return "ok";
        }).concurrency(2).itemTimeout(Duration.ofMillis(200));

        ChunkResult result = stage.runChunk(5, 0, sink);

        assertEquals(4, result.succeeded());
        assertEquals(1, result.failed());
        awaitAttempts("doc-1", summarize, 1);
        assertEquals("timed out after PT0.2S", queue.lastError("doc-1", summarize));
        assertEquals(1, eventsFor("doc-1", PipelineEvent.ItemFailed.class));
        assertEquals(0, eventsFor("doc-1", PipelineEvent.ItemCompleted.class));
    }

    @Test
    void queuedItemsGetTheirOwnTimeout() {
        queue.add(Doc.of("doc-6"));
        stage = new DocStage("summarize", queue, WorkFilter.of("summarize"), doc -> {
            Thread.sleep(150);
            return "ok";
        }).concurrency(2).itemTimeout(Duration.ofMillis(400));

        ChunkResult result = stage.runChunk(6, 0, sink);

        assertEquals(new ChunkResult(6, 0, 0, true), result);
        assertEquals(0, events.stream().filter(e -> e instanceof PipelineEvent.ItemFailed).count());
    }

    @Test
    void itemIgnoringInterruptIsReportedFailedOnce() throws InterruptedException {
        WorkFilter summarize = WorkFilter.of("summarize");
        stage = new DocStage("summarize", queue, summarize, doc -> {
            if (doc.id().equals("doc-1")) {
                busyFor(Duration.ofMillis(600));
            }
            return "ok";
        }).concurrency(2).itemTimeout(Duration.ofMillis(200));

        ChunkResult result = stage.runChunk(5, 0, sink);

        assertEquals(4, result.succeeded());
        assertEquals(1, result.failed());
        awaitAttempts("doc-1", summarize, 1);
        assertEquals(1, eventsFor("doc-1", PipelineEvent.ItemFailed.class));
        assertEquals(0, eventsFor("doc-1", PipelineEvent.ItemCompleted.class));
        assertEquals(0, stage.count());
    }

    @Test
    void itemsBehindStuckWorkersStayUnclaimed() throws InterruptedException {
        WorkFilter summarize = WorkFilter.of("summarize");
        stage = new DocStage("summarize", queue, summarize, doc -> {
            if (doc.id().equals("doc-1") || doc.id().equals("doc-2")) {
                busyFor(Duration.ofMillis(800));
            }
            return "ok";
        }).concurrency(2).itemTimeout(Duration.ofMillis(150));

        ChunkResult first = stage.runChunk(5, 0, sink);

        assertEquals(new ChunkResult(0, 2, 0, true), first);
        assertEquals(0, eventsFor("doc-3", PipelineEvent.ItemStarted.class));
        awaitAttempts("doc-1", summarize, 1);
        awaitAttempts("doc-2", summarize, 1);

        ChunkResult second = stage.runChunk(5, 0, sink);

        assertEquals(new ChunkResult(3, 0, 0, false), second);
    }

    @Test
    void rejectsNonPositiveChunkSize() {
        stage = new DocStage("extract", queue, EXTRACT, doc -> "ok");

        assertThrows(IllegalArgumentException.class, () -> stage.runChunk(0, 0, sink));
    }

    private long eventsFor(String itemId, Class<? extends PipelineEvent> type) {
        return events.stream()
                .filter(type::isInstance)
                .filter(e -> itemId.equals(itemIdOf(e)))
                .count();
    }

    private static String itemIdOf(PipelineEvent event) {
        if (event instanceof PipelineEvent.ItemStarted e) {
            return e.itemId();
        } else if (event instanceof PipelineEvent.ItemCompleted e) {
            return e.itemId();
        } else if (event instanceof PipelineEvent.ItemSkipped e) {
            return e.itemId();
        } else if (event instanceof PipelineEvent.ItemFailed e) {
            return e.itemId();
        }
        return null;
    }

    private void awaitAttempts(String itemId, WorkFilter filter, int attempts) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (queue.attempts(itemId, filter) < attempts && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(attempts, queue.attempts(itemId, filter));
    }

    // Keeps running past cancellation
    private static void busyFor(Duration duration) {
        long until = System.nanoTime() + duration.toNanos();
        while (System.nanoTime() < until) {
            try {
                Thread.sleep(10);
            } catch (InterruptedException ignored) {
                // ignored on purpose
            }
        }
    }
}
