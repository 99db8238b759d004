package workpipe.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import workpipe.jdbc.store.H2WorkStore;
import workpipe.pipeline.AbstractWorkQueueStage;
import workpipe.pipeline.EventSink;
import workpipe.pipeline.ExecutionStrategy;
import workpipe.pipeline.PipelineReport;
import workpipe.pipeline.PipelineRunner;
import workpipe.queue.WorkFilter;
import workpipe.queue.WorkHandle;
import workpipe.queue.WorkQueueException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HikariCPIntegrationTest {
  private static final WorkFilter OCR = WorkFilter.of("ocr");

  private HikariDataSource hikariDs;
  private DataSourceConnectionProvider connectionProvider;

  @BeforeEach
  void setup() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(5);
    config.setMinimumIdle(1);
    config.setPoolName("workpipe-test-pool");

    hikariDs = new HikariDataSource(config);
    connectionProvider = new DataSourceConnectionProvider(hikariDs);
    Schema.apply(hikariDs, "h2");
  }

  @AfterEach
  void tearDown() {
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  @Test
  void concurrentWorkersClaimEachItemOnce() throws Exception {
    JdbcWorkQueue workerA = queue("worker-a");
    JdbcWorkQueue workerB = queue("worker-b");
    List<WorkItem> items = new ArrayList<>();
    for (int i = 0; i < 40; i++) {
      items.add(WorkItem.of("doc-" + i));
    }
    assertEquals(40, workerA.enqueueAll(items));

    int threadCount = 8;
    ExecutorService executor = Executors.newFixedThreadPool(threadCount);
    CountDownLatch start = new CountDownLatch(1);
    Map<String, String> winners = new ConcurrentHashMap<>();
    AtomicInteger lost = new AtomicInteger();
    AtomicInteger duplicates = new AtomicInteger();

    for (int t = 0; t < threadCount; t++) {
      JdbcWorkQueue queue = t % 2 == 0 ? workerA : workerB;
      executor.submit(() -> {
        start.await();
        for (WorkItem item : items) {
          try {
            WorkHandle<WorkItem> handle = queue.claim(item, OCR);
            if (winners.putIfAbsent(item.itemKey(), queue.ownerId()) != null) {
              duplicates.incrementAndGet();
            }
            queue.complete(handle);
          } catch (WorkQueueException e) {
            if (!e.isAlreadyClaimed()) {
              throw e;
            }
            lost.incrementAndGet();
          }
        }
        return null;
      });
    }

    start.countDown();
    executor.shutdown();
    assertTrue(executor.awaitTermination(20, TimeUnit.SECONDS));

    assertEquals(0, duplicates.get());
    assertEquals(40, winners.size());
    assertEquals(40 * (threadCount - 1), lost.get());
    assertEquals(0, workerA.count(OCR));
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }

  @Test
  void pipelineDrainsJdbcBacklogThroughPool() {
    JdbcWorkQueue queue = queue("pipeline");
    for (int i = 0; i < 12; i++) {
      queue.enqueue(WorkItem.of("doc-" + i, "inbox", "application/pdf", null));
    }
    List<String> summarized = new ArrayList<>();
    ItemStage ocr = new ItemStage("ocr", queue, OCR, item -> {
      if (item.itemKey().equals("doc-3")) {
        throw new IllegalStateException("unreadable scan");
      }
      return "ok";
    });
    ItemStage summarize = new ItemStage("summarize", queue, WorkFilter.of("summarize").withPrerequisite("ocr"),
        item -> {
          synchronized (summarized) {
            summarized.add(item.itemKey());
          }
          return "ok";
        });

    PipelineReport report;
    try (PipelineRunner runner = PipelineRunner.builder().stage(ocr).stage(summarize).chunkSize(5).build()) {
      report = runner.run(ExecutionStrategy.WIDE, EventSink.NOOP);
    }

    assertEquals(11, report.stage("ocr").orElseThrow().succeeded());
    assertEquals(1, report.stage("ocr").orElseThrow().failed());
    assertEquals(11, report.stage("summarize").orElseThrow().succeeded());
    assertEquals(11, summarized.size());
    assertFalse(summarized.contains("doc-3"));
    assertEquals("unreadable scan", queue.claimState("doc-3", OCR).orElseThrow().lastError());
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }

  private JdbcWorkQueue queue(String ownerId) {
    return JdbcWorkQueue.builder()
        .connectionProvider(connectionProvider)
        .store(new H2WorkStore())
        .ownerId(ownerId)
        .build();
  }

  @FunctionalInterface
  private interface ItemProcessor {
    String process(WorkItem item) throws Exception;
  }

  private static final class ItemStage extends AbstractWorkQueueStage<WorkItem> {
    private final ItemProcessor processor;

    ItemStage(String name, JdbcWorkQueue queue, WorkFilter filter, ItemProcessor processor) {
      super(name, queue, filter);
      this.processor = processor;
    }

    @Override
    protected String process(WorkItem item) throws Exception {
      return processor.process(item);
    }

    @Override
    protected String itemId(WorkItem item) {
      return item.itemKey();
    }
  }
}
