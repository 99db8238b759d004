package workpipe.jdbc;

import workpipe.jdbc.store.AbstractJdbcWorkStore;
import workpipe.queue.WorkFilter;
import workpipe.queue.WorkHandle;
import workpipe.queue.WorkQueueException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Work queue behavior every dialect must share. Subclasses provide the DataSource and store.
 */
abstract class AbstractWorkQueueIntegrationTest {
  static final WorkFilter OCR = WorkFilter.of("ocr");

  DataSource dataSource;
  MutableClock clock;
  JdbcWorkQueue queue;

  abstract DataSource dataSource() throws Exception;

  abstract AbstractJdbcWorkStore store();

  @BeforeEach
  void setUpQueue() throws Exception {
    dataSource = dataSource();
    Schema.truncate(dataSource);
    clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    queue = queue("worker-a");
  }

  JdbcWorkQueue queue(String ownerId) {
    return JdbcWorkQueue.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .store(store())
        .ownerId(ownerId)
        .clock(clock)
        .build();
  }

  @Test
  void fetchesOldestFirst() {
    enqueue("doc-b", "doc-a", "doc-c");

    List<WorkItem> batch = queue.fetchBatch(OCR, 10);

    assertEquals(List.of("doc-b", "doc-a", "doc-c"), keys(batch));
    assertEquals(3, queue.count(OCR));
    assertEquals(Instant.parse("2024-05-01T10:00:00Z"), batch.get(0).createdAt());
  }

  @Test
  void enqueueSkipsKnownKeys() {
    assertTrue(queue.enqueue(WorkItem.of("doc-1")));
    assertFalse(queue.enqueue(WorkItem.of("doc-1")));

    assertEquals(2, queue.enqueueAll(List.of(WorkItem.of("doc-1"), WorkItem.of("doc-2"), WorkItem.of("doc-3"))));
    assertEquals(List.of("doc-1", "doc-2", "doc-3"), keys(queue.fetchBatch(OCR, 10)));
  }

  @Test
  void cursorPagesThroughBacklog() {
    enqueue("d1", "d2", "d3", "d4", "d5");

    List<WorkItem> first = queue.fetchBatch(OCR, 2, null);
    List<WorkItem> second = queue.fetchBatch(OCR, 2, queue.cursorOf(first.get(1)));
    List<WorkItem> third = queue.fetchBatch(OCR, 2, queue.cursorOf(second.get(1)));

    assertEquals(List.of("d1", "d2"), keys(first));
    assertEquals(List.of("d3", "d4"), keys(second));
    assertEquals(List.of("d5"), keys(third));
  }

  @Test
  void claimIsExclusiveAcrossOwners() {
    enqueue("doc-1");
    JdbcWorkQueue other = queue("worker-b");

    WorkHandle<WorkItem> handle = queue.claim(WorkItem.of("doc-1"), OCR);
    WorkQueueException e = assertThrows(WorkQueueException.class, () -> other.claim(WorkItem.of("doc-1"), OCR));

    assertTrue(e.isAlreadyClaimed());
    assertEquals(0, other.count(OCR));
    queue.complete(handle);
  }

  @Test
  void completedItemNeverReturns() {
    enqueue("doc-1");
    queue.complete(queue.claim(WorkItem.of("doc-1"), OCR));

    clock.advance(Duration.ofDays(30));

    assertEquals(0, queue.count(OCR));
    assertThrows(WorkQueueException.class, () -> queue.claim(WorkItem.of("doc-1"), OCR));
    assertEquals(ClaimStatus.COMPLETE, queue.claimState("doc-1", OCR).orElseThrow().status());
  }

  @Test
  void failedItemReturnsAfterRetryInterval() {
    enqueue("doc-1");
    queue.fail(queue.claim(WorkItem.of("doc-1"), OCR), "tesseract crashed", false);

    clock.advance(Duration.ofHours(11));
    assertEquals(0, queue.count(OCR));

    clock.advance(Duration.ofHours(1));
    assertEquals(1, queue.count(OCR));
    AbstractJdbcWorkStore.ClaimRow row = queue.claimState("doc-1", OCR).orElseThrow();
    assertEquals(ClaimStatus.FAILED, row.status());
    assertEquals(1, row.attempts());
    assertEquals("tesseract crashed", row.lastError());

    queue.fail(queue.claim(WorkItem.of("doc-1"), OCR), "still broken", true);
    assertEquals(2, queue.claimState("doc-1", OCR).orElseThrow().attempts());
  }

  @Test
  void abandonedClaimExpires() {
    enqueue("doc-1");
    queue.claim(WorkItem.of("doc-1"), OCR);
    JdbcWorkQueue other = queue("worker-b");

    clock.advance(Duration.ofMinutes(89));
    assertThrows(WorkQueueException.class, () -> other.claim(WorkItem.of("doc-1"), OCR));

    clock.advance(Duration.ofMinutes(1));
    WorkHandle<WorkItem> retaken = other.claim(WorkItem.of("doc-1"), OCR);
    assertEquals("worker-b", queue.claimState("doc-1", OCR).orElseThrow().owner());
    other.complete(retaken);
  }

  @Test
  void staleOwnerCannotFailRetakenClaim() {
    enqueue("doc-1");
    WorkHandle<WorkItem> stale = queue.claim(WorkItem.of("doc-1"), OCR);
    clock.advance(Duration.ofMinutes(90));
    JdbcWorkQueue other = queue("worker-b");
    WorkHandle<WorkItem> fresh = other.claim(WorkItem.of("doc-1"), OCR);

    queue.fail(stale, "too slow", false);

    AbstractJdbcWorkStore.ClaimRow row = queue.claimState("doc-1", OCR).orElseThrow();
    assertEquals(ClaimStatus.PENDING, row.status());
    assertEquals(0, row.attempts());
    other.complete(fresh);
  }

  @Test
  void expiredHandleOfSameOwnerCannotFailRetakenClaim() {
    WorkFilter noRetryWait = OCR.withRetryIntervalHours(0);
    enqueue("doc-1");
    WorkHandle<WorkItem> expired = queue.claim(WorkItem.of("doc-1"), noRetryWait);
    clock.advance(Duration.ofMinutes(90));
    WorkHandle<WorkItem> live = queue.claim(WorkItem.of("doc-1"), noRetryWait);

    queue.fail(expired, "too slow", false);

    AbstractJdbcWorkStore.ClaimRow row = queue.claimState("doc-1", noRetryWait).orElseThrow();
    assertEquals(ClaimStatus.PENDING, row.status());
    assertEquals(0, row.attempts());
    WorkQueueException e = assertThrows(WorkQueueException.class,
        () -> queue("worker-b").claim(WorkItem.of("doc-1"), noRetryWait));
    assertTrue(e.isAlreadyClaimed());

    queue.fail(live, "tesseract crashed", false);
    assertEquals(1, queue.claimState("doc-1", noRetryWait).orElseThrow().attempts());
  }

  @Test
  void claimsAreScopedByWorkTypeAndVersion() {
    enqueue("doc-1");
    queue.complete(queue.claim(WorkItem.of("doc-1"), OCR));

    assertEquals(1, queue.count(WorkFilter.of("summarize")));
    assertEquals(1, queue.count(OCR.withVersion(2)));
    assertNotNull(queue.claim(WorkItem.of("doc-1"), OCR.withVersion(2)));
  }

  @Test
  void prerequisiteRequiresCompletedUpstream() {
    enqueue("doc-1", "doc-2");
    WorkFilter summarize = WorkFilter.of("summarize").withPrerequisite("ocr");
    assertEquals(0, queue.count(summarize));

    queue.complete(queue.claim(WorkItem.of("doc-2"), OCR));

    assertEquals(List.of("doc-2"), keys(queue.fetchBatch(summarize, 10)));
  }

  @Test
  void filtersBySourceAndMimeType() {
    queue.enqueue(WorkItem.of("pdf-a", "source-a", "application/pdf", null));
    clock.advance(Duration.ofSeconds(1));
    queue.enqueue(WorkItem.of("img-a", "source-a", "image/png", null));
    clock.advance(Duration.ofSeconds(1));
    queue.enqueue(WorkItem.of("pdf-b", "source-b", "application/pdf", "{\"pages\":3}"));

    assertEquals(List.of("pdf-a", "pdf-b"), keys(queue.fetchBatch(OCR.withMimeType("application/pdf"), 10)));
    assertEquals(List.of("pdf-a", "img-a"), keys(queue.fetchBatch(OCR.withSourceId("source-a"), 10)));
    assertEquals("{\"pages\":3}", queue.fetchBatch(OCR.withSourceId("source-b"), 10).get(0).payload());
  }

  @Test
  void claimingUnknownItemIsNotFound() {
    WorkQueueException e = assertThrows(WorkQueueException.class, () -> queue.claim(WorkItem.of("ghost"), OCR));

    assertEquals(WorkQueueException.Kind.NOT_FOUND, e.kind());
  }

  @Test
  void longErrorsAreTruncated() {
    enqueue("doc-1");
    queue.fail(queue.claim(WorkItem.of("doc-1"), OCR), "x".repeat(10_000), false);

    String stored = queue.claimState("doc-1", OCR).orElseThrow().lastError();
    assertEquals(4000, stored.length());
    assertTrue(stored.endsWith("..."));
  }

  void enqueue(String... keys) {
    for (String key : keys) {
      queue.enqueue(WorkItem.of(key));
      clock.advance(Duration.ofSeconds(1));
    }
  }

  static List<String> keys(List<WorkItem> items) {
    return items.stream().map(WorkItem::itemKey).toList();
  }
}
