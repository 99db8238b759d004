package workpipe.jdbc;

import java.time.Instant;
import java.util.Objects;

/**
 * A row of the {@code work_item} backlog table.
 *
 * @param itemKey   unique key of the item, such as a document id
 * @param sourceId  optional source the item came from, matched by {@code WorkFilter.sourceId}
 * @param mimeType  optional mime type, matched by {@code WorkFilter.mimeType}
 * @param payload   optional application data, opaque to the queue
 * @param createdAt backlog order; {@code null} until enqueued
 */
public record WorkItem(String itemKey, String sourceId, String mimeType, String payload, Instant createdAt) {

  public WorkItem {
    Objects.requireNonNull(itemKey, "itemKey");
    if (itemKey.isEmpty()) {
      throw new IllegalArgumentException("itemKey must not be empty");
    }
  }

  public static WorkItem of(String itemKey) {
    return new WorkItem(itemKey, null, null, null, null);
  }

  public static WorkItem of(String itemKey, String sourceId, String mimeType, String payload) {
    return new WorkItem(itemKey, sourceId, mimeType, payload, null);
  }

  public WorkItem withCreatedAt(Instant createdAt) {
    return new WorkItem(itemKey, sourceId, mimeType, payload, createdAt);
  }
}
