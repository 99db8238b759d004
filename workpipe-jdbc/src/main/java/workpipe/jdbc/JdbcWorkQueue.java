package workpipe.jdbc;

import workpipe.jdbc.store.AbstractJdbcWorkStore;
import workpipe.queue.ClaimId;
import workpipe.queue.WorkFilter;
import workpipe.queue.WorkHandle;
import workpipe.queue.WorkQueue;
import workpipe.queue.WorkQueueException;
import workpipe.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link WorkQueue} over the {@code work_item} backlog and {@code work_claim} claim tables.
 *
 * <p>Every operation runs on its own auto-commit connection. A claim is a single guarded
 * write keyed by {@code (work_type, item_key, version)}, so workers in different processes
 * never both win the same item. A claim that is neither completed nor failed stays live for
 * the claim expiry (default 90 minutes) and is then claimable again.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class JdbcWorkQueue implements WorkQueue<WorkItem> {
  private static final Logger logger = Logger.getLogger(JdbcWorkQueue.class.getName());

  public static final Duration DEFAULT_CLAIM_EXPIRY = Duration.ofMinutes(90);

  private final ConnectionProvider connectionProvider;
  private final AbstractJdbcWorkStore store;
  private final String ownerId;
  private final Duration claimExpiry;
  private final Clock clock;

  private JdbcWorkQueue(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    this.claimExpiry = Objects.requireNonNull(builder.claimExpiry, "claimExpiry");
    if (claimExpiry.isNegative() || claimExpiry.isZero()) {
      throw new IllegalArgumentException("claimExpiry must be > 0");
    }
    this.ownerId = builder.ownerId != null ? builder.ownerId : "worker-" + UUID.randomUUID();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String ownerId() {
    return ownerId;
  }

  public AbstractJdbcWorkStore store() {
    return store;
  }

  /**
   * Adds an item to the backlog, stamping it with the current time if it has none.
   *
   * @return {@code false} if an item with the same key already exists
   */
  public boolean enqueue(WorkItem item) {
    Objects.requireNonNull(item, "item");
    WorkItem stamped = item.createdAt() != null ? item : item.withCreatedAt(clock.instant());
    return withConnection("enqueue " + item.itemKey(), conn -> store.insertItem(conn, stamped));
  }

  /**
   * Adds items to the backlog in one transaction.
   *
   * @return number of items added; existing keys are skipped
   */
  public int enqueueAll(List<WorkItem> items) {
    Objects.requireNonNull(items, "items");
    if (items.isEmpty()) {
      return 0;
    }
    Instant now = clock.instant();
    return withConnection("enqueue batch", conn -> {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        int added = 0;
        // Distinct timestamps keep the batch in list order
        for (int i = 0; i < items.size(); i++) {
          WorkItem item = items.get(i);
          WorkItem stamped = item.createdAt() != null ? item : item.withCreatedAt(now.plusMillis(i));
          if (store.insertItem(conn, stamped)) {
            added++;
          }
        }
        conn.commit();
        return added;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    });
  }

  @Override
  public long count(WorkFilter filter) {
    Objects.requireNonNull(filter, "filter");
    Instant now = clock.instant();
    return withConnection("count " + filter.workType(), conn ->
        store.countEligible(conn, filter, expiryCutoff(now), retryCutoff(filter, now)));
  }

  @Override
  public List<WorkItem> fetchBatch(WorkFilter filter, int limit, String cursor) {
    Objects.requireNonNull(filter, "filter");
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    AbstractJdbcWorkStore.Position after = parseCursor(cursor);
    Instant now = clock.instant();
    return withConnection("fetch " + filter.workType(), conn ->
        store.fetchEligible(conn, filter, expiryCutoff(now), retryCutoff(filter, now), after, limit));
  }

  @Override
  public WorkHandle<WorkItem> claim(WorkItem item, WorkFilter filter) {
    Objects.requireNonNull(item, "item");
    Objects.requireNonNull(filter, "filter");
    String key = item.itemKey();
    Instant now = clock.instant();
    String token = ClaimId.PendingClaim.newToken();
    boolean claimed = withConnection("claim " + key, conn -> {
      if (!store.itemExists(conn, key)) {
        throw WorkQueueException.notFound("Unknown item: " + key);
      }
      return store.claim(conn, filter, key, ownerId, token, now, expiryCutoff(now), retryCutoff(filter, now));
    });
    if (!claimed) {
      throw WorkQueueException.alreadyClaimed(key);
    }
    return new WorkHandle<>(item,
        new ClaimId.PendingClaim(filter.workType(), key, filter.version(), ownerId, token));
  }

  @Override
  public void complete(WorkHandle<WorkItem> handle) {
    ClaimId.PendingClaim claim = pendingClaim(handle);
    handle.consume();
    withConnection("complete " + claim.itemKey(), conn -> {
      int updated = store.markComplete(conn, claim.workType(), claim.itemKey(), claim.version(), clock.instant());
      if (updated == 0 && store.findClaim(conn, claim.workType(), claim.itemKey(), claim.version()).isEmpty()) {
        throw WorkQueueException.notFound("No claim for " + claim.itemKey());
      }
      return updated;
    });
  }

  @Override
  public void fail(WorkHandle<WorkItem> handle, String error, boolean requeue) {
    ClaimId.PendingClaim claim = pendingClaim(handle);
    handle.consume();
    withConnection("fail " + claim.itemKey(), conn -> {
      int updated = store.markFailed(conn, claim.workType(), claim.itemKey(), claim.version(),
          claim.token(), clock.instant(), error);
      if (updated == 0) {
        Optional<AbstractJdbcWorkStore.ClaimRow> row =
            store.findClaim(conn, claim.workType(), claim.itemKey(), claim.version());
        if (row.isEmpty()) {
          throw WorkQueueException.notFound("No claim for " + claim.itemKey());
        }
        logger.fine("Claim on " + claim.itemKey() + " for " + claim.workType()
            + " is no longer held by " + claim.owner() + " (" + row.get().status() + "); failure not recorded");
      }
      return updated;
    });
  }

  @Override
  public String cursorOf(WorkItem item) {
    if (item.createdAt() == null) {
      return null;
    }
    return item.createdAt().truncatedTo(ChronoUnit.MILLIS).toEpochMilli() + ":" + item.itemKey();
  }

  /**
   * Returns the persisted claim state for an item, if any.
   */
  public Optional<AbstractJdbcWorkStore.ClaimRow> claimState(String itemKey, WorkFilter filter) {
    return withConnection("read claim " + itemKey, conn ->
        store.findClaim(conn, filter.workType(), itemKey, filter.version()));
  }

  private Instant expiryCutoff(Instant now) {
    return now.minus(claimExpiry);
  }

  private static Instant retryCutoff(WorkFilter filter, Instant now) {
    return now.minus(filter.retryInterval());
  }

  private static ClaimId.PendingClaim pendingClaim(WorkHandle<WorkItem> handle) {
    Objects.requireNonNull(handle, "handle");
    if (!(handle.claimId() instanceof ClaimId.PendingClaim pending)) {
      throw new IllegalArgumentException("Not a claim issued by a JDBC work queue: " + handle.claimId());
    }
    return pending;
  }

  static AbstractJdbcWorkStore.Position parseCursor(String cursor) {
    if (cursor == null || cursor.isEmpty()) {
      return null;
    }
    int sep = cursor.indexOf(':');
    if (sep <= 0 || sep == cursor.length() - 1) {
      throw new IllegalArgumentException("Invalid cursor: " + cursor);
    }
    try {
      long millis = Long.parseLong(cursor.substring(0, sep));
      return new AbstractJdbcWorkStore.Position(Instant.ofEpochMilli(millis), cursor.substring(sep + 1));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid cursor: " + cursor, e);
    }
  }

  @FunctionalInterface
  private interface ConnectionCallback<R> {
    R apply(Connection conn) throws SQLException;
  }

  private <R> R withConnection(String action, ConnectionCallback<R> callback) {
    Connection conn;
    try {
      conn = connectionProvider.getConnection();
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to obtain connection to " + action, e);
      throw WorkQueueException.connection("Failed to obtain connection to " + action, e);
    }
    try (conn) {
      return callback.apply(conn);
    } catch (WorkStoreException e) {
      logger.log(Level.SEVERE, "Work store failed to " + action, e);
      throw e.isConnectionFailure()
          ? WorkQueueException.connection("Connection lost during " + action, e)
          : WorkQueueException.database("Work store failed to " + action, e);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Work store failed to " + action, e);
      throw e.getSQLState() != null && e.getSQLState().startsWith("08")
          ? WorkQueueException.connection("Connection lost during " + action, e)
          : WorkQueueException.database("Work store failed to " + action, e);
    }
  }

  /** Builder for {@link JdbcWorkQueue}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private AbstractJdbcWorkStore store;
    private String ownerId;
    private Duration claimExpiry = DEFAULT_CLAIM_EXPIRY;
    private Clock clock;

    private Builder() {
    }

    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    public Builder store(AbstractJdbcWorkStore store) {
      this.store = store;
      return this;
    }

    /** Identifies this worker in claim rows; defaults to a random id. */
    public Builder ownerId(String ownerId) {
      this.ownerId = ownerId;
      return this;
    }

    /** How long an unresolved claim blocks other workers. */
    public Builder claimExpiry(Duration claimExpiry) {
      this.claimExpiry = claimExpiry;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public JdbcWorkQueue build() {
      return new JdbcWorkQueue(this);
    }
  }
}
