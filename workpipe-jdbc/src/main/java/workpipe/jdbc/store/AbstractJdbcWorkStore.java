package workpipe.jdbc.store;

import workpipe.jdbc.ClaimStatus;
import workpipe.jdbc.JdbcTemplate;
import workpipe.jdbc.WorkItem;
import workpipe.jdbc.WorkStoreException;
import workpipe.queue.WorkFilter;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC work store with standard SQL implementations.
 *
 * <p>An item is claimable for a filter when it has no claim row for
 * {@code (work_type, item_key, version)}, when its pending claim is older than the claim
 * expiry, or when its failure is older than the filter's retry interval. The default
 * {@link #claim} is a conditional {@code UPDATE} of an existing row followed by an
 * {@code INSERT} guarded by the primary key; subclasses override it or
 * {@link #insertClaim} with database-specific statements. Register custom implementations
 * via {@code META-INF/services/workpipe.jdbc.store.AbstractJdbcWorkStore}.
 *
 * @see JdbcWorkStores
 */
public abstract class AbstractJdbcWorkStore {
  protected static final String DEFAULT_ITEM_TABLE = "work_item";
  protected static final String DEFAULT_CLAIM_TABLE = "work_claim";
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final JdbcTemplate.RowMapper<WorkItem> ITEM_ROW_MAPPER = rs -> new WorkItem(
      rs.getString("item_key"),
      rs.getString("source_id"),
      rs.getString("mime_type"),
      rs.getString("payload"),
      rs.getTimestamp("created_at").toInstant());

  private static final String ITEM_COLUMNS =
      "i.item_key, i.source_id, i.mime_type, i.payload, i.created_at";

  private final String itemTable;
  private final String claimTable;

  protected AbstractJdbcWorkStore() {
    this(DEFAULT_ITEM_TABLE, DEFAULT_CLAIM_TABLE);
  }

  protected AbstractJdbcWorkStore(String itemTable, String claimTable) {
    this.itemTable = validTableName(itemTable);
    this.claimTable = validTableName(claimTable);
  }

  /**
   * Unique identifier for this work store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this work store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect over different tables.
   */
  public abstract AbstractJdbcWorkStore withTables(String itemTable, String claimTable);

  protected String itemTable() {
    return itemTable;
  }

  protected String claimTable() {
    return claimTable;
  }

  /**
   * Adds an item to the backlog.
   *
   * @return {@code false} if an item with the same key already exists
   */
  public boolean insertItem(Connection conn, WorkItem item) {
    Objects.requireNonNull(item.createdAt(), "createdAt");
    String sql = "INSERT INTO " + itemTable() +
        " (item_key, source_id, mime_type, payload, created_at) VALUES (?,?,?,?,?)";
    try {
      return JdbcTemplate.update(conn, sql, item.itemKey(), item.sourceId(), item.mimeType(),
          item.payload(), ts(item.createdAt())) > 0;
    } catch (WorkStoreException e) {
      if (e.isConstraintViolation()) {
        return false;
      }
      throw e;
    }
  }

  public boolean itemExists(Connection conn, String itemKey) {
    String sql = "SELECT COUNT(*) FROM " + itemTable() + " WHERE item_key=?";
    return JdbcTemplate.queryLong(conn, sql, itemKey) > 0;
  }

  /**
   * Counts items claimable for {@code filter}.
   *
   * @param expiryCutoff pending claims at or before this instant have expired
   * @param retryCutoff  failures at or before this instant may be retried
   */
  public long countEligible(Connection conn, WorkFilter filter, Instant expiryCutoff, Instant retryCutoff) {
    List<Object> params = new ArrayList<>();
    String sql = "SELECT COUNT(*)" + eligibleFrom(filter, expiryCutoff, retryCutoff, params);
    return JdbcTemplate.queryLong(conn, sql, params.toArray());
  }

  /**
   * Selects up to {@code limit} claimable items ordered by {@code (created_at, item_key)},
   * starting after {@code after} when it is non-null.
   */
  public List<WorkItem> fetchEligible(Connection conn, WorkFilter filter, Instant expiryCutoff,
      Instant retryCutoff, Position after, int limit) {
    List<Object> params = new ArrayList<>();
    StringBuilder sql = new StringBuilder("SELECT ").append(ITEM_COLUMNS)
        .append(eligibleFrom(filter, expiryCutoff, retryCutoff, params));
    if (after != null) {
      sql.append(" AND (i.created_at > ? OR (i.created_at = ? AND i.item_key > ?))");
      params.add(ts(after.createdAt()));
      params.add(ts(after.createdAt()));
      params.add(after.itemKey());
    }
    sql.append(" ORDER BY i.created_at, i.item_key LIMIT ?");
    params.add(limit);
    return JdbcTemplate.query(conn, sql.toString(), ITEM_ROW_MAPPER, params.toArray());
  }

  /**
   * Claims {@code itemKey} for {@code owner}, tagging the claim row with {@code token}.
   *
   * @return {@code true} if this call took the claim
   */
  public boolean claim(Connection conn, WorkFilter filter, String itemKey, String owner, String token,
      Instant now, Instant expiryCutoff, Instant retryCutoff) {
    String retakeSql = "UPDATE " + claimTable() +
        " SET status=" + ClaimStatus.PENDING.code() + ", owner=?, claim_token=?, claimed_at=?, failed_at=NULL" +
        " WHERE work_type=? AND item_key=? AND version=?" +
        " AND ((status=" + ClaimStatus.PENDING.code() + " AND claimed_at<=?)" +
        " OR (status=" + ClaimStatus.FAILED.code() + " AND failed_at<=?))";
    int retaken = JdbcTemplate.update(conn, retakeSql, owner, token, ts(now),
        filter.workType(), itemKey, filter.version(), ts(expiryCutoff), ts(retryCutoff));
    if (retaken > 0) {
      return true;
    }
    return insertClaim(conn, filter, itemKey, owner, token, now);
  }

  /**
   * Inserts a fresh pending claim row.
   *
   * @return {@code false} if a row for the claim key already exists
   */
  protected boolean insertClaim(Connection conn, WorkFilter filter, String itemKey, String owner, String token,
      Instant now) {
    try {
      return JdbcTemplate.update(conn, insertClaimSql(""), filter.workType(), itemKey,
          filter.version(), owner, token, ts(now)) > 0;
    } catch (WorkStoreException e) {
      if (e.isConstraintViolation()) {
        return false;
      }
      throw e;
    }
  }

  protected String insertClaimSql(String insertModifier) {
    return "INSERT " + insertModifier + "INTO " + claimTable() +
        " (work_type, item_key, version, status, owner, claim_token, claimed_at, attempts)" +
        " VALUES (?,?,?," + ClaimStatus.PENDING.code() + ",?,?,?,0)";
  }

  /**
   * Marks a claim complete. Completing an already complete claim changes nothing.
   *
   * @return rows updated
   */
  public int markComplete(Connection conn, String workType, String itemKey, int version, Instant now) {
    String sql = "UPDATE " + claimTable() +
        " SET status=" + ClaimStatus.COMPLETE.code() + ", completed_at=?, owner=NULL, claim_token=NULL" +
        " WHERE work_type=? AND item_key=? AND version=? AND status<>" + ClaimStatus.COMPLETE.code();
    return JdbcTemplate.update(conn, sql, ts(now), workType, itemKey, version);
  }

  /**
   * Marks the pending claim tagged with {@code token} failed and records the error.
   *
   * @return rows updated; 0 if the claim was retaken or is no longer pending
   */
  public int markFailed(Connection conn, String workType, String itemKey, int version, String token,
      Instant now, String error) {
    String sql = "UPDATE " + claimTable() +
        " SET status=" + ClaimStatus.FAILED.code() +
        ", failed_at=?, attempts=attempts+1, last_error=?, owner=NULL, claim_token=NULL" +
        " WHERE work_type=? AND item_key=? AND version=? AND status=" + ClaimStatus.PENDING.code() +
        " AND claim_token=?";
    return JdbcTemplate.update(conn, sql, ts(now), truncateError(error), workType, itemKey, version, token);
  }

  /**
   * Reads the claim row for a claim key.
   */
  public Optional<ClaimRow> findClaim(Connection conn, String workType, String itemKey, int version) {
    String sql = "SELECT status, owner, attempts, last_error FROM " + claimTable() +
        " WHERE work_type=? AND item_key=? AND version=?";
    return JdbcTemplate.queryOne(conn, sql, rs -> new ClaimRow(
        ClaimStatus.fromCode(rs.getInt("status")),
        rs.getString("owner"),
        rs.getInt("attempts"),
        rs.getString("last_error")), workType, itemKey, version);
  }

  private String eligibleFrom(WorkFilter filter, Instant expiryCutoff, Instant retryCutoff, List<Object> params) {
    StringBuilder sql = new StringBuilder()
        .append(" FROM ").append(itemTable()).append(" i")
        .append(" LEFT JOIN ").append(claimTable()).append(" c")
        .append(" ON c.item_key = i.item_key AND c.work_type = ? AND c.version = ?")
        .append(" WHERE (c.item_key IS NULL")
        .append(" OR (c.status = ").append(ClaimStatus.PENDING.code()).append(" AND c.claimed_at <= ?)")
        .append(" OR (c.status = ").append(ClaimStatus.FAILED.code()).append(" AND c.failed_at <= ?))");
    params.add(filter.workType());
    params.add(filter.version());
    params.add(ts(expiryCutoff));
    params.add(ts(retryCutoff));
    if (filter.sourceId() != null) {
      sql.append(" AND i.source_id = ?");
      params.add(filter.sourceId());
    }
    if (filter.mimeType() != null) {
      sql.append(" AND i.mime_type = ?");
      params.add(filter.mimeType());
    }
    if (filter.prerequisite() != null) {
      sql.append(" AND EXISTS (SELECT 1 FROM ").append(claimTable()).append(" p")
          .append(" WHERE p.item_key = i.item_key AND p.work_type = ? AND p.status = ")
          .append(ClaimStatus.COMPLETE.code()).append(")");
      params.add(filter.prerequisite());
    }
    return sql.toString();
  }

  // Stored values lose sub-millisecond precision on MySQL; keep comparisons consistent
  protected static Timestamp ts(Instant instant) {
    return Timestamp.from(instant.truncatedTo(ChronoUnit.MILLIS));
  }

  private static String validTableName(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }

  /**
   * Position in the backlog order, used to page through eligible items.
   */
  public record Position(Instant createdAt, String itemKey) {
    public Position {
      Objects.requireNonNull(createdAt, "createdAt");
      Objects.requireNonNull(itemKey, "itemKey");
    }
  }

  /**
   * Persisted state of one claim.
   */
  public record ClaimRow(ClaimStatus status, String owner, int attempts, String lastError) {
  }
}
