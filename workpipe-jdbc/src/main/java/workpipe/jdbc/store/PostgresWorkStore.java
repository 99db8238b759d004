package workpipe.jdbc.store;

import workpipe.jdbc.ClaimStatus;
import workpipe.jdbc.JdbcTemplate;
import workpipe.jdbc.WorkItem;
import workpipe.queue.WorkFilter;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * PostgreSQL work store.
 *
 * <p>Claims in a single round-trip: {@code INSERT ... ON CONFLICT ... DO UPDATE ... WHERE}
 * takes a fresh claim or retakes an expired or retryable one, and reports zero rows when
 * the existing claim is still live or complete.
 */
public final class PostgresWorkStore extends AbstractJdbcWorkStore {

  public PostgresWorkStore() {
    super();
  }

  public PostgresWorkStore(String itemTable, String claimTable) {
    super(itemTable, claimTable);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public AbstractJdbcWorkStore withTables(String itemTable, String claimTable) {
    return new PostgresWorkStore(itemTable, claimTable);
  }

  @Override
  public boolean insertItem(Connection conn, WorkItem item) {
    Objects.requireNonNull(item.createdAt(), "createdAt");
    String sql = "INSERT INTO " + itemTable() +
        " (item_key, source_id, mime_type, payload, created_at) VALUES (?,?,?,?,?)" +
        " ON CONFLICT (item_key) DO NOTHING";
    return JdbcTemplate.update(conn, sql, item.itemKey(), item.sourceId(), item.mimeType(),
        item.payload(), ts(item.createdAt())) > 0;
  }

  @Override
  public boolean claim(Connection conn, WorkFilter filter, String itemKey, String owner, String token,
      Instant now, Instant expiryCutoff, Instant retryCutoff) {
    String sql = insertClaimSql("") +
        " ON CONFLICT (work_type, item_key, version) DO UPDATE" +
        " SET status=" + ClaimStatus.PENDING.code() +
        ", owner=EXCLUDED.owner, claim_token=EXCLUDED.claim_token, claimed_at=EXCLUDED.claimed_at, failed_at=NULL" +
        " WHERE (" + claimTable() + ".status=" + ClaimStatus.PENDING.code() +
        " AND " + claimTable() + ".claimed_at<=?)" +
        " OR (" + claimTable() + ".status=" + ClaimStatus.FAILED.code() +
        " AND " + claimTable() + ".failed_at<=?)";
    return JdbcTemplate.update(conn, sql, filter.workType(), itemKey, filter.version(), owner,
        token, ts(now), ts(expiryCutoff), ts(retryCutoff)) > 0;
  }
}
