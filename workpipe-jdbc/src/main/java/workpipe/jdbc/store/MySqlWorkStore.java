package workpipe.jdbc.store;

import workpipe.jdbc.JdbcTemplate;
import workpipe.jdbc.WorkItem;
import workpipe.queue.WorkFilter;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * MySQL work store. Also compatible with TiDB.
 *
 * <p>Inserts with {@code INSERT IGNORE}, so a duplicate key reports zero rows instead of
 * raising an error. The claim remains two statements (conditional {@code UPDATE}, then
 * {@code INSERT IGNORE}); both are guarded by the primary key, so concurrent claimers of
 * the same item see exactly one success.
 */
public final class MySqlWorkStore extends AbstractJdbcWorkStore {

  public MySqlWorkStore() {
    super();
  }

  public MySqlWorkStore(String itemTable, String claimTable) {
    super(itemTable, claimTable);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public AbstractJdbcWorkStore withTables(String itemTable, String claimTable) {
    return new MySqlWorkStore(itemTable, claimTable);
  }

  @Override
  public boolean insertItem(Connection conn, WorkItem item) {
    Objects.requireNonNull(item.createdAt(), "createdAt");
    String sql = "INSERT IGNORE INTO " + itemTable() +
        " (item_key, source_id, mime_type, payload, created_at) VALUES (?,?,?,?,?)";
    return JdbcTemplate.update(conn, sql, item.itemKey(), item.sourceId(), item.mimeType(),
        item.payload(), ts(item.createdAt())) > 0;
  }

  @Override
  protected boolean insertClaim(Connection conn, WorkFilter filter, String itemKey, String owner, String token,
      Instant now) {
    return JdbcTemplate.update(conn, insertClaimSql("IGNORE "), filter.workType(), itemKey,
        filter.version(), owner, token, ts(now)) > 0;
  }
}
