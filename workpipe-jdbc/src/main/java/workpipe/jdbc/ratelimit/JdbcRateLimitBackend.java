package workpipe.jdbc.ratelimit;

import workpipe.jdbc.JdbcTemplate;
import workpipe.jdbc.WorkStoreException;
import workpipe.ratelimit.DomainRateState;
import workpipe.ratelimit.RateLimitBackend;
import workpipe.ratelimit.RateLimitBackendException;
import workpipe.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * {@link RateLimitBackend} that shares per-domain throttling state between processes through
 * the {@code rate_limit_state} and {@code rate_limit_forbidden} tables.
 *
 * <p>{@link #update} is an optimistic compare-and-set on {@code row_version}: read the row,
 * apply the mutation, write it back only if the version is unchanged, and retry on conflict
 * up to {@code maxAttempts} times. Every call uses its own auto-commit connection.
 */
public final class JdbcRateLimitBackend implements RateLimitBackend {
  private static final Logger logger = Logger.getLogger(JdbcRateLimitBackend.class.getName());

  public static final int DEFAULT_MAX_ATTEMPTS = 10;
  private static final int MAX_URL_LENGTH = 2048;
  private static final String STATE_COLUMNS = "domain, current_delay_ms, last_request_at_ms, "
      + "consecutive_successes, in_backoff, total_requests, rate_limit_hits, row_version";

  private record VersionedState(DomainRateState state, long version) {
  }

  private final ConnectionProvider connectionProvider;
  private final String stateTable;
  private final String forbiddenTable;
  private final int maxAttempts;

  public JdbcRateLimitBackend(ConnectionProvider connectionProvider) {
    this(connectionProvider, "rate_limit_state", "rate_limit_forbidden", DEFAULT_MAX_ATTEMPTS);
  }

  public JdbcRateLimitBackend(ConnectionProvider connectionProvider, String stateTable,
      String forbiddenTable, int maxAttempts) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.stateTable = validTableName(stateTable);
    this.forbiddenTable = validTableName(forbiddenTable);
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
    }
    this.maxAttempts = maxAttempts;
  }

  @Override
  public DomainRateState getOrCreate(String domain, long baseDelayMs) {
    Objects.requireNonNull(domain, "domain");
    return withConnection("read state for " + domain,
        conn -> readOrCreate(conn, domain, baseDelayMs).state());
  }

  @Override
  public DomainRateState update(String domain, long baseDelayMs, UnaryOperator<DomainRateState> mutation) {
    Objects.requireNonNull(domain, "domain");
    Objects.requireNonNull(mutation, "mutation");
    return withConnection("update state for " + domain, conn -> {
      String sql = "UPDATE " + stateTable +
          " SET current_delay_ms=?, last_request_at_ms=?, consecutive_successes=?, in_backoff=?," +
          " total_requests=?, rate_limit_hits=?, row_version=row_version+1, last_updated=?" +
          " WHERE domain=? AND row_version=?";
      for (int attempt = 1; attempt <= maxAttempts; attempt++) {
        VersionedState current = readOrCreate(conn, domain, baseDelayMs);
        DomainRateState next = Objects.requireNonNull(mutation.apply(current.state()), "mutation returned null");
        int updated = JdbcTemplate.update(conn, sql,
            next.currentDelayMs(), next.lastRequestAtMs(), next.consecutiveSuccesses(), next.inBackoff(),
            next.totalRequests(), next.rateLimitHits(), Timestamp.from(Instant.now()),
            domain, current.version());
        if (updated > 0) {
          return next;
        }
        logger.fine("Concurrent update of rate limit state for " + domain + ", attempt " + attempt);
      }
      throw new RateLimitBackendException("Gave up updating rate limit state for " + domain
          + " after " + maxAttempts + " conflicting attempts");
    });
  }

  @Override
  public void record403(String domain, String url, long atMs) {
    String sql = "INSERT INTO " + forbiddenTable + " (domain, url, seen_at_ms) VALUES (?,?,?)";
    String stored = url != null && url.length() > MAX_URL_LENGTH ? url.substring(0, MAX_URL_LENGTH) : url;
    withConnection("record 403 for " + domain, conn -> JdbcTemplate.update(conn, sql, domain, stored, atMs));
  }

  @Override
  public int count403(String domain, long sinceMs) {
    String sql = "SELECT COUNT(DISTINCT url) FROM " + forbiddenTable + " WHERE domain=? AND seen_at_ms>=?";
    return withConnection("count 403s for " + domain,
        conn -> (int) JdbcTemplate.queryLong(conn, sql, domain, sinceMs));
  }

  @Override
  public void clear403s(String domain) {
    String sql = "DELETE FROM " + forbiddenTable + " WHERE domain=?";
    withConnection("clear 403s for " + domain, conn -> JdbcTemplate.update(conn, sql, domain));
  }

  @Override
  public int cleanupExpired403s(long beforeMs) {
    String sql = "DELETE FROM " + forbiddenTable + " WHERE seen_at_ms<?";
    return withConnection("clean up 403 records", conn -> JdbcTemplate.update(conn, sql, beforeMs));
  }

  @Override
  public List<DomainRateState> snapshot() {
    String sql = "SELECT " + STATE_COLUMNS + " FROM " + stateTable + " ORDER BY domain";
    return withConnection("read all states", conn ->
        JdbcTemplate.query(conn, sql, rs -> mapState(rs).state()));
  }

  private VersionedState readOrCreate(Connection conn, String domain, long baseDelayMs) {
    Optional<VersionedState> existing = read(conn, domain);
    if (existing.isPresent()) {
      return existing.get();
    }
    DomainRateState initial = DomainRateState.initial(domain, baseDelayMs);
    String sql = "INSERT INTO " + stateTable + " (" + STATE_COLUMNS + ", last_updated)" +
        " VALUES (?,?,?,?,?,?,?,0,?)";
    try {
      JdbcTemplate.update(conn, sql, domain, initial.currentDelayMs(), initial.lastRequestAtMs(),
          initial.consecutiveSuccesses(), initial.inBackoff(), initial.totalRequests(),
          initial.rateLimitHits(), Timestamp.from(Instant.now()));
      return new VersionedState(initial, 0L);
    } catch (WorkStoreException e) {
      if (!e.isConstraintViolation()) {
        throw e;
      }
      // Another process created the row first
      return read(conn, domain).orElseThrow(() -> e);
    }
  }

  private Optional<VersionedState> read(Connection conn, String domain) {
    String sql = "SELECT " + STATE_COLUMNS + " FROM " + stateTable + " WHERE domain=?";
    return JdbcTemplate.queryOne(conn, sql, JdbcRateLimitBackend::mapState, domain);
  }

  private static VersionedState mapState(ResultSet rs) throws SQLException {
    DomainRateState state = new DomainRateState(
        rs.getString("domain"),
        rs.getLong("current_delay_ms"),
        rs.getLong("last_request_at_ms"),
        rs.getInt("consecutive_successes"),
        rs.getBoolean("in_backoff"),
        rs.getLong("total_requests"),
        rs.getLong("rate_limit_hits"));
    return new VersionedState(state, rs.getLong("row_version"));
  }

  @FunctionalInterface
  private interface ConnectionCallback<R> {
    R apply(Connection conn) throws SQLException;
  }

  private <R> R withConnection(String action, ConnectionCallback<R> callback) {
    try (Connection conn = connectionProvider.getConnection()) {
      return callback.apply(conn);
    } catch (SQLException | WorkStoreException e) {
      throw new RateLimitBackendException("Rate limit store failed to " + action, e);
    }
  }

  private static String validTableName(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
