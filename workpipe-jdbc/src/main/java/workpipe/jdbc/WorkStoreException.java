package workpipe.jdbc;

import java.sql.SQLException;

/**
 * Unchecked exception wrapping JDBC errors thrown by work stores, the rate-limit backend
 * and {@link JdbcTemplate}.
 */
public final class WorkStoreException extends RuntimeException {
  public WorkStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Returns the SQLState of the wrapped {@link SQLException}, or {@code null}.
   */
  public String sqlState() {
    return getCause() instanceof SQLException sql ? sql.getSQLState() : null;
  }

  /** Integrity constraint violation (SQLState class 23), such as a duplicate key. */
  public boolean isConstraintViolation() {
    String state = sqlState();
    return state != null && state.startsWith("23");
  }

  /** Connection exception (SQLState class 08). */
  public boolean isConnectionFailure() {
    String state = sqlState();
    return state != null && state.startsWith("08");
  }
}
