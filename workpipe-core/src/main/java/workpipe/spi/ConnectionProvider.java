package workpipe.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for durable work queues and rate-limit backends.
 *
 * <p>Callers are responsible for closing the returned connection. Every queue and
 * backend operation runs in its own short auto-commit unit.
 *
 * @see workpipe.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
