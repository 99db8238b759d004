package workpipe.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC work stores with auto-detection support.
 *
 * <p>Work stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/workpipe.jdbc.store.AbstractJdbcWorkStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcWorkStore store = JdbcWorkStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcWorkStore store = JdbcWorkStores.detect("jdbc:mysql://localhost/mydb");
 *
 * // Get by name
 * AbstractJdbcWorkStore store = JdbcWorkStores.get("postgresql");
 * }</pre>
 */
public final class JdbcWorkStores {

  private static final List<AbstractJdbcWorkStore> STORES;
  private static final Map<String, AbstractJdbcWorkStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcWorkStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcWorkStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcWorkStores() {
  }

  /**
   * Returns all registered work stores.
   */
  public static List<AbstractJdbcWorkStore> all() {
    return STORES;
  }

  /**
   * Gets a work store by name.
   *
   * @param name work store name (case-insensitive)
   * @return the work store
   * @throws IllegalArgumentException if no work store found
   */
  public static AbstractJdbcWorkStore get(String name) {
    AbstractJdbcWorkStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown work store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the work store from a DataSource.
   *
   * @throws IllegalStateException if detection fails or no matching work store
   */
  public static AbstractJdbcWorkStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      String url = conn.getMetaData().getURL();
      return detect(url);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect work store from DataSource", e);
    }
  }

  /**
   * Auto-detects the work store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no matching work store found
   */
  public static AbstractJdbcWorkStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    String lower = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcWorkStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }

    throw new IllegalArgumentException("No work store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
