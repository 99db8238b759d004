package workpipe.jdbc;

import workpipe.jdbc.ratelimit.JdbcRateLimitBackend;
import workpipe.jdbc.store.AbstractJdbcWorkStore;
import workpipe.jdbc.store.JdbcWorkStores;
import workpipe.jdbc.store.PostgresWorkStore;
import workpipe.ratelimit.DomainRateState;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

import static org.junit.jupiter.api.Assertions.*;

@DockerAvailable
@Testcontainers
class PostgresWorkQueueIntegrationTest extends AbstractWorkQueueIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("workpipe_test");

  private static SimpleDataSource postgresDs;
  private final PostgresWorkStore store = new PostgresWorkStore();

  @BeforeAll
  static void initSchema() throws Exception {
    postgresDs = new SimpleDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
    Schema.apply(postgresDs, "postgresql");
  }

  @Override
  DataSource dataSource() {
    return postgresDs;
  }

  @Override
  AbstractJdbcWorkStore store() {
    return store;
  }

  @Test
  void detectsPostgresFromDataSource() {
    assertEquals("postgresql", JdbcWorkStores.detect(postgresDs).name());
  }

  @Test
  void rateLimitStateRoundTrips() {
    JdbcRateLimitBackend backend = new JdbcRateLimitBackend(new DataSourceConnectionProvider(postgresDs));

    backend.update("example.com", 500, s -> s.withRateLimitHit().withDelay(1000, true));
    DomainRateState state = backend.getOrCreate("example.com", 500);

    assertEquals(1000, state.currentDelayMs());
    assertTrue(state.inBackoff());
    assertEquals(1, backend.snapshot().size());
  }
}
