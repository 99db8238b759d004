package workpipe.jdbc.store;

import java.util.List;

/**
 * H2 work store. Primarily for testing.
 *
 * <p>Uses the default conditional-update-then-insert claim from {@link AbstractJdbcWorkStore}.
 */
public final class H2WorkStore extends AbstractJdbcWorkStore {

  public H2WorkStore() {
    super();
  }

  public H2WorkStore(String itemTable, String claimTable) {
    super(itemTable, claimTable);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public AbstractJdbcWorkStore withTables(String itemTable, String claimTable) {
    return new H2WorkStore(itemTable, claimTable);
  }
}
