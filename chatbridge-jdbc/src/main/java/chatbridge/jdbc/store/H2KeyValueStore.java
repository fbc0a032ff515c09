package chatbridge.jdbc.store;

import java.util.List;

/**
 * H2 key-value store using {@code MERGE ... KEY}. Primarily for testing.
 */
public final class H2KeyValueStore extends AbstractJdbcKeyValueStore {

  public H2KeyValueStore() {
    super();
  }

  public H2KeyValueStore(String tableName) {
    super(tableName);
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
  public H2KeyValueStore withTableName(String tableName) {
    return new H2KeyValueStore(tableName);
  }

  @Override
  protected String upsertSql() {
    return "MERGE INTO " + tableName() + " (store_key, store_value, updated_at) KEY (store_key) VALUES (?,?,?)";
  }
}
