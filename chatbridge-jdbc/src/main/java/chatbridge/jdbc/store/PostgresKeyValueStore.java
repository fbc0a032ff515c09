package chatbridge.jdbc.store;

import java.util.List;

/**
 * PostgreSQL key-value store using {@code INSERT ... ON CONFLICT DO UPDATE}.
 */
public final class PostgresKeyValueStore extends AbstractJdbcKeyValueStore {

  public PostgresKeyValueStore() {
    super();
  }

  public PostgresKeyValueStore(String tableName) {
    super(tableName);
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
  public PostgresKeyValueStore withTableName(String tableName) {
    return new PostgresKeyValueStore(tableName);
  }

  @Override
  protected String upsertSql() {
    return "INSERT INTO " + tableName() + " (store_key, store_value, updated_at) VALUES (?,?,?)"
        + " ON CONFLICT (store_key) DO UPDATE SET store_value=EXCLUDED.store_value,"
        + " updated_at=EXCLUDED.updated_at";
  }
}
