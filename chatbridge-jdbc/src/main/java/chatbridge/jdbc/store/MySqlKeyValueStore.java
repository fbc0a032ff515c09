package chatbridge.jdbc.store;

import java.util.List;

/**
 * MySQL/MariaDB/TiDB key-value store using {@code INSERT ... ON DUPLICATE KEY UPDATE}.
 */
public final class MySqlKeyValueStore extends AbstractJdbcKeyValueStore {

  public MySqlKeyValueStore() {
    super();
  }

  public MySqlKeyValueStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }

  @Override
  public MySqlKeyValueStore withTableName(String tableName) {
    return new MySqlKeyValueStore(tableName);
  }

  @Override
  protected String upsertSql() {
    return "INSERT INTO " + tableName() + " (store_key, store_value, updated_at) VALUES (?,?,?)"
        + " ON DUPLICATE KEY UPDATE store_value=VALUES(store_value), updated_at=VALUES(updated_at)";
  }
}
