package chatbridge.jdbc.store;

import chatbridge.jdbc.JdbcTemplate;
import chatbridge.jdbc.TableNames;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * Base JDBC key-value store holding the bridge's JSON records.
 *
 * <p>The table has three columns:
 * <pre>
 * store_key   VARCHAR(255) PRIMARY KEY
 * store_value CLOB/TEXT    NOT NULL
 * updated_at  TIMESTAMP    NOT NULL
 * </pre>
 *
 * <p>Subclasses supply the database-specific upsert. Register custom implementations via
 * {@code META-INF/services/chatbridge.jdbc.store.AbstractJdbcKeyValueStore}.
 *
 * @see JdbcKeyValueStores
 */
public abstract class AbstractJdbcKeyValueStore {
  private static final char LIKE_ESCAPE = '!';

  private final String tableName;

  protected AbstractJdbcKeyValueStore() {
    this(TableNames.DEFAULT_TABLE);
  }

  protected AbstractJdbcKeyValueStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect bound to another table.
   */
  public abstract AbstractJdbcKeyValueStore withTableName(String tableName);

  /**
   * Upsert statement binding {@code (store_key, store_value, updated_at)} in that order.
   */
  protected abstract String upsertSql();

  public String tableName() {
    return tableName;
  }

  /**
   * Returns the stored value, or {@code null} if the key is absent.
   */
  public String get(Connection conn, String key) {
    String sql = "SELECT store_value FROM " + tableName + " WHERE store_key=?";
    return JdbcTemplate.queryOne(conn, sql, rs -> JdbcTemplate.text(rs, 1), key);
  }

  public void put(Connection conn, String key, String value, Instant now) {
    JdbcTemplate.update(conn, upsertSql(), key, value, now);
  }

  /**
   * Deletes a key.
   *
   * @return {@code true} if a record was removed
   */
  public boolean remove(Connection conn, String key) {
    String sql = "DELETE FROM " + tableName + " WHERE store_key=?";
    return JdbcTemplate.update(conn, sql, key) > 0;
  }

  /**
   * Returns the keys starting with {@code prefix}, in key order.
   */
  public List<String> keysWithPrefix(Connection conn, String prefix) {
    String sql = "SELECT store_key FROM " + tableName
        + " WHERE store_key LIKE ? ESCAPE '" + LIKE_ESCAPE + "' ORDER BY store_key";
    return JdbcTemplate.query(conn, sql, rs -> rs.getString(1), escapeLike(prefix) + "%");
  }

  static String escapeLike(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 4);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
        sb.append(LIKE_ESCAPE);
      }
      sb.append(c);
    }
    return sb.toString();
  }
}
