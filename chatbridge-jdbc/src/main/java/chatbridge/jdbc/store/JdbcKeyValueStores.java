package chatbridge.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC key-value stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/chatbridge.jdbc.store.AbstractJdbcKeyValueStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcKeyValueStore store = JdbcKeyValueStores.detect(dataSource);
 *
 * // Auto-detect with a custom table
 * AbstractJdbcKeyValueStore store = JdbcKeyValueStores.detect(dataSource, "forum_chat_store");
 *
 * // Get by name
 * AbstractJdbcKeyValueStore store = JdbcKeyValueStores.get("postgresql");
 * }</pre>
 */
public final class JdbcKeyValueStores {

  private static final List<AbstractJdbcKeyValueStore> STORES;
  private static final Map<String, AbstractJdbcKeyValueStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcKeyValueStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcKeyValueStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcKeyValueStores() {
  }

  /**
   * Returns all registered stores.
   */
  public static List<AbstractJdbcKeyValueStore> all() {
    return STORES;
  }

  /**
   * Gets a store by name.
   *
   * @param name store name (case-insensitive)
   * @return the store
   * @throws IllegalArgumentException if no store is registered under that name
   */
  public static AbstractJdbcKeyValueStore get(String name) {
    AbstractJdbcKeyValueStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown key-value store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the store from a DataSource.
   *
   * @throws IllegalStateException if the connection metadata cannot be read
   * @throws IllegalArgumentException if no store matches the JDBC URL
   */
  public static AbstractJdbcKeyValueStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      String url = conn.getMetaData().getURL();
      return detect(url);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect key-value store from DataSource", e);
    }
  }

  /**
   * Auto-detects the store from a DataSource and binds it to {@code tableName}.
   */
  public static AbstractJdbcKeyValueStore detect(DataSource dataSource, String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    return detect(dataSource).withTableName(tableName);
  }

  /**
   * Auto-detects the store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no store matches
   */
  public static AbstractJdbcKeyValueStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcKeyValueStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }

    throw new IllegalArgumentException("No key-value store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
