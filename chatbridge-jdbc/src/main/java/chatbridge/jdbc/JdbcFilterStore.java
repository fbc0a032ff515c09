package chatbridge.jdbc;

import chatbridge.ChatBridgeException;
import chatbridge.jdbc.store.AbstractJdbcKeyValueStore;
import chatbridge.json.ChatBridgeJson;
import chatbridge.model.FilterScope;
import chatbridge.model.SubscriptionRule;
import chatbridge.spi.FilterStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link FilterStore} persisting each scope's rule list as one JSON record under
 * {@code category_<id>} (or {@code category_*} for all categories).
 *
 * <p>Scopes are listed in key order. For matching, a record that is not valid JSON is
 * read as an empty rule list and logged; {@link #loadForUpdate} fails on it instead.
 */
public final class JdbcFilterStore implements FilterStore {
  private static final Logger logger = Logger.getLogger(JdbcFilterStore.class.getName());

  private final ConnectionProvider connectionProvider;
  private final AbstractJdbcKeyValueStore table;

  public JdbcFilterStore(ConnectionProvider connectionProvider, AbstractJdbcKeyValueStore table) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.table = Objects.requireNonNull(table, "table");
  }

  @Override
  public List<SubscriptionRule> load(FilterScope scope) {
    String json = read(scope);
    if (json == null) {
      return List.of();
    }
    try {
      return ChatBridgeJson.readRules(json);
    } catch (ChatBridgeException e) {
      logger.log(Level.WARNING, "Ignoring unreadable rule record " + scope.storeKey(), e);
      return List.of();
    }
  }

  /**
   * @throws ChatBridgeStoreException if the stored record is unreadable or holds a
   *     malformed rule
   */
  @Override
  public List<SubscriptionRule> loadForUpdate(FilterScope scope) {
    String json = read(scope);
    if (json == null) {
      return List.of();
    }
    try {
      return ChatBridgeJson.readRulesStrict(json);
    } catch (ChatBridgeException e) {
      throw new ChatBridgeStoreException("Refusing to edit unreadable rule record "
          + scope.storeKey(), e);
    }
  }

  private String read(FilterScope scope) {
    String key = scope.storeKey();
    try (Connection conn = connectionProvider.getConnection()) {
      return table.get(conn, key);
    } catch (SQLException e) {
      throw new ChatBridgeStoreException("Failed to load rules for " + key, e);
    }
  }

  @Override
  public void save(FilterScope scope, List<SubscriptionRule> rules) {
    String key = scope.storeKey();
    try (Connection conn = connectionProvider.getConnection()) {
      if (rules.isEmpty()) {
        table.remove(conn, key);
      } else {
        table.put(conn, key, ChatBridgeJson.writeRules(rules), Instant.now());
      }
    } catch (SQLException e) {
      throw new ChatBridgeStoreException("Failed to save rules for " + key, e);
    }
  }

  @Override
  public List<FilterScope> scopes() {
    List<String> keys;
    try (Connection conn = connectionProvider.getConnection()) {
      keys = table.keysWithPrefix(conn, FilterScope.KEY_PREFIX);
    } catch (SQLException e) {
      throw new ChatBridgeStoreException("Failed to list rule scopes", e);
    }
    List<FilterScope> scopes = new ArrayList<>(keys.size());
    for (String key : keys) {
      scopes.add(FilterScope.fromStoreKey(key));
    }
    return scopes;
  }
}
