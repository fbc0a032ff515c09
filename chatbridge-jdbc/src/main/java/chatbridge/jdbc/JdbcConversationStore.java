package chatbridge.jdbc;

import chatbridge.ChatBridgeException;
import chatbridge.jdbc.store.AbstractJdbcKeyValueStore;
import chatbridge.json.ChatBridgeJson;
import chatbridge.model.ConversationState;
import chatbridge.spi.ConversationStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ConversationStore} persisting each conversation as one JSON record under
 * {@code topic_<topicId>_<channel>}.
 *
 * <p>A record that cannot be decoded is treated as absent, so the next post opens a
 * new thread and overwrites it.
 */
public final class JdbcConversationStore implements ConversationStore {
  private static final Logger logger = Logger.getLogger(JdbcConversationStore.class.getName());

  private final ConnectionProvider connectionProvider;
  private final AbstractJdbcKeyValueStore table;

  public JdbcConversationStore(ConnectionProvider connectionProvider, AbstractJdbcKeyValueStore table) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.table = Objects.requireNonNull(table, "table");
  }

  @Override
  public ConversationState find(String topicId, String channel) {
    String key = ConversationState.storeKey(topicId, channel);
    String json;
    try (Connection conn = connectionProvider.getConnection()) {
      json = table.get(conn, key);
    } catch (SQLException e) {
      throw new ChatBridgeStoreException("Failed to load conversation " + key, e);
    }
    if (json == null) {
      return null;
    }
    try {
      return ChatBridgeJson.readState(topicId, channel, json);
    } catch (ChatBridgeException e) {
      logger.log(Level.WARNING, "Ignoring unreadable conversation record " + key, e);
      return null;
    }
  }

  @Override
  public void save(ConversationState state) {
    String key = state.storeKey();
    try (Connection conn = connectionProvider.getConnection()) {
      table.put(conn, key, ChatBridgeJson.writeState(state), Instant.now());
    } catch (SQLException e) {
      throw new ChatBridgeStoreException("Failed to save conversation " + key, e);
    }
  }
}
