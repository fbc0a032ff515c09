package chatbridge.store;

import chatbridge.model.ConversationState;
import chatbridge.spi.ConversationStore;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-backed {@link ConversationStore}. State is lost on restart, which only means
 * the next post of an active topic opens a new thread.
 */
public final class InMemoryConversationStore implements ConversationStore {
  private final Map<String, ConversationState> states = new ConcurrentHashMap<>();

  @Override
  public ConversationState find(String topicId, String channel) {
    return states.get(ConversationState.storeKey(topicId, channel));
  }

  @Override
  public void save(ConversationState state) {
    states.put(state.storeKey(), state);
  }

  public int size() {
    return states.size();
  }
}
