package chatbridge.spi;

import chatbridge.model.ConversationState;

/**
 * Persistence contract for per (topic, channel) conversation state. Owned by the
 * dispatcher.
 */
public interface ConversationStore {

  /**
   * Returns the last recorded delivery of a topic to a channel.
   *
   * @param topicId the topic id
   * @param channel the subscription channel
   * @return the state, or {@code null} if none is recorded
   */
  ConversationState find(String topicId, String channel);

  /**
   * Records a delivery, replacing any previous state for the same key.
   *
   * @param state the new state
   */
  void save(ConversationState state);
}
