package chatbridge.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Last delivery of a topic to a channel, used to decide whether the next post is
 * appended to the existing chat message or starts a new one.
 *
 * @param topicId       topic id
 * @param channel       subscription channel the state belongs to
 * @param vendorChannel channel id returned by the chat vendor, used for edits
 * @param messageId     vendor message id (the message timestamp for Slack)
 * @param message       the payload as last delivered
 * @param createdAt     delivery time reported by the vendor; the freshness window starts here
 */
public record ConversationState(
    String topicId,
    String channel,
    String vendorChannel,
    String messageId,
    ChatMessage message,
    Instant createdAt
) {

  public static final String KEY_PREFIX = "topic_";

  public ConversationState {
    Objects.requireNonNull(topicId, "topicId");
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  public int attachmentCount() {
    return message.attachments().size();
  }

  public String storeKey() {
    return storeKey(topicId, channel);
  }

  /**
   * Returns the storage key {@code topic_<topicId>_<channel>}.
   */
  public static String storeKey(String topicId, String channel) {
    return KEY_PREFIX + topicId + "_" + channel;
  }
}
