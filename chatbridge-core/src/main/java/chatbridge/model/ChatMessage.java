package chatbridge.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outbound chat payload.
 *
 * @param channel     destination channel
 * @param username    bot display name
 * @param iconUrl     bot icon, may be {@code null}
 * @param text        top-level message text, may be {@code null}
 * @param attachments attachment blocks, oldest first
 */
public record ChatMessage(String channel, String username, String iconUrl, String text,
    List<Attachment> attachments) {

  public ChatMessage {
    Objects.requireNonNull(channel, "channel");
    attachments = attachments == null ? List.of() : List.copyOf(attachments);
  }

  /**
   * Returns a copy of this message with {@code more} appended to its attachments.
   */
  public ChatMessage appendAttachments(List<Attachment> more) {
    List<Attachment> merged = new ArrayList<>(attachments.size() + more.size());
    merged.addAll(attachments);
    merged.addAll(more);
    return new ChatMessage(channel, username, iconUrl, text, merged);
  }

  public ChatMessage withChannel(String newChannel) {
    return new ChatMessage(newChannel, username, iconUrl, text, attachments);
  }
}
