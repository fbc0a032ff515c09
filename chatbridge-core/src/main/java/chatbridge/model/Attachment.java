package chatbridge.model;

import java.util.List;

/**
 * One attachment block of a {@link ChatMessage}. A message accumulates one
 * attachment per coalesced post.
 *
 * <p>{@code title}, {@code titleLink} and {@code thumbUrl} are only set on the
 * attachment that opens a conversation thread; they are {@code null} on follow-ups.
 */
public record Attachment(
    String fallback,
    String authorName,
    String authorIcon,
    String color,
    String text,
    String title,
    String titleLink,
    String thumbUrl,
    List<String> mrkdwnIn
) {

  public Attachment {
    mrkdwnIn = mrkdwnIn == null ? List.of() : List.copyOf(mrkdwnIn);
  }

  public boolean hasTitle() {
    return title != null;
  }
}
