package chatbridge.spi;

import chatbridge.model.ForumPost;

/**
 * Renders a post to a chat-markup excerpt.
 */
@FunctionalInterface
public interface ExcerptFormatter {

  /**
   * @param post      the post
   * @param maxLength maximum excerpt length in characters
   * @return the excerpt, never {@code null}
   */
  String excerpt(ForumPost post, int maxLength);
}
