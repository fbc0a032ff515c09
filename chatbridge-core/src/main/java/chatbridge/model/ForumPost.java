package chatbridge.model;

import java.util.Objects;

/**
 * A newly created forum post.
 *
 * @param id         post id
 * @param postNumber position within the topic, starting at {@code 1}
 * @param regular    {@code false} for moderator actions, whispers and other non-regular posts
 * @param url        absolute URL of the post
 * @param author     the post author
 * @param topic      the topic the post belongs to
 */
public record ForumPost(String id, int postNumber, boolean regular, String url,
    Author author, ForumTopic topic) {

  public ForumPost {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(author, "author");
    Objects.requireNonNull(topic, "topic");
  }

  public boolean isFirstPost() {
    return postNumber == 1;
  }
}
