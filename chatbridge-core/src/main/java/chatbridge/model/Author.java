package chatbridge.model;

import java.util.Objects;

/**
 * The forum user who wrote a post.
 *
 * @param username  login name, without the leading {@code @}
 * @param name      full name, may be {@code null}
 * @param avatarUrl small avatar URL, may be {@code null}
 */
public record Author(String username, String name, String avatarUrl) {

  public Author {
    Objects.requireNonNull(username, "username");
  }
}
