package chatbridge.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Topic metadata consumed by the matcher and the composer.
 *
 * @param id             topic id
 * @param title          topic title
 * @param categoryId     owning category, {@code null} when uncategorized
 * @param tags           tag names in display order
 * @param privateMessage whether the topic is a private conversation
 */
public record ForumTopic(String id, String title, String categoryId, Set<String> tags,
    boolean privateMessage) {

  public ForumTopic {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(title, "title");
    tags = tags == null || tags.isEmpty()
        ? Set.of()
        : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
  }
}
