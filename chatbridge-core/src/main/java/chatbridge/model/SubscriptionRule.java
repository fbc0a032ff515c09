package chatbridge.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A single subscription of a chat channel within a {@link FilterScope}.
 *
 * <p>An empty {@code tags} set means "no tag filter"; the rule then matches
 * regardless of a topic's tags. Within one scope a rule is identified by
 * {@link #identity()}, i.e. its channel and tag set.
 *
 * @param channel the chat channel, e.g. {@code #general} or {@code @alice}
 * @param level   the filter level
 * @param tags    tag names, insertion ordered, never {@code null}
 */
public record SubscriptionRule(String channel, FilterLevel level, Set<String> tags) {

  public SubscriptionRule {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(level, "level");
    tags = tags == null || tags.isEmpty()
        ? Set.of()
        : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
  }

  public static SubscriptionRule untagged(String channel, FilterLevel level) {
    return new SubscriptionRule(channel, level, Set.of());
  }

  public static SubscriptionRule tagged(String channel, FilterLevel level, Collection<String> tags) {
    return new SubscriptionRule(channel, level, tags == null ? null : new LinkedHashSet<>(tags));
  }

  public boolean hasTags() {
    return !tags.isEmpty();
  }

  public RuleIdentity identity() {
    return new RuleIdentity(channel, tags);
  }

  public SubscriptionRule withLevel(FilterLevel newLevel) {
    return new SubscriptionRule(channel, newLevel, tags);
  }

  public SubscriptionRule withTags(Set<String> newTags) {
    return new SubscriptionRule(channel, level, newTags);
  }
}
