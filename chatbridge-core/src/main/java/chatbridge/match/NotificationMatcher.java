package chatbridge.match;

import chatbridge.model.FilterLevel;
import chatbridge.model.FilterScope;
import chatbridge.model.ForumPost;
import chatbridge.model.MatchedTarget;
import chatbridge.model.RuleIdentity;
import chatbridge.model.SubscriptionRule;
import chatbridge.spi.FilterStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.logging.Logger;

/**
 * Selects the channels that should receive a post.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Load the rules of the post's category scope followed by the {@link FilterScope#ALL}
 *       scope.</li>
 *   <li>Stable-sort by {@linkplain FilterLevel#precedence() precedence} so mute rules come
 *       first, then keep the first rule per {@linkplain SubscriptionRule#identity() identity}.
 *       A mute rule therefore survives deduplication against a watch or follow rule with
 *       the same channel and tag set.</li>
 *   <li>Skip tagged rules whose tags do not intersect the topic's tags (tag-less rules
 *       always pass), mute rules, and follow rules for replies.</li>
 * </ol>
 *
 * <p>The result holds one entry per distinct (channel, level) pair, in evaluation order.
 * Rules are not reconciled across identities: a tag rule and a tag-less rule of the
 * same channel are evaluated independently and may both produce targets.
 */
public final class NotificationMatcher {
  private static final Logger logger = Logger.getLogger(NotificationMatcher.class.getName());

  private static final Comparator<SubscriptionRule> BY_PRECEDENCE =
      Comparator.comparingInt(rule -> rule.level().precedence());

  private final FilterStore store;
  private final BooleanSupplier taggingEnabled;

  public NotificationMatcher(FilterStore store) {
    this(store, true);
  }

  /**
   * @param store          rule source
   * @param taggingEnabled when {@code false}, tag sets are ignored and tagged rules behave
   *                       like tag-less ones
   */
  public NotificationMatcher(FilterStore store, boolean taggingEnabled) {
    this(store, () -> taggingEnabled);
  }

  /**
   * @param taggingEnabled consulted on every match
   */
  public NotificationMatcher(FilterStore store, BooleanSupplier taggingEnabled) {
    this.store = Objects.requireNonNull(store, "store");
    this.taggingEnabled = Objects.requireNonNull(taggingEnabled, "taggingEnabled");
  }

  public List<MatchedTarget> match(ForumPost post) {
    return match(post.topic().categoryId(), post.topic().tags(), post.isFirstPost());
  }

  /**
   * @param categoryId  the topic's category, {@code null} for uncategorized topics
   * @param topicTags   the topic's tags
   * @param isFirstPost whether the post opens its topic
   * @return the delivery targets in evaluation order
   */
  public List<MatchedTarget> match(String categoryId, Set<String> topicTags, boolean isFirstPost) {
    Set<String> tags = topicTags == null ? Set.of() : topicTags;
    boolean tagging = taggingEnabled.getAsBoolean();

    List<SubscriptionRule> candidates = new ArrayList<>();
    FilterScope scope = FilterScope.category(categoryId);
    if (!scope.isAll()) {
      candidates.addAll(store.load(scope));
    }
    candidates.addAll(store.load(FilterScope.ALL));
    candidates.sort(BY_PRECEDENCE);

    Set<RuleIdentity> seen = new HashSet<>();
    Set<MatchedTarget> targets = new LinkedHashSet<>();
    for (SubscriptionRule rule : candidates) {
      if (rule.channel().isBlank()) {
        logger.warning("Skipping rule without channel: " + rule);
        continue;
      }
      if (!seen.add(rule.identity())) {
        continue;
      }
      if (tagging && rule.hasTags() && !intersects(rule.tags(), tags)) {
        continue;
      }
      if (rule.level() == FilterLevel.MUTE) {
        continue;
      }
      if (rule.level() == FilterLevel.FOLLOW && !isFirstPost) {
        continue;
      }
      targets.add(new MatchedTarget(rule.channel(), rule.level()));
    }
    return List.copyOf(targets);
  }

  private static boolean intersects(Set<String> ruleTags, Set<String> topicTags) {
    for (String tag : ruleTags) {
      if (topicTags.contains(tag)) {
        return true;
      }
    }
    return false;
  }
}
