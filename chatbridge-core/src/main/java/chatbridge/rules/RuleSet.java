package chatbridge.rules;

import chatbridge.model.FilterLevel;
import chatbridge.model.FilterSetting;
import chatbridge.model.RuleIdentity;
import chatbridge.model.SubscriptionRule;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Immutable rule list of one scope with the pure edit operations used by
 * {@link FilterRuleEngine}.
 *
 * <p>Every operation leaves this instance untouched and returns a {@link RuleChange}
 * describing the new list. Callers persist {@link RuleChange#rules()} only when the
 * change is not empty.
 */
public final class RuleSet {
  private final List<SubscriptionRule> rules;

  private RuleSet(List<SubscriptionRule> rules) {
    this.rules = List.copyOf(rules);
  }

  public static RuleSet of(List<SubscriptionRule> rules) {
    Objects.requireNonNull(rules, "rules");
    return new RuleSet(rules);
  }

  public static RuleSet empty() {
    return new RuleSet(List.of());
  }

  public List<SubscriptionRule> rules() {
    return rules;
  }

  /**
   * Sets, updates or (for {@link FilterSetting#UNSET}) deletes the tag-less rule of
   * {@code channel}. Tagged rules of the channel are not touched.
   */
  public RuleChange setCategoryFilter(String channel, FilterSetting setting) {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(setting, "setting");

    int index = indexOf(r -> r.channel().equals(channel) && !r.hasTags());
    if (setting.isUnset()) {
      if (index < 0) {
        return RuleChange.unchanged(rules);
      }
      List<SubscriptionRule> next = new ArrayList<>(rules);
      SubscriptionRule removed = next.remove(index);
      return new RuleChange(next, List.of(), List.of(removed));
    }

    FilterLevel level = setting.level();
    List<SubscriptionRule> next = new ArrayList<>(rules);
    if (index < 0) {
      SubscriptionRule created = SubscriptionRule.untagged(channel, level);
      next.add(created);
      return new RuleChange(next, List.of(created), List.of());
    }
    SubscriptionRule existing = next.get(index);
    if (existing.level() == level) {
      return RuleChange.unchanged(rules);
    }
    SubscriptionRule updated = existing.withLevel(level);
    next.set(index, updated);
    return new RuleChange(next, List.of(updated), List.of(existing));
  }

  /**
   * Moves {@code tag} to the tagged rule of {@code channel} at the given level.
   *
   * <p>The tag is first stripped from every tagged rule of the channel; rules whose
   * tag set becomes empty are deleted. Unless the setting is {@link FilterSetting#UNSET},
   * the tag is then appended to the channel's remaining tagged rule at that level, or a
   * new single-tag rule is created. Rules of other channels are never touched.
   *
   * <p>Stripping can shrink a rule to the tag set of another rule of the channel. The two
   * are merged into the earlier position, keeping the level the matcher would have let
   * win: mute over watch/follow, otherwise the earlier rule.
   */
  public RuleChange setTagFilter(String channel, FilterSetting setting, String tag) {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(setting, "setting");
    Objects.requireNonNull(tag, "tag");

    List<SubscriptionRule> next = new ArrayList<>(rules.size() + 1);
    for (SubscriptionRule rule : rules) {
      if (rule.channel().equals(channel) && rule.hasTags() && rule.tags().contains(tag)) {
        Set<String> remaining = new LinkedHashSet<>(rule.tags());
        remaining.remove(tag);
        if (!remaining.isEmpty()) {
          next.add(rule.withTags(remaining));
        }
      } else {
        next.add(rule);
      }
    }

    if (!setting.isUnset()) {
      FilterLevel level = setting.level();
      int index = -1;
      for (int i = 0; i < next.size(); i++) {
        SubscriptionRule r = next.get(i);
        if (r.channel().equals(channel) && r.hasTags() && r.level() == level) {
          index = i;
          break;
        }
      }
      if (index >= 0) {
        SubscriptionRule target = next.get(index);
        Set<String> tags = new LinkedHashSet<>(target.tags());
        tags.add(tag);
        next.set(index, target.withTags(tags));
      } else {
        next.add(SubscriptionRule.tagged(channel, level, List.of(tag)));
      }
    }
    return diff(mergeIdentities(next));
  }

  /**
   * Adds a rule. If a rule with the same {@linkplain SubscriptionRule#identity() identity}
   * exists, its level is replaced in place so identities stay unique.
   */
  public RuleChange add(SubscriptionRule rule) {
    Objects.requireNonNull(rule, "rule");
    RuleIdentity identity = rule.identity();
    int index = indexOf(r -> r.identity().equals(identity));
    List<SubscriptionRule> next = new ArrayList<>(rules);
    if (index < 0) {
      next.add(rule);
      return new RuleChange(next, List.of(rule), List.of());
    }
    SubscriptionRule existing = next.get(index);
    if (existing.equals(rule)) {
      return RuleChange.unchanged(rules);
    }
    next.set(index, rule);
    return new RuleChange(next, List.of(rule), List.of(existing));
  }

  /**
   * Deletes the rule whose channel and tag set equal the arguments exactly.
   */
  public RuleChange remove(String channel, Set<String> tags) {
    RuleIdentity identity = new RuleIdentity(channel, tags);
    List<SubscriptionRule> next = new ArrayList<>(rules.size());
    List<SubscriptionRule> removed = new ArrayList<>();
    for (SubscriptionRule rule : rules) {
      if (rule.identity().equals(identity)) {
        removed.add(rule);
      } else {
        next.add(rule);
      }
    }
    return removed.isEmpty()
        ? RuleChange.unchanged(rules)
        : new RuleChange(next, List.of(), removed);
  }

  private static List<SubscriptionRule> mergeIdentities(List<SubscriptionRule> candidates) {
    Map<RuleIdentity, Integer> positions = new HashMap<>();
    List<SubscriptionRule> merged = new ArrayList<>(candidates.size());
    for (SubscriptionRule rule : candidates) {
      Integer at = positions.putIfAbsent(rule.identity(), merged.size());
      if (at == null) {
        merged.add(rule);
      } else if (rule.level().precedence() < merged.get(at).level().precedence()) {
        merged.set(at, merged.get(at).withLevel(rule.level()));
      }
    }
    return merged;
  }

  private int indexOf(Predicate<SubscriptionRule> predicate) {
    for (int i = 0; i < rules.size(); i++) {
      if (predicate.test(rules.get(i))) {
        return i;
      }
    }
    return -1;
  }

  private RuleChange diff(List<SubscriptionRule> next) {
    List<SubscriptionRule> added = new ArrayList<>();
    for (SubscriptionRule rule : next) {
      if (!rules.contains(rule)) {
        added.add(rule);
      }
    }
    List<SubscriptionRule> removed = new ArrayList<>();
    for (SubscriptionRule rule : rules) {
      if (!next.contains(rule)) {
        removed.add(rule);
      }
    }
    return new RuleChange(next, added, removed);
  }
}
