package chatbridge.rules;

import chatbridge.TagNotFoundException;
import chatbridge.model.FilterLevel;
import chatbridge.model.FilterScope;
import chatbridge.model.FilterSetting;
import chatbridge.model.ScopedRule;
import chatbridge.model.SubscriptionRule;
import chatbridge.spi.FilterStore;
import chatbridge.spi.TagRegistry;
import chatbridge.util.KeyedLocks;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies subscribe, unsubscribe and tag edits to the stored rule sets.
 *
 * <p>Each mutation is a read-modify-write of one scope's rule list, executed under a
 * per-scope lock so concurrent edits of the same scope cannot lose updates. The
 * edit logic itself lives in {@link RuleSet}.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>At most one rule per (channel, tag set) exists within a scope.</li>
 *   <li>For a given channel, a tag belongs to at most one tagged rule, so it carries
 *       at most one filter level.</li>
 *   <li>Tag sets are never stored empty; a rule whose last tag is removed is deleted.</li>
 * </ul>
 *
 * <p>This class is thread-safe.
 *
 * @see RuleSet
 * @see FilterStore
 */
public final class FilterRuleEngine {
  private static final Logger logger = Logger.getLogger(FilterRuleEngine.class.getName());

  private final FilterStore store;
  private final TagRegistry tagRegistry;
  private final KeyedLocks locks = new KeyedLocks();

  public FilterRuleEngine(FilterStore store, TagRegistry tagRegistry) {
    this.store = Objects.requireNonNull(store, "store");
    this.tagRegistry = Objects.requireNonNull(tagRegistry, "tagRegistry");
  }

  /**
   * Sets the tag-less rule of a channel in a scope. {@link FilterSetting#UNSET} deletes
   * it; deleting an absent rule is a no-op.
   *
   * @return the applied change
   */
  public RuleChange setCategoryFilter(String channel, FilterScope scope, FilterSetting setting) {
    return edit(scope, rules -> rules.setCategoryFilter(channel, setting));
  }

  /**
   * Moves {@code tag} to the given level for a channel, or removes it from the channel
   * for {@link FilterSetting#UNSET}.
   *
   * @throws TagNotFoundException if the setting is not {@code UNSET} and the tag does not exist
   */
  public RuleChange setTagFilter(String channel, FilterScope scope, FilterSetting setting, String tag) {
    Objects.requireNonNull(tag, "tag");
    if (!setting.isUnset()) {
      requireTags(List.of(tag));
    }
    return edit(scope, rules -> rules.setTagFilter(channel, setting, tag));
  }

  /**
   * Tag filters of the slash-command surface are kept in the {@link FilterScope#ALL} scope.
   *
   * @see #setTagFilter(String, FilterScope, FilterSetting, String)
   */
  public RuleChange setTagFilter(String channel, FilterSetting setting, String tag) {
    return setTagFilter(channel, FilterScope.ALL, setting, tag);
  }

  /**
   * Adds a rule after validating every tag against the tag registry.
   *
   * @param tags tag names, {@code null} or empty for a tag-less rule
   * @throws TagNotFoundException naming the first unknown tag; nothing is persisted
   */
  public RuleChange addFilter(String channel, FilterScope scope, FilterLevel level,
      Collection<String> tags) {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(level, "level");
    Set<String> tagSet = tags == null ? Set.of() : new LinkedHashSet<>(tags);
    if (!tagSet.isEmpty()) {
      requireTags(tagSet);
    }
    SubscriptionRule rule = new SubscriptionRule(channel, level, tagSet);
    return edit(scope, rules -> rules.add(rule));
  }

  /**
   * Deletes the rule exactly matching {@code (channel, tags)}. Removing the last rule of
   * a scope removes the scope's record.
   */
  public RuleChange removeFilter(String channel, FilterScope scope, Collection<String> tags) {
    Objects.requireNonNull(channel, "channel");
    Set<String> tagSet = tags == null ? Set.of() : new LinkedHashSet<>(tags);
    return edit(scope, rules -> rules.remove(channel, tagSet));
  }

  /**
   * Returns the stored rules of one scope.
   */
  public List<SubscriptionRule> rules(FilterScope scope) {
    return store.load(scope);
  }

  /**
   * Returns every stored rule, category scopes first in storage order and the
   * {@link FilterScope#ALL} scope last.
   */
  public List<ScopedRule> allRules() {
    List<ScopedRule> result = new ArrayList<>();
    for (FilterScope scope : store.scopes()) {
      if (scope.isAll()) continue;
      for (SubscriptionRule rule : store.load(scope)) {
        result.add(new ScopedRule(scope, rule));
      }
    }
    for (SubscriptionRule rule : store.load(FilterScope.ALL)) {
      result.add(new ScopedRule(FilterScope.ALL, rule));
    }
    return result;
  }

  /**
   * Returns the rules of one channel across all scopes. The channel matches either the
   * stored name or its {@linkplain Channels#display display form}.
   */
  public List<ScopedRule> rulesForChannel(String channel) {
    Objects.requireNonNull(channel, "channel");
    List<ScopedRule> result = new ArrayList<>();
    for (ScopedRule scoped : allRules()) {
      String stored = scoped.rule().channel();
      if (stored.equals(channel) || Channels.display(stored).equals(channel)) {
        result.add(scoped);
      }
    }
    return result;
  }

  private RuleChange edit(FilterScope scope, Function<RuleSet, RuleChange> op) {
    Objects.requireNonNull(scope, "scope");
    return locks.withLock(scope.storeKey(), () -> {
      RuleSet current = RuleSet.of(store.loadForUpdate(scope));
      RuleChange change = op.apply(current);
      if (!change.isEmpty()) {
        store.save(scope, change.rules());
        if (logger.isLoggable(Level.FINE)) {
          logger.fine("Updated " + scope.storeKey() + ": +" + change.added() + " -" + change.removed());
        }
      }
      return change;
    });
  }

  private void requireTags(Collection<String> tags) {
    Set<String> existing = tagRegistry.existing(tags);
    for (String tag : tags) {
      if (!existing.contains(tag)) {
        throw new TagNotFoundException(tag);
      }
    }
  }
}
