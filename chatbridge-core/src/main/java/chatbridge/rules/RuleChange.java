package chatbridge.rules;

import chatbridge.model.SubscriptionRule;

import java.util.List;

/**
 * Outcome of a pure rule-set edit: the complete new rule list plus the change-set
 * that produced it. An in-place update appears as the old rule in {@code removed}
 * and the new rule in {@code added}.
 *
 * @param rules   the rule list after the edit
 * @param added   rules present after but not before
 * @param removed rules present before but not after
 */
public record RuleChange(List<SubscriptionRule> rules, List<SubscriptionRule> added,
    List<SubscriptionRule> removed) {

  public RuleChange {
    rules = List.copyOf(rules);
    added = List.copyOf(added);
    removed = List.copyOf(removed);
  }

  static RuleChange unchanged(List<SubscriptionRule> rules) {
    return new RuleChange(rules, List.of(), List.of());
  }

  public boolean isEmpty() {
    return added.isEmpty() && removed.isEmpty();
  }
}
