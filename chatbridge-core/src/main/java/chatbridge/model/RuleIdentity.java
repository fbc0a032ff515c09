package chatbridge.model;

import java.util.Set;

/**
 * Uniqueness key of a {@link SubscriptionRule} within one scope. Tag sets compare
 * by content, not by order.
 */
public record RuleIdentity(String channel, Set<String> tags) {

  public RuleIdentity {
    tags = tags == null ? Set.of() : Set.copyOf(tags);
  }
}
