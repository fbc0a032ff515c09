package chatbridge.model;

/**
 * A {@link SubscriptionRule} together with the scope it is stored under.
 */
public record ScopedRule(FilterScope scope, SubscriptionRule rule) {
}
