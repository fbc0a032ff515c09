/**
 * Subscription rule editing.
 *
 * <p>{@link chatbridge.rules.RuleSet} holds the pure edit functions over an immutable
 * rule list; {@link chatbridge.rules.FilterRuleEngine} applies them to a
 * {@link chatbridge.spi.FilterStore} under per-scope locks.
 */
package chatbridge.rules;
