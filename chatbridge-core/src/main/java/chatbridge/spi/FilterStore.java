package chatbridge.spi;

import chatbridge.model.FilterScope;
import chatbridge.model.SubscriptionRule;

import java.util.List;

/**
 * Persistence contract for subscription rules, one ordered rule list per
 * {@link FilterScope}.
 *
 * <p>Pure data access: uniqueness and merge invariants are enforced by
 * {@link chatbridge.rules.FilterRuleEngine}, which also serializes concurrent edits.
 *
 * @see chatbridge.store.InMemoryFilterStore
 */
public interface FilterStore {

  /**
   * Loads the rules of a scope in stored order.
   *
   * @param scope the scope
   * @return the rules, empty if the scope has no record
   */
  List<SubscriptionRule> load(FilterScope scope);

  /**
   * Loads the rules of a scope that is about to be rewritten. Implementations that
   * tolerate unreadable records in {@link #load} must throw here instead, so that an
   * edit never replaces a record it could not read.
   *
   * @param scope the scope
   * @return the rules, empty if the scope has no record
   */
  default List<SubscriptionRule> loadForUpdate(FilterScope scope) {
    return load(scope);
  }

  /**
   * Replaces the rules of a scope. An empty list removes the scope's record.
   *
   * @param scope the scope
   * @param rules the complete new rule list
   */
  void save(FilterScope scope, List<SubscriptionRule> rules);

  /**
   * Lists the scopes that currently have a stored record.
   *
   * @return scopes in storage order
   */
  List<FilterScope> scopes();
}
