package chatbridge.store;

import chatbridge.model.FilterScope;
import chatbridge.model.SubscriptionRule;
import chatbridge.spi.FilterStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Heap-backed {@link FilterStore}. Suitable for tests and single-process hosts
 * without a database.
 *
 * <p>This class is thread-safe.
 */
public final class InMemoryFilterStore implements FilterStore {
  private final Map<FilterScope, List<SubscriptionRule>> rules = new ConcurrentHashMap<>();
  private final ConcurrentLinkedDeque<FilterScope> order = new ConcurrentLinkedDeque<>();

  @Override
  public List<SubscriptionRule> load(FilterScope scope) {
    List<SubscriptionRule> stored = rules.get(scope);
    return stored == null ? List.of() : stored;
  }

  @Override
  public void save(FilterScope scope, List<SubscriptionRule> newRules) {
    if (newRules.isEmpty()) {
      if (rules.remove(scope) != null) {
        order.remove(scope);
      }
      return;
    }
    if (rules.put(scope, List.copyOf(newRules)) == null) {
      order.addLast(scope);
    }
  }

  @Override
  public List<FilterScope> scopes() {
    return new ArrayList<>(order);
  }
}
