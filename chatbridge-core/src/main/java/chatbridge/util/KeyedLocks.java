package chatbridge.util;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * {@link ConcurrentHashMap}-based per-key mutual exclusion.
 *
 * <p>Locks are reference counted and removed once no thread holds or waits for
 * them, so the map only grows with the number of keys in use concurrently.
 *
 * <p>This class is thread-safe.
 */
public final class KeyedLocks {
  private final Map<String, Entry> locks = new ConcurrentHashMap<>();

  /**
   * Runs {@code action} while holding the lock for {@code key}.
   *
   * @param key    the lock key
   * @param action the action
   * @return the action's result
   */
  public <T> T withLock(String key, Supplier<T> action) {
    Entry entry = acquire(key);
    entry.lock.lock();
    try {
      return action.get();
    } finally {
      entry.lock.unlock();
      release(key, entry);
    }
  }

  /**
   * Runs {@code action} while holding the lock for {@code key}.
   */
  public void withLock(String key, Runnable action) {
    withLock(key, () -> {
      action.run();
      return null;
    });
  }

  /**
   * Number of keys with a live lock. Intended for tests.
   */
  public int size() {
    return locks.size();
  }

  private Entry acquire(String key) {
    return locks.compute(key, (k, existing) -> {
      Entry entry = existing == null ? new Entry() : existing;
      entry.users++;
      return entry;
    });
  }

  private void release(String key, Entry entry) {
    locks.computeIfPresent(key, (k, existing) -> {
      if (existing != entry) return existing;
      return --existing.users == 0 ? null : existing;
    });
  }

  private static final class Entry {
    final ReentrantLock lock = new ReentrantLock();
    // guarded by the map's per-key compute
    int users;
  }
}
