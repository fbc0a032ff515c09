package chatbridge.spi;

import java.util.Collection;
import java.util.Set;

/**
 * Host lookup of existing tag names.
 */
@FunctionalInterface
public interface TagRegistry {

  /**
   * Returns the subset of {@code names} that exist.
   *
   * @param names candidate tag names
   * @return existing names, never {@code null}
   */
  Set<String> existing(Collection<String> names);
}
