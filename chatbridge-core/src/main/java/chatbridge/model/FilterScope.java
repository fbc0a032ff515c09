package chatbridge.model;

import java.util.Objects;

/**
 * The category a rule applies to, or the wildcard {@link #ALL} scope.
 *
 * <p>Each scope maps to one storage record, keyed {@code category_<id>}
 * ({@code category_*} for the wildcard).
 */
public final class FilterScope {
  public static final String KEY_PREFIX = "category_";
  private static final String WILDCARD = "*";

  public static final FilterScope ALL = new FilterScope(null);

  private final String categoryId;

  private FilterScope(String categoryId) {
    this.categoryId = categoryId;
  }

  /**
   * Returns the scope for a concrete category.
   *
   * @param categoryId the category id; {@code null} or empty yields {@link #ALL}
   */
  public static FilterScope category(String categoryId) {
    if (categoryId == null || categoryId.isEmpty() || WILDCARD.equals(categoryId)) {
      return ALL;
    }
    return new FilterScope(categoryId);
  }

  /**
   * Reverse of {@link #storeKey()}.
   *
   * @throws IllegalArgumentException if the key does not carry the category prefix
   */
  public static FilterScope fromStoreKey(String key) {
    Objects.requireNonNull(key, "key");
    if (!key.startsWith(KEY_PREFIX)) {
      throw new IllegalArgumentException("Not a filter scope key: " + key);
    }
    return category(key.substring(KEY_PREFIX.length()));
  }

  public boolean isAll() {
    return categoryId == null;
  }

  /**
   * Returns the category id, or {@code null} for {@link #ALL}.
   */
  public String categoryId() {
    return categoryId;
  }

  public String storeKey() {
    return KEY_PREFIX + (categoryId == null ? WILDCARD : categoryId);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof FilterScope other)) return false;
    return Objects.equals(categoryId, other.categoryId);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(categoryId);
  }

  @Override
  public String toString() {
    return isAll() ? "FilterScope[ALL]" : "FilterScope[" + categoryId + "]";
  }
}
