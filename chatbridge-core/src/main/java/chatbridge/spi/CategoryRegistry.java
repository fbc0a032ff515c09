package chatbridge.spi;

import chatbridge.model.Category;

/**
 * Host lookup of categories.
 */
@FunctionalInterface
public interface CategoryRegistry {

  /**
   * @param categoryId the category id
   * @return the category, or {@code null} if unknown
   */
  Category find(String categoryId);
}
