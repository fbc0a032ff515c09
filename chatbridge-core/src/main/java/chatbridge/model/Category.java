package chatbridge.model;

/**
 * Category lookup result from the host's category registry.
 *
 * @param id       category id
 * @param name     display name
 * @param slug     URL slug
 * @param color    hex color without the leading {@code #}
 * @param parentId parent category id, {@code null} for top-level categories
 */
public record Category(String id, String name, String slug, String color, String parentId) {
}
