package chatbridge.model;

/**
 * A channel selected for delivery and the level of the rule that selected it.
 */
public record MatchedTarget(String channel, FilterLevel level) {
}
