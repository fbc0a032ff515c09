package chatbridge.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Subscription intensity of a {@link SubscriptionRule}.
 *
 * <ul>
 *   <li>{@link #MUTE} suppresses notifications for the rule's identity</li>
 *   <li>{@link #WATCH} notifies on every post, replies included</li>
 *   <li>{@link #FOLLOW} notifies on the first post of a topic only</li>
 * </ul>
 *
 * <p>The persisted form is the lower-case {@linkplain #code() code}.
 */
public enum FilterLevel {
  MUTE("mute", 0),
  WATCH("watch", 1),
  FOLLOW("follow", 1);

  private final String code;
  private final int precedence;

  FilterLevel(String code, int precedence) {
    this.code = code;
    this.precedence = precedence;
  }

  public String code() {
    return code;
  }

  /**
   * Evaluation order used by the matcher; lower values are evaluated first.
   * Watch and follow share the same precedence.
   */
  public int precedence() {
    return precedence;
  }

  /**
   * Parses a persisted or user-supplied level code.
   *
   * @param code the level code, case-insensitive
   * @return the level
   * @throws IllegalArgumentException if the code is not a known level
   */
  public static FilterLevel parse(String code) {
    Objects.requireNonNull(code, "code");
    String normalized = code.trim().toLowerCase(Locale.ROOT);
    for (FilterLevel level : values()) {
      if (level.code.equals(normalized)) {
        return level;
      }
    }
    throw new IllegalArgumentException("Unknown filter level: " + code);
  }
}
