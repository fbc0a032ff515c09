package chatbridge.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Argument of the rule-editing operations: a concrete {@link FilterLevel} or
 * {@link #UNSET} to delete the matching rule.
 */
public enum FilterSetting {
  MUTE(FilterLevel.MUTE),
  WATCH(FilterLevel.WATCH),
  FOLLOW(FilterLevel.FOLLOW),
  UNSET(null);

  private final FilterLevel level;

  FilterSetting(FilterLevel level) {
    this.level = level;
  }

  /**
   * Returns the level this setting applies, or {@code null} for {@link #UNSET}.
   */
  public FilterLevel level() {
    return level;
  }

  public boolean isUnset() {
    return level == null;
  }

  public static FilterSetting of(FilterLevel level) {
    Objects.requireNonNull(level, "level");
    return switch (level) {
      case MUTE -> MUTE;
      case WATCH -> WATCH;
      case FOLLOW -> FOLLOW;
    };
  }

  /**
   * Parses {@code mute}, {@code watch}, {@code follow} or {@code unset}.
   *
   * @throws IllegalArgumentException for any other value
   */
  public static FilterSetting parse(String code) {
    Objects.requireNonNull(code, "code");
    if ("unset".equals(code.trim().toLowerCase(Locale.ROOT))) {
      return UNSET;
    }
    return of(FilterLevel.parse(code));
  }
}
