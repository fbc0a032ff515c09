package chatbridge.slack;

import java.time.Instant;

/**
 * Conversion of Slack message timestamps ({@code "1714557600.000100"}: epoch seconds with a
 * six-digit sequence suffix) to {@link Instant}.
 */
public final class SlackTimestamps {

  private SlackTimestamps() {
  }

  /**
   * @return the instant, or {@code null} if {@code ts} is not a Slack timestamp
   */
  public static Instant toInstant(String ts) {
    if (ts == null || ts.isEmpty()) {
      return null;
    }
    int dot = ts.indexOf('.');
    try {
      long seconds = Long.parseLong(dot < 0 ? ts : ts.substring(0, dot));
      long micros = 0;
      if (dot >= 0 && dot < ts.length() - 1) {
        String fraction = (ts.substring(dot + 1) + "000000").substring(0, 6);
        micros = Long.parseLong(fraction);
      }
      return Instant.ofEpochSecond(seconds, micros * 1000);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
