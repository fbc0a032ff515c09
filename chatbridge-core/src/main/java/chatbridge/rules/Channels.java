package chatbridge.rules;

/**
 * Channel name helpers.
 */
public final class Channels {

  private Channels() {
  }

  /**
   * Returns the chat display form of a channel: names already carrying {@code #} or
   * {@code @} are kept, bare channel ids are wrapped as {@code <#id>}.
   */
  public static String display(String channel) {
    if (channel.contains("@") || channel.contains("#")) {
      return channel;
    }
    return "<#" + channel + ">";
  }

  /**
   * Strips a leading {@code #}, as expected by vendor APIs that take channel names.
   */
  public static String bare(String channel) {
    return channel.startsWith("#") ? channel.substring(1) : channel;
  }
}
