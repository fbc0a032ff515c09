package chatbridge;

import java.time.Duration;
import java.util.Objects;

/**
 * Runtime settings of a {@link ChatBridge}.
 */
public final class ChatBridgeSettings {
  public static final Duration DEFAULT_FRESHNESS_WINDOW = Duration.ofMinutes(5);
  public static final int DEFAULT_MAX_ATTACHMENTS = 5;
  public static final int DEFAULT_EXCERPT_LENGTH = 400;

  private boolean enabled = true;
  private boolean taggingEnabled = true;
  private int excerptLength = DEFAULT_EXCERPT_LENGTH;
  private String username = "Forum";
  private String iconUrl;
  private Duration freshnessWindow = DEFAULT_FRESHNESS_WINDOW;
  private int maxAttachments = DEFAULT_MAX_ATTACHMENTS;

  public boolean isEnabled() {
    return enabled;
  }

  public ChatBridgeSettings setEnabled(boolean enabled) {
    this.enabled = enabled;
    return this;
  }

  public boolean isTaggingEnabled() {
    return taggingEnabled;
  }

  public ChatBridgeSettings setTaggingEnabled(boolean taggingEnabled) {
    this.taggingEnabled = taggingEnabled;
    return this;
  }

  public int getExcerptLength() {
    return excerptLength;
  }

  public ChatBridgeSettings setExcerptLength(int excerptLength) {
    if (excerptLength <= 0) {
      throw new IllegalArgumentException("excerptLength must be > 0");
    }
    this.excerptLength = excerptLength;
    return this;
  }

  /**
   * Display name the bot posts under; usually the forum title.
   */
  public String getUsername() {
    return username;
  }

  public ChatBridgeSettings setUsername(String username) {
    this.username = Objects.requireNonNull(username, "username");
    return this;
  }

  public String getIconUrl() {
    return iconUrl;
  }

  public ChatBridgeSettings setIconUrl(String iconUrl) {
    this.iconUrl = iconUrl;
    return this;
  }

  public Duration getFreshnessWindow() {
    return freshnessWindow;
  }

  public ChatBridgeSettings setFreshnessWindow(Duration freshnessWindow) {
    Objects.requireNonNull(freshnessWindow, "freshnessWindow");
    if (freshnessWindow.isNegative()) {
      throw new IllegalArgumentException("freshnessWindow must not be negative");
    }
    this.freshnessWindow = freshnessWindow;
    return this;
  }

  public int getMaxAttachments() {
    return maxAttachments;
  }

  public ChatBridgeSettings setMaxAttachments(int maxAttachments) {
    if (maxAttachments < 1) {
      throw new IllegalArgumentException("maxAttachments must be >= 1");
    }
    this.maxAttachments = maxAttachments;
    return this;
  }
}
