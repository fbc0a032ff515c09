package chatbridge.spring.boot;

import chatbridge.ChatBridgeSettings;
import chatbridge.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the chat bridge.
 *
 * @see ChatBridgeAutoConfiguration
 */
@ConfigurationProperties(prefix = "chatbridge")
public class ChatBridgeProperties {

  /**
   * Master switch; when false every post is skipped before matching.
   */
  private boolean enabled = true;

  /**
   * Whether tag filters of subscription rules are evaluated.
   */
  private boolean taggingEnabled = true;

  /**
   * Maximum length of the post excerpt in a chat attachment.
   */
  private int excerptLength = ChatBridgeSettings.DEFAULT_EXCERPT_LENGTH;

  /**
   * Name the bot posts under.
   */
  private String username = "Forum";

  private String iconUrl;

  /**
   * Bot access token; selects token mode (chat.postMessage / chat.update).
   */
  private String accessToken;

  /**
   * Incoming webhook URL; used when no access token is set.
   */
  private String webhookUrl;

  private String apiBaseUrl = "https://slack.com/api";

  /**
   * HTTP request timeout for chat deliveries.
   */
  private Duration timeout = Duration.ofSeconds(10);

  /**
   * How long a chat message keeps absorbing follow-up posts of the same topic.
   */
  private Duration freshnessWindow = ChatBridgeSettings.DEFAULT_FRESHNESS_WINDOW;

  /**
   * Maximum number of posts coalesced into one chat message.
   */
  private int maxAttachments = ChatBridgeSettings.DEFAULT_MAX_ATTACHMENTS;

  /**
   * Table backing the JDBC filter and conversation stores.
   */
  private String tableName = TableNames.DEFAULT_TABLE;

  private final Metrics metrics = new Metrics();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public boolean isTaggingEnabled() {
    return taggingEnabled;
  }

  public void setTaggingEnabled(boolean taggingEnabled) {
    this.taggingEnabled = taggingEnabled;
  }

  public int getExcerptLength() {
    return excerptLength;
  }

  public void setExcerptLength(int excerptLength) {
    this.excerptLength = excerptLength;
  }

  public String getUsername() {
    return username;
  }

  public void setUsername(String username) {
    this.username = username;
  }

  public String getIconUrl() {
    return iconUrl;
  }

  public void setIconUrl(String iconUrl) {
    this.iconUrl = iconUrl;
  }

  public String getAccessToken() {
    return accessToken;
  }

  public void setAccessToken(String accessToken) {
    this.accessToken = accessToken;
  }

  public String getWebhookUrl() {
    return webhookUrl;
  }

  public void setWebhookUrl(String webhookUrl) {
    this.webhookUrl = webhookUrl;
  }

  public String getApiBaseUrl() {
    return apiBaseUrl;
  }

  public void setApiBaseUrl(String apiBaseUrl) {
    this.apiBaseUrl = apiBaseUrl;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public Duration getFreshnessWindow() {
    return freshnessWindow;
  }

  public void setFreshnessWindow(Duration freshnessWindow) {
    this.freshnessWindow = freshnessWindow;
  }

  public int getMaxAttachments() {
    return maxAttachments;
  }

  public void setMaxAttachments(int maxAttachments) {
    this.maxAttachments = maxAttachments;
  }

  public String getTableName() {
    return tableName;
  }

  public void setTableName(String tableName) {
    this.tableName = tableName;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  /**
   * Copies the runtime settings into a {@link ChatBridgeSettings}.
   */
  public ChatBridgeSettings toSettings() {
    return new ChatBridgeSettings()
        .setEnabled(enabled)
        .setTaggingEnabled(taggingEnabled)
        .setExcerptLength(excerptLength)
        .setUsername(username)
        .setIconUrl(iconUrl)
        .setFreshnessWindow(freshnessWindow)
        .setMaxAttachments(maxAttachments);
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "chatbridge";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
