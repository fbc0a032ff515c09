package chatbridge.slack;

import chatbridge.ChatBridgeException;
import chatbridge.DeliveryException;
import chatbridge.json.ChatBridgeJson;
import chatbridge.model.ChatMessage;
import chatbridge.model.ConversationState;
import chatbridge.rules.Channels;
import chatbridge.spi.DeliveryReceipt;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.logging.Logger;

/**
 * Token-mode delivery through the Slack Web API.
 *
 * <p>New threads are sent with {@code chat.postMessage}; coalesced posts replace the
 * existing message with {@code chat.update}. Both are form-encoded POSTs carrying the
 * bot token. A response with {@code "ok": false} raises a {@link DeliveryException}
 * carrying Slack's {@code error} code.
 *
 * <p>The receipt of a new message takes its time from the message {@code ts}; the
 * receipt of an edit takes the local clock, so every edit restarts the freshness window.
 */
public final class SlackApiDelivery extends AbstractSlackDelivery {
  private static final Logger logger = Logger.getLogger(SlackApiDelivery.class.getName());

  public static final String DEFAULT_API_BASE = "https://slack.com/api";

  private final URI apiBase;
  private final String accessToken;

  public SlackApiDelivery(String accessToken) {
    this(defaultClient(), URI.create(DEFAULT_API_BASE), accessToken, DEFAULT_TIMEOUT, Clock.systemUTC());
  }

  public SlackApiDelivery(HttpClient httpClient, URI apiBase, String accessToken, Duration timeout,
      Clock clock) {
    super(httpClient, timeout, clock);
    this.apiBase = Objects.requireNonNull(apiBase, "apiBase");
    this.accessToken = Objects.requireNonNull(accessToken, "accessToken");
    if (accessToken.isBlank()) {
      throw new IllegalArgumentException("accessToken must not be blank");
    }
  }

  @Override
  public DeliveryReceipt post(ChatMessage message) {
    Map<String, String> form = new LinkedHashMap<>();
    form.put("token", accessToken);
    putIfPresent(form, "username", message.username());
    putIfPresent(form, "icon_url", message.iconUrl());
    form.put("channel", Channels.bare(message.channel()));
    form.put("attachments", ChatBridgeJson.write(ChatBridgeJson.attachmentsNode(message.attachments())));

    JsonNode body = call("chat.postMessage", form, message.channel());
    String ts = ChatBridgeJson.text(body, "ts");
    Instant sentAt = SlackTimestamps.toInstant(ts);
    return new DeliveryReceipt(ts, ChatBridgeJson.text(body, "channel"), echoed(body, message),
        sentAt != null ? sentAt : clock.instant());
  }

  @Override
  public DeliveryReceipt update(ConversationState previous, ChatMessage message) {
    String channel = previous.vendorChannel() != null ? previous.vendorChannel() : message.channel();
    Map<String, String> form = new LinkedHashMap<>();
    form.put("token", accessToken);
    putIfPresent(form, "username", message.username());
    form.put("text", message.text() == null ? "" : message.text());
    form.put("channel", channel);
    form.put("attachments", ChatBridgeJson.write(ChatBridgeJson.attachmentsNode(message.attachments())));
    form.put("ts", previous.messageId());

    JsonNode body = call("chat.update", form, previous.channel());
    String ts = ChatBridgeJson.text(body, "ts");
    String vendorChannel = ChatBridgeJson.text(body, "channel");
    return new DeliveryReceipt(ts != null ? ts : previous.messageId(),
        vendorChannel != null ? vendorChannel : channel, echoed(body, message), clock.instant());
  }

  @Override
  public boolean supportsUpdates() {
    return true;
  }

  private JsonNode call(String method, Map<String, String> form, String channel) {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(apiBase.toString() + "/" + method))
        .timeout(timeout)
        .header("Content-Type", "application/x-www-form-urlencoded; charset=utf-8")
        .header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(formEncode(form)))
        .build();

    String response = send(request, channel);
    JsonNode body;
    try {
      body = ChatBridgeJson.readTree(response);
    } catch (ChatBridgeException e) {
      throw new DeliveryException(channel, "Unreadable " + method + " response", e);
    }
    if (!body.path("ok").asBoolean(false)) {
      String error = body.path("error").asText("unknown_error");
      logger.warning(method + " to " + channel + " rejected: " + error);
      throw new DeliveryException(channel, error, method + " rejected: " + error);
    }
    return body;
  }

  /**
   * Returns the message Slack echoed back, completed with the fields Slack omits.
   */
  private static ChatMessage echoed(JsonNode body, ChatMessage sent) {
    JsonNode node = body.get("message");
    if (node == null || !node.isObject()) {
      return sent;
    }
    ChatMessage echo = ChatBridgeJson.readMessage(node, sent.channel());
    return new ChatMessage(
        sent.channel(),
        echo.username() != null ? echo.username() : sent.username(),
        sent.iconUrl(),
        echo.text() != null && !echo.text().isEmpty() ? echo.text() : sent.text(),
        echo.attachments().size() == sent.attachments().size() ? echo.attachments() : sent.attachments());
  }

  static String formEncode(Map<String, String> form) {
    StringJoiner joiner = new StringJoiner("&");
    for (Map.Entry<String, String> e : form.entrySet()) {
      joiner.add(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
          + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
    }
    return joiner.toString();
  }

  private static void putIfPresent(Map<String, String> form, String key, String value) {
    if (value != null) {
      form.put(key, value);
    }
  }
}
