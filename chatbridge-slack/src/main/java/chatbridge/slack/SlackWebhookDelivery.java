package chatbridge.slack;

import chatbridge.json.ChatBridgeJson;
import chatbridge.model.ChatMessage;
import chatbridge.model.ConversationState;
import chatbridge.spi.DeliveryReceipt;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Webhook-mode delivery: one JSON POST of the full message to an incoming-webhook URL.
 *
 * <p>Webhooks return no message id, so messages cannot be edited and every post starts
 * a new thread.
 */
public final class SlackWebhookDelivery extends AbstractSlackDelivery {
  private final URI webhookUrl;

  public SlackWebhookDelivery(URI webhookUrl) {
    this(defaultClient(), webhookUrl, DEFAULT_TIMEOUT, Clock.systemUTC());
  }

  public SlackWebhookDelivery(HttpClient httpClient, URI webhookUrl, Duration timeout, Clock clock) {
    super(httpClient, timeout, clock);
    this.webhookUrl = Objects.requireNonNull(webhookUrl, "webhookUrl");
  }

  @Override
  public DeliveryReceipt post(ChatMessage message) {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(webhookUrl)
        .timeout(timeout)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(ChatBridgeJson.write(ChatBridgeJson.messageNode(message))))
        .build();
    send(request, message.channel());
    return new DeliveryReceipt(null, null, message, clock.instant());
  }

  @Override
  public DeliveryReceipt update(ConversationState previous, ChatMessage message) {
    throw new UnsupportedOperationException("Webhook deliveries cannot edit messages");
  }

  @Override
  public boolean supportsUpdates() {
    return false;
  }
}
