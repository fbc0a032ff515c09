package chatbridge.slack;

import chatbridge.DeliveryException;
import chatbridge.spi.ChatDelivery;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Shared HTTP plumbing of the Slack deliveries.
 */
abstract class AbstractSlackDelivery implements ChatDelivery {
  private static final Logger logger = Logger.getLogger(AbstractSlackDelivery.class.getName());

  static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  protected final HttpClient httpClient;
  protected final Duration timeout;
  protected final Clock clock;

  AbstractSlackDelivery(HttpClient httpClient, Duration timeout, Clock clock) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  static HttpClient defaultClient() {
    return HttpClient.newBuilder()
        .connectTimeout(DEFAULT_TIMEOUT)
        .build();
  }

  /**
   * Sends {@code request} and returns the response body.
   *
   * @throws DeliveryException on transport errors and non-2xx responses
   */
  protected String send(HttpRequest request, String channel) {
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new DeliveryException(channel, "POST " + request.uri().getPath() + " failed", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DeliveryException(channel, "Interrupted while posting to " + channel, e);
    }
    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Slack responded " + status + " for " + channel + ": " + response.body());
      }
      throw new DeliveryException(channel, "http_" + status,
          "Slack responded with HTTP " + status + " for " + channel);
    }
    return response.body();
  }
}
