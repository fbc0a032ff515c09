package chatbridge;

/**
 * Failure to deliver a message to one channel. Deliveries to other channels of the
 * same event are not affected.
 */
public class DeliveryException extends ChatBridgeException {
  private final String channel;
  private final String errorCode;

  public DeliveryException(String channel, String errorCode, String message) {
    super(message);
    this.channel = channel;
    this.errorCode = errorCode;
  }

  public DeliveryException(String channel, String message, Throwable cause) {
    super(message, cause);
    this.channel = channel;
    this.errorCode = null;
  }

  public String channel() {
    return channel;
  }

  /**
   * Vendor error code (e.g. {@code channel_not_found}), or {@code null} for transport errors.
   */
  public String errorCode() {
    return errorCode;
  }
}
