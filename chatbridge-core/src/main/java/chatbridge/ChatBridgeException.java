package chatbridge;

/**
 * Base type for unchecked errors raised by the chat bridge.
 */
public class ChatBridgeException extends RuntimeException {

  public ChatBridgeException(String message) {
    super(message);
  }

  public ChatBridgeException(String message, Throwable cause) {
    super(message, cause);
  }
}
