package chatbridge.jdbc;

import chatbridge.ChatBridgeException;

/**
 * Unchecked exception for JDBC errors and unreadable records in the JDBC stores.
 */
public final class ChatBridgeStoreException extends ChatBridgeException {
  public ChatBridgeStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
