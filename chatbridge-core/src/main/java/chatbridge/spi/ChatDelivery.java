package chatbridge.spi;

import chatbridge.DeliveryException;
import chatbridge.model.ChatMessage;
import chatbridge.model.ConversationState;

/**
 * Outbound transport to the chat vendor.
 *
 * <p>Calls are blocking request/response. Implementations must be thread-safe.
 */
public interface ChatDelivery {

  /**
   * Sends a new message.
   *
   * @param message the message; {@link ChatMessage#channel()} is the destination
   * @return the receipt
   * @throws DeliveryException if the vendor rejects the message or the transport fails
   */
  DeliveryReceipt post(ChatMessage message);

  /**
   * Replaces an existing message.
   *
   * @param previous the conversation holding the vendor message id and channel
   * @param message  the full replacement payload
   * @return the receipt
   * @throws DeliveryException if the vendor rejects the edit or the transport fails
   * @throws UnsupportedOperationException if {@link #supportsUpdates()} is {@code false}
   */
  DeliveryReceipt update(ConversationState previous, ChatMessage message);

  /**
   * Whether this transport returns message ids and can edit messages. When
   * {@code false}, every delivery starts a new thread and no state is kept.
   */
  boolean supportsUpdates();
}
