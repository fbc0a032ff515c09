package chatbridge.spi;

import chatbridge.model.ChatMessage;

import java.time.Instant;

/**
 * Result of a successful {@link ChatDelivery} call.
 *
 * @param messageId     vendor message id, {@code null} when the delivery mode returns none
 * @param vendorChannel vendor channel id, {@code null} if not reported
 * @param message       the message as stored by the vendor, or as sent when not echoed back
 * @param sentAt        delivery time reported by the vendor
 */
public record DeliveryReceipt(String messageId, String vendorChannel, ChatMessage message,
    Instant sentAt) {

  public boolean hasMessageId() {
    return messageId != null && !messageId.isEmpty();
  }
}
