package chatbridge.dispatch;

import chatbridge.model.FilterLevel;

import java.util.Objects;

/**
 * Result of delivering one post to one channel.
 *
 * <ul>
 *   <li>{@link Created}: a new chat message was sent</li>
 *   <li>{@link Updated}: the post was appended to an existing message</li>
 *   <li>{@link Failed}: the delivery failed; other channels are unaffected</li>
 * </ul>
 */
public sealed interface DeliveryOutcome
    permits DeliveryOutcome.Created, DeliveryOutcome.Updated, DeliveryOutcome.Failed {

  String channel();

  FilterLevel level();

  /**
   * @param messageId vendor message id, {@code null} in webhook mode
   */
  record Created(String channel, FilterLevel level, String messageId) implements DeliveryOutcome {
  }

  /**
   * @param messageId   the edited vendor message id
   * @param attachments attachment count after the edit
   */
  record Updated(String channel, FilterLevel level, String messageId, int attachments)
      implements DeliveryOutcome {
  }

  record Failed(String channel, FilterLevel level, Exception error) implements DeliveryOutcome {
    public Failed {
      Objects.requireNonNull(error, "error");
    }
  }
}
