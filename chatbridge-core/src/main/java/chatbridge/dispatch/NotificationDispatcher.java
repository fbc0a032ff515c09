package chatbridge.dispatch;

import chatbridge.DeliveryException;
import chatbridge.compose.MessageComposer;
import chatbridge.model.Attachment;
import chatbridge.model.ChatMessage;
import chatbridge.model.ConversationState;
import chatbridge.model.ForumPost;
import chatbridge.model.MatchedTarget;
import chatbridge.spi.ChatDelivery;
import chatbridge.spi.ConversationStore;
import chatbridge.spi.DeliveryReceipt;
import chatbridge.spi.MetricsExporter;
import chatbridge.util.KeyedLocks;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivers a post to its matched channels, coalescing rapid posts of the same topic
 * into one chat message per channel.
 *
 * <p>For every target the dispatcher reads the channel's {@link ConversationState} for
 * the topic and either
 * <ul>
 *   <li><b>appends</b>: the state is {@linkplain CoalescingPolicy#canAppend appendable};
 *       the new attachment is added to the previous payload and the vendor message is
 *       edited, or</li>
 *   <li><b>creates</b>: a fresh message with title and link is sent and a new state is
 *       recorded from the vendor's receipt.</li>
 * </ul>
 *
 * <p>The read-decide-write sequence runs under a lock on the conversation key, so two
 * concurrent posts to the same topic and channel cannot both open a thread. Targets are
 * delivered sequentially on the calling thread; a failed delivery is reported as
 * {@link DeliveryOutcome.Failed} and does not stop the remaining targets. A channel is
 * delivered at most once per post.
 *
 * <p>When the {@link ChatDelivery} does not {@linkplain ChatDelivery#supportsUpdates()
 * support updates}, every delivery creates a new message and no state is kept.
 */
public final class NotificationDispatcher {
  private static final Logger logger = Logger.getLogger(NotificationDispatcher.class.getName());

  private final ChatDelivery delivery;
  private final ConversationStore conversations;
  private final MessageComposer composer;
  private final CoalescingPolicy policy;
  private final MetricsExporter metrics;
  private final KeyedLocks locks = new KeyedLocks();

  public NotificationDispatcher(ChatDelivery delivery, ConversationStore conversations,
      MessageComposer composer, CoalescingPolicy policy, MetricsExporter metrics) {
    this.delivery = Objects.requireNonNull(delivery, "delivery");
    this.conversations = Objects.requireNonNull(conversations, "conversations");
    this.composer = Objects.requireNonNull(composer, "composer");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Delivers {@code post} to each target.
   *
   * @return one outcome per distinct channel, in target order
   */
  public List<DeliveryOutcome> dispatch(ForumPost post, List<MatchedTarget> targets) {
    Objects.requireNonNull(post, "post");
    List<DeliveryOutcome> outcomes = new ArrayList<>(targets.size());
    Set<String> delivered = new HashSet<>();
    for (MatchedTarget target : targets) {
      if (!delivered.add(target.channel())) {
        continue;
      }
      outcomes.add(deliver(post, target));
    }
    return outcomes;
  }

  /**
   * Delivers {@code post} to a single target. Never throws for delivery failures.
   */
  public DeliveryOutcome deliver(ForumPost post, MatchedTarget target) {
    String topicId = post.topic().id();
    String key = ConversationState.storeKey(topicId, target.channel());
    try {
      DeliveryOutcome outcome = locks.withLock(key, () -> deliverLocked(post, target));
      if (outcome instanceof DeliveryOutcome.Updated) {
        metrics.incrementDeliveryUpdated();
      } else {
        metrics.incrementDeliveryCreated();
      }
      return outcome;
    } catch (DeliveryException e) {
      metrics.incrementDeliveryFailed();
      logger.log(Level.WARNING, "Delivery of post " + post.id() + " to " + target.channel()
          + " failed: " + e.getMessage(), e);
      return new DeliveryOutcome.Failed(target.channel(), target.level(), e);
    } catch (RuntimeException e) {
      metrics.incrementDeliveryFailed();
      logger.log(Level.SEVERE, "Unexpected error delivering post " + post.id()
          + " to " + target.channel(), e);
      return new DeliveryOutcome.Failed(target.channel(), target.level(), e);
    }
  }

  private DeliveryOutcome deliverLocked(ForumPost post, MatchedTarget target) {
    String channel = target.channel();
    if (!delivery.supportsUpdates()) {
      DeliveryReceipt receipt = delivery.post(composer.compose(post, channel, true));
      return new DeliveryOutcome.Created(channel, target.level(), receipt.messageId());
    }

    ConversationState previous = conversations.find(post.topic().id(), channel);
    if (policy.canAppend(previous)) {
      return append(post, target, previous);
    }
    return create(post, target);
  }

  private DeliveryOutcome create(ForumPost post, MatchedTarget target) {
    ChatMessage message = composer.compose(post, target.channel(), true);
    DeliveryReceipt receipt = delivery.post(message);
    if (receipt.hasMessageId()) {
      conversations.save(stateFrom(post, target.channel(), receipt, message, null));
    } else {
      logger.warning("Delivery to " + target.channel() + " returned no message id; "
          + "later posts of topic " + post.topic().id() + " will open new threads");
    }
    return new DeliveryOutcome.Created(target.channel(), target.level(), receipt.messageId());
  }

  private DeliveryOutcome append(ForumPost post, MatchedTarget target, ConversationState previous) {
    Attachment attachment = composer.attachment(post, false);
    ChatMessage merged = previous.message().appendAttachments(List.of(attachment));
    if (previous.vendorChannel() != null) {
      merged = merged.withChannel(previous.vendorChannel());
    }
    DeliveryReceipt receipt = delivery.update(previous, merged);
    ConversationState next = stateFrom(post, target.channel(), receipt, merged, previous);
    conversations.save(next);
    return new DeliveryOutcome.Updated(target.channel(), target.level(), next.messageId(),
        next.attachmentCount());
  }

  private ConversationState stateFrom(ForumPost post, String channel, DeliveryReceipt receipt,
      ChatMessage sent, ConversationState previous) {
    String messageId = receipt.hasMessageId() ? receipt.messageId() : previous.messageId();
    String vendorChannel = receipt.vendorChannel() != null
        ? receipt.vendorChannel()
        : previous != null ? previous.vendorChannel() : null;
    ChatMessage stored = receipt.message() != null && !receipt.message().attachments().isEmpty()
        ? receipt.message()
        : sent;
    Instant createdAt = receipt.sentAt() != null ? receipt.sentAt() : policy.now();
    return new ConversationState(post.topic().id(), channel, vendorChannel, messageId, stored,
        createdAt);
  }
}
