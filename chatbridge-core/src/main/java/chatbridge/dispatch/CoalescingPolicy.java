package chatbridge.dispatch;

import chatbridge.ChatBridgeSettings;
import chatbridge.model.ConversationState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.IntSupplier;
import java.util.function.Supplier;

/**
 * Decides whether a post may be appended to the message recorded in a
 * {@link ConversationState} rather than opening a new thread.
 *
 * <p>A state is appendable while its age is below the freshness window and its
 * attachment count is below the cap.
 */
public final class CoalescingPolicy {
  private final Supplier<Duration> freshnessWindow;
  private final IntSupplier maxAttachments;
  private final Clock clock;

  public CoalescingPolicy(Duration freshnessWindow, int maxAttachments, Clock clock) {
    Objects.requireNonNull(freshnessWindow, "freshnessWindow");
    if (maxAttachments < 1) {
      throw new IllegalArgumentException("maxAttachments must be >= 1");
    }
    this.freshnessWindow = () -> freshnessWindow;
    this.maxAttachments = () -> maxAttachments;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  private CoalescingPolicy(ChatBridgeSettings settings, Clock clock) {
    this.freshnessWindow = settings::getFreshnessWindow;
    this.maxAttachments = settings::getMaxAttachments;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns a policy that reads the window and the cap from {@code settings} on every
   * decision, so changes to the settings apply to the next post.
   */
  public static CoalescingPolicy from(ChatBridgeSettings settings, Clock clock) {
    return new CoalescingPolicy(Objects.requireNonNull(settings, "settings"), clock);
  }

  public boolean canAppend(ConversationState state) {
    if (state == null) {
      return false;
    }
    if (state.attachmentCount() >= maxAttachments.getAsInt()) {
      return false;
    }
    Duration age = Duration.between(state.createdAt(), clock.instant());
    return age.compareTo(freshnessWindow.get()) < 0;
  }

  public Instant now() {
    return clock.instant();
  }

  public Duration freshnessWindow() {
    return freshnessWindow.get();
  }

  public int maxAttachments() {
    return maxAttachments.getAsInt();
  }
}
