package chatbridge.dispatch;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of processing one post event.
 *
 * @param postId   the post id
 * @param skipped  why the event was skipped before matching, or {@code null}
 * @param outcomes one outcome per delivered channel, in delivery order
 */
public record DispatchReport(String postId, SkipReason skipped, List<DeliveryOutcome> outcomes) {

  /** Reasons an event is dropped before rule matching. */
  public enum SkipReason {
    /** The bridge is disabled in the settings. */
    DISABLED,
    /** The post is not a regular post (moderator action, whisper, ...). */
    NOT_REGULAR,
    /** The topic is a private conversation. */
    PRIVATE_MESSAGE,
    /** The visibility check denied access to the post. */
    NOT_VISIBLE
  }

  public DispatchReport {
    outcomes = List.copyOf(outcomes);
  }

  public static DispatchReport skipped(String postId, SkipReason reason) {
    return new DispatchReport(postId, Objects.requireNonNull(reason, "reason"), List.of());
  }

  public static DispatchReport delivered(String postId, List<DeliveryOutcome> outcomes) {
    return new DispatchReport(postId, null, outcomes);
  }

  public boolean isSkipped() {
    return skipped != null;
  }

  public long failures() {
    return outcomes.stream().filter(o -> o instanceof DeliveryOutcome.Failed).count();
  }
}
