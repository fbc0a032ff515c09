package chatbridge.spi;

/**
 * Observability hook for exporting bridge counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of deliveries that started a new chat thread.
   */
  void incrementDeliveryCreated();

  /**
   * Increments the count of deliveries coalesced into an existing message.
   */
  void incrementDeliveryUpdated();

  /**
   * Increments the count of failed channel deliveries.
   */
  void incrementDeliveryFailed();

  /**
   * Increments the count of events skipped before matching (disabled, not visible, ...).
   */
  default void incrementNotifySkipped() {
  }

  /**
   * Records how many channels an event matched.
   *
   * @param targets number of matched channels
   */
  default void recordTargets(int targets) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementDeliveryCreated() {
    }

    @Override
    public void incrementDeliveryUpdated() {
    }

    @Override
    public void incrementDeliveryFailed() {
    }
  }
}
