package chatbridge.micrometer;

import chatbridge.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code chatbridge.delivery.created}: deliveries that started a new chat thread</li>
 *   <li>{@code chatbridge.delivery.updated}: deliveries appended to a recent message</li>
 *   <li>{@code chatbridge.delivery.failed}: channel deliveries that failed</li>
 *   <li>{@code chatbridge.notify.skipped}: events dropped by the pre-checks</li>
 * </ul>
 *
 * <h3>Distribution summaries</h3>
 * <ul>
 *   <li>{@code chatbridge.notify.targets}: matched channels per event</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  public static final String DEFAULT_PREFIX = "chatbridge";

  private final MeterRegistry registry;
  private final Counter deliveryCreated;
  private final Counter deliveryUpdated;
  private final Counter deliveryFailed;
  private final Counter notifySkipped;
  private final DistributionSummary notifyTargets;
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "forum.chatbridge"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.deliveryCreated = Counter.builder(namePrefix + ".delivery.created")
        .description("Deliveries that started a new chat thread")
        .register(registry);
    this.deliveryUpdated = Counter.builder(namePrefix + ".delivery.updated")
        .description("Deliveries appended to an existing chat message")
        .register(registry);
    this.deliveryFailed = Counter.builder(namePrefix + ".delivery.failed")
        .description("Channel deliveries that failed")
        .register(registry);
    this.notifySkipped = Counter.builder(namePrefix + ".notify.skipped")
        .description("Post events skipped before matching")
        .register(registry);
    this.notifyTargets = DistributionSummary.builder(namePrefix + ".notify.targets")
        .description("Channels matched per post event")
        .register(registry);
  }

  @Override
  public void incrementDeliveryCreated() {
    if (closed) return;
    deliveryCreated.increment();
  }

  @Override
  public void incrementDeliveryUpdated() {
    if (closed) return;
    deliveryUpdated.increment();
  }

  @Override
  public void incrementDeliveryFailed() {
    if (closed) return;
    deliveryFailed.increment();
  }

  @Override
  public void incrementNotifySkipped() {
    if (closed) return;
    notifySkipped.increment();
  }

  @Override
  public void recordTargets(int targets) {
    if (closed) return;
    notifyTargets.record(targets);
  }

  /**
   * Removes all meters registered by this exporter from the registry. Called by
   * {@link chatbridge.ChatBridge#close()}.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(deliveryCreated, deliveryUpdated, deliveryFailed,
        notifySkipped, notifyTargets)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
