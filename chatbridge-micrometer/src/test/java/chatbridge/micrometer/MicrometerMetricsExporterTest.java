package chatbridge.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void countsDeliveries() {
    exporter.incrementDeliveryCreated();
    exporter.incrementDeliveryCreated();
    exporter.incrementDeliveryUpdated();
    exporter.incrementDeliveryFailed();

    assertEquals(2.0, counter("chatbridge.delivery.created").count());
    assertEquals(1.0, counter("chatbridge.delivery.updated").count());
    assertEquals(1.0, counter("chatbridge.delivery.failed").count());
  }

  @Test
  void countsSkippedEvents() {
    exporter.incrementNotifySkipped();
    assertEquals(1.0, counter("chatbridge.notify.skipped").count());
  }

  @Test
  void recordsTargetsPerEvent() {
    exporter.recordTargets(3);
    exporter.recordTargets(0);

    DistributionSummary summary = registry.find("chatbridge.notify.targets").summary();
    assertNotNull(summary);
    assertEquals(2, summary.count());
    assertEquals(3.0, summary.totalAmount());
    assertEquals(3.0, summary.max());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "forum.bridge");
    custom.incrementDeliveryUpdated();
    assertEquals(1.0, counter("forum.bridge.delivery.updated").count());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterCalls() {
    exporter.close();
    assertNull(registry.find("chatbridge.delivery.created").counter());
    assertNull(registry.find("chatbridge.notify.targets").summary());

    exporter.incrementDeliveryCreated();
    exporter.recordTargets(1);
    assertNull(registry.find("chatbridge.delivery.created").counter());
  }

  @Test
  void invalidPrefixRejected() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "bridge."));
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }
}
