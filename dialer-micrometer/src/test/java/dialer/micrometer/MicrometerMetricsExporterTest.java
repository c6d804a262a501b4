package dialer.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
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
  void schedulingCounters() {
    exporter.incrementHotQueued();
    exporter.incrementHotQueued();
    exporter.incrementColdCallQueued();
    exporter.incrementDialStarted();
    exporter.incrementConnectedBypass();

    assertEquals(2.0, counter("dialer.queued.hot").count());
    assertEquals(1.0, counter("dialer.queued.cold").count());
    assertEquals(1.0, counter("dialer.dial.started").count());
    assertEquals(1.0, counter("dialer.dial.connected.bypass").count());
  }

  @Test
  void coldCallAborts() {
    exporter.incrementColdCallRejected();
    exporter.incrementColdCallRejected();
    exporter.incrementColdCallSuperseded();

    assertEquals(2.0, counter("dialer.coldcall.rejected").count());
    assertEquals(1.0, counter("dialer.coldcall.superseded").count());
  }

  @Test
  void dialOutcomes() {
    exporter.incrementDialSuccess();
    exporter.incrementDialFailure();
    exporter.incrementDialFailure();
    exporter.incrementPeerBlacklisted();

    assertEquals(1.0, counter("dialer.dial.success").count());
    assertEquals(2.0, counter("dialer.dial.failure").count());
    assertEquals(1.0, counter("dialer.peer.blacklisted").count());
  }

  @Test
  void evictionCountIgnoresNonPositiveValues() {
    exporter.incrementQueuesEvicted(3);
    exporter.incrementQueuesEvicted(0);
    exporter.incrementQueuesEvicted(-2);

    assertEquals(3.0, counter("dialer.queue.evicted").count());
  }

  @Test
  void gaugesTrackLatestValues() {
    exporter.recordPendingDepths(4, 9);
    exporter.recordActiveDials(3);
    exporter.recordTrackedQueues(12);

    assertEquals(4.0, gauge("dialer.pending.hot").value());
    assertEquals(9.0, gauge("dialer.pending.cold").value());
    assertEquals(3.0, gauge("dialer.dial.active").value());
    assertEquals(12.0, gauge("dialer.queue.tracked").value());

    exporter.recordPendingDepths(0, 0);
    assertEquals(0.0, gauge("dialer.pending.hot").value());
    assertEquals(0.0, gauge("dialer.pending.cold").value());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "relay.dialer");
    custom.incrementHotQueued();
    custom.recordActiveDials(5);

    assertEquals(1.0, counter("relay.dialer.queued.hot").count());
    assertEquals(5.0, gauge("relay.dialer.dial.active").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.close();
    exporter.incrementHotQueued();
    exporter.recordActiveDials(7);

    assertNull(registry.find("dialer.queued.hot").counter());
    assertNull(registry.find("dialer.dial.active").gauge());
    assertTrue(registry.getMeters().isEmpty());
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "dialer."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
