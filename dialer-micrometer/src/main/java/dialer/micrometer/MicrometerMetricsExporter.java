package dialer.micrometer;

import dialer.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code dialer.queued.hot} — peers placed in the hot pending set</li>
 *   <li>{@code dialer.queued.cold} — peers placed in the cold-call pending set</li>
 *   <li>{@code dialer.coldcall.rejected} — cold calls aborted by the cold-call limit</li>
 *   <li>{@code dialer.coldcall.superseded} — cold calls aborted by a pending hot request</li>
 *   <li>{@code dialer.dial.started} — queues admitted into a parallel dial slot</li>
 *   <li>{@code dialer.dial.connected.bypass} — queues started for already-connected peers</li>
 *   <li>{@code dialer.queue.evicted} — queues removed by the cleanup sweep</li>
 *   <li>{@code dialer.dial.success} — dials that connected</li>
 *   <li>{@code dialer.dial.failure} — dials that failed</li>
 *   <li>{@code dialer.peer.blacklisted} — peers put under a blacklist</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code dialer.pending.hot} — hot pending set size</li>
 *   <li>{@code dialer.pending.cold} — cold-call pending set size</li>
 *   <li>{@code dialer.dial.active} — occupied parallel dial slots</li>
 *   <li>{@code dialer.queue.tracked} — per-peer queues in memory</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter hotQueued;
  private final Counter coldCallQueued;
  private final Counter coldCallRejected;
  private final Counter coldCallSuperseded;
  private final Counter dialStarted;
  private final Counter connectedBypass;
  private final Counter queuesEvicted;
  private final Counter dialSuccess;
  private final Counter dialFailure;
  private final Counter peerBlacklisted;
  private final Gauge hotDepthGauge;
  private final Gauge coldDepthGauge;
  private final Gauge activeDialsGauge;
  private final Gauge trackedQueuesGauge;

  private final AtomicInteger hotDepth = new AtomicInteger();
  private final AtomicInteger coldDepth = new AtomicInteger();
  private final AtomicInteger activeDials = new AtomicInteger();
  private final AtomicInteger trackedQueues = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "dialer"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "dialer");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for nodes running several dialers.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "relay.dialer"})
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
    this.hotQueued = counter(namePrefix + ".queued.hot", "Peers placed in the hot pending set");
    this.coldCallQueued = counter(namePrefix + ".queued.cold", "Peers placed in the cold-call pending set");
    this.coldCallRejected = counter(namePrefix + ".coldcall.rejected", "Cold calls aborted by the cold-call limit");
    this.coldCallSuperseded = counter(namePrefix + ".coldcall.superseded",
        "Cold calls aborted because a hot request was pending");
    this.dialStarted = counter(namePrefix + ".dial.started", "Queues admitted into a dial slot");
    this.connectedBypass = counter(namePrefix + ".dial.connected.bypass",
        "Queues started for already-connected peers");
    this.queuesEvicted = counter(namePrefix + ".queue.evicted", "Queues removed by the cleanup sweep");
    this.dialSuccess = counter(namePrefix + ".dial.success", "Dials that connected");
    this.dialFailure = counter(namePrefix + ".dial.failure", "Dials that failed");
    this.peerBlacklisted = counter(namePrefix + ".peer.blacklisted", "Peers put under a blacklist");

    this.hotDepthGauge = Gauge.builder(namePrefix + ".pending.hot", hotDepth, AtomicInteger::get)
        .register(registry);
    this.coldDepthGauge = Gauge.builder(namePrefix + ".pending.cold", coldDepth, AtomicInteger::get)
        .register(registry);
    this.activeDialsGauge = Gauge.builder(namePrefix + ".dial.active", activeDials, AtomicInteger::get)
        .register(registry);
    this.trackedQueuesGauge = Gauge.builder(namePrefix + ".queue.tracked", trackedQueues, AtomicInteger::get)
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementHotQueued() {
    if (closed) return;
    hotQueued.increment();
  }

  @Override
  public void incrementColdCallQueued() {
    if (closed) return;
    coldCallQueued.increment();
  }

  @Override
  public void incrementColdCallRejected() {
    if (closed) return;
    coldCallRejected.increment();
  }

  @Override
  public void incrementColdCallSuperseded() {
    if (closed) return;
    coldCallSuperseded.increment();
  }

  @Override
  public void incrementDialStarted() {
    if (closed) return;
    dialStarted.increment();
  }

  @Override
  public void incrementConnectedBypass() {
    if (closed) return;
    connectedBypass.increment();
  }

  @Override
  public void incrementQueuesEvicted(int count) {
    if (closed || count <= 0) return;
    queuesEvicted.increment(count);
  }

  @Override
  public void incrementDialSuccess() {
    if (closed) return;
    dialSuccess.increment();
  }

  @Override
  public void incrementDialFailure() {
    if (closed) return;
    dialFailure.increment();
  }

  @Override
  public void incrementPeerBlacklisted() {
    if (closed) return;
    peerBlacklisted.increment();
  }

  @Override
  public void recordPendingDepths(int hotDepth, int coldDepth) {
    if (closed) return;
    this.hotDepth.set(hotDepth);
    this.coldDepth.set(coldDepth);
  }

  @Override
  public void recordActiveDials(int activeDials) {
    if (closed) return;
    this.activeDials.set(activeDials);
  }

  @Override
  public void recordTrackedQueues(int trackedQueues) {
    if (closed) return;
    this.trackedQueues.set(trackedQueues);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Called by {@link dialer.Dialer#close()} so that a stopped dialer leaves no stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(hotQueued, coldCallQueued, coldCallRejected, coldCallSuperseded,
        dialStarted, connectedBypass, queuesEvicted, dialSuccess, dialFailure, peerBlacklisted,
        hotDepthGauge, coldDepthGauge, activeDialsGauge, trackedQueuesGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
