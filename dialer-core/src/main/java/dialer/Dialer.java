package dialer;

import dialer.queue.BlacklistPolicy;
import dialer.queue.DefaultDialQueueFactory;
import dialer.queue.DialQueueManager;
import dialer.queue.ExponentialBackoffBlacklistPolicy;
import dialer.spi.MetricsExporter;
import dialer.spi.PeerConnector;
import dialer.spi.PeerRegistry;
import dialer.util.NamedDaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Composite entry point that wires a {@link DialQueueManager} to {@link DefaultDialQueueFactory}
 * queues into a single {@link AutoCloseable} unit.
 *
 * <p>The dialer owns one daemon worker thread ({@code dialer-worker-N}) that runs the cleanup
 * sweep, delivers deferred {@code ABORTED} results and starts each admitted queue's first
 * dial. Admission therefore never calls the {@link PeerConnector} while holding the manager's
 * monitor. Connectors are expected to return without blocking.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Dialer dialer = Dialer.builder()
 *     .peerRegistry(peerBook)
 *     .connector(transport)
 *     .config(new DialerConfig().setMaxParallelDials(20))
 *     .build()) {
 *   dialer.dial("QmPeer", "/ipfs/id/1.0.0", result -> {
 *     if (result instanceof DialResult.Failed failed) {
 *       // failed.code() tells why
 *     }
 *   });
 * }
 * }</pre>
 *
 * @see DialQueueManager
 * @see DialerConfig
 */
public final class Dialer implements AutoCloseable {

  private final DialQueueManager manager;
  private final ScheduledExecutorService worker;
  private final MetricsExporter metrics;

  private Dialer(DialQueueManager manager, ScheduledExecutorService worker, MetricsExporter metrics) {
    this.manager = manager;
    this.worker = worker;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Dials {@code peerId} for {@code protocol}. A {@code null} protocol makes this a cold call.
   *
   * @param peerId   the peer to dial
   * @param protocol the protocol to negotiate, may be null
   * @param callback receives the outcome exactly once, may be null
   */
  public void dial(String peerId, String protocol, DialCallback callback) {
    dial(peerId, protocol, false, callback);
  }

  public void dial(String peerId, String protocol, boolean useFsm, DialCallback callback) {
    manager.add(new DialRequest(peerId, protocol, useFsm, callback));
  }

  /**
   * Submits a speculative dial with no protocol.
   *
   * @param peerId   the peer to probe
   * @param callback receives the outcome exactly once, may be null
   */
  public void coldCall(String peerId, DialCallback callback) {
    manager.add(DialRequest.coldCall(peerId, callback));
  }

  public void submit(DialRequest request) {
    manager.add(request);
  }

  /**
   * Forgets past dial failures for {@code peerId}, for example after it connected inbound.
   *
   * @param peerId the peer id
   */
  public void clearBlacklist(String peerId) {
    manager.clearBlacklist(peerId);
  }

  public DialQueueManager manager() {
    return manager;
  }

  /**
   * Shuts down the manager and the worker thread, then closes the metrics exporter if it is
   * {@link AutoCloseable}.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      manager.close();
    } catch (RuntimeException e) {
      first = e;
    }
    worker.shutdownNow();
    try {
      worker.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link Dialer}. */
  public static final class Builder {
    private PeerRegistry peerRegistry;
    private PeerConnector connector;
    private DialerConfig config;
    private BlacklistPolicy blacklistPolicy;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the registry consulted to learn whether a peer is already connected.
     *
     * <p><b>Required.</b>
     *
     * @param peerRegistry the peer registry
     * @return this builder
     */
    public Builder peerRegistry(PeerRegistry peerRegistry) {
      this.peerRegistry = peerRegistry;
      return this;
    }

    /**
     * Sets the transport connector that performs each dial.
     *
     * <p><b>Required.</b>
     *
     * @param connector the connector
     * @return this builder
     */
    public Builder connector(PeerConnector connector) {
      this.connector = connector;
      return this;
    }

    /**
     * Sets limits and blacklist timings.
     *
     * <p>Optional. Defaults to {@code new DialerConfig()}.
     *
     * @param config the configuration
     * @return this builder
     */
    public Builder config(DialerConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Overrides the blacklist policy derived from the configuration.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffBlacklistPolicy} built from
     * {@link DialerConfig#getBlacklistBaseTtlMs()} and {@link DialerConfig#getBlacklistMaxTtlMs()}.
     *
     * @param blacklistPolicy the blacklist policy
     * @return this builder
     */
    public Builder blacklistPolicy(BlacklistPolicy blacklistPolicy) {
      this.blacklistPolicy = blacklistPolicy;
      return this;
    }

    /**
     * Sets the metrics exporter shared by the manager and its queues.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds and starts the dialer.
     *
     * @return a running {@link Dialer}
     * @throws NullPointerException if {@code peerRegistry} or {@code connector} is null
     * @throws IllegalArgumentException if a configuration value is out of range
     */
    public Dialer build() {
      Objects.requireNonNull(peerRegistry, "peerRegistry");
      Objects.requireNonNull(connector, "connector");
      DialerConfig cfg = config != null ? config : new DialerConfig();
      MetricsExporter exporter = metrics != null ? metrics : MetricsExporter.NOOP;
      BlacklistPolicy policy = blacklistPolicy != null ? blacklistPolicy
          : new ExponentialBackoffBlacklistPolicy(cfg.getBlacklistBaseTtlMs(), cfg.getBlacklistMaxTtlMs());

      DefaultDialQueueFactory.Builder queueFactory = DefaultDialQueueFactory.builder()
          .connector(connector)
          .blacklistPolicy(policy)
          .maxBlacklistAttempts(cfg.getMaxBlacklistAttempts())
          .metrics(exporter);

      ScheduledExecutorService worker =
          Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory("dialer-worker-"));
      try {
        DialQueueManager manager = DialQueueManager.builder()
            .queueFactory(queueFactory.dialExecutor(worker).build())
            .peerRegistry(peerRegistry)
            .metrics(exporter)
            .maxParallelDials(cfg.getMaxParallelDials())
            .maxColdCalls(cfg.getMaxColdCalls())
            .cleanIntervalMs(cfg.getCleanIntervalMs())
            .scheduler(worker)
            .build();
        manager.start();
        return new Dialer(manager, worker, exporter);
      } catch (RuntimeException e) {
        worker.shutdownNow();
        throw e;
      }
    }
  }
}
