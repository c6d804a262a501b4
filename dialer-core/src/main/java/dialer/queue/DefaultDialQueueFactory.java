package dialer.queue;

import dialer.spi.MetricsExporter;
import dialer.spi.PeerConnector;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.function.LongSupplier;

/**
 * {@link DialQueueFactory} producing {@link DefaultDialQueue} instances that share one
 * connector, blacklist policy and metrics exporter.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class DefaultDialQueueFactory implements DialQueueFactory {
  private final PeerConnector connector;
  private final BlacklistPolicy blacklistPolicy;
  private final int maxBlacklistAttempts;
  private final MetricsExporter metrics;
  private final Executor dialExecutor;
  private final LongSupplier clock;

  private DefaultDialQueueFactory(Builder builder) {
    this.connector = Objects.requireNonNull(builder.connector, "connector");
    this.blacklistPolicy = builder.blacklistPolicy != null
        ? builder.blacklistPolicy : new ExponentialBackoffBlacklistPolicy(5 * 60 * 1000L, 60 * 60 * 1000L);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.dialExecutor = builder.dialExecutor != null ? builder.dialExecutor : Runnable::run;
    this.clock = builder.clock != null ? builder.clock : System::currentTimeMillis;
    if (builder.maxBlacklistAttempts < 1) {
      throw new IllegalArgumentException("maxBlacklistAttempts must be >= 1");
    }
    this.maxBlacklistAttempts = builder.maxBlacklistAttempts;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public DialQueue create(String peerId, QueueStoppedListener onStopped) {
    return new DefaultDialQueue(peerId, onStopped, connector, blacklistPolicy,
        maxBlacklistAttempts, metrics, dialExecutor, clock);
  }

  /** Builder for {@link DefaultDialQueueFactory}. */
  public static final class Builder {
    private PeerConnector connector;
    private BlacklistPolicy blacklistPolicy;
    private int maxBlacklistAttempts = 5;
    private MetricsExporter metrics;
    private Executor dialExecutor;
    private LongSupplier clock;

    private Builder() {}

    /**
     * Sets the connector that performs each dial.
     *
     * <p><b>Required.</b>
     *
     * @param connector the transport connector
     * @return this builder
     */
    public Builder connector(PeerConnector connector) {
      this.connector = connector;
      return this;
    }

    /**
     * Sets the policy that computes blacklist durations after failed dials.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffBlacklistPolicy} with a 5 minute base
     * and a 1 hour cap.
     *
     * @param blacklistPolicy the blacklist policy
     * @return this builder
     */
    public Builder blacklistPolicy(BlacklistPolicy blacklistPolicy) {
      this.blacklistPolicy = blacklistPolicy;
      return this;
    }

    /**
     * Sets the number of consecutive failures after which a peer is blacklisted permanently.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
     *
     * @param maxBlacklistAttempts failure limit
     * @return this builder
     */
    public Builder maxBlacklistAttempts(int maxBlacklistAttempts) {
      this.maxBlacklistAttempts = maxBlacklistAttempts;
      return this;
    }

    /**
     * Sets the metrics exporter for per-dial counters.
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
     * Sets the executor that runs the first dial of every {@link DefaultDialQueue#start()}.
     *
     * <p>Optional. Defaults to running on the calling thread, which for queues started by
     * {@link DialQueueManager} is a thread holding the manager's monitor. {@link dialer.Dialer}
     * supplies its worker thread here.
     *
     * @param dialExecutor the executor
     * @return this builder
     */
    public Builder dialExecutor(Executor dialExecutor) {
      this.dialExecutor = dialExecutor;
      return this;
    }

    /**
     * Sets the millisecond clock used for blacklist windows.
     *
     * <p>Optional. Defaults to {@link System#currentTimeMillis()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(LongSupplier clock) {
      this.clock = clock;
      return this;
    }

    public DefaultDialQueueFactory build() {
      return new DefaultDialQueueFactory(this);
    }
  }
}
