package dialer.queue;

import dialer.DialCallback;
import dialer.DialException;
import dialer.DialResult;
import dialer.OnceDialCallback;
import dialer.spi.MetricsExporter;
import dialer.spi.PeerConnector;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * FIFO dial queue for a single peer, dialing one buffered request at a time through a
 * {@link PeerConnector}.
 *
 * <p>A failed dial blacklists the peer: the failure count increments and the peer is refused
 * for {@link BlacklistPolicy#computeBlacklistMs(int)} milliseconds, or forever once the count
 * reaches {@code maxBlacklistAttempts}. The remaining buffered requests fail with
 * {@link DialException.Code#BLACKLISTED} and the queue stops. A successful dial resets the
 * counters.
 *
 * <p>{@link #start()} hands the first dial to the {@code dialExecutor}, so a caller holding a
 * lock (the manager during admission) never runs the connector or completion callbacks.
 * Later dials continue on the thread that completed the previous one.
 *
 * <p>This class is thread-safe. Callbacks and the {@link QueueStoppedListener} are always
 * invoked without holding the queue's monitor.
 *
 * @see DefaultDialQueueFactory
 */
public final class DefaultDialQueue implements DialQueue {
  private static final Logger logger = Logger.getLogger(DefaultDialQueue.class.getName());

  private static final long PERMANENT = Long.MAX_VALUE;

  private final String id;
  private final PeerConnector connector;
  private final BlacklistPolicy blacklistPolicy;
  private final int maxBlacklistAttempts;
  private final QueueStoppedListener onStopped;
  private final MetricsExporter metrics;
  private final Executor dialExecutor;
  private final LongSupplier clock;

  private final Deque<PendingDial> pending = new ArrayDeque<>();
  private PendingDial inFlight;
  private boolean running;
  private long blacklistedUntil;
  private int blacklistCount;

  DefaultDialQueue(String id, QueueStoppedListener onStopped, PeerConnector connector,
      BlacklistPolicy blacklistPolicy, int maxBlacklistAttempts, MetricsExporter metrics,
      Executor dialExecutor, LongSupplier clock) {
    this.id = Objects.requireNonNull(id, "id");
    this.onStopped = Objects.requireNonNull(onStopped, "onStopped");
    this.connector = Objects.requireNonNull(connector, "connector");
    this.blacklistPolicy = Objects.requireNonNull(blacklistPolicy, "blacklistPolicy");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.dialExecutor = Objects.requireNonNull(dialExecutor, "dialExecutor");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (maxBlacklistAttempts < 1) {
      throw new IllegalArgumentException("maxBlacklistAttempts must be >= 1");
    }
    this.maxBlacklistAttempts = maxBlacklistAttempts;
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public synchronized boolean isRunning() {
    return running;
  }

  @Override
  public synchronized int length() {
    return pending.size();
  }

  @Override
  public synchronized boolean isBlacklisted() {
    return blacklistedUntil != 0L;
  }

  @Override
  public synchronized boolean isPermanentlyBlacklisted() {
    return blacklistedUntil == PERMANENT;
  }

  @Override
  public synchronized int blacklistCount() {
    return blacklistCount;
  }

  @Override
  public synchronized void clearBlacklist() {
    blacklistedUntil = 0L;
    blacklistCount = 0;
  }

  @Override
  public synchronized boolean isDialAllowed() {
    if (blacklistedUntil == PERMANENT) {
      return false;
    }
    if (blacklistedUntil != 0L && clock.getAsLong() >= blacklistedUntil) {
      // backoff elapsed; failure count is kept until the next success
      blacklistedUntil = 0L;
    }
    return blacklistedUntil == 0L;
  }

  /**
   * Buffers the request, or fails it at once with {@link DialException.Code#BLACKLISTED}
   * while dialing is not allowed.
   */
  @Override
  public void add(String protocol, boolean useFsm, DialCallback callback) {
    OnceDialCallback once = OnceDialCallback.of(callback);
    boolean accepted;
    synchronized (this) {
      accepted = isDialAllowed();
      if (accepted) {
        pending.addLast(new PendingDial(protocol, useFsm, once));
      }
    }
    if (!accepted) {
      once.onResult(DialResult.failed(DialException.blacklisted(id)));
    }
  }

  @Override
  public void start() {
    synchronized (this) {
      if (running) {
        return;
      }
      running = true;
    }
    try {
      dialExecutor.execute(this::dialNext);
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Dial executor rejected start of " + id + "; dialing inline", e);
      dialNext();
    }
  }

  @Override
  public void abort() {
    List<PendingDial> cancelled = new ArrayList<>();
    boolean wasRunning;
    synchronized (this) {
      wasRunning = running;
      running = false;
      if (inFlight != null) {
        cancelled.add(inFlight);
        inFlight = null;
      }
      cancelled.addAll(pending);
      pending.clear();
    }
    for (PendingDial dial : cancelled) {
      dial.callback().onResult(DialResult.failed(DialException.aborted(id)));
    }
    if (wasRunning) {
      onStopped.onQueueStopped(id);
    }
  }

  private void dialNext() {
    PendingDial next;
    synchronized (this) {
      if (!running) {
        return;
      }
      next = pending.pollFirst();
      if (next == null) {
        running = false;
      }
      inFlight = next;
    }
    if (next == null) {
      onStopped.onQueueStopped(id);
      return;
    }

    CompletionStage<Void> stage;
    try {
      stage = Objects.requireNonNull(connector.connect(id, next.protocol(), next.useFsm()),
          "connector returned null");
    } catch (RuntimeException e) {
      stage = CompletableFuture.failedFuture(e);
    }
    stage.whenComplete((ignored, error) -> onDialComplete(next, error));
  }

  private void onDialComplete(PendingDial dial, Throwable error) {
    List<PendingDial> rejected = List.of();
    synchronized (this) {
      if (inFlight != dial) {
        // aborted while the dial was in flight; the callback already has its result
        return;
      }
      inFlight = null;
      if (error == null) {
        blacklistedUntil = 0L;
        blacklistCount = 0;
      } else {
        markFailed();
        rejected = new ArrayList<>(pending);
        pending.clear();
        running = false;
      }
    }

    if (error == null) {
      metrics.incrementDialSuccess();
      dial.callback().onResult(DialResult.connected(id, dial.protocol()));
      dialNext();
      return;
    }

    Throwable cause = error instanceof CompletionException && error.getCause() != null
        ? error.getCause() : error;
    logger.log(Level.FINE, "Dial to " + id + " failed", cause);
    metrics.incrementDialFailure();
    dial.callback().onResult(DialResult.failed(DialException.connectionFailed(id, cause)));
    for (PendingDial other : rejected) {
      other.callback().onResult(DialResult.failed(DialException.blacklisted(id)));
    }
    onStopped.onQueueStopped(id);
  }

  private void markFailed() {
    blacklistCount++;
    if (blacklistCount >= maxBlacklistAttempts) {
      blacklistedUntil = PERMANENT;
      logger.log(Level.INFO, "Peer {0} permanently blacklisted after {1} failed dials",
          new Object[]{id, blacklistCount});
    } else {
      blacklistedUntil = clock.getAsLong() + blacklistPolicy.computeBlacklistMs(blacklistCount);
    }
    metrics.incrementPeerBlacklisted();
  }

  private record PendingDial(String protocol, boolean useFsm, OnceDialCallback callback) {
  }
}
