package dialer.queue;

import dialer.DialException;
import dialer.DialRequest;
import dialer.DialResult;
import dialer.OnceDialCallback;
import dialer.spi.MetricsExporter;
import dialer.spi.PeerNotFoundException;
import dialer.spi.PeerRegistry;
import dialer.util.NamedDaemonThreadFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Admission control for outbound dials.
 *
 * <p>Every dial request is buffered in its peer's {@link DialQueue}. Peers waiting for one of
 * the {@code maxParallelDials} slots sit in one of two insertion-ordered pending sets: the
 * <em>hot set</em> (at least one request names a protocol) and the <em>cold-call set</em>
 * (speculative requests only). {@link #run()} admits one peer per call, draining the hot set
 * before the cold-call set. A queue returns its slot through {@link #onQueueStopped(String)}.
 *
 * <p>Peers the {@link PeerRegistry} reports as connected bypass the slot limit. Cold calls
 * beyond {@code maxColdCalls} are rejected with {@link DialException.Code#ABORTED} before any
 * queue state changes. A recurring sweep ({@link #clean()}) evicts queues that are permanently
 * blacklisted, or idle for a peer that is no longer connected.
 *
 * <p>Create instances via {@link #builder()}. Every state-changing method is synchronized, so
 * each one runs to completion before the next. This class implements {@link AutoCloseable};
 * {@link #close()} stops the manager and releases the scheduler thread it owns.
 *
 * @see DialQueueManager.Builder
 * @see DialQueue
 */
public final class DialQueueManager implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DialQueueManager.class.getName());

  private final Set<String> hotQueue = new LinkedHashSet<>();
  private final Set<String> coldCallQueue = new LinkedHashSet<>();
  private final Set<String> dialingQueues = new HashSet<>();
  private final Map<String, DialQueue> queues = new HashMap<>();

  private final DialQueueFactory queueFactory;
  private final PeerRegistry peerRegistry;
  private final MetricsExporter metrics;
  private final int maxParallelDials;
  private final int maxColdCalls;
  private final long cleanIntervalMs;
  private final ScheduledExecutorService scheduler;
  private final boolean ownsScheduler;
  private final Executor callbackExecutor;

  private ScheduledFuture<?> cleanTask;
  private boolean running;
  private boolean closed;

  private DialQueueManager(Builder builder) {
    this.queueFactory = Objects.requireNonNull(builder.queueFactory, "queueFactory");
    this.peerRegistry = Objects.requireNonNull(builder.peerRegistry, "peerRegistry");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    if (builder.maxParallelDials < 1) {
      throw new IllegalArgumentException("maxParallelDials must be >= 1");
    }
    if (builder.maxColdCalls < 0) {
      throw new IllegalArgumentException("maxColdCalls must be >= 0");
    }
    if (builder.cleanIntervalMs <= 0L) {
      throw new IllegalArgumentException("cleanIntervalMs must be > 0");
    }
    this.maxParallelDials = builder.maxParallelDials;
    this.maxColdCalls = builder.maxColdCalls;
    this.cleanIntervalMs = builder.cleanIntervalMs;

    if (builder.scheduler != null) {
      this.scheduler = builder.scheduler;
      this.ownsScheduler = false;
    } else {
      this.scheduler = Executors.newSingleThreadScheduledExecutor(
          new NamedDaemonThreadFactory("dialer-clean-"));
      this.ownsScheduler = true;
    }
    this.callbackExecutor = builder.callbackExecutor != null ? builder.callbackExecutor : scheduler;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts accepting dial requests and schedules the recurring cleanup sweep.
   * Does not start any queue. Calling {@code start()} on a running manager is a no-op.
   *
   * @throws IllegalStateException if the manager has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("DialQueueManager has been closed");
    }
    if (running) {
      return;
    }
    running = true;
    if (cleanTask == null) {
      cleanTask = scheduler.scheduleWithFixedDelay(
          this::clean, cleanIntervalMs, cleanIntervalMs, TimeUnit.MILLISECONDS);
    }
    logger.log(Level.INFO, "Dial queue manager started (maxParallelDials={0}, maxColdCalls={1})",
        new Object[]{maxParallelDials, maxColdCalls});
  }

  /**
   * Stops the manager: clears both pending sets, cancels the cleanup sweep, and aborts and
   * removes every tracked queue. Afterwards {@link #add(DialRequest)} fails fast with
   * {@link DialException.Code#MANAGER_STOPPED}.
   *
   * <p>If a queue throws while aborting, the remaining queues are still aborted and removed;
   * the first failure is rethrown once the table is empty.
   */
  public synchronized void stop() {
    boolean wasRunning = running;
    running = false;

    hotQueue.clear();
    coldCallQueue.clear();

    if (cleanTask != null) {
      cleanTask.cancel(false);
      cleanTask = null;
    }

    RuntimeException first = null;
    for (DialQueue dialQueue : new ArrayList<>(queues.values())) {
      try {
        dialQueue.abort();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      } finally {
        queues.remove(dialQueue.id());
      }
    }
    dialingQueues.clear();
    recordGauges();

    if (wasRunning) {
      logger.info("Dial queue manager stopped");
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Admits a dial request.
   *
   * <p>The request is buffered in its peer's queue. If the peer is already connected the queue
   * starts at once, outside the parallel dial limit. Otherwise, unless the queue currently
   * refuses to dial, the peer is placed in the hot or cold-call set and a scheduling pass runs.
   * Failures reach the request's callback, never the caller.
   *
   * @param request the dial request
   */
  public synchronized void add(DialRequest request) {
    Objects.requireNonNull(request, "request");
    String peerId = request.peerId();
    OnceDialCallback callback = OnceDialCallback.of(request.callback());

    if (!running) {
      callback.onResult(DialResult.failed(DialException.managerStopped(peerId)));
      return;
    }

    DialQueue targetQueue = getQueue(peerId);

    if (request.isColdCall() && coldCallQueue.size() >= maxColdCalls) {
      logger.log(Level.FINE, "Cold call limit reached, aborting dial to {0}", peerId);
      metrics.incrementColdCallRejected();
      abortLater(callback, peerId);
      return;
    }

    targetQueue.add(request.protocol(), request.useFsm(), callback);

    // Dials to connected peers are cheap and must not wait behind unconnected ones
    if (isConnected(peerId)) {
      metrics.incrementConnectedBypass();
      targetQueue.start();
      return;
    }

    if (!targetQueue.isDialAllowed()) {
      return;
    }

    if (!targetQueue.isRunning()) {
      if (!request.isColdCall()) {
        if (hotQueue.add(peerId)) {
          metrics.incrementHotQueued();
        }
        coldCallQueue.remove(peerId);
      } else if (!hotQueue.contains(peerId)) {
        if (coldCallQueue.add(peerId)) {
          metrics.incrementColdCallQueued();
        }
      } else {
        // A hot request for this peer is already pending
        metrics.incrementColdCallSuperseded();
        abortLater(callback, peerId);
        return;
      }
    }

    run();
  }

  /**
   * Admits at most one pending peer into active dialing, preferring the hot set.
   * No-op if the manager is stopped, every parallel slot is taken, or nothing is pending.
   */
  public synchronized void run() {
    if (!running || dialingQueues.size() >= maxParallelDials) {
      return;
    }
    String nextId;
    DialQueue targetQueue;
    do {
      nextId = pollFirst(hotQueue);
      if (nextId == null) {
        nextId = pollFirst(coldCallQueue);
      }
      if (nextId == null) {
        recordGauges();
        return;
      }
      targetQueue = queues.get(nextId);
      if (targetQueue == null) {
        logger.log(Level.FINE, "Dropping pending peer {0} with no queue", nextId);
      }
    } while (targetQueue == null);

    dialingQueues.add(nextId);
    metrics.incrementDialStarted();
    recordGauges();
    targetQueue.start();
  }

  /**
   * Returns the slot held by {@code peerId} and runs a scheduling pass.
   * Called by queues through their {@link QueueStoppedListener}.
   *
   * <p>Queues report a stop after releasing their own lock, so the notification can arrive
   * after the same queue was admitted and started again. The slot is kept while the peer's
   * current queue is running; its next stop returns it.
   *
   * @param peerId the peer whose queue stopped
   */
  public synchronized void onQueueStopped(String peerId) {
    DialQueue queue = queues.get(peerId);
    if (queue == null || !queue.isRunning()) {
      dialingQueues.remove(peerId);
    } else {
      logger.log(Level.FINE, "Ignoring stale stop of {0}, queue is running again", peerId);
    }
    run();
  }

  /**
   * Resets the blacklist of {@code peerId}'s queue, creating the queue if needed.
   * While the manager is stopped no queue is created.
   *
   * @param peerId the peer known to be reachable again
   */
  public synchronized void clearBlacklist(String peerId) {
    Objects.requireNonNull(peerId, "peerId");
    DialQueue queue = running ? getQueue(peerId) : queues.get(peerId);
    if (queue != null) {
      queue.clearBlacklist();
    }
  }

  /**
   * Runs one cleanup sweep over all tracked queues. Called by the scheduler every
   * {@code cleanIntervalMs}, but may also be invoked directly.
   *
   * <p>Permanently blacklisted queues are aborted and removed. Temporarily blacklisted queues
   * are kept. Idle, empty queues are aborted and removed unless the registry reports their
   * peer as connected. Running queues and queues with buffered requests are never removed.
   */
  public synchronized void clean() {
    try {
      int evicted = 0;
      for (DialQueue dialQueue : new ArrayList<>(queues.values())) {
        if (dialQueue.isPermanentlyBlacklisted()) {
          evict(dialQueue);
          evicted++;
          continue;
        }
        if (dialQueue.isBlacklisted()) {
          continue;
        }
        // Connected peers keep their queue; they are likely to be dialed again soon
        if (!dialQueue.isRunning() && dialQueue.length() < 1 && !isConnected(dialQueue.id())) {
          evict(dialQueue);
          evicted++;
        }
      }
      if (evicted > 0) {
        metrics.incrementQueuesEvicted(evicted);
        logger.log(Level.INFO, "Evicted {0} dial queues, {1} still tracked",
            new Object[]{evicted, queues.size()});
      }
      recordGauges();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Dial queue cleanup failed", t);
    }
  }

  /**
   * Returns the queue for {@code peerId}, creating it on first reference. The same instance
   * is returned until the queue is evicted.
   *
   * @param peerId the peer id
   * @return the peer's queue
   */
  public synchronized DialQueue getQueue(String peerId) {
    Objects.requireNonNull(peerId, "peerId");
    DialQueue queue = queues.get(peerId);
    if (queue == null) {
      queue = Objects.requireNonNull(queueFactory.create(peerId, this::onQueueStopped),
          "queueFactory returned null");
      if (!peerId.equals(queue.id())) {
        throw new IllegalStateException("queueFactory created queue " + queue.id()
            + " for peer " + peerId);
      }
      queues.put(peerId, queue);
      metrics.recordTrackedQueues(queues.size());
    }
    return queue;
  }

  public synchronized boolean isRunning() {
    return running;
  }

  /** Returns the hot pending set, oldest first. */
  public synchronized List<String> hotPeerIds() {
    return List.copyOf(hotQueue);
  }

  /** Returns the cold-call pending set, oldest first. */
  public synchronized List<String> coldCallPeerIds() {
    return List.copyOf(coldCallQueue);
  }

  public synchronized Set<String> dialingPeerIds() {
    return Set.copyOf(dialingQueues);
  }

  public synchronized Set<String> trackedPeerIds() {
    return Set.copyOf(queues.keySet());
  }

  /**
   * Stops the manager and shuts down the scheduler thread if this manager created it.
   * A closed manager cannot be restarted.
   */
  @Override
  public void close() {
    try {
      stop();
    } finally {
      synchronized (this) {
        closed = true;
      }
      if (ownsScheduler) {
        scheduler.shutdownNow();
        try {
          scheduler.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
    }
  }

  private void evict(DialQueue dialQueue) {
    String id = dialQueue.id();
    try {
      dialQueue.abort();
    } finally {
      queues.remove(id);
      hotQueue.remove(id);
      coldCallQueue.remove(id);
    }
  }

  private boolean isConnected(String peerId) {
    try {
      return peerRegistry.lookup(peerId).isConnected();
    } catch (PeerNotFoundException e) {
      return false;
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Peer registry lookup failed for " + peerId, e);
      return false;
    }
  }

  private void abortLater(OnceDialCallback callback, String peerId) {
    Runnable abort = () -> callback.onResult(DialResult.failed(DialException.aborted(peerId)));
    try {
      callbackExecutor.execute(abort);
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Callback executor rejected deferred abort; delivering inline", e);
      abort.run();
    }
  }

  private static String pollFirst(Set<String> pending) {
    Iterator<String> it = pending.iterator();
    if (!it.hasNext()) {
      return null;
    }
    String first = it.next();
    it.remove();
    return first;
  }

  private void recordGauges() {
    metrics.recordPendingDepths(hotQueue.size(), coldCallQueue.size());
    metrics.recordActiveDials(dialingQueues.size());
    metrics.recordTrackedQueues(queues.size());
  }

  /** Builder for {@link DialQueueManager}. */
  public static final class Builder {
    private DialQueueFactory queueFactory;
    private PeerRegistry peerRegistry;
    private MetricsExporter metrics;
    private int maxParallelDials = 100;
    private int maxColdCalls = 50;
    private long cleanIntervalMs = 15 * 60 * 1000L;
    private ScheduledExecutorService scheduler;
    private Executor callbackExecutor;

    private Builder() {}

    /**
     * Sets the factory that creates a queue the first time a peer id is referenced.
     *
     * <p><b>Required.</b>
     *
     * @param queueFactory the queue factory
     * @return this builder
     */
    public Builder queueFactory(DialQueueFactory queueFactory) {
      this.queueFactory = queueFactory;
      return this;
    }

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
     * Sets the metrics exporter for admission counters and pending-set gauges.
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
     * Sets the maximum number of queues dialing unconnected peers at the same time.
     *
     * <p>Optional. Defaults to {@code 100}. Must be &ge; 1.
     *
     * @param maxParallelDials the parallel dial limit
     * @return this builder
     */
    public Builder maxParallelDials(int maxParallelDials) {
      this.maxParallelDials = maxParallelDials;
      return this;
    }

    /**
     * Sets the maximum size of the cold-call pending set.
     *
     * <p>Optional. Defaults to {@code 50}. Must be &ge; 0. With {@code 0} every cold call
     * is aborted.
     *
     * @param maxColdCalls the cold-call limit
     * @return this builder
     */
    public Builder maxColdCalls(int maxColdCalls) {
      this.maxColdCalls = maxColdCalls;
      return this;
    }

    /**
     * Sets the delay in milliseconds between the end of one cleanup sweep and the next.
     *
     * <p>Optional. Defaults to 15 minutes. Must be &gt; 0.
     *
     * @param cleanIntervalMs sweep interval in milliseconds
     * @return this builder
     */
    public Builder cleanIntervalMs(long cleanIntervalMs) {
      this.cleanIntervalMs = cleanIntervalMs;
      return this;
    }

    /**
     * Sets the scheduler that runs the cleanup sweep. A scheduler supplied here is not shut
     * down by {@link DialQueueManager#close()}.
     *
     * <p>Optional. Defaults to a private single daemon thread.
     *
     * @param scheduler the scheduler
     * @return this builder
     */
    public Builder scheduler(ScheduledExecutorService scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    /**
     * Sets the executor that delivers deferred {@code ABORTED} results, so that a rejected
     * request's callback never runs inside the caller's {@code add}.
     *
     * <p>Optional. Defaults to the scheduler.
     *
     * @param callbackExecutor the executor for deferred callbacks
     * @return this builder
     */
    public Builder callbackExecutor(Executor callbackExecutor) {
      this.callbackExecutor = callbackExecutor;
      return this;
    }

    /**
     * Builds the manager. Call {@link DialQueueManager#start()} to begin accepting requests.
     *
     * @return a new, stopped {@link DialQueueManager}
     * @throws NullPointerException if {@code queueFactory} or {@code peerRegistry} is null
     * @throws IllegalArgumentException if {@code maxParallelDials < 1},
     *     {@code maxColdCalls < 0}, or {@code cleanIntervalMs <= 0}
     */
    public DialQueueManager build() {
      return new DialQueueManager(this);
    }
  }
}
