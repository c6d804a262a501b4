package dialer.queue;

import dialer.DialRequest;
import dialer.spi.PeerConnector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Manager driven by real {@link DefaultDialQueue}s whose dials complete on other threads.
 */
class DialQueueManagerConcurrencyTest {

  private final StubPeerRegistry registry = new StubPeerRegistry();
  private DialQueueManager manager;
  private ExecutorService completers;

  @AfterEach
  void tearDown() {
    if (manager != null) {
      manager.close();
    }
    if (completers != null) {
      completers.shutdownNow();
    }
  }

  // ── Stop notifications racing admission ─────────────────────────

  @Test
  void lateStopOfRestartedQueueDoesNotFreeItsSlot() throws Exception {
    HeldConnector connector = new HeldConnector();
    manager = newManager(connector, 2);
    manager.add(DialRequest.hot("a", "/p", null));
    assertEquals(1, connector.inFlight.get());

    Thread completer = new Thread(() -> connector.complete("a"), "dial-completer");
    synchronized (manager) {
      completer.start();
      awaitBlocked(completer);
      // "a" finished its buffer and is waiting to report the stop
      assertFalse(manager.getQueue("a").isRunning());
      assertEquals(Set.of("a"), manager.dialingPeerIds());

      manager.add(DialRequest.hot("a", "/p", null));
      assertTrue(manager.getQueue("a").isRunning());
    }
    completer.join(TimeUnit.SECONDS.toMillis(5));
    assertFalse(completer.isAlive());

    manager.add(DialRequest.hot("b", "/p", null));
    manager.add(DialRequest.hot("c", "/p", null));

    assertEquals(Set.of("a", "b"), manager.dialingPeerIds());
    assertEquals(List.of("c"), manager.hotPeerIds());
    assertEquals(2, connector.inFlight.get());
    assertEquals(runningPeers(), manager.dialingPeerIds());

    connector.complete("a");
    assertEquals(Set.of("b", "c"), manager.dialingPeerIds());
    assertEquals(runningPeers(), manager.dialingPeerIds());
  }

  @Test
  void concurrentCompletionsNeverExceedParallelLimit() throws Exception {
    int maxParallelDials = 3;
    int requests = 600;
    completers = Executors.newFixedThreadPool(4);
    AsyncConnector connector = new AsyncConnector(completers);
    manager = newManager(connector, maxParallelDials);
    CountDownLatch resolved = new CountDownLatch(requests);
    Random random = new Random(7);

    for (int i = 0; i < requests; i++) {
      String peer = "p" + random.nextInt(15);
      if (random.nextInt(3) == 0) {
        manager.add(DialRequest.coldCall(peer, result -> resolved.countDown()));
      } else {
        manager.add(DialRequest.hot(peer, "/p", result -> resolved.countDown()));
      }
      if (i % 50 == 0) {
        manager.clean();
      }
      assertTrue(manager.dialingPeerIds().size() <= maxParallelDials);
    }

    assertTrue(resolved.await(10, TimeUnit.SECONDS), "unresolved requests: " + resolved.getCount());
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!manager.dialingPeerIds().isEmpty()
        || !manager.hotPeerIds().isEmpty() || !manager.coldCallPeerIds().isEmpty()) {
      assertTrue(System.nanoTime() < deadline, "manager did not settle: dialing="
          + manager.dialingPeerIds() + " hot=" + manager.hotPeerIds()
          + " cold=" + manager.coldCallPeerIds());
      Thread.sleep(5);
    }
    assertTrue(connector.maxInFlight.get() <= maxParallelDials,
        "in-flight dials peaked at " + connector.maxInFlight.get());
    assertTrue(runningPeers().isEmpty());
  }

  private DialQueueManager newManager(PeerConnector connector, int maxParallelDials) {
    DialQueueManager created = DialQueueManager.builder()
        .queueFactory(DefaultDialQueueFactory.builder().connector(connector).build())
        .peerRegistry(registry)
        .maxParallelDials(maxParallelDials)
        .maxColdCalls(5)
        .build();
    created.start();
    return created;
  }

  private Set<String> runningPeers() {
    return manager.trackedPeerIds().stream()
        .filter(id -> manager.getQueue(id).isRunning())
        .collect(Collectors.toSet());
  }

  private static void awaitBlocked(Thread thread) {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (thread.getState() != Thread.State.BLOCKED) {
      assertTrue(System.nanoTime() < deadline, "thread never blocked: " + thread.getState());
      Thread.onSpinWait();
    }
  }

  /** Holds each dial until the test completes it. */
  private static final class HeldConnector implements PeerConnector {
    final AtomicInteger inFlight = new AtomicInteger();
    private final Map<String, Deque<CompletableFuture<Void>>> dials = new HashMap<>();

    @Override
    public synchronized CompletionStage<Void> connect(String peerId, String protocol, boolean useFsm) {
      CompletableFuture<Void> future = new CompletableFuture<>();
      dials.computeIfAbsent(peerId, id -> new ArrayDeque<>()).addLast(future);
      inFlight.incrementAndGet();
      return future;
    }

    void complete(String peerId) {
      CompletableFuture<Void> future;
      synchronized (this) {
        future = dials.get(peerId).pollFirst();
      }
      inFlight.decrementAndGet();
      future.complete(null);
    }
  }

  /** Completes every dial on a pool thread after a short random delay. */
  private static final class AsyncConnector implements PeerConnector {
    final AtomicInteger inFlight = new AtomicInteger();
    final AtomicInteger maxInFlight = new AtomicInteger();
    private final ExecutorService pool;

    AsyncConnector(ExecutorService pool) {
      this.pool = pool;
    }

    @Override
    public CompletionStage<Void> connect(String peerId, String protocol, boolean useFsm) {
      maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
      CompletableFuture<Void> future = new CompletableFuture<>();
      pool.execute(() -> {
        LockSupport.parkNanos(ThreadLocalRandom.current().nextLong(50_000, 500_000));
        inFlight.decrementAndGet();
        future.complete(null);
      });
      return future;
    }
  }
}
