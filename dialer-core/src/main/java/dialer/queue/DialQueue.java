package dialer.queue;

import dialer.DialCallback;

/**
 * Per-peer buffer of dial requests, driven by {@link DialQueueManager}.
 *
 * <p>The manager only reads queue state and calls the lifecycle methods below; the queue
 * owns its buffered requests and blacklist counters. A queue must call its
 * {@link QueueStoppedListener} every time it goes from running to idle, otherwise the
 * parallel dial slot it occupies is never returned.
 *
 * <p>Implementations must not hold their own lock while invoking callbacks or the stop
 * listener.
 */
public interface DialQueue {

  /** Returns the id of the peer this queue dials. */
  String id();

  boolean isRunning();

  /** Returns the number of buffered requests that have not been attempted yet. */
  int length();

  /**
   * Returns whether the queue is under any blacklist, temporary or permanent.
   *
   * @return {@code true} while a blacklist is recorded
   */
  boolean isBlacklisted();

  /**
   * Returns whether the peer reached the failure limit and will never be dialed again.
   *
   * @return {@code true} if permanently blacklisted
   */
  boolean isPermanentlyBlacklisted();

  /** Returns the number of consecutive failed dials. */
  int blacklistCount();

  /** Resets the blacklist state and the failure count. */
  void clearBlacklist();

  /**
   * Returns whether dialing is currently permitted.
   *
   * @return {@code false} while the peer is inside a blacklist backoff window
   */
  boolean isDialAllowed();

  /**
   * Buffers a dial request.
   *
   * @param protocol protocol to negotiate, or {@code null} for a cold call
   * @param useFsm   whether a managed connection was requested
   * @param callback receives the outcome exactly once
   */
  void add(String protocol, boolean useFsm, DialCallback callback);

  /** Begins dialing buffered requests. No-op if already running. */
  void start();

  /**
   * Cancels all buffered and in-flight work, resolving callbacks with
   * {@link dialer.DialException.Code#ABORTED}.
   */
  void abort();
}
