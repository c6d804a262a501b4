package dialer.queue;

/**
 * Creates the per-peer {@link DialQueue} the first time a peer id is referenced.
 *
 * @see DefaultDialQueueFactory
 */
@FunctionalInterface
public interface DialQueueFactory {

  /**
   * Creates a queue for {@code peerId}.
   *
   * @param peerId    the peer the queue dials
   * @param onStopped listener the queue must notify each time it stops
   * @return a new, idle queue whose {@link DialQueue#id()} equals {@code peerId}
   */
  DialQueue create(String peerId, QueueStoppedListener onStopped);
}
