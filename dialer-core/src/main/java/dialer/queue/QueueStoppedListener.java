package dialer.queue;

/**
 * Notification a {@link DialQueue} sends when it transitions to idle.
 */
@FunctionalInterface
public interface QueueStoppedListener {

  void onQueueStopped(String peerId);
}
