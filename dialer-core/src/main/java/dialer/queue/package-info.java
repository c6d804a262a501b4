/**
 * Dial scheduling.
 *
 * <p>{@link dialer.queue.DialQueueManager} owns the hot and cold-call pending sets, the
 * active-dialing set and the peer id to {@link dialer.queue.DialQueue} table.
 * {@link dialer.queue.DefaultDialQueue} dials one peer's requests in order and tracks its
 * blacklist using a {@link dialer.queue.BlacklistPolicy}.
 *
 * @see dialer.queue.DialQueueManager
 * @see dialer.queue.DefaultDialQueue
 */
package dialer.queue;
