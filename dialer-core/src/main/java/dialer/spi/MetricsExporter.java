package dialer.spi;

/**
 * Observability hook for exporting dialer counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of peers placed in the hot pending set.
     */
    void incrementHotQueued();

    /**
     * Increments the count of peers placed in the cold-call pending set.
     */
    void incrementColdCallQueued();

    /**
     * Increments the count of cold calls rejected because the cold-call set was full.
     */
    void incrementColdCallRejected();

    /**
     * Increments the count of cold calls aborted because the peer was already pending as hot.
     */
    void incrementColdCallSuperseded();

    /**
     * Increments the count of queues started from the pending sets.
     */
    void incrementDialStarted();

    /**
     * Increments the count of queues started immediately because the peer was already connected.
     */
    void incrementConnectedBypass();

    /**
     * Adds to the count of queues evicted by the cleanup sweep.
     *
     * @param count number of queues evicted in one sweep
     */
    void incrementQueuesEvicted(int count);

    /**
     * Records the current size of both pending sets.
     *
     * @param hotDepth  peers waiting with at least one protocol-bearing request
     * @param coldDepth peers waiting with cold calls only
     */
    void recordPendingDepths(int hotDepth, int coldDepth);

    /**
     * Records the number of queues occupying a parallel dial slot.
     *
     * @param activeDials size of the active-dialing set
     */
    void recordActiveDials(int activeDials);

    /**
     * Records the number of per-peer queues held in memory.
     *
     * @param trackedQueues size of the queue table
     */
    void recordTrackedQueues(int trackedQueues);

    /**
     * Increments the count of individual dials that connected.
     */
    default void incrementDialSuccess() {
    }

    /**
     * Increments the count of individual dials that failed.
     */
    default void incrementDialFailure() {
    }

    /**
     * Increments the count of peers put under a blacklist (temporary or permanent).
     */
    default void incrementPeerBlacklisted() {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementHotQueued() {
        }

        @Override
        public void incrementColdCallQueued() {
        }

        @Override
        public void incrementColdCallRejected() {
        }

        @Override
        public void incrementColdCallSuperseded() {
        }

        @Override
        public void incrementDialStarted() {
        }

        @Override
        public void incrementConnectedBypass() {
        }

        @Override
        public void incrementQueuesEvicted(int count) {
        }

        @Override
        public void recordPendingDepths(int hotDepth, int coldDepth) {
        }

        @Override
        public void recordActiveDials(int activeDials) {
        }

        @Override
        public void recordTrackedQueues(int trackedQueues) {
        }
    }
}
