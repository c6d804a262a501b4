package dialer.queue;

/**
 * Strategy for computing how long a peer stays blacklisted after failed dials.
 *
 * @see ExponentialBackoffBlacklistPolicy
 */
public interface BlacklistPolicy {

    /**
     * Computes the blacklist duration in milliseconds.
     *
     * @param failures the number of consecutive failures so far (1-based)
     * @return duration in milliseconds (non-negative)
     */
    long computeBlacklistMs(int failures);
}
