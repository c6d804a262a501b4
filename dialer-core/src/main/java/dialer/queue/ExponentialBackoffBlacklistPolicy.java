package dialer.queue;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Blacklist policy using exponential backoff with jitter.
 *
 * <p>Duration formula: {@code baseTtl * 2^(failures-1)}, capped at {@code maxTtl},
 * with random jitter in the range [0.5, 1.5).
 */
public final class ExponentialBackoffBlacklistPolicy implements BlacklistPolicy {
  private final long baseTtlMs;
  private final long maxTtlMs;

  /**
   * @param baseTtlMs blacklist duration after the first failure (milliseconds)
   * @param maxTtlMs  maximum blacklist duration (milliseconds)
   */
  public ExponentialBackoffBlacklistPolicy(long baseTtlMs, long maxTtlMs) {
    if (baseTtlMs <= 0) {
      throw new IllegalArgumentException("baseTtlMs must be > 0, got: " + baseTtlMs);
    }
    if (maxTtlMs < 0) {
      throw new IllegalArgumentException("maxTtlMs must be >= 0, got: " + maxTtlMs);
    }
    this.baseTtlMs = baseTtlMs;
    this.maxTtlMs = maxTtlMs;
  }

  @Override
  public long computeBlacklistMs(int failures) {
    if (failures <= 0) {
      return 0L;
    }
    long ttl;
    if (failures >= 63 || (1L << (failures - 1)) > maxTtlMs / baseTtlMs) {
      ttl = maxTtlMs;
    } else {
      ttl = baseTtlMs << (failures - 1);
    }
    long capped = Math.min(maxTtlMs, ttl);
    double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Math.min(maxTtlMs, Math.max(0L, (long) (capped * jitter)));
  }
}
