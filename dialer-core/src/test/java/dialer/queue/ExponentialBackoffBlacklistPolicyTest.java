package dialer.queue;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffBlacklistPolicyTest {

  @Test
  void firstFailureUsesBaseTtl() {
    ExponentialBackoffBlacklistPolicy policy = new ExponentialBackoffBlacklistPolicy(100, 10000);

    long ttl = policy.computeBlacklistMs(1);

    // jitter is [0.5, 1.5)
    assertTrue(ttl >= 50 && ttl < 150, "Expected ttl between 50-150, got: " + ttl);
  }

  @Test
  void ttlGrowsExponentially() {
    ExponentialBackoffBlacklistPolicy policy = new ExponentialBackoffBlacklistPolicy(100, 100000);

    long ttl1 = policy.computeBlacklistMs(1);
    long ttl2 = policy.computeBlacklistMs(2);
    long ttl3 = policy.computeBlacklistMs(3);

    assertTrue(ttl1 >= 50 && ttl1 < 150, "ttl1 range: got " + ttl1);
    assertTrue(ttl2 >= 100 && ttl2 < 300, "ttl2 range: got " + ttl2);
    assertTrue(ttl3 >= 200 && ttl3 < 600, "ttl3 range: got " + ttl3);
  }

  @Test
  void ttlIsCappedAtMax() {
    ExponentialBackoffBlacklistPolicy policy = new ExponentialBackoffBlacklistPolicy(100, 500);

    assertTrue(policy.computeBlacklistMs(10) <= 500);
  }

  @Test
  void highFailureCountsDoNotOverflow() {
    ExponentialBackoffBlacklistPolicy policy = new ExponentialBackoffBlacklistPolicy(300_000, 3_600_000);

    for (int failures : new int[]{31, 32, 62, 63, 64, 1000}) {
      long ttl = policy.computeBlacklistMs(failures);
      assertTrue(ttl > 0 && ttl <= 3_600_000, "failures=" + failures + " ttl=" + ttl);
    }
  }

  @Test
  void nonPositiveFailureCountReturnsZero() {
    ExponentialBackoffBlacklistPolicy policy = new ExponentialBackoffBlacklistPolicy(100, 10000);

    assertEquals(0L, policy.computeBlacklistMs(0));
    assertEquals(0L, policy.computeBlacklistMs(-1));
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffBlacklistPolicy(0, 100));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffBlacklistPolicy(100, -1));
  }
}
