package dialer;

public final class DialerConfig {
  private int maxParallelDials = 100;
  private int maxColdCalls = 50;
  private long cleanIntervalMs = 15 * 60 * 1000L;

  private long blacklistBaseTtlMs = 5 * 60 * 1000L;
  private long blacklistMaxTtlMs = 60 * 60 * 1000L;
  private int maxBlacklistAttempts = 5;

  public int getMaxParallelDials() {
    return maxParallelDials;
  }

  public DialerConfig setMaxParallelDials(int maxParallelDials) {
    this.maxParallelDials = maxParallelDials;
    return this;
  }

  public int getMaxColdCalls() {
    return maxColdCalls;
  }

  public DialerConfig setMaxColdCalls(int maxColdCalls) {
    this.maxColdCalls = maxColdCalls;
    return this;
  }

  public long getCleanIntervalMs() {
    return cleanIntervalMs;
  }

  public DialerConfig setCleanIntervalMs(long cleanIntervalMs) {
    this.cleanIntervalMs = cleanIntervalMs;
    return this;
  }

  public long getBlacklistBaseTtlMs() {
    return blacklistBaseTtlMs;
  }

  public DialerConfig setBlacklistBaseTtlMs(long blacklistBaseTtlMs) {
    this.blacklistBaseTtlMs = blacklistBaseTtlMs;
    return this;
  }

  public long getBlacklistMaxTtlMs() {
    return blacklistMaxTtlMs;
  }

  public DialerConfig setBlacklistMaxTtlMs(long blacklistMaxTtlMs) {
    this.blacklistMaxTtlMs = blacklistMaxTtlMs;
    return this;
  }

  public int getMaxBlacklistAttempts() {
    return maxBlacklistAttempts;
  }

  public DialerConfig setMaxBlacklistAttempts(int maxBlacklistAttempts) {
    this.maxBlacklistAttempts = maxBlacklistAttempts;
    return this;
  }
}
