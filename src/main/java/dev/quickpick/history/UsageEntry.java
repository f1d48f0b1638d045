package dev.quickpick.history;

/**
 * Usage record of one palette candidate, keyed by candidate id in the usage history.
 *
 * @param useCount number of successful invocations (never negative)
 * @param lastUsedAt time of the latest invocation, in seconds since the epoch
 */
public record UsageEntry(int useCount, long lastUsedAt) {

  public UsageEntry {
    if (useCount < 0) {
      throw new IllegalArgumentException("useCount must not be negative, got: " + useCount);
    }
  }

  /** Entry for a candidate invoked for the first time at {@code nowEpochSeconds}. */
  public static UsageEntry firstUse(long nowEpochSeconds) {
    return new UsageEntry(1, nowEpochSeconds);
  }

  /** Returns the entry after one more invocation at {@code nowEpochSeconds}. */
  public UsageEntry recordUse(long nowEpochSeconds) {
    return new UsageEntry(useCount == Integer.MAX_VALUE ? useCount : useCount + 1, nowEpochSeconds);
  }
}
