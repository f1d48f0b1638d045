package dev.quickpick.history;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Pure static utility computing the ranking addend derived from a candidate's usage history.
 *
 * <p>Formula:
 *
 * <ol>
 *   <li>{@code ageDays = max(0, now - lastUsedAt) / 86400}
 *   <li>{@code recencyBoost = max(0, 320 - ageDays * 20)} (floored to an integer)
 *   <li>{@code countBoost = min(180, useCount * 12)}
 *   <li>{@code rawBoost = recencyBoost + countBoost}
 * </ol>
 *
 * <p>An empty query applies the full raw boost so recently and frequently used candidates float to
 * the top of the unfiltered list; a non-empty query applies a third of it, enough to reorder close
 * matches but not to override a stronger text match.
 */
public final class HistoryBoost {

  static final int MAX_RECENCY_BOOST = 320;
  static final int RECENCY_DECAY_PER_DAY = 20;
  static final int MAX_COUNT_BOOST = 180;
  static final int COUNT_BOOST_PER_USE = 12;
  static final int FILTERED_QUERY_DIVISOR = 3;

  private static final double SECONDS_PER_DAY = 86_400.0;

  private HistoryBoost() {}

  /**
   * Computes the boost for a candidate.
   *
   * @param entry the candidate's usage entry, {@code null} when it was never used
   * @param now the evaluation time
   * @param emptyQuery whether the query has no tokens
   * @return a non-negative boost, at most {@code 500} (or {@code 166} for a non-empty query)
   */
  public static int boost(@Nullable UsageEntry entry, Instant now, boolean emptyQuery) {
    int raw = rawBoost(entry, now);
    return emptyQuery ? raw : raw / FILTERED_QUERY_DIVISOR;
  }

  /** Sum of the recency and count boosts; 0 for a missing entry. */
  public static int rawBoost(@Nullable UsageEntry entry, Instant now) {
    if (entry == null) {
      return 0;
    }
    return recencyBoost(entry, now) + countBoost(entry);
  }

  static int recencyBoost(UsageEntry entry, Instant now) {
    long ageSeconds;
    try {
      ageSeconds = Math.subtractExact(now.getEpochSecond(), entry.lastUsedAt());
    } catch (ArithmeticException e) {
      // only a timestamp far before any real clock reading overflows; it has fully decayed
      return 0;
    }
    // clock skew: an entry from the future counts as used right now
    ageSeconds = Math.max(0L, ageSeconds);
    double ageDays = ageSeconds / SECONDS_PER_DAY;
    return (int) Math.max(0.0, Math.floor(MAX_RECENCY_BOOST - ageDays * RECENCY_DECAY_PER_DAY));
  }

  static int countBoost(UsageEntry entry) {
    return (int) Math.min(MAX_COUNT_BOOST, (long) entry.useCount() * COUNT_BOOST_PER_USE);
  }
}
