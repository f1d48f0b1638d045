package dev.quickpick.search;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One ranked palette row.
 *
 * @param candidate the matched candidate (same instance the caller passed in)
 * @param matchScore sum of the per-token best match scores, 0 for an empty query
 * @param historyBoost addend derived from the candidate's usage history
 * @param matchedTitleIndices ascending codepoint offsets into {@code candidate.title()} to emphasise
 */
public record SearchResult(
    Candidate candidate,
    int matchScore,
    int historyBoost,
    SortedSet<Integer> matchedTitleIndices) {

  /** Compact constructor validating input and freezing the index set. */
  public SearchResult {
    if (candidate == null) {
      throw new IllegalArgumentException("Candidate must not be null");
    }
    if (matchScore < 0 || historyBoost < 0) {
      throw new IllegalArgumentException("Scores must not be negative");
    }
    matchedTitleIndices = Collections.unmodifiableSortedSet(new TreeSet<>(matchedTitleIndices));
  }

  /** Total ranking score: match score plus history boost. */
  public int score() {
    return matchScore + historyBoost;
  }
}
