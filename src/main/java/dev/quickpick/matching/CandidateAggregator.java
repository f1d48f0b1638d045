package dev.quickpick.matching;

import java.util.List;
import java.util.OptionalInt;

/**
 * Combines per-token matches across the searchable fields of one candidate.
 *
 * <p>Every token must match at least one field (AND across tokens); for each token the best field
 * counts (OR across fields). The candidate's match score is the sum of the per-token bests. No
 * tokens means an empty query, which matches with score 0.
 */
public final class CandidateAggregator {

  private final TokenMatcher tokenMatcher;

  public CandidateAggregator(TokenMatcher tokenMatcher) {
    this.tokenMatcher = tokenMatcher;
  }

  /**
   * Scores a candidate's fields against the query tokens.
   *
   * @param tokens query tokens from {@link Tokenizer#queryTokens(String)}
   * @param fields the candidate's prepared searchable fields (title, subtitle, keywords)
   * @return the summed match score, or empty when some token matches no field
   */
  public OptionalInt score(List<int[]> tokens, List<SegmentedText> fields) {
    if (tokens.isEmpty()) {
      return OptionalInt.of(0);
    }
    int total = 0;
    for (int[] token : tokens) {
      int best = 0;
      for (SegmentedText field : fields) {
        int score = tokenMatcher.bestMatch(token, field).map(TokenMatch::score).orElse(0);
        best = Math.max(best, score);
      }
      if (best == 0) {
        return OptionalInt.empty();
      }
      total += best;
    }
    return OptionalInt.of(total);
  }
}
