package dev.quickpick.matching;

/**
 * Outcome of one successful strategy for one token against one field.
 *
 * @param strategy name of the strategy that produced the match
 * @param score the strategy's score, always {@code >= 1}
 * @param positions ascending folded-text indices covered by the match
 */
public record TokenMatch(String strategy, int score, int[] positions) {

  public TokenMatch {
    if (score < 1) {
      throw new IllegalArgumentException("score must be at least 1, got: " + score);
    }
  }

  /** Builds a match covering the contiguous folded range {@code [start, start + length)}. */
  static TokenMatch range(String strategy, int score, int start, int length) {
    int[] positions = new int[length];
    for (int i = 0; i < length; i++) {
      positions[i] = start + i;
    }
    return new TokenMatch(strategy, score, positions);
  }
}
