package dev.quickpick.matching;

import java.util.Optional;

/**
 * One rung of the matching ladder: scores a single non-empty folded token against a single
 * prepared field. Implementations are pure and independent of each other; the ladder keeps the
 * maximum.
 */
@FunctionalInterface
public interface MatchStrategy {

  /**
   * @param token folded token codepoints, never empty
   * @param text the prepared field
   * @return the match, or empty when this strategy does not apply
   */
  Optional<TokenMatch> match(int[] token, SegmentedText text);
}
