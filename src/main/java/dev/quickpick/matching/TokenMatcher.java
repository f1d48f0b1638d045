package dev.quickpick.matching;

import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Runs the strategy ladder for one token against one field and keeps the best match. On equal
 * scores the strategy earlier in the ladder wins.
 */
public final class TokenMatcher {

  private final List<MatchStrategy> ladder;

  public TokenMatcher() {
    this(MatchStrategies.LADDER);
  }

  public TokenMatcher(List<MatchStrategy> ladder) {
    if (ladder.isEmpty()) {
      throw new IllegalArgumentException("ladder must contain at least one strategy");
    }
    this.ladder = List.copyOf(ladder);
  }

  /**
   * Finds the highest-scoring match of a token in a field.
   *
   * @param token folded token codepoints; an empty token never matches
   * @param text the prepared field
   * @return the best match, or empty when no strategy applies
   */
  public Optional<TokenMatch> bestMatch(int[] token, SegmentedText text) {
    if (token.length == 0 || text.isEmpty()) {
      return Optional.empty();
    }
    @Nullable TokenMatch best = null;
    for (MatchStrategy strategy : ladder) {
      Optional<TokenMatch> match = strategy.match(token, text);
      if (match.isPresent() && (best == null || match.get().score() > best.score())) {
        best = match.get();
      }
    }
    return Optional.ofNullable(best);
  }
}
