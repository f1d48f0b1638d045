package dev.quickpick.matching;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Recomputes which title codepoints a query covered, for emphasis in the palette row.
 *
 * <p>Runs independently of scoring: each token is matched against the title alone with the same
 * ladder and the covered positions are unioned. A token that only matched the subtitle or a
 * keyword highlights nothing. Offsets refer to codepoints of the original, unfolded title.
 */
public final class TitleHighlighter {

  private final TokenMatcher tokenMatcher;

  public TitleHighlighter(TokenMatcher tokenMatcher) {
    this.tokenMatcher = tokenMatcher;
  }

  /**
   * @param tokens query tokens
   * @param title the prepared title field
   * @return ascending, unmodifiable codepoint offsets into the original title
   */
  public SortedSet<Integer> highlight(List<int[]> tokens, SegmentedText title) {
    SortedSet<Integer> offsets = new TreeSet<>();
    for (int[] token : tokens) {
      tokenMatcher
          .bestMatch(token, title)
          .ifPresent(
              match -> {
                for (int position : match.positions()) {
                  offsets.add(title.text().sourceOffset(position));
                }
              });
    }
    return Collections.unmodifiableSortedSet(offsets);
  }
}
