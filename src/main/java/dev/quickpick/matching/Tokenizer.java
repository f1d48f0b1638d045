package dev.quickpick.matching;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Splits normalized queries into whitespace tokens and normalized candidate text into word
 * segments.
 *
 * <p>Word segments are delimited by whitespace and the boundary characters {@code - _ / . :}.
 */
public final class Tokenizer {

  private Tokenizer() {
    // utility class
  }

  /**
   * Normalizes a query and splits it into tokens, each returned as an array of codepoints.
   *
   * @param query the raw query (mode prefix already stripped), may be {@code null}
   * @return the non-empty tokens in query order; empty for a blank query
   */
  public static List<int[]> queryTokens(@Nullable String query) {
    FoldedText folded = TextNormalizer.fold(query);
    List<int[]> tokens = new ArrayList<>();
    int start = -1;
    for (int i = 0; i <= folded.length(); i++) {
      boolean separator = i == folded.length() || TextNormalizer.isWhitespace(folded.codePointAt(i));
      if (separator) {
        if (start >= 0) {
          tokens.add(Arrays.copyOfRange(folded.codePoints(), start, i));
          start = -1;
        }
      } else if (start < 0) {
        start = i;
      }
    }
    return tokens;
  }

  /**
   * Computes the word segments of a folded string.
   *
   * @param text the folded text
   * @return segments in left-to-right order
   */
  public static List<WordSegment> wordSegments(FoldedText text) {
    List<WordSegment> segments = new ArrayList<>();
    int start = -1;
    for (int i = 0; i <= text.length(); i++) {
      if (i == text.length() || isBoundary(text.codePointAt(i))) {
        if (start >= 0) {
          segments.add(new WordSegment(start, i));
          start = -1;
        }
      } else if (start < 0) {
        start = i;
      }
    }
    return segments;
  }

  /** Returns whether the codepoint separates word segments. */
  public static boolean isBoundary(int codePoint) {
    return switch (codePoint) {
      case '-', '_', '/', '.', ':' -> true;
      default -> TextNormalizer.isWhitespace(codePoint);
    };
  }
}
