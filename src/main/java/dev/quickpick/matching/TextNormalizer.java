package dev.quickpick.matching;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Folds query and candidate text into a comparison-safe form: diacritics removed, lower-cased
 * (locale independent) and trimmed of surrounding whitespace.
 *
 * <p>Folding is applied one source codepoint at a time so every folded codepoint keeps a link to
 * the codepoint it came from. Pure and deterministic; {@code null} and empty input fold to empty.
 */
public final class TextNormalizer {

  private TextNormalizer() {
    // utility class
  }

  /**
   * Normalizes text for comparison.
   *
   * @param text the raw text, may be {@code null}
   * @return the folded text as a string, empty for {@code null} or blank input
   */
  public static String normalize(@Nullable String text) {
    return fold(text).toString();
  }

  /**
   * Folds text and records, for each folded codepoint, its source codepoint offset.
   *
   * @param text the raw text, may be {@code null}
   * @return the folded text
   */
  public static FoldedText fold(@Nullable String text) {
    if (text == null || text.isEmpty()) {
      return FoldedText.empty();
    }

    int[] folded = new int[text.length() * 2];
    int[] offsets = new int[folded.length];
    int size = 0;
    int sourceOffset = 0;

    for (int i = 0; i < text.length(); ) {
      int codePoint = text.codePointAt(i);
      i += Character.charCount(codePoint);

      String decomposed = Normalizer.normalize(Character.toString(codePoint), Normalizer.Form.NFD);
      int[] lowered = decomposed.toLowerCase(Locale.ROOT).codePoints().toArray();
      for (int c : lowered) {
        if (isCombiningMark(c)) {
          continue;
        }
        if (size == folded.length) {
          folded = Arrays.copyOf(folded, size * 2);
          offsets = Arrays.copyOf(offsets, size * 2);
        }
        folded[size] = c;
        offsets[size] = sourceOffset;
        size++;
      }
      sourceOffset++;
    }

    int start = 0;
    int end = size;
    while (start < end && isWhitespace(folded[start])) {
      start++;
    }
    while (end > start && isWhitespace(folded[end - 1])) {
      end--;
    }
    if (start == end) {
      return FoldedText.empty();
    }
    return new FoldedText(
        Arrays.copyOfRange(folded, start, end), Arrays.copyOfRange(offsets, start, end));
  }

  static boolean isWhitespace(int codePoint) {
    return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint);
  }

  private static boolean isCombiningMark(int codePoint) {
    int type = Character.getType(codePoint);
    return type == Character.NON_SPACING_MARK
        || type == Character.COMBINING_SPACING_MARK
        || type == Character.ENCLOSING_MARK;
  }
}
