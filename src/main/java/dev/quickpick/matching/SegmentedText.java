package dev.quickpick.matching;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A folded searchable field together with its word segments, prepared once per field per search
 * pass.
 *
 * @param text the folded text
 * @param segments word segments of {@code text}
 */
public record SegmentedText(FoldedText text, List<WordSegment> segments) {

  public SegmentedText {
    segments = List.copyOf(segments);
  }

  /**
   * Folds and segments raw field text.
   *
   * @param raw the raw field text, may be {@code null}
   * @return the prepared field
   */
  public static SegmentedText of(@Nullable String raw) {
    FoldedText folded = TextNormalizer.fold(raw);
    return new SegmentedText(folded, Tokenizer.wordSegments(folded));
  }

  public int length() {
    return text.length();
  }

  public boolean isEmpty() {
    return text.isEmpty();
  }

  int codePointAt(int index) {
    return text.codePointAt(index);
  }

  boolean isBoundaryBefore(int index) {
    return index == 0 || Tokenizer.isBoundary(text.codePointAt(index - 1));
  }

  /** Returns whether {@code count} token codepoints from {@code tokenFrom} occur at {@code at}. */
  boolean regionMatches(int at, int[] token, int tokenFrom, int count) {
    if (at < 0 || at + count > text.length() || tokenFrom + count > token.length) {
      return false;
    }
    for (int i = 0; i < count; i++) {
      if (text.codePointAt(at + i) != token[tokenFrom + i]) {
        return false;
      }
    }
    return true;
  }

  /** Returns the first index at or after {@code from} where the whole token occurs, or -1. */
  int indexOf(int[] token, int from) {
    for (int at = Math.max(0, from); at + token.length <= text.length(); at++) {
      if (regionMatches(at, token, 0, token.length)) {
        return at;
      }
    }
    return -1;
  }
}
