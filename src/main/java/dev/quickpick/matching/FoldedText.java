package dev.quickpick.matching;

import java.util.Arrays;
import org.jspecify.annotations.Nullable;

/**
 * A normalized string held as codepoints, together with the offset of the original codepoint each
 * folded codepoint was produced from.
 *
 * <p>Instances are created by {@link TextNormalizer#fold(String)}. The offset table lets the
 * highlighter report positions in the caller's (unfolded) title even when folding expanded or
 * trimmed characters.
 */
public final class FoldedText {

  private static final FoldedText EMPTY = new FoldedText(new int[0], new int[0]);

  private final int[] codePoints;
  private final int[] sourceOffsets;

  FoldedText(int[] codePoints, int[] sourceOffsets) {
    this.codePoints = codePoints;
    this.sourceOffsets = sourceOffsets;
  }

  static FoldedText empty() {
    return EMPTY;
  }

  public int length() {
    return codePoints.length;
  }

  public boolean isEmpty() {
    return codePoints.length == 0;
  }

  public int codePointAt(int index) {
    return codePoints[index];
  }

  /**
   * Returns the codepoint offset, in the original string, of the folded codepoint at {@code index}.
   *
   * @param index folded codepoint index
   * @return zero-based codepoint offset into the original string
   */
  public int sourceOffset(int index) {
    return sourceOffsets[index];
  }

  int[] codePoints() {
    return codePoints;
  }

  @Override
  public boolean equals(@Nullable Object other) {
    return other instanceof FoldedText that && Arrays.equals(codePoints, that.codePoints);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(codePoints);
  }

  @Override
  public String toString() {
    return new String(codePoints, 0, codePoints.length);
  }
}
