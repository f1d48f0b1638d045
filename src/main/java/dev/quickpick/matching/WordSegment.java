package dev.quickpick.matching;

/**
 * Half-open {@code [start, end)} range of a maximal run of non-boundary codepoints in a folded
 * string.
 *
 * @param start index of the first codepoint of the word
 * @param end index one past the last codepoint of the word
 */
public record WordSegment(int start, int end) {

  public WordSegment {
    if (start < 0 || end <= start) {
      throw new IllegalArgumentException("Invalid word segment [" + start + ", " + end + ")");
    }
  }

  public int length() {
    return end - start;
  }
}
