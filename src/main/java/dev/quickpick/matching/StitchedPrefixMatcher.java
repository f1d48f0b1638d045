package dev.quickpick.matching;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Matches a token split into two or more contiguous chunks, each chunk a prefix of a distinct word
 * segment, left to right. {@code abcproj} matches {@code abc project} as {@code abc} + {@code
 * proj}; {@code retab} matches {@code rename tab} as {@code re} + {@code tab}.
 *
 * <p>Words may be skipped between chunks but never reused or reordered. The search is an explicit
 * dynamic-programming table over {@code (tokenIndex, wordIndex, usedWordCount)}, filled bottom-up
 * so no recursion is involved. {@code usedWordCount} is capped at two because only "at least two
 * words" affects the outcome. At each word, chunk lengths are tried longest first. Only words
 * whose first letter occurs in the token take part in the table.
 */
final class StitchedPrefixMatcher {

  /** Shortest token the stitched strategy accepts. */
  static final int MIN_TOKEN_LENGTH = 4;

  private static final int BASE = 1800;
  private static final int CHUNK_CHAR_REWARD = 60;
  private static final int CONTIGUOUS_WORD_BONUS = 25;
  private static final int LEFTOVER_CHAR_PENALTY = 6;
  private static final int WORD_POSITION_PENALTY = 4;
  private static final int SKIPPED_WORD_PENALTY = 20;
  private static final int EXCESS_LENGTH_PENALTY = 1;

  private static final int NO_MATCH = Integer.MIN_VALUE;
  private static final int USED_STATES = 3;

  private StitchedPrefixMatcher() {
    // utility class
  }

  static Optional<TokenMatch> match(int[] token, SegmentedText text) {
    int m = token.length;
    List<WordSegment> words = text.segments();
    if (m < MIN_TOKEN_LENGTH || words.size() < 2) {
      return Optional.empty();
    }
    int[] reachable = reachableWords(token, text);
    if (reachable.length < 2) {
      return Optional.empty();
    }
    int wordCount = reachable.length;

    // word dimension indexes into reachable, not into the segment list
    int[][][] best = new int[m + 1][wordCount + 1][USED_STATES];
    int[][][] chosenWord = new int[m + 1][wordCount + 1][USED_STATES];
    int[][][] chosenLength = new int[m + 1][wordCount + 1][USED_STATES];

    for (int tokenIndex = m; tokenIndex >= 0; tokenIndex--) {
      for (int wordIndex = wordCount; wordIndex >= 0; wordIndex--) {
        for (int used = 0; used < USED_STATES; used++) {
          best[tokenIndex][wordIndex][used] =
              fill(
                  token,
                  text,
                  reachable,
                  best,
                  chosenWord,
                  chosenLength,
                  tokenIndex,
                  wordIndex,
                  used);
        }
      }
    }

    int total = best[0][0][0];
    if (total == NO_MATCH) {
      return Optional.empty();
    }

    int[] positions = new int[m];
    int tokenIndex = 0;
    int wordIndex = 0;
    int used = 0;
    while (tokenIndex < m) {
      int word = chosenWord[tokenIndex][wordIndex][used];
      int length = chosenLength[tokenIndex][wordIndex][used];
      int start = words.get(reachable[word]).start();
      for (int i = 0; i < length; i++) {
        positions[tokenIndex + i] = start + i;
      }
      tokenIndex += length;
      wordIndex = word + 1;
      used = Math.min(used + 1, USED_STATES - 1);
    }

    int raw = BASE + total - (text.length() - m) * EXCESS_LENGTH_PENALTY;
    return Optional.of(new TokenMatch("stitched", MatchStrategies.STITCHED.clamp(raw), positions));
  }

  /**
   * Indices of the word segments whose first letter occurs in the token. Other words can never host
   * a chunk. Returns an empty array when no word starts with the token's first letter.
   */
  static int[] reachableWords(int[] token, SegmentedText text) {
    List<WordSegment> words = text.segments();
    int[] reachable = new int[words.size()];
    int count = 0;
    boolean firstChunkPossible = false;
    for (int word = 0; word < words.size(); word++) {
      int initial = text.codePointAt(words.get(word).start());
      if (initial == token[0]) {
        firstChunkPossible = true;
        reachable[count++] = word;
      } else if (contains(token, initial)) {
        reachable[count++] = word;
      }
    }
    return firstChunkPossible ? Arrays.copyOf(reachable, count) : new int[0];
  }

  private static boolean contains(int[] token, int codePoint) {
    for (int c : token) {
      if (c == codePoint) {
        return true;
      }
    }
    return false;
  }

  private static int fill(
      int[] token,
      SegmentedText text,
      int[] reachable,
      int[][][] best,
      int[][][] chosenWord,
      int[][][] chosenLength,
      int tokenIndex,
      int wordIndex,
      int used) {
    if (tokenIndex == token.length) {
      return used >= 2 ? 0 : NO_MATCH;
    }
    if (wordIndex == reachable.length) {
      return NO_MATCH;
    }

    List<WordSegment> words = text.segments();
    // skip penalties count every segment word, reachable or not
    int firstAllowedWord = wordIndex == 0 ? 0 : reachable[wordIndex - 1] + 1;
    int bestHere = NO_MATCH;
    int nextUsed = Math.min(used + 1, USED_STATES - 1);
    for (int next = wordIndex; next < reachable.length; next++) {
      int word = reachable[next];
      WordSegment segment = words.get(word);
      int common = commonPrefixLength(token, tokenIndex, text, segment);
      for (int length = common; length >= 1; length--) {
        int rest = best[tokenIndex + length][next + 1][nextUsed];
        if (rest == NO_MATCH) {
          continue;
        }
        int reward = chunkReward(length, segment, word, firstAllowedWord, used > 0);
        if (reward + rest > bestHere) {
          bestHere = reward + rest;
          chosenWord[tokenIndex][wordIndex][used] = next;
          chosenLength[tokenIndex][wordIndex][used] = length;
        }
      }
    }
    return bestHere;
  }

  private static int chunkReward(
      int length, WordSegment segment, int word, int firstAllowedWord, boolean afterChunk) {
    int reward = length * CHUNK_CHAR_REWARD;
    if (afterChunk) {
      if (word == firstAllowedWord) {
        reward += CONTIGUOUS_WORD_BONUS;
      }
      reward -= (word - firstAllowedWord) * SKIPPED_WORD_PENALTY;
    }
    reward -= (segment.length() - length) * LEFTOVER_CHAR_PENALTY;
    reward -= word * WORD_POSITION_PENALTY;
    return reward;
  }

  private static int commonPrefixLength(
      int[] token, int tokenIndex, SegmentedText text, WordSegment segment) {
    int limit = Math.min(segment.length(), token.length - tokenIndex);
    int length = 0;
    while (length < limit
        && text.codePointAt(segment.start() + length) == token[tokenIndex + length]) {
      length++;
    }
    return length;
  }
}
