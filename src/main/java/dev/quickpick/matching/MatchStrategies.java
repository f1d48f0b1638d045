package dev.quickpick.matching;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * The matching ladder: exact, whole prefix, word, substring, initialism, stitched multi-word
 * prefix and bounded subsequence.
 *
 * <p>Each strategy clamps its score into its own {@link ScoreBand}. The bands are ordered
 *
 * <pre>
 *   exact > whole prefix > word exact > word prefix > substring at boundary
 *         > substring mid-string > initialism > stitched > subsequence
 * </pre>
 *
 * <p>Penalties only move a score within its band.
 */
public final class MatchStrategies {

  static final ScoreBand EXACT = new ScoreBand(8000, 8000);
  static final ScoreBand WHOLE_PREFIX = new ScoreBand(6400, 6799);
  static final ScoreBand WORD_EXACT = new ScoreBand(5800, 6200);
  static final ScoreBand WORD_PREFIX = new ScoreBand(5200, 5599);
  static final ScoreBand SUBSTRING_AT_BOUNDARY = new ScoreBand(4250, 4499);
  static final ScoreBand SUBSTRING = new ScoreBand(3700, 4199);
  static final ScoreBand INITIALISM = new ScoreBand(2600, 3599);
  static final ScoreBand STITCHED = new ScoreBand(1600, 2599);
  static final ScoreBand SUBSEQUENCE = new ScoreBand(1, 1599);

  /** Longest token the subsequence strategy accepts. */
  static final int SUBSEQUENCE_MAX_TOKEN_LENGTH = 3;

  private static final int PREFIX_BASE = 6800;
  private static final int WORD_EXACT_BASE = 6200;
  private static final int WORD_PREFIX_BASE = 5600;
  private static final int WORD_DISTANCE_PENALTY = 8;
  private static final int WORD_REMAINDER_PENALTY = 4;

  private static final int SUBSTRING_BASE = 4200;
  private static final int SUBSTRING_START_BONUS = 220;
  private static final int SUBSTRING_BOUNDARY_BONUS = 180;
  private static final int SUBSTRING_DISTANCE_PENALTY = 9;

  private static final int INITIALISM_BASE = 3000;
  private static final int INITIALISM_CHAR_REWARD = 160;
  private static final int INITIALISM_FIRST_WORD_PENALTY = 5;
  private static final int INITIALISM_SKIPPED_WORD_PENALTY = 30;

  private static final int SUBSEQUENCE_BASE = 700;
  private static final int SUBSEQUENCE_CHAR_REWARD = 90;
  private static final int SUBSEQUENCE_BOUNDARY_BONUS = 140;
  private static final int SUBSEQUENCE_RUN_STEP = 70;
  private static final int SUBSEQUENCE_RUN_CAP = 200;
  private static final int SUBSEQUENCE_GAP_PENALTY = 6;

  /** Strategies in ladder order. */
  public static final List<MatchStrategy> LADDER =
      List.of(
          MatchStrategies::exact,
          MatchStrategies::wholePrefix,
          MatchStrategies::word,
          MatchStrategies::substring,
          MatchStrategies::initialism,
          StitchedPrefixMatcher::match,
          MatchStrategies::subsequence);

  private MatchStrategies() {
    // utility class
  }

  /** The token equals the whole field. */
  public static Optional<TokenMatch> exact(int[] token, SegmentedText text) {
    if (token.length != text.length() || !text.regionMatches(0, token, 0, token.length)) {
      return Optional.empty();
    }
    return Optional.of(TokenMatch.range("exact", EXACT.floor(), 0, token.length));
  }

  /** The field starts with the token; shorter fields score higher. */
  public static Optional<TokenMatch> wholePrefix(int[] token, SegmentedText text) {
    if (token.length >= text.length() || !text.regionMatches(0, token, 0, token.length)) {
      return Optional.empty();
    }
    int score = WHOLE_PREFIX.clamp(PREFIX_BASE - (text.length() - token.length));
    return Optional.of(TokenMatch.range("prefix", score, 0, token.length));
  }

  /**
   * The token equals, or is a prefix of, one word segment. Later words and longer trailing text
   * lower the score.
   */
  public static Optional<TokenMatch> word(int[] token, SegmentedText text) {
    @Nullable TokenMatch best = null;
    for (WordSegment segment : text.segments()) {
      if (segment.length() < token.length
          || !text.regionMatches(segment.start(), token, 0, token.length)) {
        continue;
      }
      int trailing = text.length() - segment.end();
      int distance = segment.start() * WORD_DISTANCE_PENALTY;
      TokenMatch candidate;
      if (segment.length() == token.length) {
        int score = WORD_EXACT.clamp(WORD_EXACT_BASE - distance - trailing);
        candidate = TokenMatch.range("word", score, segment.start(), token.length);
      } else {
        int remainder = (segment.length() - token.length) * WORD_REMAINDER_PENALTY;
        int score = WORD_PREFIX.clamp(WORD_PREFIX_BASE - distance - remainder - trailing);
        candidate = TokenMatch.range("word-prefix", score, segment.start(), token.length);
      }
      if (best == null || candidate.score() > best.score()) {
        best = candidate;
      }
    }
    return Optional.ofNullable(best);
  }

  /** First occurrence of the token anywhere in the field. */
  public static Optional<TokenMatch> substring(int[] token, SegmentedText text) {
    int start = text.indexOf(token, 0);
    if (start < 0) {
      return Optional.empty();
    }
    int penalty = start * SUBSTRING_DISTANCE_PENALTY + (text.length() - token.length);
    int score;
    if (text.isBoundaryBefore(start)) {
      int bonus = start == 0 ? SUBSTRING_START_BONUS : SUBSTRING_BOUNDARY_BONUS;
      score = SUBSTRING_AT_BOUNDARY.clamp(SUBSTRING_BASE + bonus - penalty);
    } else {
      score = SUBSTRING.clamp(SUBSTRING_BASE - penalty);
    }
    return Optional.of(TokenMatch.range("substring", score, start, token.length));
  }

  /**
   * Each token character matches the first character of a later word segment than the previous
   * one, e.g. {@code nw} against {@code new window}.
   */
  public static Optional<TokenMatch> initialism(int[] token, SegmentedText text) {
    List<WordSegment> segments = text.segments();
    if (token.length > segments.size()) {
      return Optional.empty();
    }
    int[] positions = new int[token.length];
    int firstWord = -1;
    int lastWord = -1;
    int next = 0;
    for (int k = 0; k < token.length; k++) {
      int found = -1;
      for (int w = next; w < segments.size(); w++) {
        if (text.codePointAt(segments.get(w).start()) == token[k]) {
          found = w;
          break;
        }
      }
      if (found < 0) {
        return Optional.empty();
      }
      if (firstWord < 0) {
        firstWord = found;
      }
      lastWord = found;
      positions[k] = segments.get(found).start();
      next = found + 1;
    }
    int skippedWords = lastWord + 1 - token.length;
    int raw =
        INITIALISM_BASE
            + INITIALISM_CHAR_REWARD * token.length
            - INITIALISM_FIRST_WORD_PENALTY * firstWord
            - INITIALISM_SKIPPED_WORD_PENALTY * skippedWords;
    return Optional.of(new TokenMatch("initialism", INITIALISM.clamp(raw), positions));
  }

  /**
   * Short tokens (up to three characters) whose characters occur in order. Within one word the
   * matched characters must be contiguous: a gap between two matched characters has to cross a
   * word boundary.
   */
  public static Optional<TokenMatch> subsequence(int[] token, SegmentedText text) {
    int m = token.length;
    int n = text.length();
    if (m > SUBSEQUENCE_MAX_TOKEN_LENGTH || m > n) {
      return Optional.empty();
    }

    int[] boundariesBefore = new int[n + 1];
    for (int i = 0; i < n; i++) {
      boundariesBefore[i + 1] =
          boundariesBefore[i] + (Tokenizer.isBoundary(text.codePointAt(i)) ? 1 : 0);
    }

    // best[k][p][r]: score with token[k] matched at p, ending a run of r consecutive characters
    int[][][] best = new int[m][n][m + 1];
    int[][][] previous = new int[m][n][m + 1];
    for (int[][] plane : best) {
      for (int[] row : plane) {
        Arrays.fill(row, Integer.MIN_VALUE);
      }
    }

    for (int p = 0; p < n; p++) {
      if (text.codePointAt(p) == token[0]) {
        best[0][p][1] = characterScore(text, p);
      }
    }
    for (int k = 1; k < m; k++) {
      for (int p = k; p < n; p++) {
        if (text.codePointAt(p) != token[k]) {
          continue;
        }
        for (int q = k - 1; q < p; q++) {
          for (int r = 1; r <= k; r++) {
            int before = best[k - 1][q][r];
            if (before == Integer.MIN_VALUE) {
              continue;
            }
            int run;
            int gain;
            if (p == q + 1) {
              run = r + 1;
              gain = characterScore(text, p) + runBonus(run) - runBonus(r);
            } else if (boundariesBefore[p] - boundariesBefore[q + 1] > 0) {
              run = 1;
              gain = characterScore(text, p) - (p - q - 1) * SUBSEQUENCE_GAP_PENALTY;
            } else {
              continue;
            }
            if (before + gain > best[k][p][run]) {
              best[k][p][run] = before + gain;
              previous[k][p][run] = q * (m + 1) + r;
            }
          }
        }
      }
    }

    int bestScore = Integer.MIN_VALUE;
    int endPosition = -1;
    int endRun = -1;
    for (int p = 0; p < n; p++) {
      for (int r = 1; r <= m; r++) {
        if (best[m - 1][p][r] > bestScore) {
          bestScore = best[m - 1][p][r];
          endPosition = p;
          endRun = r;
        }
      }
    }
    if (endPosition < 0) {
      return Optional.empty();
    }

    int[] positions = new int[m];
    int p = endPosition;
    int r = endRun;
    for (int k = m - 1; k >= 0; k--) {
      positions[k] = p;
      if (k > 0) {
        int link = previous[k][p][r];
        p = link / (m + 1);
        r = link % (m + 1);
      }
    }

    int raw = SUBSEQUENCE_BASE + bestScore - (n - m);
    return Optional.of(new TokenMatch("subsequence", SUBSEQUENCE.clamp(raw), positions));
  }

  private static int characterScore(SegmentedText text, int position) {
    return SUBSEQUENCE_CHAR_REWARD
        + (text.isBoundaryBefore(position) ? SUBSEQUENCE_BOUNDARY_BONUS : 0);
  }

  private static int runBonus(int runLength) {
    return Math.min(SUBSEQUENCE_RUN_CAP, SUBSEQUENCE_RUN_STEP * runLength * (runLength - 1) / 2);
  }
}
