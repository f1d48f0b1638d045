package dev.quickpick.search;

import java.util.Comparator;
import java.util.List;

/**
 * Orders search results for display.
 *
 * <p>Order: total score descending, then candidate rank ascending, then title compared
 * case-insensitively. Candidates sharing all three keep their input order (the sort is stable).
 */
public final class PaletteRanker {

  /** Display order of palette rows. */
  public static final Comparator<SearchResult> ORDER =
      Comparator.comparingInt(SearchResult::score)
          .reversed()
          .thenComparingInt(result -> result.candidate().rank())
          .thenComparing(result -> result.candidate().title(), String.CASE_INSENSITIVE_ORDER);

  private PaletteRanker() {}

  /**
   * Sorts results into display order.
   *
   * @param results unordered results
   * @return a new list in display order
   */
  public static List<SearchResult> rank(List<SearchResult> results) {
    return results.stream().sorted(ORDER).toList();
  }

  /**
   * Sorts results into display order and keeps the first {@code limit}.
   *
   * @param results unordered results
   * @param limit maximum number of rows (must be >= 1)
   * @return a new list of at most {@code limit} results in display order
   */
  public static List<SearchResult> rank(List<SearchResult> results, int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be at least 1");
    }
    return results.stream().sorted(ORDER).limit(limit).toList();
  }
}
