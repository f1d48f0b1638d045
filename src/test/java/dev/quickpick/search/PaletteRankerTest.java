package dev.quickpick.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.quickpick.fixture.CandidateBuilder;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class PaletteRankerTest {

  private static SearchResult result(String title, int rank, int matchScore, int historyBoost) {
    Candidate candidate = new CandidateBuilder().title(title).rank(rank).build();
    return new SearchResult(candidate, matchScore, historyBoost, Collections.emptySortedSet());
  }

  @Test
  void orders_by_total_score_descending() {
    SearchResult low = result("Low", 0, 100, 0);
    SearchResult boosted = result("Boosted", 1, 100, 50);
    SearchResult high = result("High", 2, 140, 0);

    assertThat(PaletteRanker.rank(List.of(low, boosted, high)))
        .containsExactly(boosted, high, low);
  }

  @Test
  void limit_truncates_after_sorting() {
    SearchResult a = result("A", 0, 10, 0);
    SearchResult b = result("B", 1, 30, 0);
    SearchResult c = result("C", 2, 20, 0);

    assertThat(PaletteRanker.rank(List.of(a, b, c), 2)).containsExactly(b, c);
  }

  @Test
  void title_tie_break_ignores_case() {
    SearchResult upper = result("Zed", 0, 5, 0);
    SearchResult lower = result("alpha", 0, 5, 0);

    assertThat(PaletteRanker.rank(List.of(upper, lower))).containsExactly(lower, upper);
  }

  @Test
  void rejects_non_positive_limit() {
    assertThatThrownBy(() -> PaletteRanker.rank(List.of(), 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void search_result_rejects_negative_scores() {
    Candidate candidate = new CandidateBuilder().build();

    assertThatThrownBy(
            () -> new SearchResult(candidate, -1, 0, Collections.emptySortedSet()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void candidate_requires_id_and_non_negative_rank() {
    assertThatThrownBy(() -> new Candidate(" ", "Title", "", List.of(), 0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Candidate("id", "Title", "", List.of(), -1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void candidate_defaults_missing_subtitle_and_keywords() {
    Candidate candidate = new Candidate("id", "Title", null, null, 0);

    assertThat(candidate.subtitle()).isEmpty();
    assertThat(candidate.keywords()).isEmpty();
    assertThat(candidate.kind()).isNull();
  }
}
