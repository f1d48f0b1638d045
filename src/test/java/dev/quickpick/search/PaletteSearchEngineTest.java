package dev.quickpick.search;

import static org.assertj.core.api.Assertions.assertThat;

import dev.quickpick.fixture.CandidateBuilder;
import dev.quickpick.history.UsageEntry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PaletteSearchEngineTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private final PaletteSearchEngine engine = new PaletteSearchEngine();

  private List<SearchResult> search(String query, List<Candidate> candidates) {
    return engine.search(query, candidates, Map.of(), NOW);
  }

  private static List<String> titles(List<SearchResult> results) {
    return results.stream().map(result -> result.candidate().title()).toList();
  }

  private static UsageEntry usedAgo(int count, Duration age) {
    return new UsageEntry(count, NOW.minus(age).getEpochSecond());
  }

  // --- empty query ---

  @Test
  void empty_query_returns_all_candidates_in_rank_order() {
    List<SearchResult> results = search("   ", CandidateBuilder.ranked("Zeta", "Alpha", "Mid"));

    assertThat(titles(results)).containsExactly("Zeta", "Alpha", "Mid");
    assertThat(results).allSatisfy(result -> assertThat(result.score()).isZero());
    assertThat(results).allSatisfy(result -> assertThat(result.matchedTitleIndices()).isEmpty());
  }

  @Test
  void empty_query_includes_candidates_without_searchable_text() {
    Candidate blank = new CandidateBuilder().id("blank").title("  ").build();

    assertThat(search("", List.of(blank))).hasSize(1);
    assertThat(search("a", List.of(blank))).isEmpty();
  }

  @Test
  void empty_query_applies_full_history_boost() {
    List<Candidate> candidates = CandidateBuilder.ranked("New Tab", "Close Tab", "Reload");
    Map<String, UsageEntry> history = Map.of("reload", usedAgo(2, Duration.ZERO));

    List<SearchResult> results = engine.search("", candidates, history, NOW);

    assertThat(titles(results)).containsExactly("Reload", "New Tab", "Close Tab");
    assertThat(results.get(0).historyBoost()).isEqualTo(344);
  }

  // --- relative orderings ---

  @Test
  void exact_words_beat_longer_titles() {
    List<SearchResult> results =
        search("open folder", CandidateBuilder.ranked("Open Folder In Editor", "Open Folder"));

    assertThat(titles(results)).containsExactly("Open Folder", "Open Folder In Editor");
  }

  @Test
  void prefix_beats_mid_word_substring() {
    List<SearchResult> results = search("new", CandidateBuilder.ranked("Subnew", "New Terminal"));

    assertThat(titles(results)).containsExactly("New Terminal", "Subnew");
  }

  @Test
  void short_token_matches_initials_but_not_letters_inside_one_word() {
    List<SearchResult> results = search("nt", CandidateBuilder.ranked("Notes", "New Terminal"));

    assertThat(titles(results)).containsExactly("New Terminal");
    assertThat(results.get(0).matchedTitleIndices()).containsExactly(0, 4);
  }

  @Test
  void stitched_token_needs_several_words() {
    List<SearchResult> results =
        search("termrig", CandidateBuilder.ranked("Tramrig", "Terminal Right Split", "Terminal"));

    assertThat(titles(results)).containsExactly("Terminal Right Split");
    assertThat(results.get(0).matchedTitleIndices()).containsExactly(0, 1, 2, 3, 9, 10, 11);
  }

  @Test
  void tokens_may_match_title_and_keywords() {
    Candidate reload = new CandidateBuilder().title("Reload").keywords("browser", "refresh").build();

    List<SearchResult> browser = search("reload browser", List.of(reload));
    List<SearchResult> database = search("reload database", List.of(reload));

    assertThat(browser).hasSize(1);
    assertThat(browser.get(0).matchScore()).isEqualTo(16000);
    assertThat(browser.get(0).matchedTitleIndices()).containsExactly(0, 1, 2, 3, 4, 5);
    assertThat(database).isEmpty();
  }

  @Test
  void subtitle_is_searchable() {
    Candidate workspace =
        new CandidateBuilder().title("Workspace 2").subtitle("~/src/quickpick").build();

    assertThat(search("quickpick", List.of(workspace))).hasSize(1);
  }

  @Test
  void rename_commands_rank_first() {
    List<Candidate> palette =
        CandidateBuilder.ranked(
            "New Tab",
            "Close Tab",
            "Rename Tab",
            "Rename Workspace",
            "Reload",
            "Reopen Closed Tab",
            "Toggle Sidebar");

    assertThat(titles(search("rename", palette)).subList(0, 2))
        .containsExactly("Rename Tab", "Rename Workspace");
    assertThat(titles(search("retab", palette))).first().isEqualTo("Rename Tab");
  }

  // --- history ---

  @Test
  void history_reorders_close_matches() {
    List<Candidate> candidates = CandidateBuilder.ranked("Close Tab", "Close Window");
    Map<String, UsageEntry> history = Map.of("close-window", usedAgo(10, Duration.ZERO));

    List<SearchResult> results = engine.search("close", candidates, history, NOW);

    assertThat(titles(results)).containsExactly("Close Window", "Close Tab");
    assertThat(results.get(0).historyBoost()).isEqualTo(146);
  }

  @Test
  void history_never_overrides_a_stronger_strategy() {
    List<Candidate> candidates = CandidateBuilder.ranked("Reload Window", "Reload");
    Map<String, UsageEntry> history = Map.of("reload-window", usedAgo(1_000, Duration.ZERO));

    List<SearchResult> results = engine.search("reload", candidates, history, NOW);

    assertThat(titles(results)).containsExactly("Reload", "Reload Window");
  }

  @Test
  void more_frequent_use_ranks_at_or_above() {
    List<Candidate> candidates = CandidateBuilder.ranked("Split Left", "Split Right");
    Map<String, UsageEntry> history =
        Map.of(
            "split-left", usedAgo(1, Duration.ofDays(2)),
            "split-right", usedAgo(6, Duration.ofDays(2)));

    assertThat(titles(engine.search("", candidates, history, NOW)))
        .containsExactly("Split Right", "Split Left");
  }

  @Test
  void more_recent_use_ranks_at_or_above() {
    List<Candidate> candidates = CandidateBuilder.ranked("Split Left", "Split Right");
    Map<String, UsageEntry> history =
        Map.of(
            "split-left", usedAgo(3, Duration.ofDays(5)),
            "split-right", usedAgo(3, Duration.ofHours(1)));

    assertThat(titles(engine.search("split", candidates, history, NOW)))
        .containsExactly("Split Right", "Split Left");
  }

  // --- ties and determinism ---

  @Test
  void equal_scores_fall_back_to_rank_then_title() {
    Candidate late = new CandidateBuilder().id("a").title("Tab").rank(5).build();
    Candidate early = new CandidateBuilder().id("b").title("Tab").rank(1).build();
    Candidate beta = new CandidateBuilder().id("c").title("beta").rank(9).build();
    Candidate alpha = new CandidateBuilder().id("d").title("Alpha").rank(9).build();

    assertThat(search("", List.of(late, early, beta, alpha)))
        .extracting(result -> result.candidate().id())
        .containsExactly("b", "a", "d", "c");
  }

  @Test
  void repeated_evaluation_is_identical() {
    List<Candidate> candidates =
        CandidateBuilder.ranked("New Tab", "New Terminal", "Notes", "Rename Tab", "Subnew");

    assertThat(search("n t", candidates)).isEqualTo(search("n t", candidates));
  }

  @Test
  void results_reference_caller_candidates() {
    List<Candidate> candidates = CandidateBuilder.ranked("New Tab");

    assertThat(search("new", candidates).get(0).candidate()).isSameAs(candidates.get(0));
  }

  @Test
  void highlights_stay_inside_title_with_supplementary_characters() {
    Candidate candidate = new CandidateBuilder().title("🚀 Launch Rocket").build();

    SearchResult result = search("launch", List.of(candidate)).get(0);

    assertThat(result.matchedTitleIndices()).containsExactly(2, 3, 4, 5, 6, 7);
    assertThat(result.matchedTitleIndices().last())
        .isLessThan(candidate.title().codePointCount(0, candidate.title().length()));
  }
}
