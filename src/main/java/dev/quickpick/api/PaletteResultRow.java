package dev.quickpick.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.quickpick.search.Candidate;
import dev.quickpick.search.SearchResult;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * JSON shape of one ranked palette row.
 *
 * @param id candidate id
 * @param title candidate title
 * @param subtitle candidate subtitle
 * @param kind candidate type label, if any
 * @param score total ranking score
 * @param matchScore text match part of the score
 * @param historyBoost usage history part of the score
 * @param matchedTitleIndices ascending codepoint offsets into the title to emphasise
 */
public record PaletteResultRow(
    String id,
    String title,
    String subtitle,
    @Nullable String kind,
    int score,
    @JsonProperty("match_score") int matchScore,
    @JsonProperty("history_boost") int historyBoost,
    @JsonProperty("matched_title_indices") List<Integer> matchedTitleIndices) {

  static PaletteResultRow from(SearchResult result) {
    Candidate candidate = result.candidate();
    return new PaletteResultRow(
        candidate.id(),
        candidate.title(),
        candidate.subtitle(),
        candidate.kind(),
        result.score(),
        result.matchScore(),
        result.historyBoost(),
        List.copyOf(result.matchedTitleIndices()));
  }
}
