package dev.quickpick.api;

import dev.quickpick.search.Candidate;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * JSON shape of one candidate in a search request.
 *
 * @param id stable candidate id (usage history key)
 * @param title display title
 * @param subtitle optional secondary text
 * @param keywords optional extra search terms
 * @param rank optional tie-break order; defaults to the candidate's position in the request
 * @param kind optional type label, e.g. {@code Command}, {@code Workspace} or {@code Surface}
 */
public record CandidatePayload(
    @NotBlank String id,
    @NotNull String title,
    @Nullable String subtitle,
    @Nullable List<@NotNull String> keywords,
    @PositiveOrZero @Nullable Integer rank,
    @Nullable String kind) {

  /**
   * Converts to the domain candidate.
   *
   * @param position zero-based position of this payload in the request
   * @return the candidate
   */
  Candidate toCandidate(int position) {
    return new Candidate(
        id,
        title,
        subtitle,
        keywords == null ? List.of() : keywords,
        rank != null ? rank : position,
        kind);
  }
}
