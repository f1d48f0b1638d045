package dev.quickpick.mcp;

import dev.quickpick.search.Candidate;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Candidate argument of the {@code search_palette} tool. Rank is the position in the argument list.
 *
 * @param id stable candidate id
 * @param title display title
 * @param subtitle optional secondary text
 * @param keywords optional extra search terms
 * @param kind optional type label ({@code Command}, {@code Workspace}, {@code Surface})
 */
public record ToolCandidate(
    String id,
    String title,
    @Nullable String subtitle,
    @Nullable List<String> keywords,
    @Nullable String kind) {

  Candidate toCandidate(int position) {
    return new Candidate(id, title, subtitle, keywords == null ? List.of() : keywords, position, kind);
  }
}
