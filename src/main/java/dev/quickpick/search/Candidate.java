package dev.quickpick.search;

import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * An item the palette can offer: a command, a workspace or a surface.
 *
 * <p>Candidates are built by the caller; the engine only reads them and hands the same instances
 * back inside {@link SearchResult}s.
 *
 * @param id stable identifier, also the usage history key (must not be blank)
 * @param title primary display text, the only field that receives highlights
 * @param subtitle secondary display text, searchable ({@code null} becomes empty)
 * @param keywords extra searchable terms ({@code null} becomes empty, {@code null} elements are
 *     dropped)
 * @param rank insertion order, used only as a tie-break (must be >= 0)
 * @param kind optional type label such as {@code Command} or {@code Workspace}
 */
public record Candidate(
    String id,
    String title,
    String subtitle,
    List<String> keywords,
    int rank,
    @Nullable String kind) {

  /** Compact constructor validating input. */
  public Candidate {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Candidate id must not be blank");
    }
    if (title == null) {
      throw new IllegalArgumentException("Candidate title must not be null");
    }
    if (rank < 0) {
      throw new IllegalArgumentException("Candidate rank must not be negative");
    }
    subtitle = subtitle == null ? "" : subtitle;
    keywords = keywords == null ? List.of() : keywords.stream().filter(Objects::nonNull).toList();
  }

  /** Convenience constructor for candidates without a kind label. */
  public Candidate(String id, String title, String subtitle, List<String> keywords, int rank) {
    this(id, title, subtitle, keywords, rank, null);
  }
}
