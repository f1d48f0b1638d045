package dev.quickpick.mcp;

import dev.quickpick.search.Candidate;
import dev.quickpick.search.SearchResult;
import java.util.List;
import java.util.SortedSet;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Renders ranked palette results as numbered text rows for MCP clients.
 *
 * <p>Each row shows the title with matched characters wrapped in brackets, the subtitle, the kind
 * label, the candidate id and the score split into match and history parts:
 *
 * <pre>
 * 1. [Open] [Folder] | ~/src (Command) id=open-folder score=12953 (match 12953, history 0)
 * </pre>
 */
@Component
public class ResultRowFormatter {

  /**
   * Formats results as one row per line.
   *
   * @param results ranked results
   * @return the rows, or an empty string for no results
   */
  public String format(@Nullable List<SearchResult> results) {
    if (results == null || results.isEmpty()) {
      return "";
    }
    StringBuilder output = new StringBuilder();
    for (int i = 0; i < results.size(); i++) {
      output.append(formatRow(i + 1, results.get(i))).append('\n');
    }
    return output.toString();
  }

  String formatRow(int position, SearchResult result) {
    Candidate candidate = result.candidate();
    StringBuilder row = new StringBuilder();
    row.append(position).append(". ");
    row.append(highlight(candidate.title(), result.matchedTitleIndices()));
    if (!candidate.subtitle().isBlank()) {
      row.append(" | ").append(candidate.subtitle());
    }
    if (candidate.kind() != null && !candidate.kind().isBlank()) {
      row.append(" (").append(candidate.kind()).append(')');
    }
    row.append(" id=").append(candidate.id());
    row.append(" score=").append(result.score());
    row.append(" (match ").append(result.matchScore());
    row.append(", history ").append(result.historyBoost()).append(')');
    return row.toString();
  }

  /**
   * Wraps each run of highlighted codepoints in brackets.
   *
   * @param title the original title
   * @param indices codepoint offsets to emphasise
   * @return the decorated title
   */
  String highlight(String title, SortedSet<Integer> indices) {
    if (indices.isEmpty()) {
      return title;
    }
    StringBuilder out = new StringBuilder(title.length() + indices.size() * 2);
    int[] codePoints = title.codePoints().toArray();
    boolean open = false;
    for (int i = 0; i < codePoints.length; i++) {
      boolean marked = indices.contains(i);
      if (marked && !open) {
        out.append('[');
        open = true;
      } else if (!marked && open) {
        out.append(']');
        open = false;
      }
      out.appendCodePoint(codePoints[i]);
    }
    if (open) {
      out.append(']');
    }
    return out.toString();
  }
}
