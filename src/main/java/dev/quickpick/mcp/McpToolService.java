package dev.quickpick.mcp;

import dev.quickpick.history.UsageEntry;
import dev.quickpick.history.UsageHistoryService;
import dev.quickpick.search.Candidate;
import dev.quickpick.search.PaletteMode;
import dev.quickpick.search.PaletteQuery;
import dev.quickpick.search.PaletteSearchService;
import dev.quickpick.search.SearchResult;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing the palette engine as tool methods.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig} as an MCP
 * tool callable through the stdio or SSE transport. Tool methods follow the structured error
 * pattern: all exceptions are caught and returned as descriptive error strings, never thrown.
 *
 * <p>Functional tools: {@code search_palette}, {@code record_palette_usage}.
 *
 * @see ResultRowFormatter
 * @see McpToolConfig
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  static final int MAX_LIMIT = 500;

  private final PaletteSearchService searchService;
  private final UsageHistoryService usageHistoryService;
  private final ResultRowFormatter formatter;

  public McpToolService(
      PaletteSearchService searchService,
      UsageHistoryService usageHistoryService,
      ResultRowFormatter formatter) {
    this.searchService = searchService;
    this.usageHistoryService = usageHistoryService;
    this.formatter = formatter;
  }

  /** Ranks candidates against a palette query, switcher or commands mode. */
  @Tool(
      name = "search_palette",
      description =
          "Fuzzy-search command palette candidates. "
              + "A query starting with '>' searches commands, otherwise workspaces and surfaces. "
              + "Returns ranked rows with matched title characters in brackets.")
  public String searchPalette(
      @ToolParam(description = "Query as typed into the palette, e.g. '>new tab' or 'notes'")
          @Nullable String query,
      @ToolParam(description = "Candidates in display order") @Nullable List<ToolCandidate> candidates,
      @ToolParam(description = "Maximum number of rows (1-500, default 50)", required = false)
          @Nullable Integer limit) {
    try {
      if (candidates == null || candidates.isEmpty()) {
        return "Error: No candidates provided. Pass the palette entries to search.";
      }
      List<Candidate> converted = new ArrayList<>(candidates.size());
      for (int i = 0; i < candidates.size(); i++) {
        converted.add(candidates.get(i).toCandidate(i));
      }
      List<SearchResult> results =
          searchService.search(query, converted, limit == null ? null : clampLimit(limit));
      if (results.isEmpty()) {
        PaletteQuery parsed = PaletteQuery.parse(query);
        return "No %s match '%s'."
            .formatted(
                parsed.mode() == PaletteMode.COMMANDS
                    ? "commands"
                    : "workspaces or surfaces",
                parsed.text());
      }
      return formatter.format(results);
    } catch (Exception e) {
      log.debug("search_palette failed", e);
      return "Error searching palette: " + e.getMessage();
    }
  }

  /** Records a successful invocation of a candidate's action. */
  @Tool(
      name = "record_palette_usage",
      description =
          "Record that a palette entry was invoked. "
              + "Frequently and recently used entries rank higher in later searches.")
  public String recordPaletteUsage(
      @ToolParam(description = "Id of the invoked candidate") @Nullable String candidateId) {
    try {
      if (candidateId == null || candidateId.isBlank()) {
        return "Error: Candidate id must not be empty.";
      }
      UsageEntry entry = usageHistoryService.recordInvocation(candidateId);
      return "Recorded use of '%s' (used %d times)".formatted(candidateId, entry.useCount());
    } catch (Exception e) {
      return "Error recording usage: " + e.getMessage();
    }
  }

  private static int clampLimit(int limit) {
    return Math.max(1, Math.min(limit, MAX_LIMIT));
  }
}
