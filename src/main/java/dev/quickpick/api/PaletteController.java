package dev.quickpick.api;

import dev.quickpick.history.UsageHistoryService;
import dev.quickpick.search.Candidate;
import dev.quickpick.search.PaletteQuery;
import dev.quickpick.search.PaletteSearchService;
import dev.quickpick.search.SearchResult;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST adapter for the palette: search, usage recording and session control.
 *
 * <p>Invalid input is reported as a 400 Problem Detail by {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/palette")
public class PaletteController {

  private final PaletteSearchService searchService;
  private final UsageHistoryService usageHistoryService;

  public PaletteController(
      PaletteSearchService searchService, UsageHistoryService usageHistoryService) {
    this.searchService = searchService;
    this.usageHistoryService = usageHistoryService;
  }

  /** Ranks the request's candidates against its query. */
  @PostMapping("/search")
  public PaletteSearchResponse search(@Valid @RequestBody PaletteSearchRequest request) {
    List<Candidate> candidates = new ArrayList<>(request.candidates().size());
    for (int i = 0; i < request.candidates().size(); i++) {
      candidates.add(request.candidates().get(i).toCandidate(i));
    }
    List<SearchResult> results =
        searchService.search(request.query(), candidates, request.limit());
    return new PaletteSearchResponse(
        PaletteQuery.parse(request.query()).mode(),
        results.stream().map(PaletteResultRow::from).toList());
  }

  /** Records that the candidate's action was invoked. */
  @PostMapping("/usage/{id}")
  public UsageRow recordUsage(@PathVariable("id") String id) {
    return UsageRow.of(id, usageHistoryService.recordInvocation(id));
  }

  /** Returns the current usage history, most recently used first. */
  @GetMapping("/usage")
  public List<UsageRow> usage() {
    return usageHistoryService.snapshot().entrySet().stream()
        .map(entry -> UsageRow.of(entry.getKey(), entry.getValue()))
        .sorted(
            Comparator.comparingLong(UsageRow::lastUsedAt)
                .reversed()
                .thenComparing(UsageRow::id))
        .toList();
  }

  /** Starts a new palette session, reloading the persisted usage history. */
  @PostMapping("/sessions")
  public Map<String, Integer> openSession() {
    return Map.of("loaded_entries", usageHistoryService.openSession());
  }
}
