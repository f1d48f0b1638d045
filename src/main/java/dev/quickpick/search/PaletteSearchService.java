package dev.quickpick.search;

import dev.quickpick.history.UsageHistoryService;
import java.time.Clock;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Palette search orchestration used by the REST and MCP adapters.
 *
 * <p>Pipeline: parse the mode prefix -> keep the candidates the mode offers -> run {@link
 * PaletteSearchEngine} with the current usage history snapshot and the clock's time -> truncate to
 * the requested (or configured) number of rows.
 */
@Service
public class PaletteSearchService {

  private static final Logger log = LoggerFactory.getLogger(PaletteSearchService.class);

  private final UsageHistoryService usageHistoryService;
  private final PaletteProperties properties;
  private final Clock clock;
  private final PaletteSearchEngine engine;

  public PaletteSearchService(
      UsageHistoryService usageHistoryService, PaletteProperties properties, Clock clock) {
    this.usageHistoryService = usageHistoryService;
    this.properties = properties;
    this.clock = clock;
    this.engine = new PaletteSearchEngine();
  }

  /**
   * Searches the candidates for a raw palette query.
   *
   * @param rawQuery the query as typed, possibly starting with {@code >}
   * @param candidates candidates in caller order
   * @param limit maximum number of rows, {@code null} for the configured default
   * @return ranked results, at most {@code limit}
   */
  public List<SearchResult> search(
      @Nullable String rawQuery, List<Candidate> candidates, @Nullable Integer limit) {
    int effectiveLimit = limit != null ? limit : properties.getMaxResults();
    if (effectiveLimit < 1) {
      throw new IllegalArgumentException("limit must be at least 1");
    }
    PaletteQuery query = PaletteQuery.parse(rawQuery);
    List<Candidate> offered = candidates.stream().filter(query.mode()::accepts).toList();
    log.debug(
        "Searching {} of {} candidates in {} mode", offered.size(), candidates.size(), query.mode());

    List<SearchResult> ranked =
        engine.search(query.text(), offered, usageHistoryService.snapshot(), clock.instant());
    return ranked.size() > effectiveLimit ? ranked.subList(0, effectiveLimit) : ranked;
  }
}
