package dev.quickpick.search;

import dev.quickpick.history.HistoryBoost;
import dev.quickpick.history.UsageEntry;
import dev.quickpick.matching.CandidateAggregator;
import dev.quickpick.matching.SegmentedText;
import dev.quickpick.matching.TitleHighlighter;
import dev.quickpick.matching.TokenMatcher;
import dev.quickpick.matching.Tokenizer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.SortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fuzzy matching and ranking engine behind the command palette and the workspace switcher.
 *
 * <p>A search pass is a pure function of the query, the candidates, a usage history snapshot and
 * the evaluation time: tokenise the query, score every candidate with {@link CandidateAggregator},
 * add the {@link HistoryBoost}, highlight the title with {@link TitleHighlighter} and sort with
 * {@link PaletteRanker}. The query must already have its mode prefix removed (see {@link
 * PaletteQuery}).
 *
 * <p>Thread-safe: instances hold no mutable state.
 */
public class PaletteSearchEngine {

  private static final Logger log = LoggerFactory.getLogger(PaletteSearchEngine.class);

  private final CandidateAggregator aggregator;
  private final TitleHighlighter highlighter;

  public PaletteSearchEngine() {
    this(new TokenMatcher());
  }

  public PaletteSearchEngine(TokenMatcher tokenMatcher) {
    this.aggregator = new CandidateAggregator(tokenMatcher);
    this.highlighter = new TitleHighlighter(tokenMatcher);
  }

  /**
   * Scores, filters and orders the candidates for a query.
   *
   * @param query the query without mode prefix; blank matches every candidate
   * @param candidates candidates in caller order
   * @param history usage entries keyed by candidate id
   * @param now evaluation time for recency decay
   * @return every matching candidate in display order
   */
  public List<SearchResult> search(
      String query, List<Candidate> candidates, Map<String, UsageEntry> history, Instant now) {
    List<int[]> tokens = Tokenizer.queryTokens(query);
    boolean emptyQuery = tokens.isEmpty();
    List<SearchResult> results = new ArrayList<>(candidates.size());

    for (Candidate candidate : candidates) {
      SegmentedText title = SegmentedText.of(candidate.title());
      OptionalInt matchScore = aggregator.score(tokens, searchableFields(candidate, title));
      if (matchScore.isEmpty()) {
        continue;
      }
      int boost = HistoryBoost.boost(history.get(candidate.id()), now, emptyQuery);
      SortedSet<Integer> highlights =
          emptyQuery ? Collections.emptySortedSet() : highlighter.highlight(tokens, title);
      results.add(new SearchResult(candidate, matchScore.getAsInt(), boost, highlights));
    }

    log.debug(
        "Palette search with {} tokens matched {} of {} candidates",
        tokens.size(),
        results.size(),
        candidates.size());
    return PaletteRanker.rank(results);
  }

  /**
   * Prepares the title, subtitle and keywords of a candidate. Fields that normalize to empty text
   * are left out so they can never satisfy a token.
   */
  private static List<SegmentedText> searchableFields(Candidate candidate, SegmentedText title) {
    List<SegmentedText> fields = new ArrayList<>(2 + candidate.keywords().size());
    addIfPresent(fields, title);
    addIfPresent(fields, SegmentedText.of(candidate.subtitle()));
    for (String keyword : candidate.keywords()) {
      addIfPresent(fields, SegmentedText.of(keyword));
    }
    return fields;
  }

  private static void addIfPresent(List<SegmentedText> fields, SegmentedText field) {
    if (!field.isEmpty()) {
      fields.add(field);
    }
  }
}
