package dev.quickpick.matching;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class CandidateAggregatorTest {

  private final CandidateAggregator aggregator = new CandidateAggregator(new TokenMatcher());

  private static List<SegmentedText> fields(String... texts) {
    return Arrays.stream(texts).map(SegmentedText::of).toList();
  }

  @Test
  void empty_query_scores_zero() {
    assertThat(aggregator.score(List.of(), fields("Anything"))).hasValue(0);
  }

  @Test
  void tokens_may_match_different_fields() {
    OptionalInt score =
        aggregator.score(Tokenizer.queryTokens("reload browser"), fields("Reload", "browser"));

    assertThat(score).hasValue(16000);
  }

  @Test
  void every_token_must_match_some_field() {
    OptionalInt score =
        aggregator.score(Tokenizer.queryTokens("reload database"), fields("Reload", "browser"));

    assertThat(score).isEmpty();
  }

  @Test
  void best_field_counts_per_token() {
    OptionalInt titleOnly = aggregator.score(Tokenizer.queryTokens("tab"), fields("Close Tab"));
    OptionalInt withKeyword =
        aggregator.score(Tokenizer.queryTokens("tab"), fields("Close Tab", "tab"));

    assertThat(withKeyword.getAsInt()).isEqualTo(8000);
    assertThat(titleOnly.getAsInt()).isLessThan(withKeyword.getAsInt());
  }

  @Test
  void no_fields_never_match_a_non_empty_query() {
    assertThat(aggregator.score(Tokenizer.queryTokens("a"), List.of())).isEmpty();
  }
}
