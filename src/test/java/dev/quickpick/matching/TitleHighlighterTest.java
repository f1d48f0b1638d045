package dev.quickpick.matching;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.SortedSet;
import org.junit.jupiter.api.Test;

class TitleHighlighterTest {

  private final TitleHighlighter highlighter = new TitleHighlighter(new TokenMatcher());

  private SortedSet<Integer> highlight(String query, String title) {
    return highlighter.highlight(Tokenizer.queryTokens(query), SegmentedText.of(title));
  }

  @Test
  void prefix_highlights_leading_range() {
    assertThat(highlight("new", "New Terminal")).containsExactly(0, 1, 2);
  }

  @Test
  void tokens_are_unioned() {
    assertThat(highlight("open fold", "Open Folder"))
        .containsExactly(0, 1, 2, 3, 5, 6, 7, 8);
  }

  @Test
  void initialism_highlights_word_starts() {
    assertThat(highlight("nt", "New Terminal")).containsExactly(0, 4);
  }

  @Test
  void stitched_highlights_each_chunk() {
    assertThat(highlight("retab", "Rename Tab")).containsExactly(0, 1, 7, 8, 9);
  }

  @Test
  void tokens_matching_elsewhere_highlight_nothing() {
    assertThat(highlight("browser", "Reload")).isEmpty();
    assertThat(highlight("reload browser", "Reload")).containsExactly(0, 1, 2, 3, 4, 5);
  }

  @Test
  void offsets_refer_to_original_title() {
    assertThat(highlight("creme", "Café Crème")).containsExactly(5, 6, 7, 8, 9);
    assertThat(highlight("notes", "  𝐀 Notes")).containsExactly(4, 5, 6, 7, 8);
  }

  @Test
  void result_is_unmodifiable() {
    SortedSet<Integer> offsets = highlight("new", "New Terminal");

    assertThatThrownBy(() -> offsets.add(42))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
