package dev.quickpick.matching;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TextNormalizerTest {

  @Test
  void folds_case_and_trims_whitespace() {
    assertThat(TextNormalizer.normalize("  Open Folder\t")).isEqualTo("open folder");
  }

  @Test
  void removes_diacritics() {
    assertThat(TextNormalizer.normalize("Café Crème")).isEqualTo("cafe creme");
    assertThat(TextNormalizer.normalize("Ångström")).isEqualTo("angstrom");
  }

  @Test
  void null_and_blank_fold_to_empty() {
    assertThat(TextNormalizer.normalize(null)).isEmpty();
    assertThat(TextNormalizer.fold("   ").isEmpty()).isTrue();
    assertThat(TextNormalizer.fold("")).isSameAs(TextNormalizer.fold(null));
  }

  @Test
  void lower_casing_ignores_default_locale() {
    // Turkish dotted capital I keeps only the base letter once its combining dot is dropped
    assertThat(TextNormalizer.normalize("TITLE")).isEqualTo("title");
    assertThat(TextNormalizer.normalize("İstanbul")).isEqualTo("istanbul");
  }

  @Test
  void source_offsets_point_at_original_codepoints() {
    FoldedText folded = TextNormalizer.fold("  Éa");

    assertThat(folded.toString()).isEqualTo("ea");
    assertThat(folded.sourceOffset(0)).isEqualTo(2);
    assertThat(folded.sourceOffset(1)).isEqualTo(3);
  }

  @Test
  void source_offsets_count_codepoints_not_chars() {
    // U+1D400 MATHEMATICAL BOLD CAPITAL A is a surrogate pair in UTF-16
    FoldedText folded = TextNormalizer.fold("𝐀b");

    assertThat(folded.length()).isEqualTo(2);
    assertThat(folded.sourceOffset(1)).isEqualTo(1);
  }

  @Test
  void folding_is_idempotent() {
    String once = TextNormalizer.normalize("  Ça Va, Über-Große  ");

    assertThat(TextNormalizer.normalize(once)).isEqualTo(once);
  }
}
