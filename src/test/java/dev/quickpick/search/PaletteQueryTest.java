package dev.quickpick.search;

import static org.assertj.core.api.Assertions.assertThat;

import dev.quickpick.fixture.CandidateBuilder;
import org.junit.jupiter.api.Test;

class PaletteQueryTest {

  @Test
  void plain_query_is_switcher_mode() {
    PaletteQuery query = PaletteQuery.parse("  notes ");

    assertThat(query.mode()).isEqualTo(PaletteMode.SWITCHER);
    assertThat(query.text()).isEqualTo("notes");
  }

  @Test
  void prefix_selects_commands_mode_and_is_stripped() {
    PaletteQuery query = PaletteQuery.parse(">new tab");

    assertThat(query.mode()).isEqualTo(PaletteMode.COMMANDS);
    assertThat(query.text()).isEqualTo("new tab");
  }

  @Test
  void prefix_alone_is_an_empty_commands_query() {
    PaletteQuery query = PaletteQuery.parse("  > ");

    assertThat(query.mode()).isEqualTo(PaletteMode.COMMANDS);
    assertThat(query.isEmpty()).isTrue();
  }

  @Test
  void null_is_an_empty_switcher_query() {
    PaletteQuery query = PaletteQuery.parse(null);

    assertThat(query.mode()).isEqualTo(PaletteMode.SWITCHER);
    assertThat(query.isEmpty()).isTrue();
  }

  @Test
  void only_the_first_prefix_is_stripped() {
    assertThat(PaletteQuery.parse(">>x").text()).isEqualTo(">x");
  }

  // --- PaletteMode ---

  @Test
  void commands_mode_keeps_commands() {
    Candidate command = new CandidateBuilder().title("New Tab").kind("Command").build();
    Candidate workspace = new CandidateBuilder().title("Workspace 1").kind("Workspace").build();

    assertThat(PaletteMode.COMMANDS.accepts(command)).isTrue();
    assertThat(PaletteMode.COMMANDS.accepts(workspace)).isFalse();
    assertThat(PaletteMode.SWITCHER.accepts(command)).isFalse();
    assertThat(PaletteMode.SWITCHER.accepts(workspace)).isTrue();
  }

  @Test
  void unlabelled_candidates_belong_to_both_modes() {
    Candidate unlabelled = new CandidateBuilder().title("Anything").build();

    assertThat(PaletteMode.COMMANDS.accepts(unlabelled)).isTrue();
    assertThat(PaletteMode.SWITCHER.accepts(unlabelled)).isTrue();
  }

  @Test
  void kind_comparison_ignores_case() {
    Candidate command = new CandidateBuilder().title("New Tab").kind(" COMMAND ").build();

    assertThat(PaletteMode.COMMANDS.accepts(command)).isTrue();
  }
}
