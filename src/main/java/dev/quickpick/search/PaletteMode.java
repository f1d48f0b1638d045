package dev.quickpick.search;

import org.jspecify.annotations.Nullable;

/** Which candidates the palette is currently offering. */
public enum PaletteMode {

  /** Workspaces and surfaces; the mode for a query without prefix. */
  SWITCHER,

  /** Commands; selected by a leading {@code >} in the query. */
  COMMANDS;

  static final String COMMAND_KIND = "command";

  /**
   * Returns whether a candidate belongs to this mode. Candidates without a kind label are offered
   * in both modes.
   */
  public boolean accepts(Candidate candidate) {
    @Nullable String kind = candidate.kind();
    if (kind == null || kind.isBlank()) {
      return true;
    }
    boolean command = COMMAND_KIND.equalsIgnoreCase(kind.strip());
    return this == COMMANDS ? command : !command;
  }
}
