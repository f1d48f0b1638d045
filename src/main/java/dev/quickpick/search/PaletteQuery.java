package dev.quickpick.search;

import org.jspecify.annotations.Nullable;

/**
 * A raw palette query split into its mode and the text the engine matches on.
 *
 * @param mode the palette mode selected by the query
 * @param text the query text with the mode prefix removed
 */
public record PaletteQuery(PaletteMode mode, String text) {

  /** Prefix that switches the palette into commands mode. */
  public static final String COMMANDS_PREFIX = ">";

  /**
   * Parses a query typed into the palette. Leading whitespace before the prefix is ignored.
   *
   * @param raw the raw query, may be {@code null}
   * @return the parsed query; a missing query is an empty switcher query
   */
  public static PaletteQuery parse(@Nullable String raw) {
    if (raw == null) {
      return new PaletteQuery(PaletteMode.SWITCHER, "");
    }
    String stripped = raw.stripLeading();
    if (stripped.startsWith(COMMANDS_PREFIX)) {
      return new PaletteQuery(
          PaletteMode.COMMANDS, stripped.substring(COMMANDS_PREFIX.length()).strip());
    }
    return new PaletteQuery(PaletteMode.SWITCHER, raw.strip());
  }

  /** Returns whether the query text has no tokens. */
  public boolean isEmpty() {
    return text.isBlank();
  }
}
