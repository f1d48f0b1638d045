package dev.quickpick.api;

import dev.quickpick.search.PaletteMode;
import java.util.List;

/**
 * JSON response of a palette search.
 *
 * @param mode the palette mode the query selected
 * @param results ranked rows
 */
public record PaletteSearchResponse(PaletteMode mode, List<PaletteResultRow> results) {
  public PaletteSearchResponse {
    results = List.copyOf(results);
  }
}
