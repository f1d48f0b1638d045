package dev.quickpick.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * JSON envelope of a palette search.
 *
 * @param query the query as typed; a leading {@code >} selects commands mode
 * @param candidates candidates in display order
 * @param limit optional row limit in [1, 500]; the configured default applies when absent
 */
public record PaletteSearchRequest(
    @Nullable String query,
    @NotNull @Valid List<@NotNull CandidatePayload> candidates,
    @Min(1) @Max(500) @Nullable Integer limit) {
  public PaletteSearchRequest {
    // null elements must survive the copy so validation can report them
    if (candidates != null) {
      candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
    }
  }
}
