package dev.quickpick.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.quickpick.history.UsageEntry;

/**
 * JSON shape of one usage history entry.
 *
 * @param id candidate id
 * @param useCount number of recorded invocations
 * @param lastUsedAt last invocation, seconds since the epoch
 */
public record UsageRow(
    String id,
    @JsonProperty("use_count") int useCount,
    @JsonProperty("last_used_at") long lastUsedAt) {

  static UsageRow of(String id, UsageEntry entry) {
    return new UsageRow(id, entry.useCount(), entry.lastUsedAt());
  }
}
