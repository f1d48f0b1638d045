package dev.quickpick.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Encodes the usage history as the single JSON blob stored in the preference store.
 *
 * <p>Format: {@code {"<candidate id>": {"useCount": 3, "lastUsedAt": 1760000000}, ...}}.
 *
 * <p>Decoding never fails: a missing, blank or unparseable blob decodes to an empty history, and
 * individual entries without usable numeric fields, or with a timestamp outside the range of
 * {@link Instant}, are skipped. A corrupted blob therefore only disables history boosting.
 */
@Component
public class UsageHistoryCodec {

  private static final Logger log = LoggerFactory.getLogger(UsageHistoryCodec.class);

  static final String USE_COUNT = "useCount";
  static final String LAST_USED_AT = "lastUsedAt";

  private static final long MIN_EPOCH_SECOND = Instant.MIN.getEpochSecond();
  private static final long MAX_EPOCH_SECOND = Instant.MAX.getEpochSecond();

  private final ObjectMapper objectMapper;

  public UsageHistoryCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Serialises a usage history.
   *
   * @param history entries keyed by candidate id
   * @return the JSON blob
   */
  public String encode(Map<String, UsageEntry> history) {
    ObjectNode root = objectMapper.createObjectNode();
    history.forEach(
        (id, entry) -> {
          ObjectNode node = root.putObject(id);
          node.put(USE_COUNT, entry.useCount());
          node.put(LAST_USED_AT, entry.lastUsedAt());
        });
    try {
      return objectMapper.writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode usage history", e);
    }
  }

  /**
   * Parses a usage history blob.
   *
   * @param blob the stored JSON, may be {@code null}
   * @return unmodifiable entries keyed by candidate id, in blob order; empty when unusable
   */
  public Map<String, UsageEntry> decode(@Nullable String blob) {
    if (blob == null || blob.isBlank()) {
      return Map.of();
    }
    @Nullable JsonNode root;
    try {
      root = objectMapper.readTree(blob);
    } catch (JsonProcessingException e) {
      log.warn("Discarding malformed usage history: {}", e.getOriginalMessage());
      return Map.of();
    }
    if (root == null || !root.isObject()) {
      log.warn("Discarding usage history with non-object root");
      return Map.of();
    }

    Map<String, UsageEntry> history = new LinkedHashMap<>();
    for (Map.Entry<String, JsonNode> field : root.properties()) {
      @Nullable UsageEntry entry = toEntry(field.getValue());
      if (entry != null) {
        history.put(field.getKey(), entry);
      } else {
        log.debug("Skipping unusable usage entry for '{}'", field.getKey());
      }
    }
    return Collections.unmodifiableMap(history);
  }

  private static @Nullable UsageEntry toEntry(JsonNode node) {
    if (!node.isObject()) {
      return null;
    }
    @Nullable JsonNode useCount = node.get(USE_COUNT);
    @Nullable JsonNode lastUsedAt = node.get(LAST_USED_AT);
    if (useCount == null || !useCount.isNumber() || lastUsedAt == null || !lastUsedAt.isNumber()) {
      return null;
    }
    if (!isRepresentableInstant(lastUsedAt)) {
      return null;
    }
    int count = (int) Math.max(0L, Math.min(Integer.MAX_VALUE, useCount.asLong()));
    return new UsageEntry(count, lastUsedAt.asLong());
  }

  private static boolean isRepresentableInstant(JsonNode epochSeconds) {
    if (epochSeconds.isIntegralNumber()) {
      if (!epochSeconds.canConvertToLong()) {
        return false;
      }
      long value = epochSeconds.longValue();
      return value >= MIN_EPOCH_SECOND && value <= MAX_EPOCH_SECOND;
    }
    double value = epochSeconds.doubleValue();
    return Double.isFinite(value) && value >= MIN_EPOCH_SECOND && value <= MAX_EPOCH_SECOND;
  }
}
