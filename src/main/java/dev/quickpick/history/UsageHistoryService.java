package dev.quickpick.history;

import dev.quickpick.preferences.PreferenceStore;
import dev.quickpick.preferences.PreferenceStoreException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Session-scoped owner of the palette usage history.
 *
 * <p>The history is read from the {@link PreferenceStore} when a palette session opens (explicitly
 * via {@link #openSession()}, or lazily on first access) and written back after every recorded
 * invocation. Search passes receive an immutable {@link #snapshot()} so scoring stays free of I/O.
 *
 * <p>Persistence is best effort: an unreadable store yields an empty history and a failed write
 * keeps the in-memory history, both logged as warnings.
 */
@Service
public class UsageHistoryService {

  private static final Logger log = LoggerFactory.getLogger(UsageHistoryService.class);

  private final PreferenceStore preferenceStore;
  private final UsageHistoryCodec codec;
  private final Clock clock;
  private final String storageKey;

  private final Map<String, UsageEntry> entries = new LinkedHashMap<>();
  private boolean loaded;

  public UsageHistoryService(
      PreferenceStore preferenceStore,
      UsageHistoryCodec codec,
      Clock clock,
      UsageHistoryProperties properties) {
    this.preferenceStore = preferenceStore;
    this.codec = codec;
    this.clock = clock;
    this.storageKey = properties.getStorageKey();
  }

  /**
   * Starts a palette session by (re)loading the history from the store.
   *
   * @return the number of entries loaded
   */
  public synchronized int openSession() {
    entries.clear();
    entries.putAll(load());
    loaded = true;
    log.debug("Palette session opened with {} usage entries", entries.size());
    return entries.size();
  }

  /**
   * Returns an immutable copy of the current history, loading it first if no session is open.
   *
   * @return entries keyed by candidate id
   */
  public synchronized Map<String, UsageEntry> snapshot() {
    ensureLoaded();
    return Map.copyOf(entries);
  }

  /**
   * Records a successful invocation of a candidate's action: increments its use count, stamps the
   * current time and persists the history.
   *
   * @param candidateId the invoked candidate's id
   * @return the updated entry
   */
  public synchronized UsageEntry recordInvocation(String candidateId) {
    if (candidateId == null || candidateId.isBlank()) {
      throw new IllegalArgumentException("Candidate id must not be blank");
    }
    ensureLoaded();
    long now = clock.instant().getEpochSecond();
    UsageEntry updated =
        entries.compute(
            candidateId,
            (id, existing) -> existing == null ? UsageEntry.firstUse(now) : existing.recordUse(now));
    persist();
    return updated;
  }

  private void ensureLoaded() {
    if (!loaded) {
      openSession();
    }
  }

  private Map<String, UsageEntry> load() {
    try {
      return preferenceStore.get(storageKey).map(codec::decode).orElse(Map.of());
    } catch (PreferenceStoreException e) {
      log.warn("Usage history unavailable, ranking without it: {}", e.getMessage());
      return Map.of();
    }
  }

  private void persist() {
    try {
      preferenceStore.put(storageKey, codec.encode(entries));
    } catch (PreferenceStoreException e) {
      log.warn("Failed to persist usage history ({} entries kept in memory)", entries.size(), e);
    }
  }
}
