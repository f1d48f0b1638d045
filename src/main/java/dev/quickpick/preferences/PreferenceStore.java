package dev.quickpick.preferences;

import java.util.Optional;

/**
 * Persistent string key-value store for application preferences. The usage history lives in it as
 * one JSON blob under a single key.
 *
 * <p>Implementations report I/O failures as {@link PreferenceStoreException}.
 */
public interface PreferenceStore {

  /**
   * @param key the preference key
   * @return the stored value, or empty when the key is absent
   */
  Optional<String> get(String key);

  /**
   * Stores a value, replacing any previous value of the key. Other keys are left untouched.
   *
   * @param key the preference key
   * @param value the value to store
   */
  void put(String key, String value);
}
