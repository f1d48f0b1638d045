package dev.quickpick.history;

import jakarta.annotation.PostConstruct;
import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for usage history persistence.
 *
 * <p>Properties are bound from {@code quickpick.history.*} in application.yml.
 *
 * <ul>
 *   <li>{@code file} - JSON file backing the preference store (default {@code
 *       ~/.quickpick/preferences.json})
 *   <li>{@code storage-key} - the preference key the usage history blob is stored under (default
 *       {@code commandPalette.usageHistory.v1})
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "quickpick.history")
public class UsageHistoryProperties {

  static final String DEFAULT_STORAGE_KEY = "commandPalette.usageHistory.v1";

  private String file =
      Path.of(System.getProperty("user.home"), ".quickpick", "preferences.json").toString();
  private String storageKey = DEFAULT_STORAGE_KEY;

  /** Validates configuration at startup. Throws if a value is blank. */
  @PostConstruct
  void validate() {
    if (file == null || file.isBlank()) {
      throw new IllegalStateException("quickpick.history.file must not be blank");
    }
    if (storageKey == null || storageKey.isBlank()) {
      throw new IllegalStateException("quickpick.history.storage-key must not be blank");
    }
  }

  public String getFile() {
    return file;
  }

  public void setFile(String file) {
    this.file = file;
  }

  public String getStorageKey() {
    return storageKey;
  }

  public void setStorageKey(String storageKey) {
    this.storageKey = storageKey;
  }
}
