package dev.quickpick.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.quickpick.history.UsageHistoryProperties;
import dev.quickpick.preferences.JsonFilePreferenceStore;
import dev.quickpick.preferences.PreferenceStore;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the file-backed {@link PreferenceStore} from {@code quickpick.history.file}. */
@Configuration
public class PreferenceStoreConfig {

  private static final Logger log = LoggerFactory.getLogger(PreferenceStoreConfig.class);

  @Bean
  @ConditionalOnMissingBean
  public PreferenceStore preferenceStore(
      UsageHistoryProperties properties, ObjectMapper objectMapper) {
    Path file = Path.of(properties.getFile());
    log.info("Preferences stored in {}", file.toAbsolutePath());
    return new JsonFilePreferenceStore(file, objectMapper);
  }
}
