package dev.quickpick.search;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for palette result paging.
 *
 * <p>Properties are bound from {@code quickpick.palette.*} in application.yml.
 *
 * <ul>
 *   <li>{@code max-results} - rows returned when a request does not set a limit (default 50, range
 *       [1, 500])
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "quickpick.palette")
public class PaletteProperties {

  static final int MAX_RESULTS_CEILING = 500;

  private int maxResults = 50;

  /** Validates configuration at startup. Throws if max-results is out of range. */
  @PostConstruct
  void validate() {
    if (maxResults < 1 || maxResults > MAX_RESULTS_CEILING) {
      throw new IllegalStateException(
          "quickpick.palette.max-results must be in [1, "
              + MAX_RESULTS_CEILING
              + "], got: "
              + maxResults);
    }
  }

  public int getMaxResults() {
    return maxResults;
  }

  public void setMaxResults(int maxResults) {
    this.maxResults = maxResults;
  }
}
