package dev.quickpick.fixture;

import dev.quickpick.search.Candidate;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Lightweight test builder for {@link Candidate}. Provides sensible defaults so tests only override
 * what they care about.
 *
 * <pre>{@code
 * Candidate candidate = new CandidateBuilder().title("New Tab").kind("Command").build();
 * }</pre>
 *
 * <p>Without an explicit id the id is derived from the title.
 */
public final class CandidateBuilder {

  private @Nullable String id;
  private String title = "Example";
  private String subtitle = "";
  private List<String> keywords = List.of();
  private int rank = 0;
  private @Nullable String kind;

  public CandidateBuilder id(String id) {
    this.id = id;
    return this;
  }

  public CandidateBuilder title(String title) {
    this.title = title;
    return this;
  }

  public CandidateBuilder subtitle(String subtitle) {
    this.subtitle = subtitle;
    return this;
  }

  public CandidateBuilder keywords(String... keywords) {
    this.keywords = List.of(keywords);
    return this;
  }

  public CandidateBuilder rank(int rank) {
    this.rank = rank;
    return this;
  }

  public CandidateBuilder kind(String kind) {
    this.kind = kind;
    return this;
  }

  public Candidate build() {
    String effectiveId = id != null ? id : title.toLowerCase(Locale.ROOT).replace(' ', '-');
    return new Candidate(effectiveId, title, subtitle, keywords, rank, kind);
  }

  /** Builds candidates with the given titles, ranked in argument order. */
  public static List<Candidate> ranked(String... titles) {
    Candidate[] candidates = new Candidate[titles.length];
    for (int i = 0; i < titles.length; i++) {
      candidates[i] = new CandidateBuilder().title(titles[i]).rank(i).build();
    }
    return List.of(candidates);
  }
}
