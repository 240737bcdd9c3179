package outreach.model;

import java.util.List;
import java.util.Objects;

/**
 * Researched company, as supplied by the research store. Immutable once research completes.
 *
 * <p>{@code dcCount} and {@code truckCount} use {@code 0} for "unknown"; whether a count is
 * usable in generated content is decided by {@link #hasUsableDcCount()} and
 * {@link #hasUsableTruckCount()}.
 *
 * @param id            research store identifier
 * @param name          company name
 * @param website       company website (may be {@code null})
 * @param industry      primary industry category (may be {@code null})
 * @param employeeCount reported employees, {@code 0} if unknown
 * @param locationCount reported retail locations, {@code 0} if unknown
 * @param overview      one or two sentence description (may be {@code null})
 * @param dcCount       distribution-center count, {@code 0} if unknown
 * @param dcSource      citation for {@code dcCount} (may be {@code null})
 * @param truckCount    fleet size, {@code 0} if unknown
 * @param truckSource   citation for {@code truckCount} (may be {@code null})
 * @param bullets       sourced fact bullets, never {@code null}
 * @param hook          one conversation-starter fact (may be {@code null})
 * @param gateFit       gate-automation fit score (0-100)
 * @param truckFit      truck-parking fit score (0-100)
 * @param combinedScore combined score (0-120)
 */
public record CompanyRecord(
    long id,
    String name,
    String website,
    String industry,
    int employeeCount,
    int locationCount,
    String overview,
    int dcCount,
    String dcSource,
    int truckCount,
    String truckSource,
    List<String> bullets,
    String hook,
    int gateFit,
    int truckFit,
    int combinedScore
) {

  public CompanyRecord {
    Objects.requireNonNull(name, "name");
    checkScore("gateFit", gateFit);
    checkScore("truckFit", truckFit);
    if (dcCount < 0 || truckCount < 0) {
      throw new IllegalArgumentException("counts must be >= 0");
    }
    bullets = bullets == null ? List.of() : List.copyOf(bullets);
  }

  /**
   * Combined score: the stronger fit plus a 20% bonus of the weaker fit.
   *
   * @param gateFit  gate-automation fit score
   * @param truckFit truck-parking fit score
   * @return the combined score
   */
  public static int combinedScore(int gateFit, int truckFit) {
    int base = Math.max(gateFit, truckFit);
    int bonus = (int) (Math.min(gateFit, truckFit) * 0.2);
    return base + bonus;
  }

  public FitCategory fitCategory(int threshold) {
    return FitCategory.of(gateFit, truckFit, threshold);
  }

  public boolean hasUsableDcCount() {
    return dcCount > 0 && isRealSource(dcSource);
  }

  public boolean hasUsableTruckCount() {
    return truckCount > 0 && isRealSource(truckSource);
  }

  private static boolean isRealSource(String source) {
    if (source == null || source.isBlank()) {
      return false;
    }
    String trimmed = source.trim();
    return !trimmed.regionMatches(true, 0, "N/A", 0, 3)
        && !trimmed.equalsIgnoreCase("unknown");
  }

  private static void checkScore(String name, int score) {
    if (score < 0 || score > 100) {
      throw new IllegalArgumentException(name + " must be in [0, 100], got: " + score);
    }
  }

  public static Builder builder(long id, String name) {
    return new Builder(id, name);
  }

  /** Builder for {@link CompanyRecord}; the combined score is derived unless set. */
  public static final class Builder {
    private final long id;
    private final String name;
    private String website;
    private String industry;
    private int employeeCount;
    private int locationCount;
    private String overview;
    private int dcCount;
    private String dcSource;
    private int truckCount;
    private String truckSource;
    private List<String> bullets = List.of();
    private String hook;
    private int gateFit;
    private int truckFit;
    private Integer combinedScore;

    private Builder(long id, String name) {
      this.id = id;
      this.name = name;
    }

    public Builder website(String website) {
      this.website = website;
      return this;
    }

    public Builder industry(String industry) {
      this.industry = industry;
      return this;
    }

    public Builder employeeCount(int employeeCount) {
      this.employeeCount = employeeCount;
      return this;
    }

    public Builder locationCount(int locationCount) {
      this.locationCount = locationCount;
      return this;
    }

    public Builder overview(String overview) {
      this.overview = overview;
      return this;
    }

    public Builder dcCount(int dcCount, String dcSource) {
      this.dcCount = dcCount;
      this.dcSource = dcSource;
      return this;
    }

    public Builder truckCount(int truckCount, String truckSource) {
      this.truckCount = truckCount;
      this.truckSource = truckSource;
      return this;
    }

    public Builder bullets(List<String> bullets) {
      this.bullets = bullets;
      return this;
    }

    public Builder hook(String hook) {
      this.hook = hook;
      return this;
    }

    public Builder fitScores(int gateFit, int truckFit) {
      this.gateFit = gateFit;
      this.truckFit = truckFit;
      return this;
    }

    public Builder combinedScore(int combinedScore) {
      this.combinedScore = combinedScore;
      return this;
    }

    public CompanyRecord build() {
      int combined = combinedScore != null
          ? combinedScore : CompanyRecord.combinedScore(gateFit, truckFit);
      return new CompanyRecord(id, name, website, industry, employeeCount, locationCount,
          overview, dcCount, dcSource, truckCount, truckSource, bullets, hook,
          gateFit, truckFit, combined);
    }
  }
}
