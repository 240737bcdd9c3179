package outreach.classify;

import outreach.model.CompanyRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The global top-N target companies of a wave.
 *
 * <p>Companies rank by combined score descending, then distribution-center count
 * descending, then id ascending. The set is resolved once per wave so every
 * classification in the wave sees the same targets.
 */
public final class TopTargets {

  public static final Comparator<CompanyRecord> RANKING =
      Comparator.comparingInt((CompanyRecord c) -> c.combinedScore()).reversed()
          .thenComparing(Comparator.comparingInt(CompanyRecord::dcCount).reversed())
          .thenComparingLong(CompanyRecord::id);

  private static final TopTargets NONE = new TopTargets(List.of());

  private final Set<Long> companyIds;

  private TopTargets(List<Long> rankedIds) {
    this.companyIds = new LinkedHashSet<>(rankedIds);
  }

  public static TopTargets of(List<Long> rankedIds) {
    return rankedIds.isEmpty() ? NONE : new TopTargets(rankedIds);
  }

  public static TopTargets none() {
    return NONE;
  }

  /** Ranks {@code companies} and keeps the first {@code n}. */
  public static TopTargets rank(List<CompanyRecord> companies, int n) {
    List<CompanyRecord> sorted = new ArrayList<>(companies);
    sorted.sort(RANKING);
    List<Long> ids = new ArrayList<>();
    for (int i = 0; i < Math.min(n, sorted.size()); i++) {
      ids.add(sorted.get(i).id());
    }
    return of(ids);
  }

  public boolean contains(long companyId) {
    return companyIds.contains(companyId);
  }

  public int size() {
    return companyIds.size();
  }

  @Override
  public String toString() {
    return "TopTargets" + companyIds;
  }
}
