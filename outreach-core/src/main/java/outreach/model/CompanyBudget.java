package outreach.model;

import java.util.List;
import java.util.Objects;

/**
 * Per (company, wave) outreach budget: a fixed ranking, a fixed cap and the consumed count.
 *
 * <p>Invariant: {@code 0 <= consumed <= cap}.
 *
 * @param companyId company the budget belongs to
 * @param wave      campaign wave identifier
 * @param ranking   attendee ids, best first
 * @param cap       maximum attendees contactable in the wave
 * @param consumed  attendees already messaged in the wave
 */
public record CompanyBudget(long companyId, String wave, List<Long> ranking, int cap, int consumed) {

  public CompanyBudget {
    Objects.requireNonNull(wave, "wave");
    ranking = List.copyOf(Objects.requireNonNull(ranking, "ranking"));
    if (cap < 0) {
      throw new IllegalArgumentException("cap must be >= 0, got: " + cap);
    }
    if (consumed < 0 || consumed > cap) {
      throw new IllegalArgumentException("consumed must be in [0, " + cap + "], got: " + consumed);
    }
  }

  /**
   * Returns the 1-based rank of an attendee. Attendees missing from the stored ranking
   * (added after the budget was computed) rank after everyone in it.
   *
   * @param attendeeId the attendee
   * @return the attendee's budget rank
   */
  public BudgetRank rankOf(long attendeeId) {
    int index = ranking.indexOf(attendeeId);
    int rank = index >= 0 ? index + 1 : ranking.size() + 1;
    return new BudgetRank(rank, cap);
  }

  public int remaining() {
    return cap - consumed;
  }

  public CompanyBudget withConsumed(int consumed) {
    return new CompanyBudget(companyId, wave, ranking, cap, consumed);
  }
}
