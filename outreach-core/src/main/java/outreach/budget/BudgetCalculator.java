package outreach.budget;

import outreach.InvalidInputException;
import outreach.model.AttendeeRecord;
import outreach.model.CompanyBudget;
import outreach.model.Stage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Computes a company's contact budget for one wave.
 *
 * <p>Attendees are ranked by combined score descending with ties broken by attendee id
 * ascending, so the same roster always yields the same ranking. The cap is the roster
 * size when at most {@code maxContacts} people attend, and {@code maxContacts}
 * otherwise.
 *
 * <p>This class is stateless and thread-safe. Persisting the result is the caller's job.
 */
public final class BudgetCalculator {

  /** Ranking order used for budgets: best combined score first, then lowest id. */
  public static final Comparator<AttendeeRecord> RANKING =
      Comparator.comparingInt(AttendeeRecord::combinedScore).reversed()
          .thenComparingLong(AttendeeRecord::id);

  private final int maxContacts;

  public BudgetCalculator(int maxContacts) {
    if (maxContacts < 1) {
      throw new IllegalArgumentException("maxContacts must be >= 1");
    }
    this.maxContacts = maxContacts;
  }

  /**
   * Ranks the roster and derives the cap.
   *
   * @param companyId company the roster belongs to
   * @param attendees every attendee of the company, with the score snapshot to rank by
   * @param wave      campaign wave
   * @return a budget with nothing consumed
   * @throws InvalidInputException if the roster is empty or contains an attendee of
   *     another company
   */
  public CompanyBudget computeBudget(long companyId, List<AttendeeRecord> attendees, String wave) {
    Objects.requireNonNull(wave, "wave");
    if (attendees == null || attendees.isEmpty()) {
      throw new InvalidInputException(Stage.CLASSIFY, null, companyId,
          "Cannot compute a budget for an empty roster");
    }
    for (AttendeeRecord attendee : attendees) {
      if (attendee.companyId() != companyId) {
        throw new InvalidInputException(Stage.CLASSIFY, attendee.id(), companyId,
            "Attendee belongs to company " + attendee.companyId());
      }
    }
    List<AttendeeRecord> sorted = new ArrayList<>(attendees);
    sorted.sort(RANKING);
    List<Long> ranking = new ArrayList<>(sorted.size());
    for (AttendeeRecord attendee : sorted) {
      if (ranking.contains(attendee.id())) {
        throw new InvalidInputException(Stage.CLASSIFY, attendee.id(), companyId,
            "Attendee listed twice");
      }
      ranking.add(attendee.id());
    }
    return new CompanyBudget(companyId, wave, ranking, capFor(ranking.size()), 0);
  }

  public int capFor(int attendeeCount) {
    return attendeeCount <= maxContacts ? attendeeCount : maxContacts;
  }

  public int maxContacts() {
    return maxContacts;
  }
}
