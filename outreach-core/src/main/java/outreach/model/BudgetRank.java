package outreach.model;

/**
 * An attendee's position in its company budget.
 *
 * @param rank 1-based rank by combined score
 * @param cap  maximum number of attendees contactable at the company in the wave
 */
public record BudgetRank(int rank, int cap) {

  public BudgetRank {
    if (rank < 1) {
      throw new IllegalArgumentException("rank must be >= 1, got: " + rank);
    }
    if (cap < 0) {
      throw new IllegalArgumentException("cap must be >= 0, got: " + cap);
    }
  }

  public boolean withinCap() {
    return rank <= cap;
  }
}
