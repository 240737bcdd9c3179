package outreach.model;

/**
 * Why a contact was not given an outreach treatment.
 */
public enum SuppressionReason {
  NOT_A_FIT,
  BUDGET_EXHAUSTED,
  AMBIGUOUS_ROLE,
  UNSUPPORTED_ATTENDANCE;

  /**
   * Returns {@code true} if a human should look at the contact before anything is sent.
   */
  public boolean requiresReview() {
    return this == AMBIGUOUS_ROLE;
  }
}
