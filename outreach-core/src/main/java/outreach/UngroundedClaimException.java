package outreach;

import outreach.model.GroundingVerdict;
import outreach.model.Stage;

/**
 * Generated content that cites a fact, or a number, absent from the supplied payload.
 * Raised by the composer only after the strict retry also failed validation.
 */
public class UngroundedClaimException extends OutreachException {

  private final GroundingVerdict verdict;

  public UngroundedClaimException(long attendeeId, long companyId, GroundingVerdict verdict) {
    super(Stage.COMPOSE, attendeeId, companyId, "Ungrounded content: " + verdict.describe());
    this.verdict = verdict;
  }

  public GroundingVerdict verdict() {
    return verdict;
  }
}
