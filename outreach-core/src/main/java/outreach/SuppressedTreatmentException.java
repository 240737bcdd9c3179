package outreach;

import outreach.model.Stage;
import outreach.model.Treatment;

/** A suppressed treatment reached the composer. Always a caller error. */
public class SuppressedTreatmentException extends OutreachException {

  public SuppressedTreatmentException(long attendeeId, long companyId, Treatment treatment) {
    super(Stage.COMPOSE, attendeeId, companyId,
        "Cannot compose for suppressed treatment (" + treatment.reason() + ")");
  }
}
