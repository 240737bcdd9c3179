package outreach;

import outreach.model.Stage;

/**
 * Malformed or inconsistent caller input, such as an attendee list that spans
 * companies. Rejected immediately and never retried.
 */
public class InvalidInputException extends OutreachException {

  public InvalidInputException(Stage stage, Long attendeeId, Long companyId, String message) {
    super(stage, attendeeId, companyId, message);
  }
}
