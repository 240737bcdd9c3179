package outreach;

import outreach.model.AttemptState;
import outreach.model.Stage;

/**
 * Lifecycle misuse: a backward or otherwise illegal state transition. This is a
 * programming error and is never corrected silently.
 */
public class InvalidTransitionException extends OutreachException {

  private final AttemptState from;
  private final AttemptState to;

  public InvalidTransitionException(Stage stage, long attendeeId, long companyId,
      AttemptState from, AttemptState to) {
    super(stage, attendeeId, companyId, "Illegal transition " + from + " -> " + to);
    this.from = from;
    this.to = to;
  }

  public AttemptState from() {
    return from;
  }

  public AttemptState to() {
    return to;
  }
}
