package outreach;

import outreach.model.Stage;

/** The generation service failed or timed out. */
public class GenerationException extends OutreachException {

  public GenerationException(long attendeeId, long companyId, String message, Throwable cause) {
    super(Stage.COMPOSE, attendeeId, companyId, message, cause);
  }
}
