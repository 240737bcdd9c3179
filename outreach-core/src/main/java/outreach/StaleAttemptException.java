package outreach;

import outreach.model.Stage;

/**
 * An optimistic attempt update lost a race: the stored row moved on since it was read.
 * The caller should reload the attempt before deciding what to do.
 */
public class StaleAttemptException extends OutreachException {

  private final String attemptId;

  public StaleAttemptException(Stage stage, long attendeeId, long companyId, String attemptId) {
    super(stage, attendeeId, companyId, "Attempt " + attemptId + " was modified concurrently");
    this.attemptId = attemptId;
  }

  public String attemptId() {
    return attemptId;
  }
}
