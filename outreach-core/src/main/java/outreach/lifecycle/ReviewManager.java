package outreach.lifecycle;

import outreach.InvalidInputException;
import outreach.model.AttemptState;
import outreach.model.OutreachAttempt;
import outreach.model.SendStatus;
import outreach.model.Stage;
import outreach.model.SuppressionReason;
import outreach.model.Treatment;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Facade for the human review queue: failed generations, ambiguous-role suppressions and
 * deliveries that need a manual resend.
 *
 * <p>Reviewed attempts are never edited back into play. Re-enrollment creates a new
 * PENDING attempt in a later wave and leaves the reviewed row as it was.
 *
 * @see LifecycleTracker#pendingReview(int)
 */
public final class ReviewManager {
  private static final Logger logger = Logger.getLogger(ReviewManager.class.getName());

  private final LifecycleTracker tracker;

  public ReviewManager(LifecycleTracker tracker) {
    this.tracker = Objects.requireNonNull(tracker, "tracker");
  }

  public List<OutreachAttempt> pendingReview(int limit) {
    return tracker.pendingReview(limit);
  }

  /**
   * Re-enrolls a failed attempt in a later wave with its original treatment.
   *
   * @throws InvalidInputException if the attempt is unknown, is not reviewable this way,
   *     or the new wave already has an attempt for the attendee
   */
  public OutreachAttempt reenroll(String attemptId, String newWave) {
    return reenroll(attemptId, newWave, null);
  }

  /**
   * Re-enrolls a reviewed attempt in a later wave.
   *
   * @param attemptId reviewed attempt
   * @param newWave   wave of the new attempt, different from the reviewed one
   * @param override  treatment decided by the reviewer; required for ambiguous-role
   *                  suppressions, optional otherwise
   * @return the new PENDING attempt
   */
  public OutreachAttempt reenroll(String attemptId, String newWave, Treatment override) {
    Objects.requireNonNull(attemptId, "attemptId");
    Objects.requireNonNull(newWave, "newWave");
    OutreachAttempt reviewed = tracker.findById(attemptId)
        .orElseThrow(() -> new InvalidInputException(Stage.CLASSIFY, null, null,
            "Unknown attempt " + attemptId));
    if (reviewed.wave().equals(newWave)) {
      throw new InvalidInputException(Stage.CLASSIFY, reviewed.attendeeId(), reviewed.companyId(),
          "Re-enrollment needs a new wave, got the same wave " + newWave);
    }
    Treatment treatment = override != null ? override : reviewed.treatment();
    if (treatment.isSuppressed()) {
      throw new InvalidInputException(Stage.CLASSIFY, reviewed.attendeeId(), reviewed.companyId(),
          "Re-enrollment needs a sendable treatment");
    }
    if (!isReviewable(reviewed)) {
      throw new InvalidInputException(Stage.CLASSIFY, reviewed.attendeeId(), reviewed.companyId(),
          "Attempt " + attemptId + " in state " + reviewed.state() + " is not awaiting review");
    }
    if (tracker.find(reviewed.attendeeId(), newWave).isPresent()) {
      throw new InvalidInputException(Stage.CLASSIFY, reviewed.attendeeId(), reviewed.companyId(),
          "Attendee already has an attempt in wave " + newWave);
    }
    OutreachAttempt fresh = OutreachAttempt.create(reviewed.attendeeId(), reviewed.companyId(),
        newWave, treatment, reviewed.companyContacts(), tracker.now());
    OutreachAttempt stored = tracker.recordClassified(fresh);
    logger.log(Level.INFO, "Re-enrolled attendee {0} from wave {1} into wave {2}",
        new Object[]{reviewed.attendeeId(), reviewed.wave(), newWave});
    return stored;
  }

  static boolean isReviewable(OutreachAttempt attempt) {
    return switch (attempt.state()) {
      case FAILED -> true;
      case SUPPRESSED -> attempt.treatment().reason() == SuppressionReason.AMBIGUOUS_ROLE;
      case GENERATED -> attempt.sendStatus() == SendStatus.ERROR
          || attempt.sendStatus() == SendStatus.UNCONFIRMED;
      default -> false;
    };
  }

  /**
   * Whether the attempt currently sits in the review queue. Besides the attempts
   * {@link #reenroll} accepts, this includes follow-ups whose delivery outcome is unknown.
   */
  public boolean needsReview(OutreachAttempt attempt) {
    return isReviewable(attempt)
        || (attempt.state() == AttemptState.FOLLOW_UP_DUE && attempt.followUpClaimedAt() != null);
  }
}
