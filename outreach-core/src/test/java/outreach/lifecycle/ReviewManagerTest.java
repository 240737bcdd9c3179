package outreach.lifecycle;

import outreach.InvalidInputException;
import outreach.model.AttemptState;
import outreach.model.GeneratedMessage;
import outreach.model.OutreachAttempt;
import outreach.model.SendStatus;
import outreach.model.Stage;
import outreach.model.SuppressionReason;
import outreach.model.Treatment;
import outreach.model.TreatmentKind;
import outreach.testing.InMemoryAttemptStore;
import outreach.testing.StubConnections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReviewManagerTest {
  private static final Treatment STANDARD = Treatment.of(TreatmentKind.STANDARD_PERSONALIZED, 2);
  private static final GeneratedMessage MESSAGE = new GeneratedMessage("s", "b", List.of(), null);

  private LifecycleTracker tracker;
  private ReviewManager review;

  @BeforeEach
  void setUp() {
    tracker = LifecycleTracker.builder()
        .connectionProvider(StubConnections.provider())
        .attemptStore(new InMemoryAttemptStore())
        .build();
    review = new ReviewManager(tracker);
  }

  private OutreachAttempt classified(long attendeeId, Treatment treatment) {
    return tracker.recordClassified(
        OutreachAttempt.create(attendeeId, 7, "w1", treatment, 1, Instant.now()));
  }

  @Test
  void queueHoldsFailuresAmbiguousRolesAndSendErrors() {
    tracker.recordFailed(classified(1, STANDARD), Stage.COMPOSE, "ungrounded");
    classified(2, Treatment.suppressed(SuppressionReason.AMBIGUOUS_ROLE, 1));
    classified(3, Treatment.suppressed(SuppressionReason.BUDGET_EXHAUSTED, 4));
    OutreachAttempt generated = tracker.recordGenerated(classified(4, STANDARD), MESSAGE);
    tracker.recordSendError(generated, SendStatus.ERROR, "bounced");
    classified(5, STANDARD);

    List<OutreachAttempt> queue = review.pendingReview(10);

    assertEquals(List.of(1L, 2L, 4L), queue.stream().map(OutreachAttempt::attendeeId).toList());
    queue.forEach(a -> assertTrue(review.needsReview(a)));
  }

  @Test
  void failedAttemptReenrolledAsPendingInNewWave() {
    OutreachAttempt failed = tracker.recordFailed(classified(1, STANDARD), Stage.COMPOSE, "x");

    OutreachAttempt fresh = review.reenroll(failed.attemptId(), "w2");

    assertNotEquals(failed.attemptId(), fresh.attemptId());
    assertEquals("w2", fresh.wave());
    assertEquals(AttemptState.PENDING, fresh.state());
    assertEquals(STANDARD, fresh.treatment());
    assertEquals(AttemptState.FAILED, tracker.findById(failed.attemptId()).orElseThrow().state());
  }

  @Test
  void ambiguousRoleNeedsReviewerTreatment() {
    OutreachAttempt ambiguous = classified(2, Treatment.suppressed(SuppressionReason.AMBIGUOUS_ROLE, 1));

    assertThrows(InvalidInputException.class, () -> review.reenroll(ambiguous.attemptId(), "w2"));

    OutreachAttempt fresh = review.reenroll(ambiguous.attemptId(), "w2",
        Treatment.of(TreatmentKind.EXHIBITOR_SALES, 1));
    assertEquals(TreatmentKind.EXHIBITOR_SALES, fresh.treatment().kind());
  }

  @Test
  void reenrollRejectsSameWaveUnknownAndDuplicates() {
    OutreachAttempt failed = tracker.recordFailed(classified(1, STANDARD), Stage.COMPOSE, "x");

    assertThrows(InvalidInputException.class, () -> review.reenroll(failed.attemptId(), "w1"));
    assertThrows(InvalidInputException.class, () -> review.reenroll("missing", "w2"));
    review.reenroll(failed.attemptId(), "w2");
    assertThrows(InvalidInputException.class, () -> review.reenroll(failed.attemptId(), "w2"));
  }

  @Test
  void activeAttemptsAreNotReviewable() {
    OutreachAttempt pending = classified(1, STANDARD);

    assertFalse(review.needsReview(pending));
    assertThrows(InvalidInputException.class, () -> review.reenroll(pending.attemptId(), "w2"));
  }
}
