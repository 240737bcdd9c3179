package outreach.lifecycle;

import outreach.InvalidInputException;
import outreach.InvalidTransitionException;
import outreach.OutreachException;
import outreach.StaleAttemptException;
import outreach.model.AttemptState;
import outreach.model.FactClaim;
import outreach.model.FactField;
import outreach.model.GeneratedMessage;
import outreach.model.GenerationStatus;
import outreach.model.OutreachAttempt;
import outreach.model.ReplySignal;
import outreach.model.SendStatus;
import outreach.model.Stage;
import outreach.model.SuppressionReason;
import outreach.model.Treatment;
import outreach.model.TreatmentKind;
import outreach.testing.InMemoryAttemptStore;
import outreach.testing.MutableClock;
import outreach.testing.StubConnections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LifecycleTrackerTest {
  private static final Instant START = Instant.parse("2025-03-03T09:00:00Z");
  private static final Treatment TOP_TIER = Treatment.of(TreatmentKind.TOP_TIER_PERSONALIZED, 1);
  private static final GeneratedMessage MESSAGE = new GeneratedMessage("Hi Avery", "Body",
      List.of(FactClaim.of(FactField.FIRST_NAME, "Avery")), null);

  private InMemoryAttemptStore store;
  private MutableClock clock;
  private LifecycleTracker tracker;

  @BeforeEach
  void setUp() {
    store = new InMemoryAttemptStore();
    clock = new MutableClock(START);
    tracker = LifecycleTracker.builder()
        .connectionProvider(StubConnections.provider())
        .attemptStore(store)
        .clock(clock)
        .build();
  }

  private OutreachAttempt pending(long attendeeId, String wave) {
    return tracker.recordClassified(OutreachAttempt.create(attendeeId, 7, wave, TOP_TIER, 1, clock.instant()));
  }

  private OutreachAttempt awaitingReply(long attendeeId) {
    OutreachAttempt generated = tracker.recordGenerated(pending(attendeeId, "w1"), MESSAGE);
    return tracker.recordSent(generated, "msg-" + attendeeId, clock.instant());
  }

  // ── Forward path ─────────────────────────────────────────────────

  @Test
  void classifiedAttemptIsStoredOnce() {
    OutreachAttempt first = pending(1, "w1");
    OutreachAttempt again = tracker.recordClassified(
        OutreachAttempt.create(1, 7, "w1", TOP_TIER, 1, clock.instant()));

    assertEquals(first.attemptId(), again.attemptId());
    assertEquals(1, store.all().size());
  }

  @Test
  void sendStartsFollowUpTimer() {
    OutreachAttempt attempt = awaitingReply(1);

    assertEquals(AttemptState.AWAITING_REPLY, attempt.state());
    assertEquals(SendStatus.SENT, attempt.sendStatus());
    assertEquals(GenerationStatus.VALIDATED, attempt.generationStatus());
    assertEquals(START, attempt.sentAt());
    assertEquals(START.plus(Duration.ofDays(7)), attempt.followUpEligibleAt());
    assertEquals("msg-1", attempt.deliveryId());
    assertEquals(3, attempt.version());
  }

  @Test
  void backwardTransitionRejected() {
    OutreachAttempt attempt = awaitingReply(1);

    InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
        () -> tracker.transition(attempt, AttemptState.PENDING, Stage.SEND, b -> b));
    assertEquals(AttemptState.AWAITING_REPLY, e.from());
    assertEquals(AttemptState.PENDING, e.to());
  }

  @Test
  void skippingStatesRejected() {
    OutreachAttempt attempt = pending(1, "w1");

    assertThrows(InvalidTransitionException.class,
        () -> tracker.recordSent(attempt, "msg", clock.instant()));
    assertThrows(InvalidTransitionException.class, () -> tracker.markFollowUpDue(attempt));
  }

  @Test
  void staleCopyCannotOverwriteNewerRow() {
    OutreachAttempt attempt = pending(1, "w1");
    tracker.recordGenerated(attempt, MESSAGE);

    assertThrows(StaleAttemptException.class, () -> tracker.recordFailed(attempt, Stage.COMPOSE, "x"));
    assertEquals(AttemptState.GENERATED, tracker.find(1, "w1").orElseThrow().state());
  }

  @Test
  void failedGenerationKeepsStageAndError() {
    OutreachAttempt failed = tracker.recordFailed(pending(1, "w1"), Stage.COMPOSE, "ungrounded");

    assertEquals(AttemptState.FAILED, failed.state());
    assertEquals(Stage.COMPOSE, failed.failedStage());
    assertEquals("ungrounded", failed.lastError());
    assertTrue(failed.state().isTerminal());
  }

  @Test
  void sendErrorKeepsAttemptGenerated() {
    OutreachAttempt generated = tracker.recordGenerated(pending(1, "w1"), MESSAGE);

    OutreachAttempt errored = tracker.recordSendError(generated, SendStatus.UNCONFIRMED, "timeout");

    assertEquals(AttemptState.GENERATED, errored.state());
    assertEquals(SendStatus.UNCONFIRMED, errored.sendStatus());
    assertThrows(IllegalArgumentException.class,
        () -> tracker.recordSendError(errored, SendStatus.SENT, "x"));
  }

  @Test
  void budgetRejectionSuppressesGeneratedAttempt() {
    OutreachAttempt generated = tracker.recordGenerated(pending(1, "w1"), MESSAGE);

    OutreachAttempt rejected = tracker.recordBudgetRejected(generated);

    assertEquals(AttemptState.SUPPRESSED, rejected.state());
    assertEquals(SuppressionReason.BUDGET_EXHAUSTED, rejected.treatment().reason());
  }

  @Test
  void reclassifyOnlyTouchesPendingAttempts() {
    OutreachAttempt attempt = pending(1, "w1");

    OutreachAttempt suppressed = tracker.reclassify(attempt,
        Treatment.suppressed(SuppressionReason.BUDGET_EXHAUSTED, 4), 3);
    assertEquals(AttemptState.SUPPRESSED, suppressed.state());

    OutreachAttempt sent = awaitingReply(2);
    assertEquals(sent, tracker.reclassify(sent,
        Treatment.suppressed(SuppressionReason.NOT_A_FIT, 1), 1));
  }

  // ── Follow-up ────────────────────────────────────────────────────

  @Test
  void followUpClaimWonOnlyOnce() {
    OutreachAttempt due = tracker.markFollowUpDue(awaitingReply(1));

    Optional<OutreachAttempt> first = tracker.claimFollowUp(due);
    Optional<OutreachAttempt> second = tracker.claimFollowUp(due);

    assertTrue(first.isPresent());
    assertFalse(second.isPresent());
    assertFalse(tracker.claimFollowUp(first.get()).isPresent());
  }

  @Test
  void releasedClaimCanBeTakenAgain() {
    OutreachAttempt claimed = tracker.claimFollowUp(tracker.markFollowUpDue(awaitingReply(1))).orElseThrow();

    OutreachAttempt released = tracker.releaseFollowUpClaim(claimed, "bounced");

    assertNull(released.followUpClaimedAt());
    assertTrue(tracker.claimFollowUp(released).isPresent());
  }

  @Test
  void followUpSentIsTerminal() {
    OutreachAttempt claimed = tracker.claimFollowUp(tracker.markFollowUpDue(awaitingReply(1))).orElseThrow();

    OutreachAttempt sent = tracker.recordFollowUpSent(claimed, clock.instant());

    assertEquals(AttemptState.FOLLOW_UP_SENT, sent.state());
    assertTrue(sent.followUpSent());
    assertNotNull(sent.followUpSentAt());
    assertThrows(InvalidTransitionException.class, () -> tracker.markFollowUpDue(sent));
  }

  @Test
  void dueOnlyAfterDelay() {
    awaitingReply(1);

    assertTrue(tracker.dueForFollowUp(START.plus(Duration.ofDays(6)), 10).isEmpty());
    assertEquals(1, tracker.dueForFollowUp(START.plus(Duration.ofDays(7)), 10).size());
  }

  // ── Signals ──────────────────────────────────────────────────────

  @Test
  void replyOnDayTwoMeansNeverDue() {
    awaitingReply(1);
    clock.advance(Duration.ofDays(2));

    assertEquals(1, tracker.applySignal(1, ReplySignal.REPLIED, clock.instant()));

    OutreachAttempt replied = tracker.find(1, "w1").orElseThrow();
    assertEquals(AttemptState.REPLIED, replied.state());
    assertTrue(tracker.dueForFollowUp(START.plus(Duration.ofDays(30)), 10).isEmpty());
  }

  @Test
  void repeatedSignalIsNoOp() {
    awaitingReply(1);
    tracker.applySignal(1, ReplySignal.CLAIMED_ELSEWHERE, clock.instant());
    OutreachAttempt afterFirst = tracker.find(1, "w1").orElseThrow();

    assertEquals(0, tracker.applySignal(1, ReplySignal.REPLIED, clock.instant()));
    assertEquals(afterFirst, tracker.find(1, "w1").orElseThrow());
    assertEquals(AttemptState.CLAIMED_ELSEWHERE, afterFirst.state());
  }

  @Test
  void signalBeforeSendIsIgnored() {
    pending(1, "w1");

    assertEquals(0, tracker.applySignal(1, ReplySignal.REPLIED, clock.instant()));
    assertEquals(AttemptState.PENDING, tracker.find(1, "w1").orElseThrow().state());
  }

  @Test
  void replyAfterFollowUpRecordedWithoutStateChange() {
    OutreachAttempt claimed = tracker.claimFollowUp(tracker.markFollowUpDue(awaitingReply(1))).orElseThrow();
    tracker.recordFollowUpSent(claimed, clock.instant());

    assertEquals(1, tracker.applySignal(1, ReplySignal.REPLIED, clock.instant()));

    OutreachAttempt attempt = tracker.find(1, "w1").orElseThrow();
    assertEquals(AttemptState.FOLLOW_UP_SENT, attempt.state());
    assertEquals(ReplySignal.REPLIED, attempt.replySignal());
  }

  @Test
  void noneSignalRejected() {
    assertThrows(InvalidInputException.class,
        () -> tracker.applySignal(1, ReplySignal.NONE, clock.instant()));
  }

  // ── Wiring ───────────────────────────────────────────────────────

  @Test
  void connectionFailureSurfacesAsOutreachException() {
    LifecycleTracker broken = LifecycleTracker.builder()
        .connectionProvider(() -> { throw new SQLException("down"); })
        .attemptStore(store)
        .build();

    OutreachException e = assertThrows(OutreachException.class, () -> broken.find(1, "w1"));
    assertTrue(e.getCause() instanceof SQLException);
    assertTrue(e.getMessage().contains("Failed to obtain or close connection"), e.getMessage());
  }

  @Test
  void storeFailureIsReportedAsStoreFailure() {
    store.failReads(new IllegalStateException("table is locked"));

    OutreachException e = assertThrows(OutreachException.class, () -> tracker.find(1, "w1"));
    assertTrue(e.getCause() instanceof IllegalStateException);
    assertTrue(e.getMessage().contains("Attempt store failed: table is locked"), e.getMessage());
    assertFalse(e.getMessage().contains("connection"), e.getMessage());
  }

  @Test
  void outreachExceptionsFromStorePassThrough() {
    InvalidInputException failure = new InvalidInputException(Stage.CLASSIFY, 1L, 7L, "bad row");
    store.failReads(failure);

    InvalidInputException e = assertThrows(InvalidInputException.class, () -> tracker.find(1, "w1"));
    assertSame(failure, e);
  }

  @Test
  void missingStoreRejected() {
    assertThrows(NullPointerException.class, () ->
        LifecycleTracker.builder().connectionProvider(StubConnections.provider()).build());
  }
}
