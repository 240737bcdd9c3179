package outreach.lifecycle;

import outreach.InvalidInputException;
import outreach.InvalidTransitionException;
import outreach.OutreachException;
import outreach.StaleAttemptException;
import outreach.model.AttemptState;
import outreach.model.GeneratedMessage;
import outreach.model.GenerationStatus;
import outreach.model.OutreachAttempt;
import outreach.model.ReplySignal;
import outreach.model.SendStatus;
import outreach.model.Stage;
import outreach.model.SuppressionReason;
import outreach.model.Treatment;
import outreach.spi.AttemptStore;
import outreach.spi.ConnectionProvider;
import outreach.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Forward-only state machine over {@link OutreachAttempt} rows.
 *
 * <p>Every state change is checked against {@link AttemptState#canTransitionTo} and
 * persisted with an optimistic version check. An illegal transition raises
 * {@link InvalidTransitionException}; a lost race raises {@link StaleAttemptException}.
 * Neither is corrected silently.
 *
 * <p>Reply and claim signals are idempotent: the first signal recorded on an attempt
 * wins, repeats are no-ops, and a signal that arrives before anything was sent is
 * ignored.
 */
public final class LifecycleTracker {
  private static final Logger logger = Logger.getLogger(LifecycleTracker.class.getName());

  private static final int SIGNAL_RETRIES = 3;

  private final ConnectionProvider connectionProvider;
  private final AttemptStore attemptStore;
  private final Duration followUpDelay;
  private final Clock clock;
  private final MetricsExporter metrics;

  private LifecycleTracker(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.attemptStore = Objects.requireNonNull(builder.attemptStore, "attemptStore");
    this.followUpDelay = Objects.requireNonNull(builder.followUpDelay, "followUpDelay");
    if (followUpDelay.isNegative()) {
      throw new IllegalArgumentException("followUpDelay must be >= 0");
    }
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Instant now() {
    return clock.instant();
  }

  public Duration followUpDelay() {
    return followUpDelay;
  }

  // ── Recording ───────────────────────────────────────────────────

  /**
   * Persists a freshly classified attempt, or returns the attempt already stored for the
   * same attendee and wave.
   */
  public OutreachAttempt recordClassified(OutreachAttempt attempt) {
    return withConnection(Stage.CLASSIFY, attempt, conn -> {
      Optional<OutreachAttempt> existing = attemptStore.find(conn, attempt.attendeeId(), attempt.wave());
      if (existing.isPresent()) {
        return existing.get();
      }
      attemptStore.insertNew(conn, attempt);
      return attempt;
    });
  }

  /**
   * Re-applies a fresh classification to a PENDING attempt. Attempts that already moved on
   * keep their treatment.
   */
  public OutreachAttempt reclassify(OutreachAttempt current, Treatment treatment,
      int companyContacts) {
    if (current.state() != AttemptState.PENDING) {
      return current;
    }
    if (current.treatment().equals(treatment) && current.companyContacts() == companyContacts) {
      return current;
    }
    AttemptState target = treatment.isSuppressed() ? AttemptState.SUPPRESSED : AttemptState.PENDING;
    if (target != AttemptState.PENDING) {
      check(current, target, Stage.CLASSIFY);
    }
    OutreachAttempt next = current.toBuilder()
        .treatment(treatment)
        .companyContacts(companyContacts)
        .state(target)
        .updatedAt(now())
        .build();
    return persist(current, next, Stage.CLASSIFY);
  }

  /** PENDING to GENERATED with a validated message. */
  public OutreachAttempt recordGenerated(OutreachAttempt current, GeneratedMessage message) {
    Objects.requireNonNull(message, "message");
    return transition(current, AttemptState.GENERATED, Stage.COMPOSE, b -> b
        .generationStatus(GenerationStatus.VALIDATED)
        .message(message)
        .clearError());
  }

  /** PENDING to FAILED; the attempt then waits for human review. */
  public OutreachAttempt recordFailed(OutreachAttempt current, Stage stage, String error) {
    return transition(current, AttemptState.FAILED, stage, b -> b
        .generationStatus(GenerationStatus.FAILED)
        .error(stage, error));
  }

  /**
   * GENERATED to SENT, then SENT to AWAITING_REPLY with the follow-up timer started.
   *
   * @param deliveryId transport delivery id
   * @param sentAt     confirmed send time
   */
  public OutreachAttempt recordSent(OutreachAttempt current, String deliveryId, Instant sentAt) {
    Objects.requireNonNull(sentAt, "sentAt");
    OutreachAttempt sent = transition(current, AttemptState.SENT, Stage.SEND, b -> b
        .sendStatus(SendStatus.SENT)
        .deliveryId(deliveryId)
        .sentAt(sentAt)
        .clearError());
    metrics.incrementSent();
    return transition(sent, AttemptState.AWAITING_REPLY, Stage.SEND, b -> b
        .followUpEligibleAt(sentAt.plus(followUpDelay)));
  }

  /**
   * Records a failed or unconfirmed delivery. The attempt stays GENERATED and is listed
   * for manual resend.
   *
   * @param status {@link SendStatus#ERROR} or {@link SendStatus#UNCONFIRMED}
   */
  public OutreachAttempt recordSendError(OutreachAttempt current, SendStatus status, String error) {
    if (status != SendStatus.ERROR && status != SendStatus.UNCONFIRMED) {
      throw new IllegalArgumentException("status must be ERROR or UNCONFIRMED");
    }
    if (current.state() != AttemptState.GENERATED) {
      throw new InvalidTransitionException(Stage.SEND, current.attendeeId(), current.companyId(),
          current.state(), AttemptState.GENERATED);
    }
    metrics.incrementDeliveryFailure();
    OutreachAttempt next = current.toBuilder()
        .sendStatus(status)
        .error(Stage.SEND, error)
        .updatedAt(now())
        .build();
    return persist(current, next, Stage.SEND);
  }

  /** GENERATED to SUPPRESSED: the company's budget was used up before this send. */
  public OutreachAttempt recordBudgetRejected(OutreachAttempt current) {
    metrics.incrementBudgetRejected();
    return transition(current, AttemptState.SUPPRESSED, Stage.SEND, b -> b
        .treatment(Treatment.suppressed(SuppressionReason.BUDGET_EXHAUSTED,
            current.treatment().priorityRank())));
  }

  /** AWAITING_REPLY to FOLLOW_UP_DUE once the timer expired. */
  public OutreachAttempt markFollowUpDue(OutreachAttempt current) {
    return transition(current, AttemptState.FOLLOW_UP_DUE, Stage.FOLLOW_UP, UnaryOperator.identity());
  }

  /**
   * Claims a due follow-up for sending. Only one caller can win the claim; the others get
   * an empty result.
   */
  public Optional<OutreachAttempt> claimFollowUp(OutreachAttempt current) {
    if (current.state() != AttemptState.FOLLOW_UP_DUE || current.followUpClaimedAt() != null) {
      return Optional.empty();
    }
    OutreachAttempt next = current.toBuilder()
        .followUpClaimedAt(now())
        .updatedAt(now())
        .build();
    int updated = withConnection(Stage.FOLLOW_UP, current, conn -> attemptStore.update(conn, next));
    return updated == 1 ? Optional.of(next) : Optional.empty();
  }

  /** Gives up a claim after a definite delivery failure so a later sweep retries. */
  public OutreachAttempt releaseFollowUpClaim(OutreachAttempt current, String error) {
    OutreachAttempt next = current.toBuilder()
        .followUpClaimedAt(null)
        .error(Stage.FOLLOW_UP, error)
        .updatedAt(now())
        .build();
    return persist(current, next, Stage.FOLLOW_UP);
  }

  /** Records the one failure that keeps a claim: the delivery outcome is unknown. */
  public OutreachAttempt recordFollowUpUnconfirmed(OutreachAttempt current, String error) {
    OutreachAttempt next = current.toBuilder()
        .error(Stage.FOLLOW_UP, error)
        .updatedAt(now())
        .build();
    return persist(current, next, Stage.FOLLOW_UP);
  }

  /** FOLLOW_UP_DUE to FOLLOW_UP_SENT. Terminal. */
  public OutreachAttempt recordFollowUpSent(OutreachAttempt current, Instant sentAt) {
    OutreachAttempt next = transition(current, AttemptState.FOLLOW_UP_SENT, Stage.FOLLOW_UP, b -> b
        .followUpSent(sentAt)
        .clearError());
    metrics.incrementFollowUpSent();
    return next;
  }

  /**
   * Moves an attempt to {@code target} after checking the transition is legal.
   *
   * @throws InvalidTransitionException if the move is backward or skips a state
   * @throws StaleAttemptException      if the stored row changed since {@code current}
   */
  public OutreachAttempt transition(OutreachAttempt current, AttemptState target, Stage stage,
      UnaryOperator<OutreachAttempt.Builder> changes) {
    check(current, target, stage);
    OutreachAttempt next = changes.apply(current.toBuilder().state(target).updatedAt(now())).build();
    return persist(current, next, stage);
  }

  static void check(OutreachAttempt current, AttemptState target, Stage stage) {
    if (!current.state().canTransitionTo(target)) {
      throw new InvalidTransitionException(stage, current.attendeeId(), current.companyId(),
          current.state(), target);
    }
  }

  // ── Signals ─────────────────────────────────────────────────────

  /**
   * Applies a reply or claim signal to every sent attempt of the attendee.
   *
   * <p>Attempts that already carry a signal keep it. An attempt whose follow-up was
   * already sent records the signal without changing state. Attempts not yet sent are
   * left alone.
   *
   * @return number of attempts that recorded the signal
   */
  public int applySignal(long attendeeId, ReplySignal signal, Instant at) {
    Objects.requireNonNull(signal, "signal");
    Objects.requireNonNull(at, "at");
    if (signal == ReplySignal.NONE) {
      throw new InvalidInputException(Stage.SIGNAL, attendeeId, null, "signal must not be NONE");
    }
    List<OutreachAttempt> attempts = withConnection(Stage.SIGNAL, attendeeId,
        conn -> attemptStore.findByAttendee(conn, attendeeId));
    int applied = 0;
    for (OutreachAttempt attempt : attempts) {
      if (applySignal(attempt, signal, at)) {
        applied++;
      }
    }
    if (applied > 0) {
      metrics.incrementSignalApplied();
    }
    return applied;
  }

  private boolean applySignal(OutreachAttempt attempt, ReplySignal signal, Instant at) {
    OutreachAttempt current = attempt;
    for (int i = 0; i < SIGNAL_RETRIES; i++) {
      if (current.replySignal() != ReplySignal.NONE || !current.state().isSent()) {
        return false;
      }
      OutreachAttempt.Builder builder = current.toBuilder()
          .replySignal(signal, at)
          .updatedAt(now());
      if (current.state().canTransitionTo(signal.targetState())) {
        builder.state(signal.targetState());
      }
      OutreachAttempt next = builder.build();
      int updated = withConnection(Stage.SIGNAL, current, conn -> attemptStore.update(conn, next));
      if (updated == 1) {
        logger.log(Level.FINE, "Recorded {0} for attempt {1} ({2} -> {3})",
            new Object[]{signal, current.attemptId(), current.state(), next.state()});
        return true;
      }
      String attemptId = current.attemptId();
      current = withConnection(Stage.SIGNAL, current, conn -> attemptStore.findById(conn, attemptId))
          .orElseThrow(() -> new StaleAttemptException(Stage.SIGNAL, attempt.attendeeId(),
              attempt.companyId(), attemptId));
    }
    throw new StaleAttemptException(Stage.SIGNAL, attempt.attendeeId(), attempt.companyId(),
        attempt.attemptId());
  }

  // ── Queries ─────────────────────────────────────────────────────

  public Optional<OutreachAttempt> find(long attendeeId, String wave) {
    return withConnection(Stage.CLASSIFY, attendeeId, conn -> attemptStore.find(conn, attendeeId, wave));
  }

  public Optional<OutreachAttempt> findById(String attemptId) {
    return withConnection(Stage.FOLLOW_UP, (Long) null,
        conn -> attemptStore.findById(conn, attemptId));
  }

  public List<OutreachAttempt> attemptsFor(long companyId, String wave) {
    return withConnection(Stage.CLASSIFY, (Long) null,
        conn -> attemptStore.queryByCompanyWave(conn, companyId, wave));
  }

  /**
   * Attempts whose follow-up is due as of {@code asOf}: awaiting a reply past their
   * eligibility time, or already marked due and not yet sent.
   */
  public List<OutreachAttempt> dueForFollowUp(Instant asOf, int limit) {
    return withConnection(Stage.FOLLOW_UP, (Long) null,
        conn -> attemptStore.queryDueForFollowUp(conn, asOf, limit));
  }

  public List<OutreachAttempt> pendingReview(int limit) {
    return withConnection(Stage.CLASSIFY, (Long) null,
        conn -> attemptStore.queryPendingReview(conn, limit));
  }

  // ── Persistence helpers ─────────────────────────────────────────

  private OutreachAttempt persist(OutreachAttempt current, OutreachAttempt next, Stage stage) {
    int updated = withConnection(stage, current, conn -> attemptStore.update(conn, next));
    if (updated != 1) {
      throw new StaleAttemptException(stage, current.attendeeId(), current.companyId(),
          current.attemptId());
    }
    return next;
  }

  private <T> T withConnection(Stage stage, OutreachAttempt attempt, StoreWork<T> work) {
    return withConnection(stage, attempt.attendeeId(), attempt.companyId(), work);
  }

  private <T> T withConnection(Stage stage, Long attendeeId, StoreWork<T> work) {
    return withConnection(stage, attendeeId, null, work);
  }

  /**
   * Runs {@code work} on a fresh connection. Connection failures and store failures are
   * reported separately; exceptions that already are {@link OutreachException}s pass
   * through unchanged.
   */
  private <T> T withConnection(Stage stage, Long attendeeId, Long companyId, StoreWork<T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      try {
        return work.run(conn);
      } catch (OutreachException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new OutreachException(stage, attendeeId, companyId,
            "Attempt store failed: " + e.getMessage(), e);
      }
    } catch (SQLException e) {
      throw new OutreachException(stage, attendeeId, companyId,
          "Failed to obtain or close connection", e);
    }
  }

  @FunctionalInterface
  private interface StoreWork<T> {
    T run(Connection conn);
  }

  /** Builder for {@link LifecycleTracker}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private AttemptStore attemptStore;
    private Duration followUpDelay = Duration.ofDays(7);
    private Clock clock;
    private MetricsExporter metrics;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder attemptStore(AttemptStore attemptStore) {
      this.attemptStore = attemptStore;
      return this;
    }

    /** Delay between a confirmed send and follow-up eligibility. Defaults to 7 days. */
    public Builder followUpDelay(Duration followUpDelay) {
      this.followUpDelay = followUpDelay;
      return this;
    }

    /** Defaults to the UTC system clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public LifecycleTracker build() {
      return new LifecycleTracker(this);
    }
  }
}
