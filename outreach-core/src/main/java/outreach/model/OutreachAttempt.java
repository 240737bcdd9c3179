package outreach.model;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Objects;

/**
 * One outreach attempt per (attendee, wave). Rows are never deleted; re-enrollment
 * creates a new attempt in a later wave.
 *
 * <p>Instances are immutable. State changes go through
 * {@link outreach.lifecycle.LifecycleTracker}, which produces a new instance with an
 * incremented {@link #version()} and persists it with an optimistic check.
 */
public record OutreachAttempt(
    String attemptId,
    long attendeeId,
    long companyId,
    String wave,
    Treatment treatment,
    int companyContacts,
    AttemptState state,
    GenerationStatus generationStatus,
    SendStatus sendStatus,
    String deliveryId,
    Instant sentAt,
    ReplySignal replySignal,
    Instant signalAt,
    Instant followUpEligibleAt,
    Instant followUpClaimedAt,
    boolean followUpSent,
    Instant followUpSentAt,
    GeneratedMessage message,
    String lastError,
    Stage failedStage,
    int version,
    Instant createdAt,
    Instant updatedAt
) {

  public OutreachAttempt {
    Objects.requireNonNull(attemptId, "attemptId");
    Objects.requireNonNull(wave, "wave");
    Objects.requireNonNull(treatment, "treatment");
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(generationStatus, "generationStatus");
    Objects.requireNonNull(sendStatus, "sendStatus");
    Objects.requireNonNull(replySignal, "replySignal");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(updatedAt, "updatedAt");
  }

  /**
   * Creates the attempt recorded when a batch is classified. Suppressed treatments start
   * (and stay) in {@link AttemptState#SUPPRESSED}; everything else starts PENDING.
   *
   * @param attendee        the classified attendee
   * @param wave            campaign wave
   * @param treatment       assigned treatment
   * @param companyContacts number of non-suppressed attendees at the company in the wave
   * @param now             creation time
   * @return a new attempt with a fresh ULID
   */
  public static OutreachAttempt create(AttendeeRecord attendee, String wave, Treatment treatment,
      int companyContacts, Instant now) {
    return create(attendee.id(), attendee.companyId(), wave, treatment, companyContacts, now);
  }

  public static OutreachAttempt create(long attendeeId, long companyId, String wave,
      Treatment treatment, int companyContacts, Instant now) {
    AttemptState initial = treatment.isSuppressed() ? AttemptState.SUPPRESSED : AttemptState.PENDING;
    return new OutreachAttempt(
        UlidCreator.getMonotonicUlid().toString(),
        attendeeId, companyId, wave, treatment, companyContacts,
        initial, GenerationStatus.PENDING, SendStatus.NOT_SENT, null, null,
        ReplySignal.NONE, null, null, null, false, null, null, null, null,
        0, now, now);
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  /**
   * Copy-on-write builder used to derive the next version of an attempt.
   * {@link #build()} increments the version.
   */
  public static final class Builder {
    private final OutreachAttempt base;
    private Treatment treatment;
    private int companyContacts;
    private AttemptState state;
    private GenerationStatus generationStatus;
    private SendStatus sendStatus;
    private String deliveryId;
    private Instant sentAt;
    private ReplySignal replySignal;
    private Instant signalAt;
    private Instant followUpEligibleAt;
    private Instant followUpClaimedAt;
    private boolean followUpSent;
    private Instant followUpSentAt;
    private GeneratedMessage message;
    private String lastError;
    private Stage failedStage;
    private Instant updatedAt;

    private Builder(OutreachAttempt base) {
      this.base = base;
      this.treatment = base.treatment;
      this.companyContacts = base.companyContacts;
      this.state = base.state;
      this.generationStatus = base.generationStatus;
      this.sendStatus = base.sendStatus;
      this.deliveryId = base.deliveryId;
      this.sentAt = base.sentAt;
      this.replySignal = base.replySignal;
      this.signalAt = base.signalAt;
      this.followUpEligibleAt = base.followUpEligibleAt;
      this.followUpClaimedAt = base.followUpClaimedAt;
      this.followUpSent = base.followUpSent;
      this.followUpSentAt = base.followUpSentAt;
      this.message = base.message;
      this.lastError = base.lastError;
      this.failedStage = base.failedStage;
      this.updatedAt = base.updatedAt;
    }

    public Builder treatment(Treatment treatment) {
      this.treatment = treatment;
      return this;
    }

    public Builder companyContacts(int companyContacts) {
      this.companyContacts = companyContacts;
      return this;
    }

    public Builder state(AttemptState state) {
      this.state = state;
      return this;
    }

    public Builder generationStatus(GenerationStatus generationStatus) {
      this.generationStatus = generationStatus;
      return this;
    }

    public Builder sendStatus(SendStatus sendStatus) {
      this.sendStatus = sendStatus;
      return this;
    }

    public Builder deliveryId(String deliveryId) {
      this.deliveryId = deliveryId;
      return this;
    }

    public Builder sentAt(Instant sentAt) {
      this.sentAt = sentAt;
      return this;
    }

    public Builder replySignal(ReplySignal replySignal, Instant signalAt) {
      this.replySignal = replySignal;
      this.signalAt = signalAt;
      return this;
    }

    public Builder followUpEligibleAt(Instant followUpEligibleAt) {
      this.followUpEligibleAt = followUpEligibleAt;
      return this;
    }

    public Builder followUpClaimedAt(Instant followUpClaimedAt) {
      this.followUpClaimedAt = followUpClaimedAt;
      return this;
    }

    public Builder followUpSent(Instant followUpSentAt) {
      this.followUpSent = followUpSentAt != null;
      this.followUpSentAt = followUpSentAt;
      return this;
    }

    public Builder message(GeneratedMessage message) {
      this.message = message;
      return this;
    }

    public Builder error(Stage stage, String error) {
      this.failedStage = stage;
      this.lastError = error;
      return this;
    }

    public Builder clearError() {
      this.failedStage = null;
      this.lastError = null;
      return this;
    }

    public Builder updatedAt(Instant updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    public OutreachAttempt build() {
      return new OutreachAttempt(base.attemptId, base.attendeeId, base.companyId, base.wave,
          treatment, companyContacts, state, generationStatus, sendStatus, deliveryId, sentAt,
          replySignal, signalAt, followUpEligibleAt, followUpClaimedAt, followUpSent,
          followUpSentAt, message, lastError, failedStage, base.version + 1,
          base.createdAt, updatedAt);
    }
  }
}
