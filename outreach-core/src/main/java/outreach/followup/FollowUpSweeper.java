package outreach.followup;

import outreach.DeliveryException;
import outreach.InvalidTransitionException;
import outreach.OutreachException;
import outreach.StaleAttemptException;
import outreach.compose.FollowUpTemplate;
import outreach.delivery.MessageSender;
import outreach.lifecycle.LifecycleTracker;
import outreach.model.AttemptState;
import outreach.model.AttendeeRecord;
import outreach.model.CompanyRecord;
import outreach.model.GeneratedMessage;
import outreach.model.OutreachAttempt;
import outreach.model.Stage;
import outreach.spi.MetricsExporter;
import outreach.spi.ResearchStore;
import outreach.util.DaemonThreadFactory;
import outreach.util.DefaultInFlightTracker;
import outreach.util.InFlightTracker;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic sweep that sends the single follow-up of every attempt whose reply window
 * expired.
 *
 * <p>Each due attempt is first marked FOLLOW_UP_DUE, then claimed by stamping its claim
 * time through a versioned update, and only then delivered. A claimed attempt is skipped
 * by later sweeps, so re-running a sweep before the transport confirms never sends twice.
 * A definite delivery failure releases the claim for the next sweep; an unknown outcome
 * keeps it and leaves the attempt for review.
 *
 * <p>{@link #start()} schedules the sweep on a daemon thread; {@link #runOnce(Instant)}
 * may be called directly.
 */
public final class FollowUpSweeper implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(FollowUpSweeper.class.getName());

  private final LifecycleTracker tracker;
  private final ResearchStore researchStore;
  private final MessageSender sender;
  private final FollowUpTemplate template;
  private final InFlightTracker inFlight;
  private final MetricsExporter metrics;
  private final int batchSize;
  private final Duration interval;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> sweepTask;
  private volatile boolean closed;

  private FollowUpSweeper(Builder builder) {
    this.tracker = Objects.requireNonNull(builder.tracker, "tracker");
    this.researchStore = Objects.requireNonNull(builder.researchStore, "researchStore");
    this.sender = Objects.requireNonNull(builder.sender, "sender");
    this.template = Objects.requireNonNull(builder.template, "template");
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.interval == null || builder.interval.isZero() || builder.interval.isNegative()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    this.batchSize = builder.batchSize;
    this.interval = builder.interval;
    this.inFlight = builder.inFlight != null ? builder.inFlight : new DefaultInFlightTracker();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Starts the scheduled sweep. Subsequent calls are no-ops if already started. */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("FollowUpSweeper has been closed");
    }
    if (sweepTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("outreach-followup-"));
    long millis = interval.toMillis();
    sweepTask = scheduler.scheduleWithFixedDelay(this::runScheduled, millis, millis,
        TimeUnit.MILLISECONDS);
  }

  private void runScheduled() {
    try {
      runOnce(tracker.now());
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Follow-up sweep failed", t);
    }
  }

  /**
   * Sends follow-ups for attempts due as of {@code asOf}.
   *
   * @return number of follow-ups sent in this sweep
   */
  public int runOnce(Instant asOf) {
    if (closed) {
      return 0;
    }
    List<OutreachAttempt> due = tracker.dueForFollowUp(asOf, batchSize);
    int sent = 0;
    int pending = 0;
    for (OutreachAttempt attempt : due) {
      if (!inFlight.tryAcquire(attempt.attemptId())) {
        continue;
      }
      try {
        if (process(attempt)) {
          sent++;
        } else {
          pending++;
        }
      } catch (OutreachException e) {
        pending++;
        logger.log(Level.WARNING, "Follow-up for attempt " + attempt.attemptId() + " failed", e);
      } finally {
        inFlight.release(attempt.attemptId());
      }
    }
    metrics.recordFollowUpBacklog(pending);
    if (sent > 0) {
      logger.log(Level.INFO, "Sent {0} follow-ups as of {1}", new Object[]{sent, asOf});
    }
    return sent;
  }

  private boolean process(OutreachAttempt attempt) {
    OutreachAttempt current = attempt;
    if (current.state() == AttemptState.AWAITING_REPLY) {
      try {
        current = tracker.markFollowUpDue(current);
      } catch (StaleAttemptException e) {
        logger.log(Level.FINE, "Attempt {0} changed before it was marked due", attempt.attemptId());
        return false;
      }
    }
    if (current.followUpClaimedAt() != null) {
      return false;
    }
    Optional<OutreachAttempt> claimed = tracker.claimFollowUp(current);
    if (claimed.isEmpty()) {
      return false;
    }
    current = claimed.get();

    AttendeeRecord attendee = researchStore.getAttendee(current.attendeeId())
        .orElseThrow(() -> missing(attempt, "attendee"));
    CompanyRecord company = researchStore.getCompany(current.companyId())
        .orElseThrow(() -> missing(attempt, "company"));
    GeneratedMessage message = template.render(attendee.firstName(), company.name());

    try {
      sender.send(Stage.FOLLOW_UP, attendee.id(), company.id(), attendee.email(), message);
    } catch (DeliveryException e) {
      if (e.definite()) {
        tracker.releaseFollowUpClaim(current, e.getMessage());
      } else {
        tracker.recordFollowUpUnconfirmed(current, e.getMessage());
      }
      metrics.incrementDeliveryFailure();
      logger.log(Level.WARNING, "Follow-up delivery failed for attempt " + current.attemptId(), e);
      return false;
    }

    try {
      tracker.recordFollowUpSent(current, tracker.now());
    } catch (InvalidTransitionException | StaleAttemptException e) {
      // a reply landed between claim and send
      logger.log(Level.WARNING, "Follow-up for attempt " + current.attemptId()
          + " was delivered but the attempt moved on", e);
    }
    return true;
  }

  private static OutreachException missing(OutreachAttempt attempt, String what) {
    return new OutreachException(Stage.FOLLOW_UP, attempt.attendeeId(), attempt.companyId(),
        "Research store has no " + what + " for attempt " + attempt.attemptId());
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (sweepTask != null) {
      sweepTask.cancel(false);
      sweepTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link FollowUpSweeper}. */
  public static final class Builder {
    private LifecycleTracker tracker;
    private ResearchStore researchStore;
    private MessageSender sender;
    private FollowUpTemplate template;
    private InFlightTracker inFlight;
    private MetricsExporter metrics;
    private int batchSize = 100;
    private Duration interval = Duration.ofMinutes(15);

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder tracker(LifecycleTracker tracker) {
      this.tracker = tracker;
      return this;
    }

    /** <b>Required.</b> */
    public Builder researchStore(ResearchStore researchStore) {
      this.researchStore = researchStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder sender(MessageSender sender) {
      this.sender = sender;
      return this;
    }

    /** <b>Required.</b> */
    public Builder template(FollowUpTemplate template) {
      this.template = template;
      return this;
    }

    /** Defaults to a {@link DefaultInFlightTracker} without expiry. */
    public Builder inFlightTracker(InFlightTracker inFlight) {
      this.inFlight = inFlight;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Maximum attempts handled per sweep. Defaults to {@code 100}. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Delay between sweeps. Defaults to 15 minutes. */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    public FollowUpSweeper build() {
      return new FollowUpSweeper(this);
    }
  }
}
