package outreach.wave;

import outreach.DeliveryException;
import outreach.GenerationException;
import outreach.InvalidInputException;
import outreach.InvalidTransitionException;
import outreach.OutreachException;
import outreach.UngroundedClaimException;
import outreach.budget.BudgetCalculator;
import outreach.classify.TopTargets;
import outreach.classify.TreatmentClassifier;
import outreach.compose.ContentComposer;
import outreach.delivery.MessageSender;
import outreach.lifecycle.LifecycleTracker;
import outreach.model.AttemptState;
import outreach.model.AttendeeRecord;
import outreach.model.CompanyBudget;
import outreach.model.CompanyRecord;
import outreach.model.GeneratedMessage;
import outreach.model.OutreachAttempt;
import outreach.model.SendStatus;
import outreach.model.Stage;
import outreach.model.Treatment;
import outreach.spi.BudgetStore;
import outreach.spi.ConnectionProvider;
import outreach.spi.MetricsExporter;
import outreach.spi.ResearchStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-company and per-attendee steps of a wave: classify, compose, send.
 *
 * <p>Each step reads the attempt's current state first, so re-running a step for an
 * attendee that already moved past it returns the stored attempt unchanged.
 */
public final class WavePipeline {
  private static final Logger logger = Logger.getLogger(WavePipeline.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ResearchStore researchStore;
  private final BudgetStore budgetStore;
  private final BudgetCalculator budgetCalculator;
  private final LifecycleTracker tracker;
  private final ContentComposer composer;
  private final MessageSender sender;
  private final MetricsExporter metrics;
  private final int fitThreshold;
  private final int topTargetCount;
  private final Map<String, TopTargets> topTargetsByWave = new ConcurrentHashMap<>();

  private WavePipeline(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.researchStore = Objects.requireNonNull(builder.researchStore, "researchStore");
    this.budgetStore = Objects.requireNonNull(builder.budgetStore, "budgetStore");
    this.budgetCalculator = Objects.requireNonNull(builder.budgetCalculator, "budgetCalculator");
    this.tracker = Objects.requireNonNull(builder.tracker, "tracker");
    this.composer = Objects.requireNonNull(builder.composer, "composer");
    this.sender = Objects.requireNonNull(builder.sender, "sender");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.fitThreshold = builder.fitThreshold;
    this.topTargetCount = builder.topTargetCount;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Ranks the company's roster, classifies every attendee and records one attempt per
   * attendee for the wave.
   *
   * <p>The budget is computed once per (company, wave) and stored; later runs reuse the
   * stored ranking and cap. Attempts that are still PENDING take the new classification,
   * attempts that moved on keep theirs.
   *
   * @return treatments in ranking order
   * @throws InvalidInputException if the company is unknown
   */
  public List<ClassifiedAttendee> classifyBatch(long companyId, String wave) {
    Objects.requireNonNull(wave, "wave");
    CompanyRecord company = researchStore.getCompany(companyId)
        .orElseThrow(() -> new InvalidInputException(Stage.CLASSIFY, null, companyId,
            "Unknown company"));
    List<AttendeeRecord> attendees = new ArrayList<>(researchStore.getAttendees(companyId));
    if (attendees.isEmpty()) {
      logger.log(Level.FINE, "Company {0} has no attendees", companyId);
      return List.of();
    }
    CompanyBudget budget = storeBudget(budgetCalculator.computeBudget(companyId, attendees, wave));
    TreatmentClassifier classifier = TreatmentClassifier.standard(fitThreshold, topTargets(wave));

    attendees.sort(BudgetCalculator.RANKING);
    List<ClassifiedAttendee> result = new ArrayList<>(attendees.size());
    int contacts = 0;
    for (AttendeeRecord attendee : attendees) {
      Treatment treatment = classifier.classify(attendee, company, budget.rankOf(attendee.id()));
      result.add(new ClassifiedAttendee(attendee.id(), treatment));
      metrics.incrementClassified(treatment.kind());
      if (!treatment.isSuppressed()) {
        contacts++;
      }
    }
    for (ClassifiedAttendee row : result) {
      record(companyId, wave, row, contacts);
    }
    logger.log(Level.FINE, "Classified {0} attendees of company {1} for wave {2} ({3} contacts)",
        new Object[]{result.size(), companyId, wave, contacts});
    return result;
  }

  private void record(long companyId, String wave, ClassifiedAttendee row, int contacts) {
    Optional<OutreachAttempt> existing = tracker.find(row.attendeeId(), wave);
    if (existing.isPresent()) {
      tracker.reclassify(existing.get(), row.treatment(), contacts);
    } else {
      tracker.recordClassified(OutreachAttempt.create(row.attendeeId(), companyId, wave,
          row.treatment(), contacts, tracker.now()));
    }
  }

  private CompanyBudget storeBudget(CompanyBudget budget) {
    return withConnection(Stage.CLASSIFY, null, budget.companyId(), "save budget",
        conn -> budgetStore.saveIfAbsent(conn, budget));
  }

  /** The wave's global top targets, resolved on first use and fixed for the wave. */
  public TopTargets topTargets(String wave) {
    return topTargetsByWave.computeIfAbsent(wave,
        w -> TopTargets.of(researchStore.topCompanyIds(topTargetCount)));
  }

  /**
   * Composes and validates the message of a PENDING attempt and records the outcome.
   * Grounding and generation failures mark the attempt FAILED instead of propagating.
   *
   * @return the updated attempt
   * @throws InvalidInputException if the attendee was not classified for the wave
   */
  public OutreachAttempt composeAndRecord(long attendeeId, String wave) {
    OutreachAttempt attempt = requireAttempt(attendeeId, wave, Stage.COMPOSE);
    if (attempt.state() != AttemptState.PENDING) {
      return attempt;
    }
    AttendeeRecord attendee = requireAttendee(attendeeId, attempt.companyId(), Stage.COMPOSE);
    CompanyRecord company = requireCompany(attempt, Stage.COMPOSE);
    try {
      GeneratedMessage message = composer.compose(attendee, company, attempt.treatment(),
          attempt.companyContacts());
      return tracker.recordGenerated(attempt, message);
    } catch (UngroundedClaimException | GenerationException e) {
      logger.log(Level.WARNING, "Composition failed, holding attempt for review", e);
      return tracker.recordFailed(attempt, Stage.COMPOSE, e.getMessage());
    }
  }

  /**
   * Delivers the message of a GENERATED attempt.
   *
   * <p>One budget unit is consumed before delivery. When the budget is used up the
   * attempt is suppressed. A definite delivery failure returns the unit and leaves the
   * attempt GENERATED with status ERROR; an unknown outcome keeps the unit and sets
   * UNCONFIRMED. Either way the attempt is listed for review. An UNCONFIRMED attempt is
   * never delivered again by this method; it is returned unchanged until a reviewer
   * re-enrolls it.
   *
   * @return the updated attempt
   * @throws InvalidTransitionException if the attempt has not been generated
   */
  public OutreachAttempt sendAndRecord(long attendeeId, String wave) {
    OutreachAttempt attempt = requireAttempt(attendeeId, wave, Stage.SEND);
    if (attempt.state().isSent()) {
      return attempt;
    }
    if (attempt.state() != AttemptState.GENERATED) {
      throw new InvalidTransitionException(Stage.SEND, attendeeId, attempt.companyId(),
          attempt.state(), AttemptState.SENT);
    }
    if (attempt.sendStatus() == SendStatus.UNCONFIRMED) {
      logger.log(Level.FINE, "Attempt {0} has an unconfirmed delivery, leaving it for review",
          attempt.attemptId());
      return attempt;
    }
    AttendeeRecord attendee = requireAttendee(attendeeId, attempt.companyId(), Stage.SEND);
    if (!consume(attempt)) {
      logger.log(Level.INFO, "Budget of company {0} used up, suppressing attendee {1}",
          new Object[]{attempt.companyId(), attendeeId});
      return tracker.recordBudgetRejected(attempt);
    }
    try {
      String deliveryId = sender.send(Stage.SEND, attendeeId, attempt.companyId(),
          attendee.email(), attempt.message());
      return tracker.recordSent(attempt, deliveryId, tracker.now());
    } catch (DeliveryException e) {
      logger.log(Level.WARNING, "Delivery failed, holding attempt for review", e);
      if (e.definite()) {
        release(attempt);
        return tracker.recordSendError(attempt, SendStatus.ERROR, e.getMessage());
      }
      return tracker.recordSendError(attempt, SendStatus.UNCONFIRMED, e.getMessage());
    }
  }

  /** Consumed versus cap for the company in the wave. */
  public Optional<CompanyBudget> budgetUsage(long companyId, String wave) {
    return withConnection(Stage.SEND, null, companyId, "read budget",
        conn -> budgetStore.find(conn, companyId, wave));
  }

  private boolean consume(OutreachAttempt attempt) {
    return withConnection(Stage.SEND, attempt.attendeeId(), attempt.companyId(), "consume budget",
        conn -> budgetStore.tryConsume(conn, attempt.companyId(), attempt.wave(), 1));
  }

  private void release(OutreachAttempt attempt) {
    try {
      withConnection(Stage.SEND, attempt.attendeeId(), attempt.companyId(), "return budget",
          conn -> {
            budgetStore.release(conn, attempt.companyId(), attempt.wave(), 1);
            return null;
          });
    } catch (OutreachException e) {
      logger.log(Level.SEVERE, "Failed to return budget unit for company " + attempt.companyId(), e);
    }
  }

  private <T> T withConnection(Stage stage, Long attendeeId, long companyId, String operation,
      BudgetWork<T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      try {
        return work.run(conn);
      } catch (OutreachException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new OutreachException(stage, attendeeId, companyId,
            "Budget store failed to " + operation + ": " + e.getMessage(), e);
      }
    } catch (SQLException e) {
      throw new OutreachException(stage, attendeeId, companyId,
          "Failed to obtain or close connection", e);
    }
  }

  @FunctionalInterface
  private interface BudgetWork<T> {
    T run(Connection conn);
  }

  private OutreachAttempt requireAttempt(long attendeeId, String wave, Stage stage) {
    return tracker.find(attendeeId, wave)
        .orElseThrow(() -> new InvalidInputException(stage, attendeeId, null,
            "Attendee was not classified for wave " + wave));
  }

  private AttendeeRecord requireAttendee(long attendeeId, long companyId, Stage stage) {
    return researchStore.getAttendee(attendeeId)
        .orElseThrow(() -> new InvalidInputException(stage, attendeeId, companyId,
            "Unknown attendee"));
  }

  private CompanyRecord requireCompany(OutreachAttempt attempt, Stage stage) {
    return researchStore.getCompany(attempt.companyId())
        .orElseThrow(() -> new InvalidInputException(stage, attempt.attendeeId(),
            attempt.companyId(), "Unknown company"));
  }

  /** Builder for {@link WavePipeline}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private ResearchStore researchStore;
    private BudgetStore budgetStore;
    private BudgetCalculator budgetCalculator;
    private LifecycleTracker tracker;
    private ContentComposer composer;
    private MessageSender sender;
    private MetricsExporter metrics;
    private int fitThreshold = 50;
    private int topTargetCount = 50;

    private Builder() {
    }

    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    public Builder researchStore(ResearchStore researchStore) {
      this.researchStore = researchStore;
      return this;
    }

    public Builder budgetStore(BudgetStore budgetStore) {
      this.budgetStore = budgetStore;
      return this;
    }

    public Builder budgetCalculator(BudgetCalculator budgetCalculator) {
      this.budgetCalculator = budgetCalculator;
      return this;
    }

    public Builder tracker(LifecycleTracker tracker) {
      this.tracker = tracker;
      return this;
    }

    public Builder composer(ContentComposer composer) {
      this.composer = composer;
      return this;
    }

    public Builder sender(MessageSender sender) {
      this.sender = sender;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder fitThreshold(int fitThreshold) {
      this.fitThreshold = fitThreshold;
      return this;
    }

    public Builder topTargetCount(int topTargetCount) {
      this.topTargetCount = topTargetCount;
      return this;
    }

    public WavePipeline build() {
      return new WavePipeline(this);
    }
  }
}
