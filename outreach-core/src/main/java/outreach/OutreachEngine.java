package outreach;

import outreach.budget.BudgetCalculator;
import outreach.budget.InMemoryBudgetStore;
import outreach.compose.ContentComposer;
import outreach.compose.FollowUpTemplate;
import outreach.compose.GroundingValidator;
import outreach.delivery.MessageSender;
import outreach.followup.FollowUpSweeper;
import outreach.lifecycle.LifecycleTracker;
import outreach.lifecycle.ReviewManager;
import outreach.model.CompanyBudget;
import outreach.model.OutreachAttempt;
import outreach.model.ReplySignal;
import outreach.signal.SignalPoller;
import outreach.spi.AttemptStore;
import outreach.spi.BudgetStore;
import outreach.spi.ConnectionProvider;
import outreach.spi.DeliveryService;
import outreach.spi.GenerationService;
import outreach.spi.MetricsExporter;
import outreach.spi.ResearchStore;
import outreach.spi.SignalFeed;
import outreach.wave.ClassifiedAttendee;
import outreach.wave.WavePipeline;
import outreach.wave.WaveReport;
import outreach.wave.WaveRunner;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the budget tracker, classifier, composer, lifecycle
 * tracker, follow-up sweeper and signal poller into one {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (OutreachEngine engine = OutreachEngine.builder()
 *     .connectionProvider(connectionProvider)
 *     .attemptStore(attemptStore)
 *     .researchStore(researchStore)
 *     .generationService(generationService)
 *     .deliveryService(deliveryService)
 *     .config(new OutreachConfig().setTrackingBcc("tracking@example.com"))
 *     .build()) {
 *   engine.start();
 *   WaveReport report = engine.runWave("2025-spring", companyIds);
 * }
 * }</pre>
 *
 * <p>{@link #start()} begins the scheduled follow-up sweep and, when a signal feed is
 * configured, the signal poller. Every operation is also callable directly.
 */
public final class OutreachEngine implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(OutreachEngine.class.getName());

  private final OutreachConfig config;
  private final LifecycleTracker tracker;
  private final ReviewManager reviewManager;
  private final ContentComposer composer;
  private final MessageSender sender;
  private final WavePipeline pipeline;
  private final WaveRunner runner;
  private final FollowUpSweeper sweeper;
  private final SignalPoller signalPoller;
  private final MetricsExporter metrics;

  private OutreachEngine(Builder builder) {
    ConnectionProvider connectionProvider =
        Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    AttemptStore attemptStore = Objects.requireNonNull(builder.attemptStore, "attemptStore");
    ResearchStore researchStore = Objects.requireNonNull(builder.researchStore, "researchStore");
    GenerationService generationService =
        Objects.requireNonNull(builder.generationService, "generationService");
    DeliveryService deliveryService =
        Objects.requireNonNull(builder.deliveryService, "deliveryService");
    this.config = builder.config != null ? builder.config : new OutreachConfig();
    if (config.getTrackingBcc() == null || config.getTrackingBcc().isBlank()) {
      throw new IllegalArgumentException("trackingBcc must be configured");
    }
    BudgetStore budgetStore = builder.budgetStore != null ? builder.budgetStore : new InMemoryBudgetStore();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();

    this.tracker = LifecycleTracker.builder()
        .connectionProvider(connectionProvider)
        .attemptStore(attemptStore)
        .followUpDelay(config.getFollowUpDelay())
        .clock(clock)
        .metrics(metrics)
        .build();
    this.reviewManager = new ReviewManager(tracker);
    this.composer = ContentComposer.builder()
        .generationService(generationService)
        .fitThreshold(config.getFitThreshold())
        .generationTimeout(config.getGenerationTimeout())
        .metrics(metrics)
        .build();
    this.sender = new MessageSender(deliveryService, config.getTrackingBcc(),
        config.getDeliveryTimeout());
    this.pipeline = WavePipeline.builder()
        .connectionProvider(connectionProvider)
        .researchStore(researchStore)
        .budgetStore(budgetStore)
        .budgetCalculator(new BudgetCalculator(config.getMaxContactsPerCompany()))
        .tracker(tracker)
        .composer(composer)
        .sender(sender)
        .metrics(metrics)
        .fitThreshold(config.getFitThreshold())
        .topTargetCount(config.getTopTargetCount())
        .build();
    this.runner = new WaveRunner(pipeline, config.getCompanyConcurrency(),
        config.getComposeConcurrency());
    this.sweeper = FollowUpSweeper.builder()
        .tracker(tracker)
        .researchStore(researchStore)
        .sender(sender)
        .template(new FollowUpTemplate(new GroundingValidator()))
        .metrics(metrics)
        .batchSize(config.getFollowUpBatchSize())
        .interval(config.getFollowUpSweepInterval())
        .build();
    this.signalPoller = builder.signalFeed == null ? null : SignalPoller.builder()
        .feed(builder.signalFeed)
        .tracker(tracker)
        .batchSize(config.getSignalBatchSize())
        .interval(config.getSignalPollInterval())
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Starts the follow-up sweep and, if configured, the signal poller. */
  public void start() {
    sweeper.start();
    if (signalPoller != null) {
      signalPoller.start();
    }
  }

  /**
   * Ranks, classifies and records attempts for every attendee of the company.
   *
   * @return (attendee, treatment) pairs in ranking order
   */
  public List<ClassifiedAttendee> classifyBatch(long companyId, String wave) {
    return pipeline.classifyBatch(companyId, wave);
  }

  public OutreachAttempt composeAndRecord(long attendeeId, String wave) {
    return pipeline.composeAndRecord(attendeeId, wave);
  }

  public OutreachAttempt sendAndRecord(long attendeeId, String wave) {
    return pipeline.sendAndRecord(attendeeId, wave);
  }

  public WaveReport runWave(String wave, List<Long> companyIds) {
    return runner.runWave(wave, companyIds);
  }

  public List<OutreachAttempt> dueForFollowUp(Instant asOf) {
    return tracker.dueForFollowUp(asOf, config.getFollowUpBatchSize());
  }

  /** Runs one follow-up sweep immediately. */
  public int sweepFollowUps(Instant asOf) {
    return sweeper.runOnce(asOf);
  }

  public List<OutreachAttempt> pendingReview() {
    return reviewManager.pendingReview(config.getFollowUpBatchSize());
  }

  public int applySignal(long attendeeId, ReplySignal signal, Instant at) {
    return tracker.applySignal(attendeeId, signal, at);
  }

  /** Pulls and applies pending signals now; no-op without a signal feed. */
  public int pollSignals() {
    return signalPoller == null ? 0 : signalPoller.poll();
  }

  public Optional<CompanyBudget> budgetUsage(long companyId, String wave) {
    return pipeline.budgetUsage(companyId, wave);
  }

  public Optional<OutreachAttempt> attempt(long attendeeId, String wave) {
    return tracker.find(attendeeId, wave);
  }

  public ReviewManager reviewManager() {
    return reviewManager;
  }

  public LifecycleTracker tracker() {
    return tracker;
  }

  /**
   * Shuts down in order: signal poller, follow-up sweeper, wave runner, sender, composer,
   * then the metrics exporter if it is closeable.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    for (AutoCloseable component : new AutoCloseable[]{
        signalPoller, sweeper, runner, sender, composer,
        metrics instanceof AutoCloseable closeable ? closeable : null}) {
      if (component == null) {
        continue;
      }
      try {
        component.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      logger.log(Level.WARNING, "Engine shutdown completed with errors", first);
      throw first;
    }
  }

  /** Builder for {@link OutreachEngine}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private AttemptStore attemptStore;
    private BudgetStore budgetStore;
    private ResearchStore researchStore;
    private GenerationService generationService;
    private DeliveryService deliveryService;
    private SignalFeed signalFeed;
    private OutreachConfig config;
    private MetricsExporter metrics;
    private Clock clock;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /**
     * <b>Required.</b>
     *
     * @param connectionProvider source of connections for attempt and budget updates
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder attemptStore(AttemptStore attemptStore) {
      this.attemptStore = attemptStore;
      return this;
    }

    /** Optional. Defaults to an {@link InMemoryBudgetStore}. */
    public Builder budgetStore(BudgetStore budgetStore) {
      this.budgetStore = budgetStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder researchStore(ResearchStore researchStore) {
      this.researchStore = researchStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder generationService(GenerationService generationService) {
      this.generationService = generationService;
      return this;
    }

    /** <b>Required.</b> */
    public Builder deliveryService(DeliveryService deliveryService) {
      this.deliveryService = deliveryService;
      return this;
    }

    /** Optional. Without a feed, signals are applied through {@link #applySignal} only. */
    public Builder signalFeed(SignalFeed signalFeed) {
      this.signalFeed = signalFeed;
      return this;
    }

    /**
     * Optional. Defaults to {@link OutreachConfig} defaults, which leave the tracking BCC
     * unset; building fails until it is configured.
     */
    public Builder config(OutreachConfig config) {
      this.config = config;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to the UTC system clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * @throws NullPointerException     if a required component is missing
     * @throws IllegalArgumentException if the tracking BCC is not configured
     * @throws IllegalStateException    if called twice
     */
    public OutreachEngine build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new OutreachEngine(this);
    }
  }
}
