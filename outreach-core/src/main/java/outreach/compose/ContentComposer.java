package outreach.compose;

import outreach.GenerationException;
import outreach.SuppressedTreatmentException;
import outreach.UngroundedClaimException;
import outreach.model.AttendeeRecord;
import outreach.model.CompanyRecord;
import outreach.model.GeneratedMessage;
import outreach.model.GroundingIssue;
import outreach.model.GroundingVerdict;
import outreach.model.Treatment;
import outreach.model.TreatmentKind;
import outreach.spi.GenerationService;
import outreach.spi.MetricsExporter;
import outreach.util.DaemonThreadFactory;
import outreach.util.TimeoutCalls;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns a non-suppressed treatment into a validated {@link GeneratedMessage}.
 *
 * <p>The generation service receives only the {@link FactPayload} for the attendee. Its
 * output gets the disclosure line enforced and is then validated by
 * {@link GroundingValidator}; validation cannot be skipped. A rejected or failed first
 * attempt is retried once in strict mode. When the retry fails too, the composer throws
 * and nothing unverified leaves it.
 *
 * <p>Each generation call runs on the composer's own daemon threads under
 * {@code generationTimeout}. Follow-up treatments use {@link FollowUpTemplate} and make
 * no generation call.
 *
 * <p>Create instances via {@link #builder()}. Thread-safe.
 */
public final class ContentComposer implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ContentComposer.class.getName());

  private static final int MAX_ATTEMPTS = 2;

  private final GenerationService generationService;
  private final GroundingValidator validator;
  private final FollowUpTemplate followUpTemplate;
  private final MetricsExporter metrics;
  private final int fitThreshold;
  private final Duration generationTimeout;
  private final ExecutorService executor;

  private ContentComposer(Builder builder) {
    this.generationService = Objects.requireNonNull(builder.generationService, "generationService");
    if (builder.fitThreshold < 0 || builder.fitThreshold > 100) {
      throw new IllegalArgumentException("fitThreshold must be in [0, 100]");
    }
    if (builder.generationTimeout.isZero() || builder.generationTimeout.isNegative()) {
      throw new IllegalArgumentException("generationTimeout must be > 0");
    }
    this.validator = new GroundingValidator();
    this.followUpTemplate = new FollowUpTemplate(validator);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.fitThreshold = builder.fitThreshold;
    this.generationTimeout = builder.generationTimeout;
    this.executor = Executors.newCachedThreadPool(new DaemonThreadFactory("outreach-generate-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Composes and validates a message.
   *
   * @param attendee        recipient
   * @param company         recipient's company
   * @param treatment       assigned treatment, must not be suppressed
   * @param companyContacts number of people at the company contacted in this wave; the
   *                        disclosure line is included iff this is greater than one
   * @return a grounded message
   * @throws SuppressedTreatmentException if {@code treatment} is suppressed
   * @throws UngroundedClaimException     if both attempts produced ungrounded content
   * @throws GenerationException          if the last attempt failed or timed out
   */
  public GeneratedMessage compose(AttendeeRecord attendee, CompanyRecord company,
      Treatment treatment, int companyContacts) {
    Objects.requireNonNull(attendee, "attendee");
    Objects.requireNonNull(company, "company");
    Objects.requireNonNull(treatment, "treatment");
    if (treatment.isSuppressed()) {
      throw new SuppressedTreatmentException(attendee.id(), company.id(), treatment);
    }
    if (treatment.kind() == TreatmentKind.FOLLOW_UP) {
      return followUp(attendee, company);
    }

    TemplateFamily family = TemplateFamily.forTreatment(treatment.kind());
    FactPayload payload = FactPayload.of(attendee, company, family, fitThreshold);
    List<String> rejection = List.of();
    GroundingVerdict lastVerdict = null;
    Throwable lastFailure = null;

    for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
      boolean strict = attempt > 1;
      GenerationRequest request = new GenerationRequest(family, payload, strict, rejection);
      GenerationResult result;
      try {
        result = callService(request);
      } catch (TimeoutException e) {
        lastFailure = e;
        lastVerdict = null;
        rejection = List.of("previous attempt timed out");
        logger.log(Level.WARNING, "Generation timed out for attendee {0} (attempt {1})",
            new Object[]{attendee.id(), attempt});
        continue;
      } catch (ExecutionException e) {
        lastFailure = TimeoutCalls.unwrap(e);
        lastVerdict = null;
        rejection = List.of("previous attempt failed");
        logger.log(Level.WARNING, "Generation failed for attendee " + attendee.id()
            + " (attempt " + attempt + ")", lastFailure);
        continue;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new GenerationException(attendee.id(), company.id(), "Interrupted", e);
      }

      String body = Disclosure.apply(nullToEmpty(result.body()), company.name(), companyContacts);
      String subject = nullToEmpty(result.subject()).strip();
      GroundingVerdict verdict = validator.validate(subject, body, result.claimedFacts(), payload);
      if (verdict.grounded()) {
        metrics.incrementGenerated();
        return new GeneratedMessage(subject, body, result.claimedFacts(), verdict);
      }
      lastVerdict = verdict;
      lastFailure = null;
      rejection = describe(verdict);
      logger.log(Level.INFO, "Rejected generated content for attendee {0} (attempt {1}): {2}",
          new Object[]{attendee.id(), attempt, verdict.describe()});
    }

    if (lastVerdict != null) {
      metrics.incrementValidationFailure();
      throw new UngroundedClaimException(attendee.id(), company.id(), lastVerdict);
    }
    metrics.incrementGenerationFailure();
    throw new GenerationException(attendee.id(), company.id(),
        "Generation failed after " + MAX_ATTEMPTS + " attempts", lastFailure);
  }

  /** Renders the fixed follow-up for the attendee. */
  public GeneratedMessage followUp(AttendeeRecord attendee, CompanyRecord company) {
    return followUpTemplate.render(attendee.firstName(), company.name());
  }

  private GenerationResult callService(GenerationRequest request)
      throws TimeoutException, ExecutionException, InterruptedException {
    GenerationResult result = TimeoutCalls.call(executor, generationTimeout,
        () -> generationService.generate(request));
    if (result == null) {
      throw new ExecutionException("Generation service returned no result", null);
    }
    return result;
  }

  private static List<String> describe(GroundingVerdict verdict) {
    List<String> reasons = new ArrayList<>();
    for (GroundingIssue issue : verdict.issues()) {
      reasons.add(issue.toString());
    }
    return reasons;
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  /** Stops the generation threads, interrupting calls still in flight. */
  @Override
  public void close() {
    executor.shutdownNow();
    try {
      executor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link ContentComposer}. */
  public static final class Builder {
    private GenerationService generationService;
    private MetricsExporter metrics;
    private int fitThreshold = 50;
    private Duration generationTimeout = Duration.ofSeconds(30);

    private Builder() {
    }

    /**
     * <b>Required.</b>
     */
    public Builder generationService(GenerationService generationService) {
      this.generationService = generationService;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Defaults to {@code 50}. */
    public Builder fitThreshold(int fitThreshold) {
      this.fitThreshold = fitThreshold;
      return this;
    }

    /** Defaults to 30 seconds. Must be positive. */
    public Builder generationTimeout(Duration generationTimeout) {
      this.generationTimeout = Objects.requireNonNull(generationTimeout, "generationTimeout");
      return this;
    }

    public ContentComposer build() {
      return new ContentComposer(this);
    }
  }
}
