package outreach.spi;

import outreach.model.TreatmentKind;

/**
 * Observability hook for exporting engine counters and gauges.
 *
 * <p>{@link #NOOP} discards everything.
 *
 * @see outreach.micrometer.MicrometerMetricsExporter
 */
public interface MetricsExporter {

  MetricsExporter NOOP = new Noop();

  /** Counts one classification result. */
  void incrementClassified(TreatmentKind kind);

  void incrementGenerated();

  /** A generated message failed grounding validation (counted per attempt, not per retry). */
  void incrementValidationFailure();

  void incrementGenerationFailure();

  void incrementSent();

  void incrementDeliveryFailure();

  /** A send was refused because the company's budget was already used up. */
  void incrementBudgetRejected();

  void incrementFollowUpSent();

  void incrementSignalApplied();

  /**
   * Records how many attempts were due for follow-up at the end of a sweep.
   *
   * @param due number of due attempts
   */
  default void recordFollowUpBacklog(int due) {
  }

  /** No-op implementation. */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementClassified(TreatmentKind kind) {
    }

    @Override
    public void incrementGenerated() {
    }

    @Override
    public void incrementValidationFailure() {
    }

    @Override
    public void incrementGenerationFailure() {
    }

    @Override
    public void incrementSent() {
    }

    @Override
    public void incrementDeliveryFailure() {
    }

    @Override
    public void incrementBudgetRejected() {
    }

    @Override
    public void incrementFollowUpSent() {
    }

    @Override
    public void incrementSignalApplied() {
    }
  }
}
