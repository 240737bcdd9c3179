package outreach.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import outreach.model.TreatmentKind;
import outreach.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code outreach.classified} tagged {@code treatment}: classification results</li>
 *   <li>{@code outreach.generation.success}: messages that passed grounding</li>
 *   <li>{@code outreach.generation.ungrounded}: attempts rejected by the grounding validator</li>
 *   <li>{@code outreach.generation.failure}: generation service errors and timeouts</li>
 *   <li>{@code outreach.send.success}: messages handed to the delivery service</li>
 *   <li>{@code outreach.send.failure}: delivery errors, confirmed or not</li>
 *   <li>{@code outreach.send.budget.rejected}: sends refused by a spent company budget</li>
 *   <li>{@code outreach.followup.sent}: follow-ups delivered</li>
 *   <li>{@code outreach.signal.applied}: reply and claim signals applied</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code outreach.followup.backlog}: attempts due for follow-up after the last sweep</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Map<TreatmentKind, Counter> classified = new EnumMap<>(TreatmentKind.class);
  private final Counter generated;
  private final Counter validationFailure;
  private final Counter generationFailure;
  private final Counter sent;
  private final Counter deliveryFailure;
  private final Counter budgetRejected;
  private final Counter followUpSent;
  private final Counter signalApplied;
  private final Gauge backlogGauge;

  private final AtomicInteger backlog = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "outreach"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "outreach");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "expo.outreach"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    for (TreatmentKind kind : TreatmentKind.values()) {
      classified.put(kind, Counter.builder(namePrefix + ".classified")
          .tag("treatment", kind.name().toLowerCase(Locale.ROOT))
          .description("Attendees classified, by treatment")
          .register(registry));
    }
    this.generated = counter(namePrefix + ".generation.success", "Messages that passed grounding");
    this.validationFailure = counter(namePrefix + ".generation.ungrounded",
        "Generation attempts rejected by grounding validation");
    this.generationFailure = counter(namePrefix + ".generation.failure",
        "Generation service errors and timeouts");
    this.sent = counter(namePrefix + ".send.success", "Messages handed to the delivery service");
    this.deliveryFailure = counter(namePrefix + ".send.failure", "Delivery errors");
    this.budgetRejected = counter(namePrefix + ".send.budget.rejected",
        "Sends refused because the company budget was spent");
    this.followUpSent = counter(namePrefix + ".followup.sent", "Follow-ups delivered");
    this.signalApplied = counter(namePrefix + ".signal.applied", "Reply and claim signals applied");
    this.backlogGauge = Gauge.builder(namePrefix + ".followup.backlog", backlog, AtomicInteger::get)
        .description("Attempts due for follow-up after the last sweep")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementClassified(TreatmentKind kind) {
    if (closed || kind == null) return;
    classified.get(kind).increment();
  }

  @Override
  public void incrementGenerated() {
    if (closed) return;
    generated.increment();
  }

  @Override
  public void incrementValidationFailure() {
    if (closed) return;
    validationFailure.increment();
  }

  @Override
  public void incrementGenerationFailure() {
    if (closed) return;
    generationFailure.increment();
  }

  @Override
  public void incrementSent() {
    if (closed) return;
    sent.increment();
  }

  @Override
  public void incrementDeliveryFailure() {
    if (closed) return;
    deliveryFailure.increment();
  }

  @Override
  public void incrementBudgetRejected() {
    if (closed) return;
    budgetRejected.increment();
  }

  @Override
  public void incrementFollowUpSent() {
    if (closed) return;
    followUpSent.increment();
  }

  @Override
  public void incrementSignalApplied() {
    if (closed) return;
    signalApplied.increment();
  }

  @Override
  public void recordFollowUpBacklog(int due) {
    if (closed) return;
    backlog.set(due);
  }

  /**
   * Removes every meter this exporter registered, so a closed engine leaves no stale gauge.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(classified.values());
    meters.addAll(List.of(generated, validationFailure, generationFailure, sent,
        deliveryFailure, budgetRejected, followUpSent, signalApplied, backlogGauge));
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
