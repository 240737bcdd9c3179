package outreach.wave;

import outreach.model.Stage;
import outreach.model.TreatmentKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Outcome of one {@link WaveRunner#runWave} call.
 *
 * @param wave           wave identifier
 * @param companies      companies processed, including failed ones
 * @param treatments     classification counts per treatment kind
 * @param generated      messages generated and validated
 * @param failed         attempts marked FAILED during composition
 * @param sent           confirmed sends
 * @param sendErrors     sends that failed or are unconfirmed
 * @param budgetRejected sends refused because the company budget was used up
 * @param failures       per-attendee (or per-company) failures, in no particular order
 */
public record WaveReport(
    String wave,
    int companies,
    Map<TreatmentKind, Integer> treatments,
    int generated,
    int failed,
    int sent,
    int sendErrors,
    int budgetRejected,
    List<Failure> failures
) {

  public WaveReport {
    treatments = treatments.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new EnumMap<>(treatments));
    failures = List.copyOf(failures);
  }

  public int treated(TreatmentKind kind) {
    return treatments.getOrDefault(kind, 0);
  }

  /**
   * A failure isolated to one attendee, or to a whole company when {@code attendeeId} is
   * {@code null}.
   */
  public record Failure(Long attendeeId, long companyId, Stage stage, String message) {
  }

  /** Thread-safe accumulator used while the wave runs. */
  static final class Collector {
    private final String wave;
    private final AtomicInteger companies = new AtomicInteger();
    private final Map<TreatmentKind, AtomicInteger> treatments = new EnumMap<>(TreatmentKind.class);
    private final AtomicInteger generated = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger sent = new AtomicInteger();
    private final AtomicInteger sendErrors = new AtomicInteger();
    private final AtomicInteger budgetRejected = new AtomicInteger();
    private final List<Failure> failures = Collections.synchronizedList(new ArrayList<>());

    Collector(String wave) {
      this.wave = wave;
      for (TreatmentKind kind : TreatmentKind.values()) {
        treatments.put(kind, new AtomicInteger());
      }
    }

    void company() {
      companies.incrementAndGet();
    }

    void classified(TreatmentKind kind) {
      treatments.get(kind).incrementAndGet();
    }

    void generated() {
      generated.incrementAndGet();
    }

    void failed() {
      failed.incrementAndGet();
    }

    void sent() {
      sent.incrementAndGet();
    }

    void sendError() {
      sendErrors.incrementAndGet();
    }

    void budgetRejected() {
      budgetRejected.incrementAndGet();
    }

    void failure(Long attendeeId, long companyId, Stage stage, String message) {
      failures.add(new Failure(attendeeId, companyId, stage, message));
    }

    WaveReport build() {
      Map<TreatmentKind, Integer> counts = new EnumMap<>(TreatmentKind.class);
      treatments.forEach((kind, count) -> {
        if (count.get() > 0) {
          counts.put(kind, count.get());
        }
      });
      List<Failure> copy;
      synchronized (failures) {
        copy = new ArrayList<>(failures);
      }
      return new WaveReport(wave, companies.get(), counts, generated.get(), failed.get(),
          sent.get(), sendErrors.get(), budgetRejected.get(), copy);
    }
  }
}
