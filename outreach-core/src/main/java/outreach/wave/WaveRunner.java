package outreach.wave;

import outreach.model.AttemptState;
import outreach.model.OutreachAttempt;
import outreach.model.SendStatus;
import outreach.model.Stage;
import outreach.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a whole wave over a set of companies.
 *
 * <p>Companies are processed in parallel on {@code companyConcurrency} threads. Within a
 * company the roster is ranked and classified first; the non-suppressed attendees are
 * then composed concurrently, sharing a pool of {@code composeConcurrency} threads
 * across the whole wave to respect the generation service's rate limits. Sends follow in
 * ranking order so the budget goes to the best-ranked attendees first.
 *
 * <p>A failure is recorded against the attendee (or company) it concerns and never
 * aborts its siblings.
 */
public final class WaveRunner implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(WaveRunner.class.getName());

  private final WavePipeline pipeline;
  private final ExecutorService companyPool;
  private final ExecutorService composePool;

  public WaveRunner(WavePipeline pipeline, int companyConcurrency, int composeConcurrency) {
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    if (companyConcurrency <= 0 || composeConcurrency <= 0) {
      throw new IllegalArgumentException("concurrency must be > 0");
    }
    this.companyPool = Executors.newFixedThreadPool(companyConcurrency,
        new DaemonThreadFactory("outreach-wave-"));
    this.composePool = Executors.newFixedThreadPool(composeConcurrency,
        new DaemonThreadFactory("outreach-compose-"));
  }

  public WaveReport runWave(String wave, List<Long> companyIds) {
    Objects.requireNonNull(wave, "wave");
    Objects.requireNonNull(companyIds, "companyIds");
    WaveReport.Collector report = new WaveReport.Collector(wave);
    List<CompletableFuture<Void>> companies = new ArrayList<>();
    for (Long companyId : companyIds) {
      companies.add(CompletableFuture.runAsync(() -> runCompany(wave, companyId, report), companyPool));
    }
    CompletableFuture.allOf(companies.toArray(new CompletableFuture[0])).join();
    WaveReport result = report.build();
    logger.log(Level.INFO, "Wave {0}: {1} companies, {2} sent, {3} failed, {4} failures recorded",
        new Object[]{wave, result.companies(), result.sent(), result.failed(), result.failures().size()});
    return result;
  }

  private void runCompany(String wave, long companyId, WaveReport.Collector report) {
    report.company();
    List<ClassifiedAttendee> classified;
    try {
      classified = pipeline.classifyBatch(companyId, wave);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Classification failed for company " + companyId, e);
      report.failure(null, companyId, Stage.CLASSIFY, e.getMessage());
      return;
    }

    List<Long> contacts = new ArrayList<>();
    for (ClassifiedAttendee row : classified) {
      report.classified(row.treatment().kind());
      if (!row.treatment().isSuppressed()) {
        contacts.add(row.attendeeId());
      }
    }

    List<Future<OutreachAttempt>> composed = new ArrayList<>(contacts.size());
    for (Long attendeeId : contacts) {
      composed.add(composePool.submit(() -> pipeline.composeAndRecord(attendeeId, wave)));
    }

    for (int i = 0; i < contacts.size(); i++) {
      long attendeeId = contacts.get(i);
      OutreachAttempt attempt = await(composed.get(i), attendeeId, companyId, report);
      if (attempt == null) {
        continue;
      }
      if (attempt.state() == AttemptState.FAILED) {
        report.failed();
        report.failure(attendeeId, companyId, Stage.COMPOSE, attempt.lastError());
        continue;
      }
      if (attempt.state() != AttemptState.GENERATED) {
        continue;
      }
      report.generated();
      send(wave, attendeeId, companyId, report);
    }
  }

  private OutreachAttempt await(Future<OutreachAttempt> future, long attendeeId, long companyId,
      WaveReport.Collector report) {
    try {
      return future.get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      logger.log(Level.WARNING, "Composition failed for attendee " + attendeeId, cause);
      report.failure(attendeeId, companyId, Stage.COMPOSE, String.valueOf(cause.getMessage()));
      return null;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      report.failure(attendeeId, companyId, Stage.COMPOSE, "interrupted");
      return null;
    }
  }

  private void send(String wave, long attendeeId, long companyId, WaveReport.Collector report) {
    try {
      OutreachAttempt sent = pipeline.sendAndRecord(attendeeId, wave);
      if (sent.state() == AttemptState.SUPPRESSED) {
        report.budgetRejected();
      } else if (sent.state().isSent()) {
        report.sent();
      } else if (sent.sendStatus() == SendStatus.ERROR || sent.sendStatus() == SendStatus.UNCONFIRMED) {
        report.sendError();
        report.failure(attendeeId, companyId, Stage.SEND, sent.lastError());
      }
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Send failed for attendee " + attendeeId, e);
      report.sendError();
      report.failure(attendeeId, companyId, Stage.SEND, e.getMessage());
    }
  }

  @Override
  public void close() {
    companyPool.shutdownNow();
    composePool.shutdownNow();
    try {
      companyPool.awaitTermination(5, TimeUnit.SECONDS);
      composePool.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
