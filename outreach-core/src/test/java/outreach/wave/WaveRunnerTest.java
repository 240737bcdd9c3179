package outreach.wave;

import outreach.budget.BudgetCalculator;
import outreach.budget.InMemoryBudgetStore;
import outreach.compose.ContentComposer;
import outreach.compose.GenerationResult;
import outreach.delivery.MessageSender;
import outreach.lifecycle.LifecycleTracker;
import outreach.model.AttendanceType;
import outreach.model.CompanyRecord;
import outreach.model.FactField;
import outreach.model.Stage;
import outreach.model.TreatmentKind;
import outreach.spi.DeliveryRequest;
import outreach.spi.GenerationService;
import outreach.testing.Fixtures;
import outreach.testing.InMemoryAttemptStore;
import outreach.testing.InMemoryResearchStore;
import outreach.testing.RecordingDeliveryService;
import outreach.testing.StubConnections;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WaveRunnerTest {
  private final InMemoryResearchStore research = new InMemoryResearchStore();
  private final RecordingDeliveryService delivery = new RecordingDeliveryService();
  private ContentComposer composer;
  private MessageSender sender;
  private WaveRunner runner;

  private WaveRunner runner(GenerationService generation) {
    composer = ContentComposer.builder().generationService(generation)
        .generationTimeout(Duration.ofSeconds(2)).build();
    sender = new MessageSender(delivery, "log@crm.example.com", Duration.ofSeconds(2));
    WavePipeline pipeline = WavePipeline.builder()
        .connectionProvider(StubConnections.provider())
        .researchStore(research)
        .budgetStore(new InMemoryBudgetStore())
        .budgetCalculator(new BudgetCalculator(3))
        .tracker(LifecycleTracker.builder()
            .connectionProvider(StubConnections.provider())
            .attemptStore(new InMemoryAttemptStore())
            .build())
        .composer(composer)
        .sender(sender)
        .build();
    runner = new WaveRunner(pipeline, 2, 4);
    return runner;
  }

  @AfterEach
  void tearDown() {
    runner.close();
    composer.close();
    sender.close();
  }

  private void retailer(long companyId, String name, int attendees, long firstAttendeeId) {
    CompanyRecord company = Fixtures.retailer(companyId, name, 25);
    research.add(company);
    for (long id = firstAttendeeId; id < firstAttendeeId + attendees; id++) {
      research.add(Fixtures.attendee(id, company, AttendanceType.RETAILER_CPG));
    }
  }

  @Test
  void fiveRetailersGetThreeTopTierMessagesCitingTheirDcCount() {
    retailer(7, "Fresh Foods", 5, 1);

    WaveReport report = runner(Fixtures.groundedGenerator()).runWave("w1", List.of(7L));

    assertEquals(3, report.treated(TreatmentKind.TOP_TIER_PERSONALIZED));
    assertEquals(2, report.treated(TreatmentKind.SUPPRESSED));
    assertEquals(3, report.generated());
    assertEquals(3, report.sent());
    assertTrue(report.failures().isEmpty());
    List<DeliveryRequest> requests = delivery.requests();
    assertEquals(3, requests.size());
    for (DeliveryRequest request : requests) {
      assertTrue(request.body().contains("25"), request.body());
      assertTrue(request.body().contains("also reaching out"), request.body());
      assertEquals("log@crm.example.com", request.bcc());
    }
  }

  @Test
  void oneFailingCompanyDoesNotStopOthers() {
    retailer(7, "Fresh Foods", 2, 1);
    retailer(8, "Broken Mart", 2, 11);

    WaveReport report = runner(request -> {
      if ("Broken Mart".equals(request.payload().value(FactField.COMPANY_NAME))) {
        throw new IllegalStateException("model refused");
      }
      return Fixtures.groundedResult(request);
    }).runWave("w1", List.of(7L, 8L, 99L));

    assertEquals(3, report.companies());
    assertEquals(2, report.sent());
    assertEquals(2, report.failed());
    assertEquals(3, report.failures().size());
    assertTrue(report.failures().stream()
        .anyMatch(f -> f.attendeeId() == null && f.companyId() == 99L && f.stage() == Stage.CLASSIFY));
  }

  @Test
  void ungroundedOutputNeverReachesTransport() {
    retailer(7, "Fresh Foods", 3, 1);

    WaveReport report = runner(request ->
        new GenerationResult("Hi", "Congrats on 40 new stores!", List.of()))
        .runWave("w1", List.of(7L));

    assertEquals(0, report.sent());
    assertEquals(3, report.failed());
    assertTrue(delivery.requests().isEmpty());
  }

  @Test
  void deliveryFailureIsCountedPerAttendee() {
    retailer(7, "Fresh Foods", 1, 1);
    delivery.failDefinitely(2);

    WaveReport report = runner(Fixtures.groundedGenerator()).runWave("w1", List.of(7L));

    assertEquals(0, report.sent());
    assertEquals(1, report.sendErrors());
    assertEquals(Stage.SEND, report.failures().get(0).stage());
  }
}
