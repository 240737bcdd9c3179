package outreach.delivery;

import outreach.DeliveryException;
import outreach.model.GeneratedMessage;
import outreach.model.Stage;
import outreach.spi.DeliveryRequest;
import outreach.testing.RecordingDeliveryService;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageSenderTest {
  private static final GeneratedMessage MESSAGE = new GeneratedMessage("Hi", "Body", List.of(), null);
  private static final String BCC = "log@crm.example.com";

  private MessageSender sender;

  @AfterEach
  void tearDown() {
    if (sender != null) {
      sender.close();
    }
  }

  @Test
  void everySendCarriesTrackingBcc() {
    RecordingDeliveryService delivery = new RecordingDeliveryService();
    sender = new MessageSender(delivery, BCC, Duration.ofSeconds(2));

    String id = sender.send(Stage.SEND, 1, 7, "avery@example.com", MESSAGE);

    assertEquals("msg-1", id);
    DeliveryRequest request = delivery.requests().get(0);
    assertEquals(BCC, request.bcc());
    assertEquals("avery@example.com", request.to());
    assertEquals("Body", request.body());
  }

  @Test
  void definiteFailureRetriedOnce() {
    RecordingDeliveryService delivery = new RecordingDeliveryService().failDefinitely(1);
    sender = new MessageSender(delivery, BCC, Duration.ofSeconds(2));

    assertEquals("msg-1", sender.send(Stage.SEND, 1, 7, "avery@example.com", MESSAGE));
    assertEquals(2, delivery.requests().size());
  }

  @Test
  void secondDefiniteFailureSurfacesWithContext() {
    RecordingDeliveryService delivery = new RecordingDeliveryService().failDefinitely(3);
    sender = new MessageSender(delivery, BCC, Duration.ofSeconds(2));

    DeliveryException e = assertThrows(DeliveryException.class,
        () -> sender.send(Stage.SEND, 1, 7, "avery@example.com", MESSAGE));

    assertTrue(e.definite());
    assertEquals(Long.valueOf(1), e.attendeeId());
    assertEquals(Long.valueOf(7), e.companyId());
    assertEquals(2, delivery.requests().size());
  }

  @Test
  void unknownOutcomeIsNotRetried() {
    RecordingDeliveryService delivery = new RecordingDeliveryService()
        .failNext(new DeliveryException("connection reset after DATA", false, null));
    sender = new MessageSender(delivery, BCC, Duration.ofSeconds(2));

    DeliveryException e = assertThrows(DeliveryException.class,
        () -> sender.send(Stage.SEND, 1, 7, "avery@example.com", MESSAGE));

    assertFalse(e.definite());
    assertEquals(1, delivery.requests().size());
  }

  @Test
  void unexpectedExceptionIsTreatedAsUnknownOutcome() {
    RecordingDeliveryService delivery = new RecordingDeliveryService()
        .failNext(new IllegalStateException("socket closed"));
    sender = new MessageSender(delivery, BCC, Duration.ofSeconds(2));

    DeliveryException e = assertThrows(DeliveryException.class,
        () -> sender.send(Stage.SEND, 1, 7, "avery@example.com", MESSAGE));

    assertFalse(e.definite());
    assertTrue(e.getCause() instanceof IllegalStateException);
  }

  @Test
  void timeoutIsNotRetried() {
    AtomicInteger calls = new AtomicInteger();
    sender = new MessageSender(request -> {
      calls.incrementAndGet();
      try {
        Thread.sleep(5_000);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return "late";
    }, BCC, Duration.ofMillis(100));

    DeliveryException e = assertThrows(DeliveryException.class,
        () -> sender.send(Stage.FOLLOW_UP, 1, 7, "avery@example.com", MESSAGE));

    assertFalse(e.definite());
    assertEquals(Stage.FOLLOW_UP, e.stage());
    assertEquals(1, calls.get());
  }

  @Test
  void missingAddressFailsWithoutCallingTransport() {
    RecordingDeliveryService delivery = new RecordingDeliveryService();
    sender = new MessageSender(delivery, BCC, Duration.ofSeconds(2));

    DeliveryException e = assertThrows(DeliveryException.class,
        () -> sender.send(Stage.SEND, 1, 7, " ", MESSAGE));

    assertTrue(e.definite());
    assertTrue(delivery.requests().isEmpty());
  }

  @Test
  void trackingBccRequired() {
    assertThrows(IllegalArgumentException.class,
        () -> new MessageSender(new RecordingDeliveryService(), " ", Duration.ofSeconds(1)));
  }
}
