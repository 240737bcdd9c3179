package outreach.delivery;

import outreach.DeliveryException;
import outreach.model.GeneratedMessage;
import outreach.model.Stage;
import outreach.spi.DeliveryRequest;
import outreach.spi.DeliveryService;
import outreach.util.DaemonThreadFactory;
import outreach.util.TimeoutCalls;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hands composed messages to the {@link DeliveryService} with the tracking BCC, a
 * timeout and at most one retry.
 *
 * <p>Only definite failures are retried. A timeout or any other unknown outcome is
 * reported immediately as a non-definite {@link DeliveryException}, because a second
 * send could deliver the message twice.
 */
public final class MessageSender implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(MessageSender.class.getName());

  private static final int MAX_ATTEMPTS = 2;

  private final DeliveryService deliveryService;
  private final String trackingBcc;
  private final Duration timeout;
  private final ExecutorService executor;

  public MessageSender(DeliveryService deliveryService, String trackingBcc, Duration timeout) {
    this.deliveryService = Objects.requireNonNull(deliveryService, "deliveryService");
    if (trackingBcc == null || trackingBcc.isBlank()) {
      throw new IllegalArgumentException("trackingBcc is required");
    }
    this.trackingBcc = trackingBcc;
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.executor = Executors.newCachedThreadPool(new DaemonThreadFactory("outreach-deliver-"));
  }

  /**
   * Sends {@code message} to {@code to}.
   *
   * @return the transport delivery id
   * @throws DeliveryException with attendee context when both attempts failed, on the
   *     first unknown outcome, or when the attendee has no address
   */
  public String send(Stage stage, long attendeeId, long companyId, String to,
      GeneratedMessage message) {
    if (to == null || to.isBlank()) {
      throw new DeliveryException(stage, attendeeId, companyId, "No email address", true, null);
    }
    DeliveryRequest request = new DeliveryRequest(to, message.subject(), message.body(), trackingBcc);
    DeliveryException last = null;
    for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
      try {
        String deliveryId = TimeoutCalls.call(executor, timeout, () -> deliveryService.send(request));
        if (attempt > 1) {
          logger.log(Level.INFO, "Delivery to attendee {0} succeeded on retry", attendeeId);
        }
        return deliveryId;
      } catch (TimeoutException e) {
        throw new DeliveryException(stage, attendeeId, companyId,
            "Delivery timed out after " + timeout.toMillis() + " ms", false, e);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new DeliveryException(stage, attendeeId, companyId, "Interrupted", false, e);
      } catch (ExecutionException e) {
        Throwable cause = TimeoutCalls.unwrap(e);
        if (!(cause instanceof DeliveryException failure)) {
          throw new DeliveryException(stage, attendeeId, companyId,
              "Delivery failed: " + cause, false, cause);
        }
        last = failure.withContext(stage, attendeeId, companyId);
        if (!failure.definite()) {
          throw last;
        }
        logger.log(Level.WARNING, "Delivery to attendee " + attendeeId + " failed (attempt "
            + attempt + ")", failure);
      }
    }
    throw last;
  }

  @Override
  public void close() {
    executor.shutdownNow();
    try {
      executor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
