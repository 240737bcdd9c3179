package outreach;

import outreach.model.Stage;

/**
 * Transport failure reported by the delivery service.
 *
 * <p>{@link #definite()} distinguishes a rejected send (nothing went out) from an
 * unknown outcome such as a timeout, where the message may still be delivered. Capacity
 * and follow-up claims are released only for definite failures.
 */
public class DeliveryException extends OutreachException {

  private final boolean definite;

  public DeliveryException(String message) {
    this(message, true, null);
  }

  public DeliveryException(String message, boolean definite, Throwable cause) {
    this(Stage.SEND, null, null, message, definite, cause);
  }

  public DeliveryException(Stage stage, Long attendeeId, Long companyId, String message,
      boolean definite, Throwable cause) {
    super(stage, attendeeId, companyId, message, cause);
    this.definite = definite;
  }

  public boolean definite() {
    return definite;
  }

  /**
   * Returns a copy carrying the attendee context, for failures raised by a delivery
   * service that does not know about attendees.
   */
  public DeliveryException withContext(Stage stage, long attendeeId, long companyId) {
    return new DeliveryException(stage, attendeeId, companyId, rawMessage(), definite,
        getCause() != null ? getCause() : this);
  }

  private String rawMessage() {
    String message = getMessage();
    int end = message.indexOf("] ");
    return end >= 0 ? message.substring(end + 2) : message;
  }
}
