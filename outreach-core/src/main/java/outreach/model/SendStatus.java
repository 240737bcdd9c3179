package outreach.model;

/**
 * Delivery status of an attempt's first message.
 *
 * <p>{@link #ERROR} means the transport definitely rejected the send; the budget unit was
 * returned. {@link #UNCONFIRMED} means the outcome is unknown (for example a timeout):
 * the budget unit stays consumed and the attempt is not resent automatically.
 */
public enum SendStatus {
  NOT_SENT,
  SENT,
  ERROR,
  UNCONFIRMED
}
