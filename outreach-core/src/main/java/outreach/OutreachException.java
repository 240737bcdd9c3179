package outreach;

import outreach.model.Stage;

/**
 * Base type for failures surfaced by the outreach engine.
 *
 * <p>Every failure identifies the pipeline {@link Stage} it occurred in and, where known,
 * the attendee and company it concerns. {@link #getMessage()} includes that context so a
 * log line alone is enough to find the affected record.
 */
public class OutreachException extends RuntimeException {

  private final Stage stage;
  private final Long attendeeId;
  private final Long companyId;

  public OutreachException(Stage stage, Long attendeeId, Long companyId, String message) {
    this(stage, attendeeId, companyId, message, null);
  }

  public OutreachException(Stage stage, Long attendeeId, Long companyId, String message,
      Throwable cause) {
    super(format(stage, attendeeId, companyId, message), cause);
    this.stage = stage;
    this.attendeeId = attendeeId;
    this.companyId = companyId;
  }

  public Stage stage() {
    return stage;
  }

  /**
   * @return the affected attendee, or {@code null} for company-level failures
   */
  public Long attendeeId() {
    return attendeeId;
  }

  /**
   * @return the affected company, or {@code null} if unknown
   */
  public Long companyId() {
    return companyId;
  }

  private static String format(Stage stage, Long attendeeId, Long companyId, String message) {
    StringBuilder sb = new StringBuilder();
    sb.append('[').append(stage);
    if (companyId != null) {
      sb.append(" company=").append(companyId);
    }
    if (attendeeId != null) {
      sb.append(" attendee=").append(attendeeId);
    }
    sb.append("] ").append(message);
    return sb.toString();
  }
}
