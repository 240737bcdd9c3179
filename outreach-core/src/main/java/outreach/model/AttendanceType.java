package outreach.model;

import java.util.Locale;

/**
 * Ticket / attendance tag of a conference attendee.
 */
public enum AttendanceType {
  RETAILER_CPG,
  EXHIBITOR_SPONSOR,
  OTHER;

  /**
   * Parses a ticket tag such as {@code "Retailer/CPG"} or {@code "Exhibitor/Sponsor"}.
   * Unknown or blank tags map to {@link #OTHER}.
   *
   * @param ticketType raw ticket tag (may be {@code null})
   * @return the attendance type, never {@code null}
   */
  public static AttendanceType fromTicketType(String ticketType) {
    if (ticketType == null || ticketType.isBlank()) {
      return OTHER;
    }
    String normalized = ticketType.trim().toLowerCase(Locale.ROOT);
    if (normalized.startsWith("retailer") || normalized.contains("cpg")) {
      return RETAILER_CPG;
    }
    if (normalized.startsWith("exhibitor") || normalized.contains("sponsor")) {
      return EXHIBITOR_SPONSOR;
    }
    return OTHER;
  }
}
