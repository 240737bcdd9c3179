package outreach.spi;

import java.util.Objects;

/**
 * Fully composed message handed to the {@link DeliveryService}. The tracking BCC is
 * mandatory.
 */
public record DeliveryRequest(String to, String subject, String body, String bcc) {

  public DeliveryRequest {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(body, "body");
    if (bcc == null || bcc.isBlank()) {
      throw new IllegalArgumentException("bcc tracking address is required");
    }
  }
}
