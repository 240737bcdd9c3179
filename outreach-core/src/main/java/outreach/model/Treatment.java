package outreach.model;

import java.util.Objects;

/**
 * Outreach treatment assigned to one contact.
 *
 * @param kind         the outreach variant
 * @param priorityRank 1-based rank of the attendee within the company budget
 * @param reason       suppression reason; non-null exactly when {@code kind} is SUPPRESSED
 */
public record Treatment(TreatmentKind kind, int priorityRank, SuppressionReason reason) {

  public Treatment {
    Objects.requireNonNull(kind, "kind");
    if (priorityRank < 1) {
      throw new IllegalArgumentException("priorityRank must be >= 1, got: " + priorityRank);
    }
    if ((kind == TreatmentKind.SUPPRESSED) != (reason != null)) {
      throw new IllegalArgumentException("reason must be set exactly for SUPPRESSED treatments");
    }
  }

  public static Treatment of(TreatmentKind kind, int priorityRank) {
    return new Treatment(kind, priorityRank, null);
  }

  public static Treatment suppressed(SuppressionReason reason, int priorityRank) {
    return new Treatment(TreatmentKind.SUPPRESSED, priorityRank, Objects.requireNonNull(reason, "reason"));
  }

  public boolean isSuppressed() {
    return kind == TreatmentKind.SUPPRESSED;
  }
}
