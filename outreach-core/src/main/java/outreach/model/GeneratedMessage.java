package outreach.model;

import java.util.List;
import java.util.Objects;

/**
 * Composed message for one attempt. Recomputed, never mutated, on regeneration.
 *
 * @param subject  subject line
 * @param body     plain-text body
 * @param claims   facts the message claims to use
 * @param verdict  validation outcome
 */
public record GeneratedMessage(String subject, String body, List<FactClaim> claims, GroundingVerdict verdict) {

  public GeneratedMessage {
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(body, "body");
    claims = claims == null ? List.of() : List.copyOf(claims);
    verdict = verdict == null ? GroundingVerdict.GROUNDED : verdict;
  }
}
