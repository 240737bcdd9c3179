package outreach.compose;

import outreach.model.FactClaim;
import outreach.model.FactField;
import outreach.model.GeneratedMessage;

import java.util.List;
import java.util.Objects;

/**
 * Fixed follow-up message. Uses the first name and company name and nothing else.
 */
public final class FollowUpTemplate {

  private final GroundingValidator validator;

  public FollowUpTemplate(GroundingValidator validator) {
    this.validator = Objects.requireNonNull(validator, "validator");
  }

  public GeneratedMessage render(String firstName, String companyName) {
    Objects.requireNonNull(firstName, "firstName");
    Objects.requireNonNull(companyName, "companyName");
    String subject = "Following up, " + firstName;
    String body = "Hi " + firstName + ",\n\n"
        + "Circling back on my earlier note in case it got buried. If it would help "
        + companyName + " to compare notes, just reply here and I'll work around your "
        + "schedule. If someone else at " + companyName + " is the better contact, a pointer "
        + "would be much appreciated.\n\n"
        + "Thanks";
    List<FactClaim> claims = List.of(
        FactClaim.of(FactField.FIRST_NAME, firstName),
        FactClaim.of(FactField.COMPANY_NAME, companyName));
    FactPayload payload = FactPayload.followUp(firstName, companyName);
    return new GeneratedMessage(subject, body, claims,
        validator.validate(subject, body, claims, payload));
  }
}
