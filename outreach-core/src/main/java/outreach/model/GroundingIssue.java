package outreach.model;

/**
 * A single reason a generated message failed validation.
 *
 * @param kind   category of the problem
 * @param detail the offending token, claim or phrase
 */
public record GroundingIssue(Kind kind, String detail) {

  public enum Kind {
    /** A number in the subject or body that no supplied fact contains. */
    UNGROUNDED_NUMBER,
    /** A claimed fact whose field was not supplied or whose value is not in that field. */
    UNTRACEABLE_CLAIM,
    /** Language the template family does not permit. */
    FORBIDDEN_PHRASE,
    /** Subject or body missing. */
    EMPTY_CONTENT
  }

  @Override
  public String toString() {
    return kind + ": " + detail;
  }
}
