package outreach.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of validating a generated message against its fact payload.
 */
public record GroundingVerdict(List<GroundingIssue> issues) {

  public static final GroundingVerdict GROUNDED = new GroundingVerdict(List.of());

  public GroundingVerdict {
    issues = issues == null ? List.of() : List.copyOf(issues);
  }

  public boolean grounded() {
    return issues.isEmpty();
  }

  public String describe() {
    if (issues.isEmpty()) {
      return "grounded";
    }
    return issues.stream().map(GroundingIssue::toString).collect(Collectors.joining("; "));
  }
}
