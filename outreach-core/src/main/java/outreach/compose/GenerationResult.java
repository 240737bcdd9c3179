package outreach.compose;

import outreach.model.FactClaim;

import java.util.List;

/** Raw output of the generation service, before validation. */
public record GenerationResult(String subject, String body, List<FactClaim> claimedFacts) {

  public GenerationResult {
    claimedFacts = claimedFacts == null ? List.of() : List.copyOf(claimedFacts);
  }
}
