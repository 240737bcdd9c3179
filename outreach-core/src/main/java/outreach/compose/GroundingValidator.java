package outreach.compose;

import outreach.model.FactClaim;
import outreach.model.GroundingIssue;
import outreach.model.GroundingVerdict;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Checks generated content against the payload it was generated from.
 *
 * <p>Content is grounded when
 * <ul>
 *   <li>subject and body are not blank,</li>
 *   <li>every number in the subject or body appears somewhere in the payload,</li>
 *   <li>a number written as a count of distribution centers or trucks is the supplied
 *       count of that kind,</li>
 *   <li>spelled-out numbers and vague quantities ("ninety", "thousands") appear in the
 *       payload,</li>
 *   <li>every claimed fact names a field the payload supplied, and every number in the
 *       claim appears in that field,</li>
 *   <li>none of the template family's forbidden phrases occur.</li>
 * </ul>
 *
 * <p>Pure function, no I/O; safe to share between threads.
 */
public final class GroundingValidator {

  public GroundingVerdict validate(String subject, String body, List<FactClaim> claims,
      FactPayload payload) {
    List<GroundingIssue> issues = new ArrayList<>();
    if (subject == null || subject.isBlank()) {
      issues.add(new GroundingIssue(GroundingIssue.Kind.EMPTY_CONTENT, "subject is empty"));
    }
    if (body == null || body.isBlank()) {
      issues.add(new GroundingIssue(GroundingIssue.Kind.EMPTY_CONTENT, "body is empty"));
    }
    String text = (subject == null ? "" : subject) + "\n" + (body == null ? "" : body);

    Set<String> supplied = payload.numbers();
    Set<String> ungrounded = new LinkedHashSet<>();
    for (String number : NumericTokens.extract(text)) {
      if (!supplied.contains(number)) {
        ungrounded.add(number);
      }
    }
    for (String number : ungrounded) {
      issues.add(new GroundingIssue(GroundingIssue.Kind.UNGROUNDED_NUMBER,
          "'" + number + "' is not in the supplied facts"));
    }
    Set<NumericTokens.CountMention> miscounted = new LinkedHashSet<>();
    for (NumericTokens.CountMention mention : NumericTokens.countMentions(text)) {
      if (!ungrounded.contains(mention.number())
          && !payload.numbers(mention.field()).contains(mention.number())) {
        miscounted.add(mention);
      }
    }
    for (NumericTokens.CountMention mention : miscounted) {
      issues.add(new GroundingIssue(GroundingIssue.Kind.UNGROUNDED_NUMBER,
          "'" + mention.number() + "' is used as " + mention.field().key()
              + " but is not the supplied count"));
    }
    Set<String> suppliedWords = payload.quantityWords();
    Set<String> vague = new LinkedHashSet<>();
    for (String word : NumericTokens.quantityWords(text)) {
      if (!suppliedWords.contains(word)) {
        vague.add(word);
      }
    }
    for (String word : vague) {
      issues.add(new GroundingIssue(GroundingIssue.Kind.UNGROUNDED_NUMBER,
          "'" + word + "' is not in the supplied facts"));
    }

    if (claims != null) {
      for (FactClaim claim : claims) {
        checkClaim(claim, payload, issues);
      }
    }

    String lower = text.toLowerCase(Locale.ROOT);
    for (String phrase : payload.family().forbiddenPhrases()) {
      if (lower.contains(phrase)) {
        issues.add(new GroundingIssue(GroundingIssue.Kind.FORBIDDEN_PHRASE,
            "'" + phrase + "' is not allowed for " + payload.family()));
      }
    }
    return issues.isEmpty() ? GroundingVerdict.GROUNDED : new GroundingVerdict(issues);
  }

  private static void checkClaim(FactClaim claim, FactPayload payload, List<GroundingIssue> issues) {
    if (claim.field() == null || !payload.has(claim.field())) {
      issues.add(new GroundingIssue(GroundingIssue.Kind.UNTRACEABLE_CLAIM,
          "claim on '" + claim.rawField() + "' has no supplied source"));
      return;
    }
    Set<String> fieldNumbers = payload.numbers(claim.field());
    for (String number : NumericTokens.extract(claim.value())) {
      if (!fieldNumbers.contains(number)) {
        issues.add(new GroundingIssue(GroundingIssue.Kind.UNGROUNDED_NUMBER,
            "claim on '" + claim.field().key() + "' cites '" + number + "'"));
      }
    }
  }
}
