package outreach.classify;

import outreach.model.AttendanceType;
import outreach.model.AttendeeRecord;
import outreach.model.BudgetRank;
import outreach.model.CompanyRecord;
import outreach.model.RoleClass;
import outreach.model.SuppressionReason;
import outreach.model.Treatment;
import outreach.model.TreatmentKind;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, first-match-wins evaluator mapping an attendee to a {@link Treatment}.
 *
 * <p>The default table:
 * <ol>
 *   <li>attendee fits neither product line: suppressed, not a fit</li>
 *   <li>retailer/CPG: outside the budget cap is suppressed; a top target company gets
 *       the top-tier message, any other company the standard one</li>
 *   <li>exhibitor/sponsor: the company must fit; operations roles get the top-tier
 *       message, sales roles the exhibitor-sales message, anything else is held for
 *       review</li>
 *   <li>any other attendance: suppressed</li>
 * </ol>
 *
 * <p>The rule order is part of the contract. Classification is pure and total: the
 * fallback rule always decides, so every input yields exactly one treatment.
 */
public final class TreatmentClassifier {

  private final List<ClassificationRule> rules;

  public TreatmentClassifier(List<ClassificationRule> rules) {
    Objects.requireNonNull(rules, "rules");
    this.rules = List.copyOf(rules);
  }

  /**
   * Creates a classifier with the default decision table.
   *
   * @param fitThreshold minimum fit score (inclusive) for a product line to count
   * @param topTargets   global top target companies of the wave
   */
  public static TreatmentClassifier standard(int fitThreshold, TopTargets topTargets) {
    return new TreatmentClassifier(defaultRules(fitThreshold, topTargets, new RoleClassifier()));
  }

  public static List<ClassificationRule> defaultRules(int fitThreshold, TopTargets topTargets,
      RoleClassifier roleClassifier) {
    Objects.requireNonNull(topTargets, "topTargets");
    Objects.requireNonNull(roleClassifier, "roleClassifier");
    return List.of(
        new NotAFitRule(fitThreshold),
        new RetailerRule(topTargets),
        new ExhibitorRule(fitThreshold, roleClassifier));
  }

  public Treatment classify(AttendeeRecord attendee, CompanyRecord company, BudgetRank rank) {
    Objects.requireNonNull(attendee, "attendee");
    Objects.requireNonNull(company, "company");
    Objects.requireNonNull(rank, "rank");
    for (ClassificationRule rule : rules) {
      Optional<Treatment> treatment = rule.evaluate(attendee, company, rank);
      if (treatment.isPresent()) {
        return treatment.get();
      }
    }
    return Treatment.suppressed(SuppressionReason.UNSUPPORTED_ATTENDANCE, rank.rank());
  }

  public List<ClassificationRule> rules() {
    return rules;
  }

  static final class NotAFitRule implements ClassificationRule {
    private final int fitThreshold;

    NotAFitRule(int fitThreshold) {
      this.fitThreshold = fitThreshold;
    }

    @Override
    public String name() {
      return "not-a-fit";
    }

    @Override
    public Optional<Treatment> evaluate(AttendeeRecord attendee, CompanyRecord company,
        BudgetRank rank) {
      if (attendee.fitCategory(fitThreshold).fits()) {
        return Optional.empty();
      }
      return Optional.of(Treatment.suppressed(SuppressionReason.NOT_A_FIT, rank.rank()));
    }
  }

  static final class RetailerRule implements ClassificationRule {
    private final TopTargets topTargets;

    RetailerRule(TopTargets topTargets) {
      this.topTargets = topTargets;
    }

    @Override
    public String name() {
      return "retailer";
    }

    @Override
    public Optional<Treatment> evaluate(AttendeeRecord attendee, CompanyRecord company,
        BudgetRank rank) {
      if (attendee.attendanceType() != AttendanceType.RETAILER_CPG) {
        return Optional.empty();
      }
      if (!rank.withinCap()) {
        return Optional.of(Treatment.suppressed(SuppressionReason.BUDGET_EXHAUSTED, rank.rank()));
      }
      TreatmentKind kind = topTargets.contains(company.id())
          ? TreatmentKind.TOP_TIER_PERSONALIZED
          : TreatmentKind.STANDARD_PERSONALIZED;
      return Optional.of(Treatment.of(kind, rank.rank()));
    }
  }

  static final class ExhibitorRule implements ClassificationRule {
    private final int fitThreshold;
    private final RoleClassifier roleClassifier;

    ExhibitorRule(int fitThreshold, RoleClassifier roleClassifier) {
      this.fitThreshold = fitThreshold;
      this.roleClassifier = roleClassifier;
    }

    @Override
    public String name() {
      return "exhibitor";
    }

    @Override
    public Optional<Treatment> evaluate(AttendeeRecord attendee, CompanyRecord company,
        BudgetRank rank) {
      if (attendee.attendanceType() != AttendanceType.EXHIBITOR_SPONSOR) {
        return Optional.empty();
      }
      if (!company.fitCategory(fitThreshold).fits()) {
        return Optional.of(Treatment.suppressed(SuppressionReason.NOT_A_FIT, rank.rank()));
      }
      RoleClass role = attendee.role() != RoleClass.OTHER
          ? attendee.role()
          : roleClassifier.classify(attendee.title(), attendee.jobFunction());
      return Optional.of(switch (role) {
        case OPERATIONS -> Treatment.of(TreatmentKind.TOP_TIER_PERSONALIZED, rank.rank());
        case SALES -> Treatment.of(TreatmentKind.EXHIBITOR_SALES, rank.rank());
        case OTHER -> Treatment.suppressed(SuppressionReason.AMBIGUOUS_ROLE, rank.rank());
      });
    }
  }
}
