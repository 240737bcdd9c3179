package outreach.classify;

import outreach.model.AttendeeRecord;
import outreach.model.BudgetRank;
import outreach.model.CompanyRecord;
import outreach.model.Treatment;

import java.util.Optional;

/**
 * One row of the treatment decision table. A rule either decides the treatment or
 * passes, and the first rule that decides wins.
 *
 * <p>Rules must be pure: no I/O, no mutable state.
 */
public interface ClassificationRule {

  /** Short name used in logs and tests. */
  String name();

  Optional<Treatment> evaluate(AttendeeRecord attendee, CompanyRecord company, BudgetRank rank);
}
