package outreach.model;

/**
 * Coarse role classification of an attendee, used by the exhibitor rule.
 *
 * @see outreach.classify.RoleClassifier
 */
public enum RoleClass {
  OPERATIONS,
  SALES,
  OTHER
}
