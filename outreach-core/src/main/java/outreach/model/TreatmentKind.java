package outreach.model;

/**
 * Named outreach variants. The exhibitor-operations path reuses
 * {@link #TOP_TIER_PERSONALIZED}.
 */
public enum TreatmentKind {
  TOP_TIER_PERSONALIZED,
  STANDARD_PERSONALIZED,
  EXHIBITOR_SALES,
  FOLLOW_UP,
  SUPPRESSED
}
