package outreach.compose;

import outreach.model.TreatmentKind;

import java.util.List;

/**
 * Message families handed to the generation service. Each family fixes the framing the
 * model must follow and the phrases it must not use.
 */
public enum TemplateFamily {
  TOP_TIER(
      "Personal note from the account lead. Offer to meet privately during the event at a "
          + "time that suits them. Lead with the hook, then one relevant fact.",
      List.of()),
  STANDARD(
      "Friendly invitation to stop by the booth during expo hours. Lead with the hook, then "
          + "one relevant fact. Do not propose a private meeting.",
      List.of("meet privately", "private meeting")),
  EXHIBITOR_SALES(
      "Light, peer-to-peer note between exhibitors. Mention one relevant fact about their "
          + "business and say hello. No meeting offer and no sales pitch.",
      List.of("meet privately", "private meeting", "schedule a meeting", "book a meeting",
          "set up a meeting", "set up a time", "grab time", "find time", "your calendar",
          "calendar invite", "quick call", "demo")),
  FOLLOW_UP(
      "Fixed follow-up text. Only the first name and company name may be used.",
      List.of());

  private final String instructions;
  private final List<String> forbiddenPhrases;

  TemplateFamily(String instructions, List<String> forbiddenPhrases) {
    this.instructions = instructions;
    this.forbiddenPhrases = forbiddenPhrases;
  }

  public String instructions() {
    return instructions;
  }

  /** Lower-case phrases that must not appear in the subject or body. */
  public List<String> forbiddenPhrases() {
    return forbiddenPhrases;
  }

  /**
   * @throws IllegalArgumentException for {@link TreatmentKind#SUPPRESSED}
   */
  public static TemplateFamily forTreatment(TreatmentKind kind) {
    return switch (kind) {
      case TOP_TIER_PERSONALIZED -> TOP_TIER;
      case STANDARD_PERSONALIZED -> STANDARD;
      case EXHIBITOR_SALES -> EXHIBITOR_SALES;
      case FOLLOW_UP -> FOLLOW_UP;
      case SUPPRESSED -> throw new IllegalArgumentException("No template for suppressed treatment");
    };
  }
}
