package outreach.classify;

import outreach.model.RoleClass;

import java.util.List;
import java.util.Locale;

/**
 * Keyword classification of a job title and function into operations or sales.
 * A title that matches both families, or neither, is {@link RoleClass#OTHER}.
 */
public final class RoleClassifier {

  private static final List<String> OPERATIONS_KEYWORDS = List.of(
      "operations", "logistics", "supply chain", "distribution", "warehouse", "fleet",
      "transportation", "security", "loss prevention", "facilities", "asset protection");

  private static final List<String> SALES_KEYWORDS = List.of(
      "sales", "business development", "account executive", "account manager",
      "partnerships", "revenue", "commercial", "marketing");

  public RoleClass classify(String title, String jobFunction) {
    String text = normalize(title) + " | " + normalize(jobFunction);
    boolean operations = matchesAny(text, OPERATIONS_KEYWORDS);
    boolean sales = matchesAny(text, SALES_KEYWORDS);
    if (operations == sales) {
      return RoleClass.OTHER;
    }
    return operations ? RoleClass.OPERATIONS : RoleClass.SALES;
  }

  private static boolean matchesAny(String text, List<String> keywords) {
    for (String keyword : keywords) {
      if (text.contains(keyword)) {
        return true;
      }
    }
    return false;
  }

  private static String normalize(String value) {
    return value == null ? "" : value.toLowerCase(Locale.ROOT);
  }
}
