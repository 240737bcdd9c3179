package outreach.compose;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The company-wide "also reaching out to others" line. Added to a body when more than
 * one person at the company is contacted in the wave, removed otherwise. Whatever the
 * model wrote on the subject is replaced.
 */
final class Disclosure {
  private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");
  private static final String MARKER = "also reaching out";

  private Disclosure() {
  }

  static String line(String companyName) {
    return "I'm also reaching out to a few of your colleagues at " + companyName
        + ", so feel free to loop in whoever is closest to this.";
  }

  static String apply(String body, String companyName, int companyContacts) {
    String stripped = strip(body);
    if (companyContacts <= 1) {
      return stripped;
    }
    return stripped + "\n\n" + line(companyName);
  }

  static boolean present(String body) {
    return body != null && body.toLowerCase(Locale.ROOT).contains(MARKER);
  }

  private static String strip(String body) {
    StringBuilder sb = new StringBuilder();
    for (String line : LINE_BREAK.split(body, -1)) {
      if (line.toLowerCase(Locale.ROOT).contains(MARKER)) {
        continue;
      }
      if (sb.length() > 0) {
        sb.append('\n');
      }
      sb.append(line);
    }
    return sb.toString().strip();
  }
}
