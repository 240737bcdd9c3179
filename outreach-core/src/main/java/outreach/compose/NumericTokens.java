package outreach.compose;

import outreach.model.FactField;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts numbers from free text in a comparable form. Thousands separators are removed
 * and a trailing {@code .0} is dropped, so {@code "1,200"}, {@code "1200"} and
 * {@code "1200.0"} compare equal. Approximation markers ({@code ~25}, {@code 25+}) are
 * not part of a token.
 *
 * <p>Spelled-out cardinals and vague quantities ({@code "ninety"}, {@code "dozens"},
 * {@code "thousands"}) are extracted separately as lower-case words. {@code "one"} is
 * left out; it is almost always a pronoun or article in prose.
 */
final class NumericTokens {
  private static final String NUMBER_REGEX = "\\d[\\d,]*(?:\\.\\d+)?";
  private static final Pattern NUMBER = Pattern.compile(NUMBER_REGEX);

  private static final Pattern QUANTITY_WORD = Pattern.compile(
      "\\b(two|three|four|five|six|seven|eight|nine|ten|eleven|twelve|thirteen|fourteen"
          + "|fifteen|sixteen|seventeen|eighteen|nineteen|twenty|thirty|forty|fifty|sixty"
          + "|seventy|eighty|ninety|hundreds?|thousands?|millions?|billions?|dozens?)\\b",
      Pattern.CASE_INSENSITIVE);

  private static final String DC_NOUN =
      "distribution cent(?:er|re)s?|dcs?|warehouses?|fulfil?lment cent(?:er|re)s?";
  private static final String TRUCK_NOUN = "trucks?|tractors?|trailers?|vehicles?|fleet";

  // "25 distribution centers", "300-truck fleet", "25+ regional DCs"
  private static final Pattern COUNT_BEFORE_NOUN = Pattern.compile(
      "(" + NUMBER_REGEX + ")\\+?[\\s-]+(?:[a-z]+[\\s-]+){0,2}?(" + DC_NOUN + "|" + TRUCK_NOUN
          + ")\\b",
      Pattern.CASE_INSENSITIVE);

  // "a fleet of 300"
  private static final Pattern NOUN_OF_COUNT = Pattern.compile(
      "\\b(" + DC_NOUN + "|" + TRUCK_NOUN + ")\\s+of\\s+(?:about\\s+|over\\s+|nearly\\s+|~)?("
          + NUMBER_REGEX + ")",
      Pattern.CASE_INSENSITIVE);

  private static final Pattern DC = Pattern.compile(DC_NOUN, Pattern.CASE_INSENSITIVE);

  private NumericTokens() {
  }

  /** A number used as the count of distribution centers or trucks. */
  record CountMention(String number, FactField field) {
  }

  static List<String> extract(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return tokens;
    }
    Matcher matcher = NUMBER.matcher(text);
    while (matcher.find()) {
      tokens.add(normalize(matcher.group()));
    }
    return tokens;
  }

  static List<String> quantityWords(String text) {
    List<String> words = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return words;
    }
    Matcher matcher = QUANTITY_WORD.matcher(text);
    while (matcher.find()) {
      words.add(matcher.group(1).toLowerCase(Locale.ROOT));
    }
    return words;
  }

  /**
   * Numbers written next to a distribution-center or truck noun, paired with the count
   * field they have to come from.
   */
  static List<CountMention> countMentions(String text) {
    List<CountMention> mentions = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return mentions;
    }
    Matcher before = COUNT_BEFORE_NOUN.matcher(text);
    while (before.find()) {
      mentions.add(new CountMention(normalize(before.group(1)), fieldFor(before.group(2))));
    }
    Matcher after = NOUN_OF_COUNT.matcher(text);
    while (after.find()) {
      mentions.add(new CountMention(normalize(after.group(2)), fieldFor(after.group(1))));
    }
    return mentions;
  }

  private static FactField fieldFor(String noun) {
    return DC.matcher(noun).matches() ? FactField.DC_COUNT : FactField.TRUCK_COUNT;
  }

  static String normalize(String token) {
    String plain = token.replace(",", "");
    int dot = plain.indexOf('.');
    if (dot >= 0) {
      String fraction = plain.substring(dot + 1).replaceAll("0+$", "");
      plain = fraction.isEmpty() ? plain.substring(0, dot) : plain.substring(0, dot + 1) + fraction;
    }
    return plain.replaceFirst("^0+(?=\\d)", "");
  }
}
