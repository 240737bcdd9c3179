package outreach.compose;

import outreach.model.AttendeeRecord;
import outreach.model.CompanyRecord;
import outreach.model.FactField;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Whitelisted facts a single message may use. Nothing outside this payload reaches the
 * generation service, and the grounding validator checks output against it.
 *
 * <p>At most one count is included: the distribution-center count for gate-driven fit,
 * the truck count for truck-driven fit, and for a company fitting both lines the count
 * of the stronger line. A count is only included when it is known and sourced; when the
 * preferred count is unusable the other one is used if it is, otherwise no count at all.
 */
public final class FactPayload {

  static final int MAX_BULLETS = 3;

  private final TemplateFamily family;
  private final Map<FactField, List<String>> facts;

  private FactPayload(TemplateFamily family, Map<FactField, List<String>> facts) {
    this.family = family;
    this.facts = facts;
  }

  /**
   * Builds the payload for a personalized message.
   *
   * @param attendee     recipient
   * @param company      recipient's company
   * @param family       template family of the treatment
   * @param fitThreshold minimum score (inclusive) for a product line to count as a fit
   */
  public static FactPayload of(AttendeeRecord attendee, CompanyRecord company,
      TemplateFamily family, int fitThreshold) {
    Objects.requireNonNull(attendee, "attendee");
    Objects.requireNonNull(company, "company");
    Objects.requireNonNull(family, "family");
    if (family == TemplateFamily.FOLLOW_UP) {
      return followUp(attendee.firstName(), company.name());
    }
    Map<FactField, List<String>> facts = new EnumMap<>(FactField.class);
    put(facts, FactField.FIRST_NAME, attendee.firstName());
    put(facts, FactField.COMPANY_NAME, company.name());
    put(facts, FactField.OVERVIEW, company.overview());
    putCount(facts, company, fitThreshold);
    put(facts, FactField.HOOK, company.hook());
    List<String> bullets = new ArrayList<>();
    for (String bullet : company.bullets()) {
      if (bullet != null && !bullet.isBlank() && bullets.size() < MAX_BULLETS) {
        bullets.add(bullet.trim());
      }
    }
    if (!bullets.isEmpty()) {
      facts.put(FactField.BULLET, List.copyOf(bullets));
    }
    return new FactPayload(family, Collections.unmodifiableMap(facts));
  }

  /** Payload for the fixed follow-up: first name and company name only. */
  public static FactPayload followUp(String firstName, String companyName) {
    Map<FactField, List<String>> facts = new EnumMap<>(FactField.class);
    put(facts, FactField.FIRST_NAME, firstName);
    put(facts, FactField.COMPANY_NAME, companyName);
    return new FactPayload(TemplateFamily.FOLLOW_UP, Collections.unmodifiableMap(facts));
  }

  private static void putCount(Map<FactField, List<String>> facts, CompanyRecord company,
      int fitThreshold) {
    boolean gateFits = company.gateFit() >= fitThreshold;
    boolean truckFits = company.truckFit() >= fitThreshold;
    boolean preferDc;
    if (gateFits != truckFits) {
      preferDc = gateFits;
    } else {
      preferDc = company.gateFit() >= company.truckFit();
    }
    if (preferDc ? !putDc(facts, company) : !putTrucks(facts, company)) {
      if (preferDc) {
        putTrucks(facts, company);
      } else {
        putDc(facts, company);
      }
    }
  }

  private static boolean putDc(Map<FactField, List<String>> facts, CompanyRecord company) {
    if (!company.hasUsableDcCount()) {
      return false;
    }
    put(facts, FactField.DC_COUNT, Integer.toString(company.dcCount()));
    put(facts, FactField.COUNT_SOURCE, company.dcSource());
    return true;
  }

  private static boolean putTrucks(Map<FactField, List<String>> facts, CompanyRecord company) {
    if (!company.hasUsableTruckCount()) {
      return false;
    }
    put(facts, FactField.TRUCK_COUNT, Integer.toString(company.truckCount()));
    put(facts, FactField.COUNT_SOURCE, company.truckSource());
    return true;
  }

  private static void put(Map<FactField, List<String>> facts, FactField field, String value) {
    if (value != null && !value.isBlank()) {
      facts.put(field, List.of(value.trim()));
    }
  }

  public TemplateFamily family() {
    return family;
  }

  public boolean has(FactField field) {
    return facts.containsKey(field);
  }

  /** Values supplied for {@code field}; empty when the field is not part of the payload. */
  public List<String> values(FactField field) {
    return facts.getOrDefault(field, List.of());
  }

  /** First value of {@code field}, or {@code null}. */
  public String value(FactField field) {
    List<String> values = values(field);
    return values.isEmpty() ? null : values.get(0);
  }

  public Set<FactField> fields() {
    return facts.keySet();
  }

  /** Every normalized number appearing anywhere in the payload. */
  public Set<String> numbers() {
    Set<String> numbers = new LinkedHashSet<>();
    for (List<String> values : facts.values()) {
      for (String value : values) {
        numbers.addAll(NumericTokens.extract(value));
      }
    }
    return numbers;
  }

  /** Numbers appearing in the values of one field. */
  public Set<String> numbers(FactField field) {
    Set<String> numbers = new LinkedHashSet<>();
    for (String value : values(field)) {
      numbers.addAll(NumericTokens.extract(value));
    }
    return numbers;
  }

  /** Spelled-out numbers and quantity words appearing anywhere in the payload. */
  public Set<String> quantityWords() {
    Set<String> words = new LinkedHashSet<>();
    for (List<String> values : facts.values()) {
      for (String value : values) {
        words.addAll(NumericTokens.quantityWords(value));
      }
    }
    return words;
  }

  /** Field-to-values view, keyed by {@link FactField#key()}, for serialization. */
  public Map<String, List<String>> asMap() {
    Map<String, List<String>> map = new LinkedHashMap<>();
    facts.forEach((field, values) -> map.put(field.key(), values));
    return map;
  }

  @Override
  public String toString() {
    return "FactPayload{" + family + ", " + facts.keySet() + "}";
  }
}
