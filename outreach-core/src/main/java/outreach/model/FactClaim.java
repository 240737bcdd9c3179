package outreach.model;

import java.util.Objects;

/**
 * One factual claim a generated message makes, tagged with the field it was derived from.
 *
 * @param field the source field, {@code null} when the generator named an unknown field
 * @param rawField the field name exactly as reported by the generator
 * @param value the claimed value or phrase
 */
public record FactClaim(FactField field, String rawField, String value) {

  public FactClaim {
    Objects.requireNonNull(value, "value");
  }

  public static FactClaim of(FactField field, String value) {
    return new FactClaim(field, field.key(), value);
  }

  /**
   * Builds a claim from a generator-reported field name, resolving it against the whitelist.
   */
  public static FactClaim parse(String rawField, String value) {
    return new FactClaim(FactField.fromKey(rawField), rawField, value == null ? "" : value);
  }
}
