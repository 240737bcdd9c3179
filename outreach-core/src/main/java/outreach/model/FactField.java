package outreach.model;

import java.util.Locale;

/**
 * Whitelisted source fields a generated message may draw facts from.
 */
public enum FactField {
  FIRST_NAME,
  COMPANY_NAME,
  OVERVIEW,
  DC_COUNT,
  TRUCK_COUNT,
  COUNT_SOURCE,
  HOOK,
  BULLET;

  /** Snake-case key used in generation payloads and claim lists. */
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a field key, accepting either the snake-case key or the enum name.
   *
   * @param key the key (case-insensitive)
   * @return the field, or {@code null} if the key names no whitelisted field
   */
  public static FactField fromKey(String key) {
    if (key == null) {
      return null;
    }
    String normalized = key.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    for (FactField field : values()) {
      if (field.name().equals(normalized)) {
        return field;
      }
    }
    return null;
  }
}
