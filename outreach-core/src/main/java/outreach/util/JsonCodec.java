package outreach.util;

import java.util.List;
import java.util.Map;

/**
 * Codec for the small JSON documents the stores persist: string lists (research
 * bullets) and lists of flat string records (claimed facts).
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies. Callers
 * that already carry a JSON library can supply their own implementation.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes a list of strings as a JSON array.
   *
   * @param values values to encode; {@code null} elements are rejected
   * @return JSON array text, {@code "[]"} for a null or empty list
   */
  String toJsonArray(List<String> values);

  /**
   * Parses a JSON array of strings. Returns an empty list for {@code null}, blank or
   * {@code "null"} input.
   *
   * @throws IllegalArgumentException if the input is not an array of strings
   */
  List<String> parseArray(String json);

  /**
   * Encodes a list of flat string-to-string objects as a JSON array of objects.
   * Key order of each record is preserved.
   */
  String toJsonRecords(List<Map<String, String>> records);

  /**
   * Parses a JSON array of flat objects. {@code null} values are dropped.
   *
   * @throws IllegalArgumentException if the input is malformed
   */
  List<Map<String, String>> parseRecords(String json);
}
