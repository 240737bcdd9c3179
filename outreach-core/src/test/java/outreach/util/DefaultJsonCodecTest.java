package outreach.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultJsonCodecTest {
  private final JsonCodec codec = JsonCodec.getDefault();

  @Test
  void bulletsSurviveQuotesAndNewlines() {
    List<String> bullets = List.of("Runs \"Fresh Market\" stores", "Line one\nline two", "Path C:\\dc");

    String json = codec.toJsonArray(bullets);

    assertEquals(bullets, codec.parseArray(json));
  }

  @Test
  void emptyAndNullInputsParseToEmptyList() {
    assertEquals("[]", codec.toJsonArray(List.of()));
    assertTrue(codec.parseArray(null).isEmpty());
    assertTrue(codec.parseArray("").isEmpty());
    assertTrue(codec.parseArray("null").isEmpty());
    assertTrue(codec.parseArray(" [ ] ").isEmpty());
  }

  @Test
  void parsesUnicodeEscapes() {
    assertEquals(List.of("caf\u00e9"), codec.parseArray("[\"caf\\u00e9\"]"));
  }

  @Test
  void rejectsNullElement() {
    List<String> values = new java.util.ArrayList<>();
    values.add(null);
    assertThrows(IllegalArgumentException.class, () -> codec.toJsonArray(values));
  }

  @Test
  void rejectsMalformedArray() {
    assertThrows(IllegalArgumentException.class, () -> codec.parseArray("[\"a\" \"b\"]"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseArray("[\"unterminated"));
  }

  @Test
  void recordsKeepFieldOrderAndNullValues() {
    Map<String, String> claim = new LinkedHashMap<>();
    claim.put("field", "dc_count");
    claim.put("value", "25");
    Map<String, String> partial = new LinkedHashMap<>();
    partial.put("field", "hook");
    partial.put("value", null);

    List<Map<String, String>> parsed = codec.parseRecords(codec.toJsonRecords(List.of(claim, partial)));

    assertEquals(2, parsed.size());
    assertEquals(List.of("field", "value"), List.copyOf(parsed.get(0).keySet()));
    assertEquals("25", parsed.get(0).get("value"));
    assertTrue(parsed.get(1).containsKey("value"));
    assertNull(parsed.get(1).get("value"));
  }
}
