package outreach.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Zero-dependency {@link JsonCodec}. Supports only arrays of strings and arrays of flat
 * string-valued objects, which is all the stores write.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJsonArray(List<String> values) {
    StringBuilder sb = new StringBuilder("[");
    if (values != null) {
      boolean first = true;
      for (String value : values) {
        if (value == null) {
          throw new IllegalArgumentException("values cannot contain null");
        }
        if (!first) {
          sb.append(',');
        }
        first = false;
        appendString(sb, value);
      }
    }
    return sb.append(']').toString();
  }

  @Override
  public List<String> parseArray(String json) {
    List<String> result = new ArrayList<>();
    Cursor cursor = openArray(json);
    if (cursor == null) {
      return result;
    }
    while (true) {
      cursor.skipWhitespace();
      if (cursor.peek() == ']' && result.isEmpty()) {
        cursor.index++;
        return result;
      }
      cursor.expect('"');
      result.add(cursor.readString());
      if (cursor.endOfArray()) {
        return result;
      }
    }
  }

  @Override
  public String toJsonRecords(List<Map<String, String>> records) {
    StringBuilder sb = new StringBuilder("[");
    if (records != null) {
      boolean firstRecord = true;
      for (Map<String, String> record : records) {
        if (!firstRecord) {
          sb.append(',');
        }
        firstRecord = false;
        sb.append('{');
        boolean first = true;
        for (Map.Entry<String, String> entry : record.entrySet()) {
          if (entry.getKey() == null) {
            throw new IllegalArgumentException("records cannot contain null keys");
          }
          if (!first) {
            sb.append(',');
          }
          first = false;
          appendString(sb, entry.getKey());
          sb.append(':');
          if (entry.getValue() == null) {
            sb.append("null");
          } else {
            appendString(sb, entry.getValue());
          }
        }
        sb.append('}');
      }
    }
    return sb.append(']').toString();
  }

  @Override
  public List<Map<String, String>> parseRecords(String json) {
    List<Map<String, String>> result = new ArrayList<>();
    Cursor cursor = openArray(json);
    if (cursor == null) {
      return result;
    }
    while (true) {
      cursor.skipWhitespace();
      if (cursor.peek() == ']' && result.isEmpty()) {
        cursor.index++;
        return result;
      }
      cursor.expect('{');
      result.add(readObject(cursor));
      if (cursor.endOfArray()) {
        return result;
      }
    }
  }

  private static Map<String, String> readObject(Cursor cursor) {
    Map<String, String> record = new LinkedHashMap<>();
    while (true) {
      cursor.skipWhitespace();
      char ch = cursor.peek();
      if (ch == '}' && record.isEmpty()) {
        cursor.index++;
        return record;
      }
      cursor.expect('"');
      String key = cursor.readString();
      cursor.skipWhitespace();
      cursor.expect(':');
      cursor.skipWhitespace();
      if (cursor.input.startsWith("null", cursor.index)) {
        cursor.index += 4;
        record.put(key, null);
      } else {
        cursor.expect('"');
        record.put(key, cursor.readString());
      }
      cursor.skipWhitespace();
      char next = cursor.next();
      if (next == '}') {
        return record;
      }
      if (next != ',') {
        throw new IllegalArgumentException("Expected ',' or '}' at " + (cursor.index - 1));
      }
    }
  }

  private static Cursor openArray(String json) {
    if (json == null) {
      return null;
    }
    String trimmed = json.trim();
    if (trimmed.isEmpty() || "null".equals(trimmed)) {
      return null;
    }
    Cursor cursor = new Cursor(trimmed);
    cursor.expect('[');
    return cursor;
  }

  private static void appendString(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    sb.append('"');
  }

  private static final class Cursor {
    private final String input;
    private int index;

    private Cursor(String input) {
      this.input = input;
    }

    char peek() {
      if (index >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON");
      }
      return input.charAt(index);
    }

    char next() {
      char c = peek();
      index++;
      return c;
    }

    void expect(char expected) {
      char c = next();
      if (c != expected) {
        throw new IllegalArgumentException(
            "Expected '" + expected + "' at " + (index - 1) + " but found '" + c + "'");
      }
    }

    void skipWhitespace() {
      while (index < input.length() && Character.isWhitespace(input.charAt(index))) {
        index++;
      }
    }

    /** Consumes the separator after an element; returns true when the array closed. */
    boolean endOfArray() {
      skipWhitespace();
      char c = next();
      if (c == ']') {
        return true;
      }
      if (c != ',') {
        throw new IllegalArgumentException("Expected ',' or ']' at " + (index - 1));
      }
      return false;
    }

    String readString() {
      StringBuilder sb = new StringBuilder();
      while (true) {
        char c = next();
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        char esc = next();
        switch (esc) {
          case '"', '\\', '/' -> sb.append(esc);
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> {
            if (index + 4 > input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(index, index + 4), 16));
            } catch (NumberFormatException ex) {
              throw new IllegalArgumentException("Invalid unicode escape", ex);
            }
            index += 4;
          }
          default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + esc);
        }
      }
    }
  }
}
