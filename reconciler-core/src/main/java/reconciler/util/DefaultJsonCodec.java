package reconciler.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dependency-free {@link JsonCodec} for flat string-to-string objects.
 */
final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  private DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> fields) {
    if (fields == null || fields.isEmpty()) {
      return null;
    }
    StringBuilder sb = new StringBuilder("{");
    for (Map.Entry<String, String> entry : fields.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("JSON object keys must not be null");
      }
      if (sb.length() > 1) {
        sb.append(',');
      }
      appendString(sb, entry.getKey());
      sb.append(':');
      if (entry.getValue() == null) {
        sb.append("null");
      } else {
        appendString(sb, entry.getValue());
      }
    }
    return sb.append('}').toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (json == null || json.isBlank() || "null".equals(json.trim())) {
      return Collections.emptyMap();
    }
    return new Parser(json).object();
  }

  private static void appendString(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
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

  private static final class Parser {
    private final String input;
    private int pos;

    private Parser(String input) {
      this.input = input;
    }

    Map<String, String> object() {
      skipWhitespace();
      expect('{');
      Map<String, String> result = new LinkedHashMap<>();
      skipWhitespace();
      if (peek() == '}') {
        pos++;
        return trailing(result);
      }
      while (true) {
        skipWhitespace();
        if (peek() != '"') {
          throw new IllegalArgumentException("Expected string key at " + pos);
        }
        pos++;
        String key = string();
        skipWhitespace();
        expect(':');
        skipWhitespace();
        if (input.startsWith("null", pos)) {
          pos += 4;
        } else if (peek() == '"') {
          pos++;
          result.put(key, string());
        } else {
          throw new IllegalArgumentException("Expected string value or null at " + pos);
        }
        skipWhitespace();
        char next = peek();
        pos++;
        if (next == '}') {
          return trailing(result);
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or '}' at " + (pos - 1));
        }
      }
    }

    private Map<String, String> trailing(Map<String, String> result) {
      skipWhitespace();
      if (pos < input.length()) {
        throw new IllegalArgumentException("Unexpected content after JSON object at " + pos);
      }
      return result;
    }

    private String string() {
      StringBuilder sb = new StringBuilder();
      while (pos < input.length()) {
        char c = input.charAt(pos++);
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        if (pos >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char escaped = input.charAt(pos++);
        switch (escaped) {
          case '"', '\\', '/' -> sb.append(escaped);
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> {
            if (pos + 4 > input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(pos, pos + 4), 16));
            } catch (NumberFormatException e) {
              throw new IllegalArgumentException("Invalid unicode escape", e);
            }
            pos += 4;
          }
          default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + escaped);
        }
      }
      throw new IllegalArgumentException("Unterminated string");
    }

    private void expect(char expected) {
      if (peek() != expected) {
        throw new IllegalArgumentException("Expected '" + expected + "' at " + pos);
      }
      pos++;
    }

    private char peek() {
      if (pos >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      return input.charAt(pos);
    }

    private void skipWhitespace() {
      while (pos < input.length()) {
        char c = input.charAt(pos);
        if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
          return;
        }
        pos++;
      }
    }
  }
}
