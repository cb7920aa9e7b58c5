package cadence.util;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.time.temporal.TemporalAccessor;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Zero-dependency {@link JsonCodec}. Accessible via {@link JsonCodec#getDefault()}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Object value) {
    StringBuilder sb = new StringBuilder();
    write(sb, value);
    return sb.toString();
  }

  private void write(StringBuilder sb, Object value) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof CharSequence || value instanceof Character) {
      sb.append('"').append(escape(value.toString())).append('"');
    } else if (value instanceof Number) {
      writeNumber(sb, (Number) value);
    } else if (value instanceof Boolean) {
      sb.append(value);
    } else if (value instanceof Enum<?>) {
      sb.append('"').append(escape(((Enum<?>) value).name().toLowerCase())).append('"');
    } else if (value instanceof TemporalAccessor) {
      sb.append('"').append(escape(value.toString())).append('"');
    } else if (value instanceof Map<?, ?>) {
      writeObject(sb, (Map<?, ?>) value);
    } else if (value instanceof Iterable<?>) {
      sb.append('[');
      boolean first = true;
      for (Object element : (Iterable<?>) value) {
        if (!first) {
          sb.append(',');
        }
        first = false;
        write(sb, element);
      }
      sb.append(']');
    } else if (value.getClass().isArray()) {
      sb.append('[');
      int length = Array.getLength(value);
      for (int i = 0; i < length; i++) {
        if (i > 0) {
          sb.append(',');
        }
        write(sb, Array.get(value, i));
      }
      sb.append(']');
    } else {
      sb.append('"').append(escape(value.toString())).append('"');
    }
  }

  private void writeObject(StringBuilder sb, Map<?, ?> map) {
    sb.append('{');
    boolean first = true;
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("JSON objects cannot contain null keys");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      sb.append('"').append(escape(entry.getKey().toString())).append('"').append(':');
      write(sb, entry.getValue());
    }
    sb.append('}');
  }

  private static void writeNumber(StringBuilder sb, Number number) {
    if (number instanceof Double || number instanceof Float) {
      double d = number.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new IllegalArgumentException("JSON cannot represent " + d);
      }
    }
    if (number instanceof BigDecimal) {
      sb.append(((BigDecimal) number).toPlainString());
    } else {
      sb.append(number);
    }
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (json == null) {
      return Collections.emptyMap();
    }
    String trimmed = json.trim();
    if (trimmed.isEmpty() || "null".equals(trimmed)) {
      return Collections.emptyMap();
    }
    int len = trimmed.length();
    int idx = skipWhitespace(trimmed, 0);
    if (idx >= len || trimmed.charAt(idx) != '{') {
      throw new IllegalArgumentException("Expected JSON object");
    }
    idx++;
    Map<String, String> result = new LinkedHashMap<>();
    while (true) {
      idx = skipWhitespace(trimmed, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char ch = trimmed.charAt(idx);
      if (ch == '}' && result.isEmpty()) {
        return result;
      }
      if (ch != '"') {
        throw new IllegalArgumentException("Expected string key");
      }
      ParseResult key = parseString(trimmed, idx + 1);
      idx = skipWhitespace(trimmed, key.nextIndex);
      if (idx >= len || trimmed.charAt(idx) != ':') {
        throw new IllegalArgumentException("Expected ':' after key");
      }
      idx = skipWhitespace(trimmed, idx + 1);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char start = trimmed.charAt(idx);
      if (start == '"') {
        ParseResult value = parseString(trimmed, idx + 1);
        result.put(key.value, value.value);
        idx = value.nextIndex;
      } else if (start == '{' || start == '[') {
        throw new IllegalArgumentException("Nested value for key '" + key.value + "' is not supported");
      } else {
        int end = idx;
        while (end < len && ",} \t\n\r".indexOf(trimmed.charAt(end)) < 0) {
          end++;
        }
        String literal = trimmed.substring(idx, end);
        if (!"null".equals(literal)) {
          if (!isScalarLiteral(literal)) {
            throw new IllegalArgumentException("Invalid value for key '" + key.value + "': " + literal);
          }
          result.put(key.value, literal);
        }
        idx = end;
      }
      idx = skipWhitespace(trimmed, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char next = trimmed.charAt(idx);
      if (next == ',') {
        idx++;
        continue;
      }
      if (next == '}') {
        return result;
      }
      throw new IllegalArgumentException("Expected ',' or '}'");
    }
  }

  private static boolean isScalarLiteral(String literal) {
    if ("true".equals(literal) || "false".equals(literal)) {
      return true;
    }
    if (literal.isEmpty()) {
      return false;
    }
    try {
      new BigDecimal(literal);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  private static int skipWhitespace(String input, int index) {
    int i = index;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
        break;
      }
      i++;
    }
    return i;
  }

  private static ParseResult parseString(String input, int startIndex) {
    StringBuilder sb = new StringBuilder();
    int i = startIndex;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == '"') {
        return new ParseResult(sb.toString(), i + 1);
      }
      if (c != '\\') {
        sb.append(c);
        i++;
        continue;
      }
      if (i + 1 >= input.length()) {
        throw new IllegalArgumentException("Invalid escape sequence");
      }
      char next = input.charAt(i + 1);
      if (next == 'u') {
        if (i + 5 >= input.length()) {
          throw new IllegalArgumentException("Invalid unicode escape");
        }
        try {
          sb.append((char) Integer.parseInt(input.substring(i + 2, i + 6), 16));
        } catch (NumberFormatException ex) {
          throw new IllegalArgumentException("Invalid unicode escape", ex);
        }
        i += 6;
        continue;
      }
      sb.append(unescape(next));
      i += 2;
    }
    throw new IllegalArgumentException("Unterminated string");
  }

  private static char unescape(char c) {
    switch (c) {
      case '"':
      case '\\':
      case '/':
        return c;
      case 'b':
        return '\b';
      case 'f':
        return '\f';
      case 'n':
        return '\n';
      case 'r':
        return '\r';
      case 't':
        return '\t';
      default:
        throw new IllegalArgumentException("Unsupported escape sequence: \\" + c);
    }
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 8);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.toString();
  }

  private static final class ParseResult {
    private final String value;
    private final int nextIndex;

    private ParseResult(String value, int nextIndex) {
      this.value = value;
      this.nextIndex = nextIndex;
    }
  }
}
