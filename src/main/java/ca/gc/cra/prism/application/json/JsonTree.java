package ca.gc.cra.prism.application.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Parses a JSON document into a map/list tree and reads typed fields from it.
 * <p><strong>Role:</strong> Shared by the envelope codec and the Reasoner response codec. Accessors name
 * the offending field in their {@link IllegalArgumentException}, so decode failures are traceable.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the thread-safe {@link JsonFactory}.</p>
 *
 * @since 0.1.0
 */
public final class JsonTree {
  private final JsonFactory factory;

  public JsonTree(JsonFactory factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  /**
   * Parses {@code json} into nested {@link Map}, {@link List}, {@link String}, {@link Number},
   * {@link Boolean} and {@code null} values.
   *
   * @param json document text
   * @return root value
   * @throws IllegalArgumentException when the text is empty, malformed or followed by trailing content
   */
  public Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken first = parser.nextToken();
      if (first == null) {
        throw new IllegalArgumentException("empty JSON document");
      }
      Object root = read(parser, first);
      if (parser.nextToken() != null) {
        throw new IllegalArgumentException("trailing content after JSON document");
      }
      return root;
    } catch (IOException ex) {
      throw new IllegalArgumentException("invalid JSON: " + ex.getMessage(), ex);
    }
  }

  /**
   * Parses {@code json} and requires an object at the root.
   *
   * @param json document text
   * @return root object
   */
  public Map<String, Object> parseObject(String json) {
    return asObject(parse(json), "$");
  }

  private Object read(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw new IllegalArgumentException("truncated JSON document");
    }
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("unsupported JSON token " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> object = new LinkedHashMap<>();
    JsonToken next;
    while ((next = parser.nextToken()) == JsonToken.FIELD_NAME) {
      String name = parser.currentName();
      object.put(name, read(parser, parser.nextToken()));
    }
    if (next != JsonToken.END_OBJECT) {
      throw new IllegalArgumentException("expected field name but found " + next);
    }
    return object;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> array = new ArrayList<>();
    JsonToken next;
    while ((next = parser.nextToken()) != JsonToken.END_ARRAY) {
      array.add(read(parser, next));
    }
    return array;
  }

  /**
   * Returns a tree value as an object with string keys.
   *
   * @param value tree value
   * @param path location used in the error message
   * @return object view
   */
  public static Map<String, Object> asObject(Object value, String path) {
    if (!(value instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException(path + " is not a JSON object");
    }
    Map<String, Object> object = new LinkedHashMap<>();
    map.forEach((key, item) -> object.put(String.valueOf(key), item));
    return object;
  }

  public static Map<String, Object> object(Map<String, Object> parent, String field) {
    return asObject(require(parent, field), field);
  }

  /**
   * Returns the object held by {@code field}, or {@code null} when the field is absent or null.
   */
  public static Map<String, Object> optionalObject(Map<String, Object> parent, String field) {
    Object value = parent.get(field);
    return value == null ? null : asObject(value, field);
  }

  public static List<?> array(Map<String, Object> parent, String field) {
    Object value = require(parent, field);
    if (!(value instanceof List<?> list)) {
      throw new IllegalArgumentException(field + " is not a JSON array");
    }
    return list;
  }

  public static String string(Map<String, Object> parent, String field) {
    Object value = require(parent, field);
    if (!(value instanceof String text)) {
      throw new IllegalArgumentException(field + " is not a JSON string");
    }
    return text;
  }

  public static long longValue(Map<String, Object> parent, String field) {
    return number(parent, field).longValue();
  }

  public static int intValue(Map<String, Object> parent, String field) {
    long value = longValue(parent, field);
    if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      throw new IllegalArgumentException(field + " is out of int range: " + value);
    }
    return (int) value;
  }

  /**
   * Reads a double. Non-finite values arrive as strings ({@code "NaN"}, {@code "Infinity"}) because the
   * generator quotes them.
   */
  public static double doubleValue(Map<String, Object> parent, String field) {
    Object value = require(parent, field);
    if (value instanceof String text) {
      try {
        return Double.parseDouble(text);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(field + " is not a number: " + text, ex);
      }
    }
    return number(parent, field).doubleValue();
  }

  public static boolean booleanValue(Map<String, Object> parent, String field) {
    Object value = require(parent, field);
    if (!(value instanceof Boolean flag)) {
      throw new IllegalArgumentException(field + " is not a JSON boolean");
    }
    return flag;
  }

  public static <E extends Enum<E>> E enumValue(Map<String, Object> parent, String field, Class<E> type) {
    String name = string(parent, field);
    try {
      return Enum.valueOf(type, name.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(field + " has unknown " + type.getSimpleName() + " '" + name + "'", ex);
    }
  }

  private static Number number(Map<String, Object> parent, String field) {
    Object value = require(parent, field);
    if (!(value instanceof Number number)) {
      throw new IllegalArgumentException(field + " is not a JSON number");
    }
    return number;
  }

  private static Object require(Map<String, Object> parent, String field) {
    Object value = parent.get(field);
    if (value == null) {
      throw new IllegalArgumentException("missing field '" + field + "'");
    }
    return value;
  }
}
