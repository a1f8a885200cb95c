package io.poseflow.infrastructure.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal JSON helper that parses worker output into {@link Map}/{@link List} structures, plus typed
 * accessors for the loosely-typed fields pose workers emit.
 *
 * <p>Workers are not consistent about key spelling ({@code frameNumber} vs {@code frame_number}), so
 * accessors take a list of aliases and use the first one present.</p>
 *
 * @since POSEFLOW 0.1
 */
public final class JsonSupport {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses a UTF-8 JSON document into a graph of maps, lists, and primitives.
   *
   * @param json JSON bytes; never {@code null}
   * @return parsed object graph; {@code null} for an empty document
   * @throws IOException when the document is malformed
   */
  public Object parse(byte[] json) throws IOException {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      return parseDocument(parser);
    }
  }

  /**
   * Parses a JSON string into a graph of maps, lists, and primitives.
   *
   * @param json JSON text; never {@code null}
   * @return parsed object graph; {@code null} for an empty document
   * @throws IOException when the document is malformed
   */
  public Object parse(String json) throws IOException {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      return parseDocument(parser);
    }
  }

  /**
   * Shared factory for generators.
   *
   * @return jackson factory
   */
  public JsonFactory factory() {
    return factory;
  }

  /**
   * Looks up the first alias present in {@code object}.
   *
   * @param object parsed JSON object
   * @param aliases candidate keys in preference order
   * @return value, or {@code null} when no alias is present or the value is JSON {@code null}
   */
  public static Object field(Map<String, Object> object, String... aliases) {
    for (String alias : aliases) {
      if (object.containsKey(alias)) {
        return object.get(alias);
      }
    }
    return null;
  }

  /**
   * Casts a parsed value to a JSON object.
   *
   * @param value parsed value
   * @param what description used in the error message
   * @return the object
   * @throws IOException if {@code value} is not an object
   */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> asObject(Object value, String what) throws IOException {
    if (value instanceof Map<?, ?> map) {
      return (Map<String, Object>) map;
    }
    throw new IOException(what + " must be a JSON object but was " + describe(value));
  }

  /**
   * Casts a parsed value to a JSON array; {@code null} yields an empty list.
   *
   * @param value parsed value
   * @param what description used in the error message
   * @return list view
   * @throws IOException if {@code value} is neither {@code null} nor an array
   */
  @SuppressWarnings("unchecked")
  public static List<Object> asArray(Object value, String what) throws IOException {
    if (value == null) {
      return List.of();
    }
    if (value instanceof List<?> list) {
      return (List<Object>) list;
    }
    throw new IOException(what + " must be a JSON array but was " + describe(value));
  }

  /**
   * Reads a numeric value.
   *
   * @param value parsed value
   * @param what description used in the error message
   * @return numeric value as double
   * @throws IOException if {@code value} is not a number
   */
  public static double asDouble(Object value, String what) throws IOException {
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    throw new IOException(what + " must be a number but was " + describe(value));
  }

  /**
   * Reads an integral value; fractional numbers are rejected.
   *
   * @param value parsed value
   * @param what description used in the error message
   * @return numeric value as int
   * @throws IOException if {@code value} is not an integral number in int range
   */
  public static int asInt(Object value, String what) throws IOException {
    double number = asDouble(value, what);
    if (number != Math.rint(number) || number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
      throw new IOException(what + " must be an integer but was " + number);
    }
    return (int) number;
  }

  private Object parseDocument(JsonParser parser) throws IOException {
    JsonToken token = parser.nextToken();
    if (token == null) {
      return null;
    }
    Object value = readValue(parser, token);
    JsonToken trailing = parser.nextToken();
    if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
      throw new IOException("JSON document contains trailing content");
    }
    return value;
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IOException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IOException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }

  private static String describe(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }
}
