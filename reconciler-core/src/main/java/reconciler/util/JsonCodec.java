package reconciler.util;

import java.util.Map;

/**
 * Codec for the flat JSON objects the reconciler stores and exchanges: unit-of-work
 * arguments, inbox payloads and rollover specs.
 *
 * <p>The default implementation has no dependencies and only handles objects whose
 * values are strings. Implement this interface to delegate to Jackson or Gson.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes a string map as a JSON object. Returns {@code null} for a null or empty map.
   */
  String toJson(Map<String, String> fields);

  /**
   * Parses a JSON object of string values. Returns an empty map for {@code null},
   * blank or {@code "null"} input; {@code null} values are dropped.
   *
   * @throws IllegalArgumentException if the input is not a flat JSON object
   */
  Map<String, String> parseObject(String json);
}
