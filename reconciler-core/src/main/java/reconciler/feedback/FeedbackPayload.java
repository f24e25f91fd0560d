package reconciler.feedback;

import reconciler.util.JsonCodec;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field names and codec helpers for inbox row payloads.
 *
 * <ul>
 *   <li>{@code fired}: {@code {"firedAt": "<instant>"}}</li>
 *   <li>{@code next_due_computed}: {@code {"nextDueAt": "<instant>"}}</li>
 *   <li>{@code exhausted}: no payload</li>
 * </ul>
 */
public final class FeedbackPayload {
  public static final String FIRED_AT = "firedAt";
  public static final String NEXT_DUE_AT = "nextDueAt";

  private FeedbackPayload() {
  }

  public static String of(JsonCodec codec, String field, Instant value) {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put(field, value.toString());
    return codec.toJson(fields);
  }

  /**
   * Reads an instant field.
   *
   * @return the instant, or {@code null} if the field is absent
   * @throws IllegalArgumentException if the payload or the field is malformed
   */
  public static Instant instant(JsonCodec codec, String payloadJson, String field) {
    String raw = codec.parseObject(payloadJson).get(field);
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return Instant.parse(raw);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid " + field + ": " + raw, e);
    }
  }
}
