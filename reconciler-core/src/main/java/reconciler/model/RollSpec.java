package reconciler.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Kind-tagged recurrence rule of a task rollover, decoded from the flat JSON
 * object stored in {@code roll_spec}.
 *
 * <p>Supported payloads:
 * <pre>{@code
 * {"kind":"cron","cron":"0 9 * * MON"}
 * {"kind":"calendar","hour":"9","minute":"0","day_of_week":"1-5"}
 * {"kind":"interval","every_seconds":"86400"}
 * }</pre>
 */
public sealed interface RollSpec {

  String KIND_KEY = "kind";

  /** Calendar field names accepted in a {@code calendar} payload. */
  List<String> CALENDAR_FIELDS = List.of(
      "second", "minute", "hour", "day_of_month", "month", "day_of_week", "year");

  <R> R accept(Visitor<R> visitor);

  interface Visitor<R> {
    R visitCron(CronRoll spec);

    R visitCalendar(CalendarRoll spec);

    R visitInterval(IntervalRoll spec);

    R visitUnrecognized(UnrecognizedRoll spec);
  }

  /** One or more cron expressions; empty if the payload had none. */
  record CronRoll(List<String> expressions) implements RollSpec {
    public CronRoll {
      expressions = List.copyOf(expressions);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCron(this);
    }
  }

  /**
   * Calendar fields keyed by name (see {@link #CALENDAR_FIELDS}), each a range
   * expression such as {@code "1-5"} or {@code "0,30"}.
   */
  record CalendarRoll(Map<String, String> fields) implements RollSpec {
    public CalendarRoll {
      fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCalendar(this);
    }
  }

  /** Repeating interval; {@code every} is {@code null} when missing or unparsable. */
  record IntervalRoll(Duration every) implements RollSpec {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitInterval(this);
    }
  }

  record UnrecognizedRoll(String kind) implements RollSpec {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUnrecognized(this);
    }
  }

  /**
   * Decodes a parsed {@code roll_spec} object. Never throws; malformed input yields a
   * variant the compiler maps to a delete.
   */
  static RollSpec fromMap(Map<String, String> payload) {
    String kind = payload == null ? null : payload.get(KIND_KEY);
    if (kind == null) {
      return new UnrecognizedRoll(null);
    }
    switch (kind) {
      case "cron": {
        String raw = payload.getOrDefault("cron", "");
        List<String> expressions = new ArrayList<>();
        for (String expression : raw.split(";")) {
          if (!expression.isBlank()) {
            expressions.add(expression.trim());
          }
        }
        return new CronRoll(expressions);
      }
      case "calendar": {
        Map<String, String> fields = new LinkedHashMap<>();
        for (String field : CALENDAR_FIELDS) {
          String value = payload.get(field);
          if (value != null && !value.isBlank()) {
            fields.put(field, value.trim());
          }
        }
        return new CalendarRoll(fields);
      }
      case "interval": {
        Duration every = null;
        try {
          String seconds = payload.get("every_seconds");
          if (seconds != null) {
            every = Duration.ofSeconds(Long.parseLong(seconds.trim()));
          }
        } catch (NumberFormatException e) {
          every = null;
        }
        return new IntervalRoll(every);
      }
      default:
        return new UnrecognizedRoll(kind);
    }
  }
}
