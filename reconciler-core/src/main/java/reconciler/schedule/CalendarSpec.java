package reconciler.schedule;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * One calendar rule: a set of range lists per field. An empty list means the
 * scheduler's default for that field (every value, or zero for second/minute/hour).
 */
public record CalendarSpec(
    List<FieldRange> second,
    List<FieldRange> minute,
    List<FieldRange> hour,
    List<FieldRange> dayOfMonth,
    List<FieldRange> month,
    List<FieldRange> dayOfWeek,
    List<FieldRange> year
) {

  public CalendarSpec {
    second = List.copyOf(second);
    minute = List.copyOf(minute);
    hour = List.copyOf(hour);
    dayOfMonth = List.copyOf(dayOfMonth);
    month = List.copyOf(month);
    dayOfWeek = List.copyOf(dayOfWeek);
    year = List.copyOf(year);
  }

  /**
   * Rule matching exactly one wall-clock instant: every field is pinned to the
   * value {@code dateTime} has in its own zone.
   */
  public static CalendarSpec at(ZonedDateTime dateTime) {
    return new CalendarSpec(
        List.of(FieldRange.single(dateTime.getSecond())),
        List.of(FieldRange.single(dateTime.getMinute())),
        List.of(FieldRange.single(dateTime.getHour())),
        List.of(FieldRange.single(dateTime.getDayOfMonth())),
        List.of(FieldRange.single(dateTime.getMonthValue())),
        List.of(),
        List.of(FieldRange.single(dateTime.getYear())));
  }
}
