package reconciler.schedule;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Scheduler-native description of when a schedule fires.
 *
 * <p>Exactly one of {@code calendars}, {@code intervals} or {@code cronExpressions}
 * is populated by the compiler, though the scheduler accepts any combination.
 *
 * @param timeZone IANA zone the calendar and cron rules are evaluated in
 * @param startAt  optional earliest fire time
 * @param endAt    optional latest fire time
 */
public record ScheduleSpec(
    List<CalendarSpec> calendars,
    List<IntervalSpec> intervals,
    List<String> cronExpressions,
    String timeZone,
    Instant startAt,
    Instant endAt,
    OverlapPolicy overlapPolicy
) {

  public ScheduleSpec {
    calendars = List.copyOf(calendars);
    intervals = List.copyOf(intervals);
    cronExpressions = List.copyOf(cronExpressions);
    Objects.requireNonNull(timeZone, "timeZone");
    Objects.requireNonNull(overlapPolicy, "overlapPolicy");
    if (calendars.isEmpty() && intervals.isEmpty() && cronExpressions.isEmpty()) {
      throw new IllegalArgumentException("ScheduleSpec needs at least one calendar, interval or cron rule");
    }
    if (startAt != null && endAt != null && endAt.isBefore(startAt)) {
      throw new IllegalArgumentException("endAt must not be before startAt");
    }
  }

  public static ScheduleSpec calendar(CalendarSpec calendar, String timeZone,
      Instant startAt, Instant endAt) {
    return new ScheduleSpec(List.of(calendar), List.of(), List.of(), timeZone,
        startAt, endAt, OverlapPolicy.SKIP);
  }

  public static ScheduleSpec interval(IntervalSpec interval, String timeZone,
      Instant startAt, Instant endAt) {
    return new ScheduleSpec(List.of(), List.of(interval), List.of(), timeZone,
        startAt, endAt, OverlapPolicy.SKIP);
  }

  public static ScheduleSpec cron(List<String> expressions, String timeZone,
      Instant startAt, Instant endAt) {
    return new ScheduleSpec(List.of(), List.of(), expressions, timeZone,
        startAt, endAt, OverlapPolicy.SKIP);
  }
}
