package reconciler.compile;

import reconciler.model.EntityType;
import reconciler.model.ReminderDefinition;
import reconciler.model.ReminderTrigger;
import reconciler.model.RollSpec;
import reconciler.model.TaskContext;
import reconciler.model.TaskRolloverDefinition;
import reconciler.schedule.CalendarSpec;
import reconciler.schedule.FieldRange;
import reconciler.schedule.IntervalSpec;
import reconciler.schedule.ScheduleHandle;
import reconciler.schedule.ScheduleSpec;
import reconciler.schedule.WorkAction;
import reconciler.spi.MetricsExporter;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps a domain row to the state its external schedule should be in.
 *
 * <p>Compilation is a pure function of the row and the clock: it performs no I/O and
 * never throws for a row of a known shape. Rows missing the fields their kind requires
 * compile to {@link DesiredState.Delete}, so bad data converges instead of retrying.
 *
 * <p>Reminder rules, first match wins:
 * <ol>
 *   <li>disabled, or {@code end_at <= now}: delete</li>
 *   <li>{@code one_off}: one calendar instant at {@code at}, window {@code [at, at+1s)},
 *       self-deleting after it fires</li>
 *   <li>{@code task_due_before}: same shape at {@code due_date - before}; requires an
 *       open task with a due date</li>
 *   <li>{@code interval}: fixed positive interval within the reminder's window</li>
 *   <li>{@code cron}: non-blank cron expression within the reminder's window</li>
 *   <li>anything else: delete</li>
 * </ol>
 *
 * <p>This class is thread-safe.
 */
public final class DesiredStateCompiler {
  private static final Logger logger = Logger.getLogger(DesiredStateCompiler.class.getName());

  /** Work type started when a reminder fires. */
  public static final String REMINDER_WORK_TYPE = "reminder_fire";

  /** Work type started when a rollover fires; the unit of work itself does nothing. */
  public static final String ROLLOVER_WORK_TYPE = "task_rollover";

  static final String UTC = "UTC";
  private static final Duration SINGLE_SHOT_WINDOW = Duration.ofSeconds(1);

  private final Clock clock;
  private final MetricsExporter metrics;

  public DesiredStateCompiler() {
    this(Clock.systemUTC(), MetricsExporter.NOOP);
  }

  public DesiredStateCompiler(Clock clock, MetricsExporter metrics) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  public DesiredState compile(ReminderDefinition reminder) {
    Objects.requireNonNull(reminder, "reminder");
    if (!reminder.enabled()) {
      return new DesiredState.Delete("disabled");
    }
    Instant now = clock.instant();
    if (reminder.endAt() != null && !reminder.endAt().isAfter(now)) {
      return new DesiredState.Delete("window ended at " + reminder.endAt());
    }
    if (reminder.startAt() != null && reminder.endAt() != null
        && reminder.endAt().isBefore(reminder.startAt())) {
      return new DesiredState.Delete("end_at precedes start_at");
    }
    return reminder.trigger().accept(new ReminderRules(reminder));
  }

  public DesiredState compile(TaskRolloverDefinition rollover) {
    Objects.requireNonNull(rollover, "rollover");
    if (!rollover.roll()) {
      return new DesiredState.Delete("rollover disabled");
    }
    if (rollover.rollSpec() == null) {
      return new DesiredState.Delete("no roll_spec");
    }
    return rollover.rollSpec().accept(new RolloverRules(rollover));
  }

  private final class ReminderRules implements ReminderTrigger.Visitor<DesiredState> {
    private final ReminderDefinition reminder;

    private ReminderRules(ReminderDefinition reminder) {
      this.reminder = reminder;
    }

    @Override
    public DesiredState visitOneOff(ReminderTrigger.OneOff trigger) {
      if (trigger.at() == null) {
        return new DesiredState.Delete("one_off without at");
      }
      return singleShot(trigger.at());
    }

    @Override
    public DesiredState visitTaskDueBefore(ReminderTrigger.TaskDueBefore trigger) {
      TaskContext task = trigger.task();
      if (task == null) {
        return new DesiredState.Delete("task_due_before without task");
      }
      if (task.done()) {
        return new DesiredState.Delete("task is done");
      }
      if (task.dueDate() == null) {
        return new DesiredState.Delete("task has no due date");
      }
      if (trigger.before() == null) {
        return new DesiredState.Delete("task_due_before without before");
      }
      return singleShot(task.dueDate().minus(trigger.before()));
    }

    @Override
    public DesiredState visitInterval(ReminderTrigger.Interval trigger) {
      Duration every = trigger.every();
      if (every == null || every.isZero() || every.isNegative()) {
        return new DesiredState.Delete("interval without positive every");
      }
      ResolvedZone zone = resolveZone(reminder.timeZone(), EntityType.REMINDER, reminder.id());
      ScheduleSpec spec = ScheduleSpec.interval(IntervalSpec.every(every), zone.name(),
          reminder.startAt(), reminder.endAt());
      return new DesiredState.Upsert(spec, action(false), zone.fallback());
    }

    @Override
    public DesiredState visitCron(ReminderTrigger.Cron trigger) {
      if (trigger.expression() == null || trigger.expression().isBlank()) {
        return new DesiredState.Delete("cron without expression");
      }
      ResolvedZone zone = resolveZone(reminder.timeZone(), EntityType.REMINDER, reminder.id());
      ScheduleSpec spec = ScheduleSpec.cron(List.of(trigger.expression().trim()), zone.name(),
          reminder.startAt(), reminder.endAt());
      return new DesiredState.Upsert(spec, action(false), zone.fallback());
    }

    @Override
    public DesiredState visitUnrecognized(ReminderTrigger.Unrecognized trigger) {
      return new DesiredState.Delete("unknown kind: " + trigger.kind());
    }

    private DesiredState singleShot(Instant fireAt) {
      ResolvedZone zone = resolveZone(reminder.timeZone(), EntityType.REMINDER, reminder.id());
      CalendarSpec calendar = CalendarSpec.at(fireAt.atZone(zone.zoneId()));
      ScheduleSpec spec = ScheduleSpec.calendar(calendar, zone.name(),
          fireAt, fireAt.plus(SINGLE_SHOT_WINDOW));
      return new DesiredState.Upsert(spec, action(true), zone.fallback());
    }

    private WorkAction action(boolean deleteAfter) {
      return workAction(REMINDER_WORK_TYPE, EntityType.REMINDER, reminder.id(), deleteAfter);
    }
  }

  private final class RolloverRules implements RollSpec.Visitor<DesiredState> {
    private final TaskRolloverDefinition rollover;

    private RolloverRules(TaskRolloverDefinition rollover) {
      this.rollover = rollover;
    }

    @Override
    public DesiredState visitCron(RollSpec.CronRoll spec) {
      if (spec.expressions().isEmpty()) {
        return new DesiredState.Delete("cron rollover without expression");
      }
      ResolvedZone zone = resolveZone(rollover.timeZone(), EntityType.TASK_ROLLOVER, rollover.taskId());
      return new DesiredState.Upsert(
          ScheduleSpec.cron(spec.expressions(), zone.name(), null, null), action(), zone.fallback());
    }

    @Override
    public DesiredState visitCalendar(RollSpec.CalendarRoll spec) {
      if (spec.fields().isEmpty()) {
        return new DesiredState.Delete("calendar rollover without fields");
      }
      CalendarSpec calendar;
      try {
        calendar = new CalendarSpec(
            ranges(spec, "second"),
            ranges(spec, "minute"),
            ranges(spec, "hour"),
            ranges(spec, "day_of_month"),
            ranges(spec, "month"),
            ranges(spec, "day_of_week"),
            ranges(spec, "year"));
      } catch (IllegalArgumentException e) {
        return new DesiredState.Delete("malformed calendar rollover: " + e.getMessage());
      }
      ResolvedZone zone = resolveZone(rollover.timeZone(), EntityType.TASK_ROLLOVER, rollover.taskId());
      return new DesiredState.Upsert(
          ScheduleSpec.calendar(calendar, zone.name(), null, null), action(), zone.fallback());
    }

    @Override
    public DesiredState visitInterval(RollSpec.IntervalRoll spec) {
      // Whether the next due date counts from now or from the previous due date is undecided.
      return new DesiredState.Delete("interval rollovers are unsupported");
    }

    @Override
    public DesiredState visitUnrecognized(RollSpec.UnrecognizedRoll spec) {
      return new DesiredState.Delete("unknown roll_spec kind: " + spec.kind());
    }

    private List<FieldRange> ranges(RollSpec.CalendarRoll spec, String field) {
      String expression = spec.fields().get(field);
      return expression == null ? List.of() : FieldRange.parseList(expression);
    }

    private WorkAction action() {
      return workAction(ROLLOVER_WORK_TYPE, EntityType.TASK_ROLLOVER, rollover.taskId(), false);
    }
  }

  private static WorkAction workAction(String workType, EntityType entityType, long entityId,
      boolean deleteAfter) {
    Map<String, String> arguments = new LinkedHashMap<>();
    arguments.put(WorkAction.ARG_ENTITY_TYPE, entityType.code());
    arguments.put(WorkAction.ARG_ENTITY_ID, Long.toString(entityId));
    arguments.put(WorkAction.ARG_HANDLE, ScheduleHandle.of(entityType, entityId).id());
    arguments.put(WorkAction.ARG_DELETE_AFTER, Boolean.toString(deleteAfter));
    return new WorkAction(workType, arguments);
  }

  private ResolvedZone resolveZone(String name, EntityType entityType, long entityId) {
    if (name == null || name.isBlank()) {
      return new ResolvedZone(ZoneOffset.UTC, UTC, false);
    }
    try {
      ZoneId zoneId = ZoneId.of(name.trim());
      return new ResolvedZone(zoneId, zoneId.getId(), false);
    } catch (DateTimeException e) {
      logger.log(Level.WARNING, "Unknown time zone ''{0}'' on {1}:{2}, using UTC",
          new Object[]{name, entityType.code(), String.valueOf(entityId)});
      metrics.incrementTimeZoneFallback();
      return new ResolvedZone(ZoneOffset.UTC, UTC, true);
    }
  }

  private record ResolvedZone(ZoneId zoneId, String name, boolean fallback) {
  }
}
