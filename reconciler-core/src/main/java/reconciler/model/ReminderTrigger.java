package reconciler.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Kind-specific part of a reminder. Each variant carries the single field its kind
 * requires; that field may be {@code null} when the stored row is incomplete.
 *
 * <p>Consumers match variants through {@link Visitor}, so a new kind cannot be added
 * without every visitor being updated.
 */
public sealed interface ReminderTrigger {

  /** Stored {@code kind} column value. */
  String kind();

  <R> R accept(Visitor<R> visitor);

  interface Visitor<R> {
    R visitOneOff(OneOff trigger);

    R visitTaskDueBefore(TaskDueBefore trigger);

    R visitInterval(Interval trigger);

    R visitCron(Cron trigger);

    R visitUnrecognized(Unrecognized trigger);
  }

  /** Fires once at {@code at}. */
  record OneOff(Instant at) implements ReminderTrigger {
    public static final String KIND = "one_off";

    @Override
    public String kind() {
      return KIND;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitOneOff(this);
    }
  }

  /** Fires once, {@code before} ahead of the owning task's due date. */
  record TaskDueBefore(Duration before, TaskContext task) implements ReminderTrigger {
    public static final String KIND = "task_due_before";

    @Override
    public String kind() {
      return KIND;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTaskDueBefore(this);
    }
  }

  /** Fires every {@code every}, within the reminder's window. */
  record Interval(Duration every) implements ReminderTrigger {
    public static final String KIND = "interval";

    @Override
    public String kind() {
      return KIND;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitInterval(this);
    }
  }

  /** Fires on a cron expression, within the reminder's window. */
  record Cron(String expression) implements ReminderTrigger {
    public static final String KIND = "cron";

    @Override
    public String kind() {
      return KIND;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCron(this);
    }
  }

  /** A stored kind this version does not know. */
  record Unrecognized(String kind) implements ReminderTrigger {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUnrecognized(this);
    }
  }

  /**
   * Builds the variant matching a stored row. Only the field relevant to {@code kind}
   * is kept; the others are ignored.
   */
  static ReminderTrigger of(String kind, Instant at, Duration before, Duration every,
      String cron, TaskContext task) {
    if (kind == null) {
      return new Unrecognized(null);
    }
    switch (kind) {
      case OneOff.KIND:
        return new OneOff(at);
      case TaskDueBefore.KIND:
        return new TaskDueBefore(before, task);
      case Interval.KIND:
        return new Interval(every);
      case Cron.KIND:
        return new Cron(cron);
      default:
        return new Unrecognized(kind);
    }
  }
}
