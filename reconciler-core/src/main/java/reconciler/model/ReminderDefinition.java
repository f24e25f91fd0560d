package reconciler.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A reminder row plus the join context the compiler needs.
 *
 * @param id       reminder id
 * @param enabled  whether the reminder should have a live schedule
 * @param trigger  kind-specific fields
 * @param startAt  optional start of the validity window
 * @param endAt    optional end of the validity window
 * @param timeZone IANA zone name, may be {@code null} (treated as UTC)
 * @param taskId   optional owning task
 */
public record ReminderDefinition(
    long id,
    boolean enabled,
    ReminderTrigger trigger,
    Instant startAt,
    Instant endAt,
    String timeZone,
    Long taskId
) {
  public ReminderDefinition {
    Objects.requireNonNull(trigger, "trigger");
  }

  /** Whether the trigger fires at most once. */
  public boolean singleShot() {
    return trigger instanceof ReminderTrigger.OneOff
        || trigger instanceof ReminderTrigger.TaskDueBefore;
  }

  /**
   * The instant a single-shot trigger fires at: {@code at} for a one-off, the due date minus
   * {@code before} for a due-date reminder. Empty for recurring triggers and for single-shot
   * triggers missing a field.
   */
  public Optional<Instant> singleShotAt() {
    if (trigger instanceof ReminderTrigger.OneOff oneOff) {
      return Optional.ofNullable(oneOff.at());
    }
    if (trigger instanceof ReminderTrigger.TaskDueBefore dueBefore) {
      TaskContext task = dueBefore.task();
      if (task == null || task.dueDate() == null || dueBefore.before() == null) {
        return Optional.empty();
      }
      return Optional.of(task.dueDate().minus(dueBefore.before()));
    }
    return Optional.empty();
  }
}
