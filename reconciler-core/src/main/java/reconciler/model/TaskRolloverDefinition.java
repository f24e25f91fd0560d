package reconciler.model;

/**
 * A task's rollover rule: a recurrence that computes the task's next due date.
 *
 * @param taskId   owning task id (also the rollover's id)
 * @param roll     whether rollover is active
 * @param rollSpec decoded rule, or {@code null} if none is stored
 * @param timeZone IANA zone name for the rule, may be {@code null}
 * @param task     the task's current due date and completion flag
 */
public record TaskRolloverDefinition(
    long taskId,
    boolean roll,
    RollSpec rollSpec,
    String timeZone,
    TaskContext task
) {
}
