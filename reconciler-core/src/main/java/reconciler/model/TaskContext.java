package reconciler.model;

import java.time.Instant;

/**
 * The owning task's fields a reminder or rollover depends on.
 *
 * @param dueDate the task's due date, or {@code null} if it has none
 * @param done    whether the task is completed
 */
public record TaskContext(Instant dueDate, boolean done) {
}
