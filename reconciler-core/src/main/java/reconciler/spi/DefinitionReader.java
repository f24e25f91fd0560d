package reconciler.spi;

import reconciler.model.ReminderDefinition;
import reconciler.model.TaskRolloverDefinition;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to reminder and rollover rows with their task join context.
 */
public interface DefinitionReader {

    Optional<ReminderDefinition> findReminder(Connection conn, long reminderId);

    Optional<TaskRolloverDefinition> findRollover(Connection conn, long taskId);

    /**
     * Ids of enabled reminders whose {@code end_at} is at or before {@code now}.
     */
    List<Long> findLapsedReminderIds(Connection conn, Instant now, int limit);

    /**
     * Ids of {@code task_due_before} reminders attached to a task.
     */
    List<Long> findDueBeforeReminderIds(Connection conn, long taskId);
}
