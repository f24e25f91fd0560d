package reconciler.spi;

import java.sql.Connection;
import java.time.Instant;
import java.util.Collection;

/**
 * Storage writes the reconciler performs on domain rows.
 */
public interface DefinitionWriter {

    /**
     * Caches the scheduler's next fire time on a reminder.
     *
     * @param nextFireAt next fire time, or {@code null} to clear it
     * @return rows updated (0 or 1)
     */
    int updateNextFireTime(Connection conn, long reminderId, Instant nextFireAt);

    /**
     * Disables the given reminders and clears their cached next fire time.
     *
     * @return rows updated
     */
    int disableReminders(Connection conn, Collection<Long> reminderIds);

    /**
     * Moves a task's due date forward to {@code nextDueAt} if the task is not done and its
     * current due date is missing or earlier.
     *
     * @return rows updated (0 or 1)
     */
    int advanceTaskDueDate(Connection conn, long taskId, Instant nextDueAt);

    /**
     * Turns a task's rollover off.
     *
     * @return rows updated (0 or 1)
     */
    int disableRollover(Connection conn, long taskId);
}
