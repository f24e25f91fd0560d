package reconciler.jdbc.store;

import reconciler.jdbc.JdbcTemplate;
import reconciler.jdbc.TableNames;
import reconciler.spi.DefinitionWriter;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Writes the columns the reconciler owns on the {@code reminders} and {@code tasks} tables.
 * Every statement is conditional, so replaying the same fact changes nothing.
 */
public final class JdbcDefinitionWriter implements DefinitionWriter {

  private final String reminderTable;
  private final String taskTable;

  public JdbcDefinitionWriter() {
    this(TableNames.DEFAULT_REMINDER_TABLE, TableNames.DEFAULT_TASK_TABLE);
  }

  public JdbcDefinitionWriter(String reminderTable, String taskTable) {
    this.reminderTable = TableNames.validate(reminderTable);
    this.taskTable = TableNames.validate(taskTable);
  }

  @Override
  public int updateNextFireTime(Connection conn, long reminderId, Instant nextFireAt) {
    String sql = "UPDATE " + reminderTable + " SET next_fire_at=? WHERE id=?";
    return JdbcTemplate.update(conn, sql, nextFireAt, reminderId);
  }

  @Override
  public int disableReminders(Connection conn, Collection<Long> reminderIds) {
    Objects.requireNonNull(reminderIds, "reminderIds");
    if (reminderIds.isEmpty()) {
      return 0;
    }
    List<Object> params = new ArrayList<>(reminderIds);
    String sql = "UPDATE " + reminderTable + " SET enabled=FALSE, next_fire_at=NULL" +
        " WHERE id IN (" + JdbcTemplate.placeholders(params.size()) + ")";
    return JdbcTemplate.update(conn, sql, params.toArray());
  }

  @Override
  public int advanceTaskDueDate(Connection conn, long taskId, Instant nextDueAt) {
    Objects.requireNonNull(nextDueAt, "nextDueAt");
    String sql = "UPDATE " + taskTable + " SET due_date=?" +
        " WHERE id=? AND done=FALSE AND (due_date IS NULL OR due_date < ?)";
    return JdbcTemplate.update(conn, sql, nextDueAt, taskId, nextDueAt);
  }

  @Override
  public int disableRollover(Connection conn, long taskId) {
    String sql = "UPDATE " + taskTable + " SET roll=FALSE WHERE id=? AND roll=TRUE";
    return JdbcTemplate.update(conn, sql, taskId);
  }
}
