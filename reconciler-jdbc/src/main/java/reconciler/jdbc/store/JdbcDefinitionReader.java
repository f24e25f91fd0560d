package reconciler.jdbc.store;

import reconciler.jdbc.JdbcTemplate;
import reconciler.jdbc.TableNames;
import reconciler.model.ReminderDefinition;
import reconciler.model.ReminderTrigger;
import reconciler.model.RollSpec;
import reconciler.model.TaskContext;
import reconciler.model.TaskRolloverDefinition;
import reconciler.spi.DefinitionReader;
import reconciler.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads reminder and task rollover definitions from the {@code reminders} and
 * {@code tasks} tables.
 *
 * <p>An unparsable {@code roll_spec} is read as an unrecognized rule rather than an error,
 * so the rollover compiles to a delete.
 */
public final class JdbcDefinitionReader implements DefinitionReader {
  private static final Logger logger = Logger.getLogger(JdbcDefinitionReader.class.getName());

  private final String reminderTable;
  private final String taskTable;
  private final JsonCodec jsonCodec;

  public JdbcDefinitionReader() {
    this(TableNames.DEFAULT_REMINDER_TABLE, TableNames.DEFAULT_TASK_TABLE, JsonCodec.getDefault());
  }

  public JdbcDefinitionReader(String reminderTable, String taskTable, JsonCodec jsonCodec) {
    this.reminderTable = TableNames.validate(reminderTable);
    this.taskTable = TableNames.validate(taskTable);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public Optional<ReminderDefinition> findReminder(Connection conn, long reminderId) {
    String sql = "SELECT r.id, r.kind, r.enabled, r.fire_at, r.before_seconds, r.every_seconds," +
        " r.cron, r.start_at, r.end_at, r.tz, r.task_id, t.id AS joined_task_id, t.due_date, t.done" +
        " FROM " + reminderTable + " r LEFT JOIN " + taskTable + " t ON t.id = r.task_id" +
        " WHERE r.id=?";
    List<ReminderDefinition> rows = JdbcTemplate.query(conn, sql, this::mapReminder, reminderId);
    return rows.stream().findFirst();
  }

  @Override
  public Optional<TaskRolloverDefinition> findRollover(Connection conn, long taskId) {
    String sql = "SELECT id, due_date, done, roll, roll_spec, roll_tz FROM " + taskTable +
        " WHERE id=?";
    List<TaskRolloverDefinition> rows = JdbcTemplate.query(conn, sql, rs -> new TaskRolloverDefinition(
        rs.getLong("id"),
        rs.getBoolean("roll"),
        rollSpec(rs.getLong("id"), rs.getString("roll_spec")),
        rs.getString("roll_tz"),
        new TaskContext(instant(rs, "due_date"), rs.getBoolean("done"))), taskId);
    return rows.stream().findFirst();
  }

  @Override
  public List<Long> findLapsedReminderIds(Connection conn, Instant now, int limit) {
    String sql = "SELECT id FROM " + reminderTable +
        " WHERE enabled=TRUE AND end_at IS NOT NULL AND end_at <= ? ORDER BY id LIMIT ?";
    return JdbcTemplate.query(conn, sql, rs -> rs.getLong(1), Timestamp.from(now), limit);
  }

  @Override
  public List<Long> findDueBeforeReminderIds(Connection conn, long taskId) {
    String sql = "SELECT id FROM " + reminderTable + " WHERE task_id=? AND kind=? ORDER BY id";
    return JdbcTemplate.query(conn, sql, rs -> rs.getLong(1),
        taskId, ReminderTrigger.TaskDueBefore.KIND);
  }

  private ReminderDefinition mapReminder(ResultSet rs) throws SQLException {
    Long taskId = nullableLong(rs, "task_id");
    TaskContext task = null;
    if (nullableLong(rs, "joined_task_id") != null) {
      task = new TaskContext(instant(rs, "due_date"), rs.getBoolean("done"));
    }
    ReminderTrigger trigger = ReminderTrigger.of(
        rs.getString("kind"),
        instant(rs, "fire_at"),
        seconds(rs, "before_seconds"),
        seconds(rs, "every_seconds"),
        rs.getString("cron"),
        task);
    return new ReminderDefinition(
        rs.getLong("id"),
        rs.getBoolean("enabled"),
        trigger,
        instant(rs, "start_at"),
        instant(rs, "end_at"),
        rs.getString("tz"),
        taskId);
  }

  private RollSpec rollSpec(long taskId, String json) {
    if (json == null) {
      return null;
    }
    try {
      return RollSpec.fromMap(jsonCodec.parseObject(json));
    } catch (IllegalArgumentException e) {
      logger.log(Level.WARNING, "Unreadable roll_spec of task " + taskId + ": " + e.getMessage());
      return RollSpec.fromMap(null);
    }
  }

  private static Instant instant(ResultSet rs, String column) throws SQLException {
    Timestamp ts = rs.getTimestamp(column);
    return ts == null ? null : ts.toInstant();
  }

  private static Duration seconds(ResultSet rs, String column) throws SQLException {
    Long value = nullableLong(rs, column);
    return value == null ? null : Duration.ofSeconds(value);
  }

  private static Long nullableLong(ResultSet rs, String column) throws SQLException {
    long value = rs.getLong(column);
    return rs.wasNull() ? null : value;
  }
}
