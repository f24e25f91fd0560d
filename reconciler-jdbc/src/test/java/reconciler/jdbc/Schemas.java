package reconciler.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Schema setup and row fixtures shared by the JDBC tests.
 */
final class Schemas {

  private Schemas() {}

  /** Fresh in-memory H2 database with the bundled schema applied. */
  static JdbcDataSource h2() throws SQLException, IOException {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:reconciler_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
    apply(ds, "/schema/h2.sql");
    return ds;
  }

  static void apply(DataSource dataSource, String resource) throws SQLException, IOException {
    String script;
    try (InputStream is = Schemas.class.getResourceAsStream(resource)) {
      if (is == null) {
        throw new IOException("Resource not found: " + resource);
      }
      script = new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : script.split(";")) {
        if (!sql.isBlank()) {
          stmt.execute(sql.trim());
        }
      }
    }
  }

  static void truncateAll(DataSource dataSource) throws SQLException {
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String table : new String[]{"reconcile_outbox", "reconcile_inbox", "reminders", "tasks"}) {
        stmt.execute("DELETE FROM " + table);
      }
    }
  }

  static void insertTask(Connection conn, long id, Instant dueDate, boolean done,
      boolean roll, String rollSpec, String rollTz) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(
        "INSERT INTO tasks (id, due_date, done, roll, roll_spec, roll_tz) VALUES (?,?,?,?,?,?)")) {
      ps.setLong(1, id);
      ps.setTimestamp(2, dueDate == null ? null : Timestamp.from(dueDate));
      ps.setBoolean(3, done);
      ps.setBoolean(4, roll);
      ps.setString(5, rollSpec);
      ps.setString(6, rollTz);
      ps.executeUpdate();
    }
  }

  static void insertOneOff(Connection conn, long id, Instant at) throws SQLException {
    insertReminder(conn, id, "one_off", at, null, null, null, null, null);
  }

  static void insertInterval(Connection conn, long id, Duration every, Instant endAt) throws SQLException {
    insertReminder(conn, id, "interval", null, null, every, null, endAt, null);
  }

  static void insertDueBefore(Connection conn, long id, long taskId, Duration before) throws SQLException {
    insertReminder(conn, id, "task_due_before", null, before, null, null, null, taskId);
  }

  static void insertReminder(Connection conn, long id, String kind, Instant at, Duration before,
      Duration every, String cron, Instant endAt, Long taskId) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(
        "INSERT INTO reminders (id, kind, fire_at, before_seconds, every_seconds, cron, end_at, tz, task_id)" +
            " VALUES (?,?,?,?,?,?,?,?,?)")) {
      ps.setLong(1, id);
      ps.setString(2, kind);
      ps.setTimestamp(3, at == null ? null : Timestamp.from(at));
      ps.setObject(4, before == null ? null : before.getSeconds(), Types.BIGINT);
      ps.setObject(5, every == null ? null : every.getSeconds(), Types.BIGINT);
      ps.setString(6, cron);
      ps.setTimestamp(7, endAt == null ? null : Timestamp.from(endAt));
      ps.setString(8, "UTC");
      ps.setObject(9, taskId, Types.BIGINT);
      ps.executeUpdate();
    }
  }
}
