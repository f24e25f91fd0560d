package reconciler.jdbc.store;

import reconciler.jdbc.JdbcTemplate;
import reconciler.jdbc.TableNames;
import reconciler.jdbc.spi.Dialect;
import reconciler.model.EntityType;
import reconciler.model.FeedbackKind;
import reconciler.model.InboxEvent;
import reconciler.spi.InboxStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * Inbox of scheduler facts in the {@code reconcile_inbox} table (or a custom name).
 */
public final class JdbcInboxStore extends AbstractJdbcClaimQueue<InboxEvent> implements InboxStore {

  private static final String COLUMNS =
      "id, kind, entity_type, entity_id, payload, attempts, created_at";

  private static final JdbcTemplate.RowMapper<InboxEvent> ROW_MAPPER = rs -> new InboxEvent(
      rs.getLong("id"),
      FeedbackKind.fromCode(rs.getString("kind")),
      EntityType.fromCode(rs.getString("entity_type")),
      rs.getLong("entity_id"),
      rs.getString("payload"),
      rs.getInt("attempts"),
      rs.getTimestamp("created_at").toInstant());

  public JdbcInboxStore(Dialect dialect) {
    this(dialect, TableNames.DEFAULT_INBOX_TABLE);
  }

  public JdbcInboxStore(Dialect dialect, String tableName) {
    super(dialect, tableName);
  }

  @Override
  public long append(Connection conn, FeedbackKind kind, EntityType entityType, long entityId,
      String payloadJson, Instant now) {
    String sql = "INSERT INTO " + tableName() +
        " (kind, entity_type, entity_id, payload, attempts, available_at, created_at)" +
        " VALUES (?,?,?,?,0,?,?)";
    Timestamp ts = Timestamp.from(now);
    return JdbcTemplate.insertReturningKey(conn, sql,
        kind.code(), entityType.code(), entityId, payloadJson, ts, ts);
  }

  @Override
  protected String columns() {
    return COLUMNS;
  }

  @Override
  protected JdbcTemplate.RowMapper<InboxEvent> rowMapper() {
    return ROW_MAPPER;
  }
}
