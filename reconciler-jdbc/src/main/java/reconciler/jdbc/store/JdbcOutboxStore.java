package reconciler.jdbc.store;

import reconciler.jdbc.JdbcTemplate;
import reconciler.jdbc.TableNames;
import reconciler.jdbc.spi.Dialect;
import reconciler.model.EntityType;
import reconciler.model.IntentOp;
import reconciler.model.OutboxEvent;
import reconciler.spi.OutboxStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * Outbox of schedule sync intents in the {@code reconcile_outbox} table (or a custom name).
 */
public final class JdbcOutboxStore extends AbstractJdbcClaimQueue<OutboxEvent> implements OutboxStore {

  private static final String COLUMNS = "id, op, entity_type, entity_id, attempts, created_at";

  private static final JdbcTemplate.RowMapper<OutboxEvent> ROW_MAPPER = rs -> new OutboxEvent(
      rs.getLong("id"),
      IntentOp.fromCode(rs.getString("op")),
      EntityType.fromCode(rs.getString("entity_type")),
      rs.getLong("entity_id"),
      rs.getInt("attempts"),
      rs.getTimestamp("created_at").toInstant());

  public JdbcOutboxStore(Dialect dialect) {
    this(dialect, TableNames.DEFAULT_OUTBOX_TABLE);
  }

  public JdbcOutboxStore(Dialect dialect, String tableName) {
    super(dialect, tableName);
  }

  @Override
  public long append(Connection conn, IntentOp op, EntityType entityType, long entityId, Instant now) {
    String sql = "INSERT INTO " + tableName() +
        " (op, entity_type, entity_id, attempts, available_at, created_at)" +
        " VALUES (?,?,?,0,?,?)";
    Timestamp ts = Timestamp.from(now);
    return JdbcTemplate.insertReturningKey(conn, sql, op.code(), entityType.code(), entityId, ts, ts);
  }

  @Override
  protected String columns() {
    return COLUMNS;
  }

  @Override
  protected JdbcTemplate.RowMapper<OutboxEvent> rowMapper() {
    return ROW_MAPPER;
  }
}
