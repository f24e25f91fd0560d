package reconciler.jdbc.store;

import reconciler.jdbc.JdbcTemplate;
import reconciler.jdbc.TableNames;
import reconciler.jdbc.spi.Dialect;
import reconciler.model.ClaimedEvent;
import reconciler.spi.ClaimQueue;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Base JDBC claim queue with the lifecycle statements shared by the outbox and inbox
 * tables. Claims are delegated to the {@link Dialect}.
 *
 * @param <E> row type
 */
public abstract class AbstractJdbcClaimQueue<E extends ClaimedEvent> implements ClaimQueue<E> {
  private static final int MAX_ERROR_LENGTH = 4000;

  private final Dialect dialect;
  private final String tableName;

  protected AbstractJdbcClaimQueue(Dialect dialect, String tableName) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.tableName = TableNames.validate(tableName);
  }

  /** Columns read by {@link #rowMapper()}. */
  protected abstract String columns();

  protected abstract JdbcTemplate.RowMapper<E> rowMapper();

  public Dialect dialect() {
    return dialect;
  }

  public String tableName() {
    return tableName;
  }

  @Override
  public List<E> claim(Connection conn, Instant now, Instant leaseUntil, int limit) {
    return dialect.claim(conn, tableName, columns(), rowMapper(), now, leaseUntil, limit);
  }

  @Override
  public int markProcessed(Connection conn, long id, Instant processedAt) {
    String sql = "UPDATE " + tableName +
        " SET processed_at=?, last_error=NULL, claim_token=NULL" +
        " WHERE id=? AND processed_at IS NULL";
    return JdbcTemplate.update(conn, sql, Timestamp.from(processedAt), id);
  }

  @Override
  public int markRetry(Connection conn, long id, Instant nextAt, String error) {
    String sql = "UPDATE " + tableName +
        " SET available_at=?, last_error=?, claim_token=NULL" +
        " WHERE id=? AND processed_at IS NULL AND quarantined_at IS NULL";
    return JdbcTemplate.update(conn, sql, Timestamp.from(nextAt), truncateError(error), id);
  }

  @Override
  public int markQuarantined(Connection conn, long id, Instant quarantinedAt, String error) {
    String sql = "UPDATE " + tableName +
        " SET quarantined_at=?, last_error=?, claim_token=NULL" +
        " WHERE id=? AND processed_at IS NULL AND quarantined_at IS NULL";
    return JdbcTemplate.update(conn, sql, Timestamp.from(quarantinedAt), truncateError(error), id);
  }

  @Override
  public List<E> queryQuarantined(Connection conn, int limit) {
    String sql = "SELECT " + columns() + " FROM " + tableName +
        " WHERE quarantined_at IS NOT NULL ORDER BY id LIMIT ?";
    return JdbcTemplate.query(conn, sql, rowMapper(), limit);
  }

  @Override
  public int replayQuarantined(Connection conn, long id, Instant availableAt) {
    String sql = "UPDATE " + tableName +
        " SET quarantined_at=NULL, attempts=0, available_at=?, last_error=NULL" +
        " WHERE id=? AND quarantined_at IS NOT NULL";
    return JdbcTemplate.update(conn, sql, Timestamp.from(availableAt), id);
  }

  @Override
  public int countQuarantined(Connection conn) {
    String sql = "SELECT COUNT(*) FROM " + tableName + " WHERE quarantined_at IS NOT NULL";
    List<Integer> counts = JdbcTemplate.query(conn, sql, rs -> rs.getInt(1));
    return counts.isEmpty() ? 0 : counts.get(0);
  }

  static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
