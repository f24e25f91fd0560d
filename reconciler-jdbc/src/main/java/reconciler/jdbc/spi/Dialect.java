package reconciler.jdbc.spi;

import reconciler.jdbc.JdbcTemplate;
import reconciler.model.ClaimedEvent;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide the database-specific claim of queue rows; every other
 * statement the stores issue is standard SQL.
 * Register custom dialects via {@code META-INF/services/reconciler.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: PostgreSQL, H2.
 *
 * @see reconciler.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:postgresql:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Claims up to {@code limit} claimable rows of a queue table and returns them in id order.
   *
   * <p>A row is claimable when it is neither processed nor quarantined and its
   * {@code available_at} is not after {@code now}. Claiming increments {@code attempts}
   * and sets {@code available_at} to {@code leaseUntil}, so a crashed worker's rows are
   * re-offered once the lease lapses. Concurrent claimers never receive the same row.
   *
   * @param conn       JDBC connection, inside the caller's transaction
   * @param table      queue table name
   * @param columns    comma-separated columns the mapper reads
   * @param mapper     maps one claimed row
   * @param now        current time
   * @param leaseUntil new {@code available_at} of claimed rows
   * @param limit      max rows to claim
   * @return claimed rows, with their incremented attempt counts
   */
  <E extends ClaimedEvent> List<E> claim(
      Connection conn, String table, String columns, JdbcTemplate.RowMapper<E> mapper,
      Instant now, Instant leaseUntil, int limit);
}
