package reconciler.jdbc.dialect;

import reconciler.jdbc.JdbcTemplate;
import reconciler.model.ClaimedEvent;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * PostgreSQL dialect.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for
 * single-round-trip claim.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public <E extends ClaimedEvent> List<E> claim(
      Connection conn, String table, String columns, JdbcTemplate.RowMapper<E> mapper,
      Instant now, Instant leaseUntil, int limit) {
    String sql = "UPDATE " + table +
        " SET attempts=attempts+1, available_at=?, claim_token=NULL" +
        " WHERE id IN (" +
        "SELECT id FROM " + table + " WHERE " + CLAIMABLE +
        " ORDER BY id LIMIT ?" +
        " FOR UPDATE SKIP LOCKED" +
        ") RETURNING " + columns;
    List<E> claimed = new ArrayList<>(JdbcTemplate.updateReturning(conn, sql, mapper,
        Timestamp.from(leaseUntil), Timestamp.from(now), limit));
    // RETURNING carries no order
    claimed.sort(Comparator.comparingLong(ClaimedEvent::id));
    return claimed;
  }
}
