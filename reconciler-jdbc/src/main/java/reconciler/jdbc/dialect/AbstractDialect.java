package reconciler.jdbc.dialect;

import reconciler.jdbc.JdbcTemplate;
import reconciler.jdbc.spi.Dialect;
import reconciler.model.ClaimedEvent;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Base dialect with a standard SQL two-phase claim.
 *
 * <p>Phase one stamps a fresh claim token on the selected rows with a conditional
 * update that re-checks claimability, so a row another claimer took in the meantime is
 * skipped. Phase two selects the rows carrying the token.
 */
public abstract class AbstractDialect implements Dialect {

  protected static final String CLAIMABLE =
      "processed_at IS NULL AND quarantined_at IS NULL AND available_at <= ?";

  @Override
  public <E extends ClaimedEvent> List<E> claim(
      Connection conn, String table, String columns, JdbcTemplate.RowMapper<E> mapper,
      Instant now, Instant leaseUntil, int limit) {
    String token = UUID.randomUUID().toString();
    Timestamp nowTs = Timestamp.from(now);
    String claimSql = "UPDATE " + table +
        " SET attempts=attempts+1, available_at=?, claim_token=?" +
        " WHERE id IN (SELECT id FROM " + table + " WHERE " + CLAIMABLE +
        " ORDER BY id LIMIT ?) AND " + CLAIMABLE;
    int updated = JdbcTemplate.update(conn, claimSql,
        Timestamp.from(leaseUntil), token, nowTs, limit, nowTs);
    if (updated == 0) {
      return List.of();
    }
    String selectSql = "SELECT " + columns + " FROM " + table +
        " WHERE claim_token=? ORDER BY id";
    return JdbcTemplate.query(conn, selectSql, mapper, token);
  }
}
