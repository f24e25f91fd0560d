package reconciler.spi;

import reconciler.model.ClaimedEvent;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * Claim, outcome and quarantine operations shared by the outbox and inbox tables.
 *
 * <p>A row moves through: pending → claimed (lease) → processed, or back to pending after
 * a retry delay, or quarantined once the drainer gives up. Rows are never deleted.
 *
 * <p>All methods take an explicit {@link Connection} so the caller owns transaction
 * boundaries.
 *
 * @param <E> row type
 */
public interface ClaimQueue<E extends ClaimedEvent> {

    /**
     * Atomically claims up to {@code limit} rows that are unprocessed, not quarantined and
     * whose {@code available_at} is at or before {@code now}, ordered by id.
     *
     * <p>Each claimed row has its {@code attempts} incremented and its {@code available_at}
     * moved to {@code leaseUntil} before it is returned, so a crash while processing still
     * advances the backoff. Concurrent callers never receive the same row.
     *
     * <p>Must run inside a transaction the caller commits.
     *
     * @return claimed rows, lowest id first, with the incremented attempt count
     */
    List<E> claim(Connection conn, Instant now, Instant leaseUntil, int limit);

    /**
     * Marks a row processed and clears its last error.
     *
     * @return rows updated (0 or 1)
     */
    int markProcessed(Connection conn, long id, Instant processedAt);

    /**
     * Records a failure and schedules the next attempt. Does not change {@code attempts};
     * the claim already counted this attempt.
     *
     * @return rows updated (0 or 1)
     */
    int markRetry(Connection conn, long id, Instant nextAt, String error);

    /**
     * Removes a row from circulation after too many failures.
     *
     * @return rows updated (0 or 1)
     */
    int markQuarantined(Connection conn, long id, Instant quarantinedAt, String error);

    /**
     * Lists quarantined rows, oldest first.
     */
    List<E> queryQuarantined(Connection conn, int limit);

    /**
     * Puts a quarantined row back into circulation with zero attempts.
     *
     * @return rows updated; 0 if the row is missing or not quarantined
     */
    int replayQuarantined(Connection conn, long id, Instant availableAt);

    int countQuarantined(Connection conn);
}
