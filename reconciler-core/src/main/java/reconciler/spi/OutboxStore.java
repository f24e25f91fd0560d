package reconciler.spi;

import reconciler.model.EntityType;
import reconciler.model.IntentOp;
import reconciler.model.OutboxEvent;

import java.sql.Connection;
import java.time.Instant;

/**
 * Durable log of reconciliation intents.
 *
 * <p>Appends normally happen in the same transaction as the domain mutation that made
 * them necessary.
 *
 * @see reconciler.jdbc.store.JdbcOutboxStore
 */
public interface OutboxStore extends ClaimQueue<OutboxEvent> {

    /**
     * Appends a pending intent available at {@code now}.
     *
     * @return the new row id
     */
    long append(Connection conn, IntentOp op, EntityType entityType, long entityId, Instant now);
}
