package reconciler;

import reconciler.model.EntityType;
import reconciler.model.IntentOp;
import reconciler.spi.OutboxStore;

import java.sql.Connection;
import java.time.Clock;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Primary entry point for application code: records that an entity's schedule needs
 * syncing, on the caller's connection.
 *
 * <p>Call it inside the same transaction as the mutation of the reminder or task, so the
 * intent commits or rolls back together with the change that caused it. Enqueueing the
 * same entity several times is harmless; every sync reads the latest row.
 *
 * @see OutboxStore#append
 */
public final class IntentWriter {
    private static final Logger logger = Logger.getLogger(IntentWriter.class.getName());

    private final OutboxStore outboxStore;
    private final Clock clock;

    public IntentWriter(OutboxStore outboxStore) {
        this(outboxStore, Clock.systemUTC());
    }

    public IntentWriter(OutboxStore outboxStore, Clock clock) {
        this.outboxStore = Objects.requireNonNull(outboxStore, "outboxStore");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Queues a sync of the entity's schedule with its current row.
     *
     * @param conn connection in the caller's transaction
     * @return outbox row id
     */
    public long enqueueUpsert(Connection conn, EntityType entityType, long entityId) {
        return enqueue(conn, IntentOp.UPSERT, entityType, entityId);
    }

    /**
     * Queues removal of the entity's schedule, e.g. before the row itself is deleted.
     *
     * @param conn connection in the caller's transaction
     * @return outbox row id
     */
    public long enqueueDelete(Connection conn, EntityType entityType, long entityId) {
        return enqueue(conn, IntentOp.DELETE, entityType, entityId);
    }

    private long enqueue(Connection conn, IntentOp op, EntityType entityType, long entityId) {
        Objects.requireNonNull(conn, "conn");
        Objects.requireNonNull(entityType, "entityType");
        long id = outboxStore.append(conn, op, entityType, entityId, clock.instant());
        logger.log(Level.FINE, "Queued {0} {1}:{2} as outbox#{3}",
                new Object[]{op.code(), entityType.code(), String.valueOf(entityId), String.valueOf(id)});
        return id;
    }
}
