package reconciler.spi;

import reconciler.model.EntityType;
import reconciler.model.FeedbackKind;
import reconciler.model.InboxEvent;

import java.sql.Connection;
import java.time.Instant;

/**
 * Durable log of facts reported by the scheduler, drained with the same claim
 * discipline as the outbox.
 *
 * @see reconciler.jdbc.store.JdbcInboxStore
 */
public interface InboxStore extends ClaimQueue<InboxEvent> {

    /**
     * Appends a pending fact available at {@code now}.
     *
     * @param payloadJson flat JSON object, may be {@code null}
     * @return the new row id
     */
    long append(Connection conn, FeedbackKind kind, EntityType entityType, long entityId,
        String payloadJson, Instant now);
}
