package reconciler.testing;

import reconciler.model.EntityType;
import reconciler.model.IntentOp;
import reconciler.model.OutboxEvent;
import reconciler.spi.OutboxStore;

import java.sql.Connection;
import java.time.Instant;

public final class InMemoryOutboxStore
    extends InMemoryQueue<OutboxEvent, InMemoryOutboxStore.Intent> implements OutboxStore {

  public record Intent(IntentOp op, EntityType entityType, long entityId) {
  }

  @Override
  public long append(Connection conn, IntentOp op, EntityType entityType, long entityId, Instant now) {
    return insert(new Intent(op, entityType, entityId), now);
  }

  @Override
  protected OutboxEvent toEvent(Row<Intent> row) {
    Intent intent = row.payload;
    return new OutboxEvent(row.id, intent.op(), intent.entityType(), intent.entityId(),
        row.attempts, row.createdAt);
  }
}
