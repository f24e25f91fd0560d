package reconciler.model;

import java.time.Instant;

/**
 * Read-only record of a claimed outbox row: an intent to bring one entity's
 * external schedule in line with storage.
 *
 * @see reconciler.spi.OutboxStore#claim
 */
public record OutboxEvent(
    long id,
    IntentOp op,
    EntityType entityType,
    long entityId,
    int attempts,
    Instant createdAt
) implements ClaimedEvent {

  @Override
  public String describe() {
    return "outbox#" + id + " " + op.code() + " " + entityType.code() + ":" + entityId;
  }
}
