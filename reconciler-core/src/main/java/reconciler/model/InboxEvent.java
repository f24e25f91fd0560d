package reconciler.model;

import java.time.Instant;

/**
 * Read-only record of a claimed inbox row: a fact pushed back by the scheduler.
 *
 * @param payloadJson flat JSON object with kind-specific fields, may be {@code null}
 * @see reconciler.spi.InboxStore#claim
 */
public record InboxEvent(
    long id,
    FeedbackKind kind,
    EntityType entityType,
    long entityId,
    String payloadJson,
    int attempts,
    Instant createdAt
) implements ClaimedEvent {

  @Override
  public String describe() {
    return "inbox#" + id + " " + kind.code() + " " + entityType.code() + ":" + entityId;
  }
}
