package reconciler.model;

import java.time.Instant;

/**
 * Common view of a claimable queue row, shared by {@link OutboxEvent} and {@link InboxEvent}.
 */
public interface ClaimedEvent {

  /** Monotonic row id; claims are ordered by it. */
  long id();

  /** Attempt count, already incremented by the claim that returned this row. */
  int attempts();

  Instant createdAt();

  /** Short description for log messages. */
  String describe();
}
