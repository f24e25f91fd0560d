package reconciler.feedback;

import reconciler.model.FeedbackKind;
import reconciler.schedule.ScheduleHandle;
import reconciler.spi.ConnectionProvider;
import reconciler.spi.InboxStore;
import reconciler.util.JsonCodec;
import reconciler.util.Transactions;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for the scheduler's callbacks. Each call records one inbox row in its own
 * transaction and returns; the {@link FeedbackProcessor} acts on it later.
 *
 * <p>Handles are the ids the scheduler knows schedules by, e.g. {@code reminder-42}.
 */
public final class FireCallbackReceiver {
  private static final Logger logger = Logger.getLogger(FireCallbackReceiver.class.getName());

  private final ConnectionProvider connectionProvider;
  private final InboxStore inboxStore;
  private final JsonCodec jsonCodec;
  private final Clock clock;

  public FireCallbackReceiver(ConnectionProvider connectionProvider, InboxStore inboxStore) {
    this(connectionProvider, inboxStore, JsonCodec.getDefault(), Clock.systemUTC());
  }

  public FireCallbackReceiver(ConnectionProvider connectionProvider, InboxStore inboxStore,
      JsonCodec jsonCodec, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.inboxStore = Objects.requireNonNull(inboxStore, "inboxStore");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Records that a schedule fired.
   *
   * @param handleId schedule id
   * @param firedAt  when it fired, or {@code null} for now
   * @return inbox row id
   * @throws IllegalArgumentException if the handle id is not one of ours
   */
  public long fired(String handleId, Instant firedAt) throws SQLException {
    ScheduleHandle handle = ScheduleHandle.parse(handleId);
    Instant now = clock.instant();
    String payload = FeedbackPayload.of(jsonCodec, FeedbackPayload.FIRED_AT,
        firedAt != null ? firedAt : now);
    return record(FeedbackKind.FIRED, handle, payload, now);
  }

  /**
   * Records that a schedule has no future fire times.
   *
   * @return inbox row id
   * @throws IllegalArgumentException if the handle id is not one of ours
   */
  public long exhausted(String handleId) throws SQLException {
    ScheduleHandle handle = ScheduleHandle.parse(handleId);
    return record(FeedbackKind.EXHAUSTED, handle, null, clock.instant());
  }

  private long record(FeedbackKind kind, ScheduleHandle handle, String payload, Instant now)
      throws SQLException {
    long id = Transactions.inTransaction(connectionProvider,
        conn -> inboxStore.append(conn, kind, handle.entityType(), handle.entityId(), payload, now));
    logger.log(Level.FINE, "Recorded {0} for {1} as inbox#{2}",
        new Object[]{kind.code(), handle, String.valueOf(id)});
    return id;
  }
}
