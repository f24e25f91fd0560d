package reconciler.feedback;

import reconciler.drain.EventProcessor;
import reconciler.gateway.NextFireTime;
import reconciler.gateway.ScheduleGateway;
import reconciler.model.EntityType;
import reconciler.model.InboxEvent;
import reconciler.model.IntentOp;
import reconciler.model.ReminderDefinition;
import reconciler.schedule.ScheduleHandle;
import reconciler.spi.ConnectionProvider;
import reconciler.spi.DefinitionReader;
import reconciler.spi.DefinitionWriter;
import reconciler.spi.OutboxStore;
import reconciler.util.JsonCodec;
import reconciler.util.Transactions;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Handles one inbox row: folds a fact reported by the scheduler back into storage.
 *
 * <p>Storage changes that require another schedule sync are written together with their
 * outbox rows in one transaction, and only when they actually changed something, so
 * repeated or duplicate facts settle instead of feeding the outbox forever.
 */
public final class FeedbackProcessor implements EventProcessor<InboxEvent> {
  private static final Logger logger = Logger.getLogger(FeedbackProcessor.class.getName());

  private final ConnectionProvider connectionProvider;
  private final DefinitionReader reader;
  private final DefinitionWriter writer;
  private final OutboxStore outboxStore;
  private final ScheduleGateway gateway;
  private final JsonCodec jsonCodec;
  private final Clock clock;

  private FeedbackProcessor(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.reader = Objects.requireNonNull(builder.reader, "reader");
    this.writer = Objects.requireNonNull(builder.writer, "writer");
    this.outboxStore = Objects.requireNonNull(builder.outboxStore, "outboxStore");
    this.gateway = Objects.requireNonNull(builder.gateway, "gateway");
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public void process(InboxEvent event) throws SQLException {
    switch (event.kind()) {
      case FIRED:
        if (event.entityType() == EntityType.REMINDER) {
          reminderFired(event.entityId(), FeedbackPayload.instant(jsonCodec, event.payloadJson(),
              FeedbackPayload.FIRED_AT));
        } else {
          rolloverFired(event.entityId());
        }
        break;
      case NEXT_DUE_COMPUTED:
        Instant nextDueAt = FeedbackPayload.instant(jsonCodec, event.payloadJson(),
            FeedbackPayload.NEXT_DUE_AT);
        if (nextDueAt == null) {
          logger.log(Level.WARNING, "Ignoring {0}: payload has no {1}",
              new Object[]{event.describe(), FeedbackPayload.NEXT_DUE_AT});
          return;
        }
        advanceDueDate(event.entityId(), nextDueAt);
        break;
      case EXHAUSTED:
        exhausted(event.entityType(), event.entityId());
        break;
      default:
        throw new IllegalStateException("Unhandled inbox kind: " + event.kind());
    }
  }

  /**
   * A single-shot reminder is retired only when the fire covers its current fire instant. A
   * reminder moved to a later instant after the fire keeps its new schedule.
   */
  private void reminderFired(long reminderId, Instant firedAt) throws SQLException {
    ScheduleHandle handle = ScheduleHandle.of(EntityType.REMINDER, reminderId);
    Optional<ReminderDefinition> reminder = Transactions.autoCommit(connectionProvider,
        conn -> reader.findReminder(conn, reminderId));
    if (reminder.isEmpty()) {
      gateway.delete(handle);
      return;
    }
    if (reminder.get().singleShot()) {
      Optional<Instant> fireAt = reminder.get().singleShotAt();
      if (firedAt != null && fireAt.isPresent()
          && fireAt.get().truncatedTo(ChronoUnit.SECONDS).isAfter(firedAt)) {
        logger.log(Level.FINE, "Ignoring fire of {0} at {1}; reminder now fires at {2}",
            new Object[]{handle, firedAt, fireAt.get()});
        return;
      }
      gateway.delete(handle);
      Transactions.autoCommit(connectionProvider,
          conn -> writer.disableReminders(conn, List.of(reminderId)));
      logger.log(Level.FINE, "Single-shot reminder {0} fired; disabled", String.valueOf(reminderId));
      return;
    }
    NextFireTime next = gateway.nextFireTime(handle);
    switch (next.status()) {
      case SCHEDULED:
        Transactions.autoCommit(connectionProvider,
            conn -> writer.updateNextFireTime(conn, reminderId, next.at().orElseThrow()));
        break;
      case EXHAUSTED:
        exhausted(EntityType.REMINDER, reminderId);
        break;
      default:
        logger.log(Level.FINE, "Next fire time of {0} unknown after fire", handle);
        break;
    }
  }

  private void rolloverFired(long taskId) throws SQLException {
    ScheduleHandle handle = ScheduleHandle.of(EntityType.TASK_ROLLOVER, taskId);
    NextFireTime next = gateway.nextFireTime(handle);
    if (next.status() == NextFireTime.Status.SCHEDULED) {
      advanceDueDate(taskId, next.at().orElseThrow());
    } else if (next.status() == NextFireTime.Status.EXHAUSTED) {
      exhausted(EntityType.TASK_ROLLOVER, taskId);
    }
  }

  /**
   * Moves the task's due date forward and, when it moved, queues syncs for the rollover
   * and every reminder that depends on the due date.
   */
  private void advanceDueDate(long taskId, Instant nextDueAt) throws SQLException {
    Instant now = clock.instant();
    int queued = Transactions.inTransaction(connectionProvider, conn -> {
      if (writer.advanceTaskDueDate(conn, taskId, nextDueAt) == 0) {
        return 0;
      }
      int count = 1;
      outboxStore.append(conn, IntentOp.UPSERT, EntityType.TASK_ROLLOVER, taskId, now);
      for (Long reminderId : reader.findDueBeforeReminderIds(conn, taskId)) {
        outboxStore.append(conn, IntentOp.UPSERT, EntityType.REMINDER, reminderId, now);
        count++;
      }
      return count;
    });
    if (queued > 0) {
      logger.log(Level.FINE, "Task {0} due date advanced to {1}; queued {2} syncs",
          new Object[]{String.valueOf(taskId), nextDueAt, queued});
    }
  }

  private void exhausted(EntityType entityType, long entityId) throws SQLException {
    Instant now = clock.instant();
    Transactions.inTransaction(connectionProvider, conn -> {
      if (entityType == EntityType.REMINDER) {
        writer.disableReminders(conn, List.of(entityId));
      } else {
        writer.disableRollover(conn, entityId);
      }
      return outboxStore.append(conn, IntentOp.DELETE, entityType, entityId, now);
    });
    logger.log(Level.FINE, "{0}:{1} exhausted; disabled and queued delete",
        new Object[]{entityType.code(), String.valueOf(entityId)});
  }

  /** Builder for {@link FeedbackProcessor}. All components except the codec and clock are required. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DefinitionReader reader;
    private DefinitionWriter writer;
    private OutboxStore outboxStore;
    private ScheduleGateway gateway;
    private JsonCodec jsonCodec;
    private Clock clock;

    private Builder() {
    }

    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    public Builder reader(DefinitionReader reader) {
      this.reader = reader;
      return this;
    }

    public Builder writer(DefinitionWriter writer) {
      this.writer = writer;
      return this;
    }

    public Builder outboxStore(OutboxStore outboxStore) {
      this.outboxStore = outboxStore;
      return this;
    }

    public Builder gateway(ScheduleGateway gateway) {
      this.gateway = gateway;
      return this;
    }

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public FeedbackProcessor build() {
      return new FeedbackProcessor(this);
    }
  }
}
