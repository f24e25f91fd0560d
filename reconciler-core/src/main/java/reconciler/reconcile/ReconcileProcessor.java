package reconciler.reconcile;

import reconciler.compile.DesiredState;
import reconciler.compile.DesiredStateCompiler;
import reconciler.drain.EventProcessor;
import reconciler.feedback.FeedbackPayload;
import reconciler.gateway.NextFireTime;
import reconciler.gateway.ScheduleGateway;
import reconciler.model.EntityType;
import reconciler.model.FeedbackKind;
import reconciler.model.IntentOp;
import reconciler.model.OutboxEvent;
import reconciler.model.ReminderDefinition;
import reconciler.model.TaskRolloverDefinition;
import reconciler.schedule.ScheduleHandle;
import reconciler.spi.ConnectionProvider;
import reconciler.spi.DefinitionReader;
import reconciler.spi.DefinitionWriter;
import reconciler.spi.InboxStore;
import reconciler.util.JsonCodec;
import reconciler.util.Transactions;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Handles one outbox row: reads the entity's current definition, compiles it and makes
 * the external schedule match.
 *
 * <p>Reminders are upserted in place and their cached {@code next_fire_at} refreshed.
 * Rollover schedules are recreated on every sync so the scheduler restarts the
 * recurrence from scratch; the resulting next fire time is reported back through the
 * inbox as the task's next due date.
 *
 * <p>Every step converges: replaying the same row any number of times leaves the same
 * external and stored state. Exceptions propagate to the drainer, which retries.
 */
public final class ReconcileProcessor implements EventProcessor<OutboxEvent> {
  private static final Logger logger = Logger.getLogger(ReconcileProcessor.class.getName());

  private final ConnectionProvider connectionProvider;
  private final DefinitionReader reader;
  private final DefinitionWriter writer;
  private final InboxStore inboxStore;
  private final DesiredStateCompiler compiler;
  private final ScheduleGateway gateway;
  private final JsonCodec jsonCodec;
  private final Clock clock;

  private ReconcileProcessor(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.reader = Objects.requireNonNull(builder.reader, "reader");
    this.writer = Objects.requireNonNull(builder.writer, "writer");
    this.inboxStore = Objects.requireNonNull(builder.inboxStore, "inboxStore");
    this.compiler = Objects.requireNonNull(builder.compiler, "compiler");
    this.gateway = Objects.requireNonNull(builder.gateway, "gateway");
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public void process(OutboxEvent event) throws SQLException {
    ScheduleHandle handle = ScheduleHandle.of(event.entityType(), event.entityId());
    if (event.op() == IntentOp.DELETE) {
      gateway.delete(handle);
      if (event.entityType() == EntityType.REMINDER) {
        Transactions.autoCommit(connectionProvider,
            conn -> writer.updateNextFireTime(conn, event.entityId(), null));
      }
      return;
    }
    if (event.entityType() == EntityType.REMINDER) {
      syncReminder(event.entityId(), handle);
    } else {
      syncRollover(event.entityId(), handle);
    }
  }

  private void syncReminder(long reminderId, ScheduleHandle handle) throws SQLException {
    Optional<ReminderDefinition> reminder = Transactions.autoCommit(connectionProvider,
        conn -> reader.findReminder(conn, reminderId));
    if (reminder.isEmpty()) {
      logger.log(Level.FINE, "Reminder {0} no longer exists; deleting {1}",
          new Object[]{String.valueOf(reminderId), handle});
      gateway.delete(handle);
      return;
    }

    DesiredState desired = compiler.compile(reminder.get());
    if (desired instanceof DesiredState.Delete delete) {
      gateway.delete(handle);
      Transactions.autoCommit(connectionProvider,
          conn -> writer.updateNextFireTime(conn, reminderId, null));
      logger.log(Level.FINE, "Deleted {0}: {1}", new Object[]{handle, delete.reason()});
      return;
    }

    DesiredState.Upsert upsert = (DesiredState.Upsert) desired;
    gateway.upsert(handle, upsert.spec(), upsert.action());
    NextFireTime next = gateway.nextFireTime(handle);
    Instant nextAt = next.at().orElse(null);
    Transactions.autoCommit(connectionProvider,
        conn -> writer.updateNextFireTime(conn, reminderId, nextAt));
    if (next.status() == NextFireTime.Status.EXHAUSTED) {
      appendFeedback(FeedbackKind.EXHAUSTED, EntityType.REMINDER, reminderId, null);
    }
  }

  private void syncRollover(long taskId, ScheduleHandle handle) throws SQLException {
    Optional<TaskRolloverDefinition> rollover = Transactions.autoCommit(connectionProvider,
        conn -> reader.findRollover(conn, taskId));
    if (rollover.isEmpty()) {
      gateway.delete(handle);
      return;
    }

    DesiredState desired = compiler.compile(rollover.get());
    if (desired instanceof DesiredState.Delete delete) {
      gateway.delete(handle);
      logger.log(Level.FINE, "Deleted {0}: {1}", new Object[]{handle, delete.reason()});
      return;
    }

    DesiredState.Upsert upsert = (DesiredState.Upsert) desired;
    gateway.recreate(handle, upsert.spec(), upsert.action());
    NextFireTime next = gateway.nextFireTime(handle);
    switch (next.status()) {
      case SCHEDULED:
        appendFeedback(FeedbackKind.NEXT_DUE_COMPUTED, EntityType.TASK_ROLLOVER, taskId,
            FeedbackPayload.of(jsonCodec, FeedbackPayload.NEXT_DUE_AT, next.at().orElseThrow()));
        break;
      case EXHAUSTED:
        appendFeedback(FeedbackKind.EXHAUSTED, EntityType.TASK_ROLLOVER, taskId, null);
        break;
      default:
        logger.log(Level.FINE, "Next fire time of {0} unknown; due date left unchanged", handle);
        break;
    }
  }

  private void appendFeedback(FeedbackKind kind, EntityType entityType, long entityId,
      String payloadJson) throws SQLException {
    Transactions.inTransaction(connectionProvider,
        conn -> inboxStore.append(conn, kind, entityType, entityId, payloadJson, clock.instant()));
  }

  /** Builder for {@link ReconcileProcessor}. All components except the codec and clock are required. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DefinitionReader reader;
    private DefinitionWriter writer;
    private InboxStore inboxStore;
    private DesiredStateCompiler compiler;
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

    public Builder inboxStore(InboxStore inboxStore) {
      this.inboxStore = inboxStore;
      return this;
    }

    public Builder compiler(DesiredStateCompiler compiler) {
      this.compiler = compiler;
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

    public ReconcileProcessor build() {
      return new ReconcileProcessor(this);
    }
  }
}
