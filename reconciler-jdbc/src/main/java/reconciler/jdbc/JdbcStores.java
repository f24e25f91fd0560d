package reconciler.jdbc;

import reconciler.jdbc.dialect.Dialects;
import reconciler.jdbc.spi.Dialect;
import reconciler.jdbc.store.JdbcDefinitionReader;
import reconciler.jdbc.store.JdbcDefinitionWriter;
import reconciler.jdbc.store.JdbcInboxStore;
import reconciler.jdbc.store.JdbcOutboxStore;
import reconciler.util.JsonCodec;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * The four JDBC stores of one database, sharing a dialect.
 *
 * <pre>{@code
 * JdbcStores stores = JdbcStores.detect(dataSource);
 *
 * JdbcStores stores = JdbcStores.builder(Dialects.get("postgresql"))
 *     .outboxTable("sched_outbox")
 *     .inboxTable("sched_inbox")
 *     .build();
 * }</pre>
 */
public final class JdbcStores {
  private final Dialect dialect;
  private final JdbcOutboxStore outbox;
  private final JdbcInboxStore inbox;
  private final JdbcDefinitionReader reader;
  private final JdbcDefinitionWriter writer;

  private JdbcStores(Builder builder) {
    this.dialect = builder.dialect;
    this.outbox = new JdbcOutboxStore(dialect, builder.outboxTable);
    this.inbox = new JdbcInboxStore(dialect, builder.inboxTable);
    this.reader = new JdbcDefinitionReader(builder.reminderTable, builder.taskTable,
        builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault());
    this.writer = new JdbcDefinitionWriter(builder.reminderTable, builder.taskTable);
  }

  /** Stores with default table names for the dialect detected from the DataSource. */
  public static JdbcStores detect(DataSource dataSource) {
    return builder(Dialects.detect(dataSource)).build();
  }

  public static Builder builder(Dialect dialect) {
    return new Builder(dialect);
  }

  public Dialect dialect() {
    return dialect;
  }

  public JdbcOutboxStore outbox() {
    return outbox;
  }

  public JdbcInboxStore inbox() {
    return inbox;
  }

  public JdbcDefinitionReader reader() {
    return reader;
  }

  public JdbcDefinitionWriter writer() {
    return writer;
  }

  public static final class Builder {
    private final Dialect dialect;
    private String outboxTable = TableNames.DEFAULT_OUTBOX_TABLE;
    private String inboxTable = TableNames.DEFAULT_INBOX_TABLE;
    private String reminderTable = TableNames.DEFAULT_REMINDER_TABLE;
    private String taskTable = TableNames.DEFAULT_TASK_TABLE;
    private JsonCodec jsonCodec;

    private Builder(Dialect dialect) {
      this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    public Builder outboxTable(String outboxTable) {
      this.outboxTable = TableNames.validate(outboxTable);
      return this;
    }

    public Builder inboxTable(String inboxTable) {
      this.inboxTable = TableNames.validate(inboxTable);
      return this;
    }

    public Builder reminderTable(String reminderTable) {
      this.reminderTable = TableNames.validate(reminderTable);
      return this;
    }

    public Builder taskTable(String taskTable) {
      this.taskTable = TableNames.validate(taskTable);
      return this;
    }

    /** Codec for {@code roll_spec}; defaults to {@link JsonCodec#getDefault()}. */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    public JdbcStores build() {
      return new JdbcStores(this);
    }
  }
}
