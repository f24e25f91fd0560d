package reconciler;

import reconciler.compile.DesiredStateCompiler;
import reconciler.drain.ClaimQueueDrainer;
import reconciler.drain.ExponentialBackoffRetryPolicy;
import reconciler.drain.RetryPolicy;
import reconciler.feedback.FeedbackProcessor;
import reconciler.feedback.FireCallbackReceiver;
import reconciler.gateway.ScheduleGateway;
import reconciler.model.InboxEvent;
import reconciler.model.OutboxEvent;
import reconciler.model.QueueKind;
import reconciler.quarantine.QuarantineManager;
import reconciler.reconcile.ReconcileProcessor;
import reconciler.spi.ConnectionProvider;
import reconciler.spi.DefinitionReader;
import reconciler.spi.DefinitionWriter;
import reconciler.spi.InboxStore;
import reconciler.spi.MetricsExporter;
import reconciler.spi.OutboxStore;
import reconciler.spi.SchedulerClient;
import reconciler.sweep.ExpirySweeper;
import reconciler.util.JsonCodec;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the outbox drainer, the inbox drainer, the expiry
 * sweeper and the scheduler gateway into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Reconciler reconciler = Reconciler.builder()
 *     .connectionProvider(connProvider)
 *     .outboxStore(outboxStore)
 *     .inboxStore(inboxStore)
 *     .definitionReader(reader)
 *     .definitionWriter(writer)
 *     .schedulerClient(client)
 *     .build()) {
 *   reconciler.start();
 *   // inside the application's transactions:
 *   reconciler.intentWriter().enqueueUpsert(conn, EntityType.REMINDER, reminderId);
 * }
 * }</pre>
 *
 * @see IntentWriter
 * @see FireCallbackReceiver
 */
public final class Reconciler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Reconciler.class.getName());

  private final IntentWriter intentWriter;
  private final FireCallbackReceiver callbackReceiver;
  private final ClaimQueueDrainer<OutboxEvent> outboxDrainer;
  private final ClaimQueueDrainer<InboxEvent> inboxDrainer;
  private final ExpirySweeper sweeper;
  private final ScheduleGateway gateway;
  private final QuarantineManager<OutboxEvent> outboxQuarantine;
  private final QuarantineManager<InboxEvent> inboxQuarantine;
  private final MetricsExporter metrics;

  private Reconciler(Builder builder, ScheduleGateway gateway) {
    this.gateway = gateway;
    this.metrics = builder.metrics;
    DesiredStateCompiler compiler = new DesiredStateCompiler(builder.clock, builder.metrics);

    this.intentWriter = new IntentWriter(builder.outboxStore, builder.clock);
    this.callbackReceiver = new FireCallbackReceiver(builder.connectionProvider, builder.inboxStore,
        builder.jsonCodec, builder.clock);

    ReconcileProcessor reconcileProcessor = ReconcileProcessor.builder()
        .connectionProvider(builder.connectionProvider)
        .reader(builder.definitionReader)
        .writer(builder.definitionWriter)
        .inboxStore(builder.inboxStore)
        .compiler(compiler)
        .gateway(gateway)
        .jsonCodec(builder.jsonCodec)
        .clock(builder.clock)
        .build();
    FeedbackProcessor feedbackProcessor = FeedbackProcessor.builder()
        .connectionProvider(builder.connectionProvider)
        .reader(builder.definitionReader)
        .writer(builder.definitionWriter)
        .outboxStore(builder.outboxStore)
        .gateway(gateway)
        .jsonCodec(builder.jsonCodec)
        .clock(builder.clock)
        .build();

    this.outboxDrainer = ClaimQueueDrainer.<OutboxEvent>builder(QueueKind.OUTBOX)
        .connectionProvider(builder.connectionProvider)
        .queue(builder.outboxStore)
        .processor(reconcileProcessor)
        .batchSize(builder.outbox.batchSize)
        .concurrency(builder.outbox.concurrency)
        .pollInterval(builder.outbox.pollInterval)
        .lease(builder.outbox.lease)
        .drainTimeout(builder.drainTimeout)
        .retryPolicy(builder.retryPolicy)
        .maxAttempts(builder.maxAttempts)
        .metrics(builder.metrics)
        .clock(builder.clock)
        .build();
    this.inboxDrainer = ClaimQueueDrainer.<InboxEvent>builder(QueueKind.INBOX)
        .connectionProvider(builder.connectionProvider)
        .queue(builder.inboxStore)
        .processor(feedbackProcessor)
        .batchSize(builder.inbox.batchSize)
        .concurrency(builder.inbox.concurrency)
        .pollInterval(builder.inbox.pollInterval)
        .lease(builder.inbox.lease)
        .drainTimeout(builder.drainTimeout)
        .retryPolicy(builder.retryPolicy)
        .maxAttempts(builder.maxAttempts)
        .metrics(builder.metrics)
        .clock(builder.clock)
        .build();
    this.sweeper = ExpirySweeper.builder()
        .connectionProvider(builder.connectionProvider)
        .reader(builder.definitionReader)
        .writer(builder.definitionWriter)
        .gateway(gateway)
        .interval(builder.sweepInterval)
        .metrics(builder.metrics)
        .clock(builder.clock)
        .build();

    this.outboxQuarantine = new QuarantineManager<>(builder.connectionProvider, builder.outboxStore, builder.clock);
    this.inboxQuarantine = new QuarantineManager<>(builder.connectionProvider, builder.inboxStore, builder.clock);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Starts both drainers and the sweeper. */
  public void start() {
    outboxDrainer.start();
    inboxDrainer.start();
    sweeper.start();
    logger.log(Level.INFO, "Reconciler started");
  }

  /** Records schedule sync intents inside application transactions. */
  public IntentWriter intentWriter() {
    return intentWriter;
  }

  /** Target for the scheduler's fire and exhaustion callbacks. */
  public FireCallbackReceiver callbackReceiver() {
    return callbackReceiver;
  }

  public QuarantineManager<OutboxEvent> outboxQuarantine() {
    return outboxQuarantine;
  }

  public QuarantineManager<InboxEvent> inboxQuarantine() {
    return inboxQuarantine;
  }

  ClaimQueueDrainer<OutboxEvent> outboxDrainer() {
    return outboxDrainer;
  }

  ClaimQueueDrainer<InboxEvent> inboxDrainer() {
    return inboxDrainer;
  }

  ExpirySweeper sweeper() {
    return sweeper;
  }

  /**
   * Shuts down components in order: outbox drainer, inbox drainer, sweeper, gateway
   * (which closes the scheduler client), then the metrics exporter if it is closeable.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    AutoCloseable[] components = {outboxDrainer, inboxDrainer, sweeper, gateway};
    for (AutoCloseable component : components) {
      try {
        component.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
    logger.log(Level.INFO, "Reconciler stopped");
  }

  /** Knobs of one drained queue. */
  public static final class QueueSettings {
    private int batchSize;
    private int concurrency;
    private Duration pollInterval = Duration.ofSeconds(1);
    private Duration lease = Duration.ofSeconds(30);

    private QueueSettings(int batchSize, int concurrency) {
      this.batchSize = batchSize;
      this.concurrency = concurrency;
    }

    public QueueSettings batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public QueueSettings concurrency(int concurrency) {
      this.concurrency = concurrency;
      return this;
    }

    public QueueSettings pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    public QueueSettings lease(Duration lease) {
      this.lease = lease;
      return this;
    }
  }

  /** Builder for {@link Reconciler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private OutboxStore outboxStore;
    private InboxStore inboxStore;
    private DefinitionReader definitionReader;
    private DefinitionWriter definitionWriter;
    private SchedulerClient schedulerClient;
    private MetricsExporter metrics = MetricsExporter.NOOP;
    private JsonCodec jsonCodec = JsonCodec.getDefault();
    private Clock clock = Clock.systemUTC();
    private final QueueSettings outbox = new QueueSettings(200, 50);
    private final QueueSettings inbox = new QueueSettings(100, 10);
    private RetryPolicy retryPolicy = new ExponentialBackoffRetryPolicy();
    private int maxAttempts = 20;
    private Duration sweepInterval = Duration.ofSeconds(60);
    private Duration drainTimeout = Duration.ofSeconds(30);
    private Duration callTimeout = Duration.ofSeconds(10);
    private int describeAttempts = 6;
    private Duration describeBackoff = Duration.ofMillis(150);
    private int maxConcurrentCalls = 64;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder outboxStore(OutboxStore outboxStore) {
      this.outboxStore = outboxStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder inboxStore(InboxStore inboxStore) {
      this.inboxStore = inboxStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder definitionReader(DefinitionReader definitionReader) {
      this.definitionReader = definitionReader;
      return this;
    }

    /** <b>Required.</b> */
    public Builder definitionWriter(DefinitionWriter definitionWriter) {
      this.definitionWriter = definitionWriter;
      return this;
    }

    /** <b>Required.</b> Owned by the reconciler and closed with it. */
    public Builder schedulerClient(SchedulerClient schedulerClient) {
      this.schedulerClient = schedulerClient;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
      return this;
    }

    /** Optional. Defaults to {@link JsonCodec#getDefault()}. */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    /** Outbox drainer knobs. Defaults: batch 200, concurrency 50, poll 1 s, lease 30 s. */
    public QueueSettings outbox() {
      return outbox;
    }

    /** Inbox drainer knobs. Defaults: batch 100, concurrency 10, poll 1 s, lease 30 s. */
    public QueueSettings inbox() {
      return inbox;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
      return this;
    }

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder sweepInterval(Duration sweepInterval) {
      this.sweepInterval = sweepInterval;
      return this;
    }

    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    public Builder callTimeout(Duration callTimeout) {
      this.callTimeout = callTimeout;
      return this;
    }

    public Builder describeAttempts(int describeAttempts) {
      this.describeAttempts = describeAttempts;
      return this;
    }

    public Builder describeBackoff(Duration describeBackoff) {
      this.describeBackoff = describeBackoff;
      return this;
    }

    /** Bound on concurrent scheduler calls. Defaults to 64. */
    public Builder maxConcurrentCalls(int maxConcurrentCalls) {
      this.maxConcurrentCalls = maxConcurrentCalls;
      return this;
    }

    /**
     * Builds the gateway and every component around it. If any component fails to
     * build, the gateway is closed before rethrowing.
     *
     * @throws IllegalStateException if build() was already called
     */
    public Reconciler build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(outboxStore, "outboxStore");
      Objects.requireNonNull(inboxStore, "inboxStore");
      Objects.requireNonNull(definitionReader, "definitionReader");
      Objects.requireNonNull(definitionWriter, "definitionWriter");
      Objects.requireNonNull(schedulerClient, "schedulerClient");

      ScheduleGateway gateway = ScheduleGateway.builder()
          .client(schedulerClient)
          .callTimeout(callTimeout)
          .describeAttempts(describeAttempts)
          .describeBackoff(describeBackoff)
          .maxConcurrentCalls(maxConcurrentCalls)
          .build();
      try {
        return new Reconciler(this, gateway);
      } catch (RuntimeException e) {
        gateway.close();
        throw e;
      }
    }
  }
}
