package reconciler.sweep;

import reconciler.gateway.ScheduleGateway;
import reconciler.model.EntityType;
import reconciler.schedule.ScheduleHandle;
import reconciler.spi.ConnectionProvider;
import reconciler.spi.DefinitionReader;
import reconciler.spi.DefinitionWriter;
import reconciler.spi.MetricsExporter;
import reconciler.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic job that retires reminders whose validity window has ended.
 *
 * <p>Each cycle finds enabled reminders with {@code end_at <= now}, deletes their
 * schedules in parallel, then disables the ones whose delete succeeded in a single
 * statement. A reminder whose delete failed stays enabled and is retried next cycle.
 * Batches repeat while full batches keep being retired.
 *
 * <p>Lifecycle follows the other background components: builder, {@link AutoCloseable},
 * daemon threads, synchronized start and close. Create instances via {@link #builder()}.
 */
public final class ExpirySweeper implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ExpirySweeper.class.getName());

  private final ConnectionProvider connectionProvider;
  private final DefinitionReader reader;
  private final DefinitionWriter writer;
  private final ScheduleGateway gateway;
  private final Duration interval;
  private final int batchSize;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final ExecutorService workers;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> sweepTask;
  private volatile boolean closed;

  private ExpirySweeper(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.reader = Objects.requireNonNull(builder.reader, "reader");
    this.writer = Objects.requireNonNull(builder.writer, "writer");
    this.gateway = Objects.requireNonNull(builder.gateway, "gateway");
    this.interval = Objects.requireNonNull(builder.interval, "interval");

    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.concurrency <= 0) {
      throw new IllegalArgumentException("concurrency must be > 0");
    }

    this.batchSize = builder.batchSize;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.workers = Executors.newFixedThreadPool(builder.concurrency,
        new DaemonThreadFactory("reconciler-sweep-worker-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the periodic sweep. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("ExpirySweeper has been closed");
    }
    if (sweepTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("reconciler-sweep-"));
    long millis = interval.toMillis();
    sweepTask = scheduler.scheduleWithFixedDelay(this::runOnce, millis, millis, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes one sweep cycle. May be invoked directly for testing.
   *
   * @return number of reminders disabled
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    int total = 0;
    try {
      Instant now = clock.instant();
      while (true) {
        List<Long> lapsed = findLapsed(now);
        if (lapsed.isEmpty()) {
          break;
        }
        int disabled = retire(lapsed);
        total += disabled;
        if (lapsed.size() < batchSize || disabled == 0) {
          break;
        }
      }
      if (total > 0) {
        metrics.incrementSweepDisabled(total);
        logger.log(Level.INFO, "Disabled {0} lapsed reminders", total);
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Sweep cycle failed", t);
    }
    return total;
  }

  private List<Long> findLapsed(Instant now) throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return reader.findLapsedReminderIds(conn, now, batchSize);
    }
  }

  private int retire(List<Long> reminderIds) throws SQLException, InterruptedException {
    List<Callable<Long>> deletes = new ArrayList<>(reminderIds.size());
    for (Long id : reminderIds) {
      deletes.add(() -> {
        gateway.delete(ScheduleHandle.of(EntityType.REMINDER, id));
        return id;
      });
    }
    List<Long> deleted = new ArrayList<>(reminderIds.size());
    List<Future<Long>> results = workers.invokeAll(deletes);
    for (int i = 0; i < results.size(); i++) {
      try {
        deleted.add(results.get(i).get());
      } catch (ExecutionException e) {
        logger.log(Level.WARNING, "Failed to delete schedule of lapsed reminder "
            + reminderIds.get(i) + "; will retry next sweep", e.getCause());
      }
    }
    if (deleted.isEmpty()) {
      return 0;
    }
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return writer.disableReminders(conn, deleted);
    }
  }

  /** Cancels the sweep schedule and shuts down its threads. */
  @Override
  public synchronized void close() {
    closed = true;
    if (sweepTask != null) {
      sweepTask.cancel(false);
      sweepTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
    }
    workers.shutdownNow();
    try {
      if (scheduler != null) {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      }
      workers.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link ExpirySweeper}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DefinitionReader reader;
    private DefinitionWriter writer;
    private ScheduleGateway gateway;
    private Duration interval = Duration.ofSeconds(60);
    private int batchSize = 200;
    private int concurrency = 10;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> Finds lapsed reminders. */
    public Builder reader(DefinitionReader reader) {
      this.reader = reader;
      return this;
    }

    /** <b>Required.</b> Disables retired reminders. */
    public Builder writer(DefinitionWriter writer) {
      this.writer = writer;
      return this;
    }

    /** <b>Required.</b> */
    public Builder gateway(ScheduleGateway gateway) {
      this.gateway = gateway;
      return this;
    }

    /**
     * Delay between sweeps. Optional. Defaults to 60 seconds.
     */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    /**
     * Maximum reminders retired per batch. Optional. Defaults to {@code 200}.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Parallel schedule deletes per batch. Optional. Defaults to {@code 10}.
     */
    public Builder concurrency(int concurrency) {
      this.concurrency = concurrency;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public ExpirySweeper build() {
      return new ExpirySweeper(this);
    }
  }
}
