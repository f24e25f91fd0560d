package reconciler.drain;

import reconciler.model.ClaimedEvent;
import reconciler.model.QueueKind;
import reconciler.spi.ClaimQueue;
import reconciler.spi.ConnectionProvider;
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
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single control loop that drains a {@link ClaimQueue}.
 *
 * <p>Each cycle claims up to {@code batchSize} rows in one transaction (the claim bumps
 * each row's attempt count and pushes its {@code available_at} out by the lease), runs the
 * {@link EventProcessor} for every row on a fixed pool of {@code concurrency} workers, and
 * waits for the whole batch before claiming again. An empty claim sleeps for
 * {@code pollInterval}.
 *
 * <p>Per-row outcomes are independent:
 * <ul>
 *   <li>success marks the row processed and clears its error;
 *   <li>failure records the error and makes the row available again after
 *       {@link RetryPolicy#computeDelayMs(int)};
 *   <li>failure on attempt {@code maxAttempts} quarantines the row.
 * </ul>
 *
 * <p>{@link #close()} stops claiming, lets the in-flight batch finish (up to
 * {@code drainTimeout}), then stops the workers. Rows abandoned by a forced stop are
 * re-offered once their lease expires.
 *
 * <p>Create instances via {@link #builder(QueueKind)}.
 *
 * @param <E> row type
 */
public final class ClaimQueueDrainer<E extends ClaimedEvent> implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ClaimQueueDrainer.class.getName());

    private final QueueKind queueKind;
    private final ConnectionProvider connectionProvider;
    private final ClaimQueue<E> queue;
    private final EventProcessor<E> processor;
    private final int batchSize;
    private final int concurrency;
    private final Duration pollInterval;
    private final Duration lease;
    private final Duration drainTimeout;
    private final RetryPolicy retryPolicy;
    private final int maxAttempts;
    private final MetricsExporter metrics;
    private final Clock clock;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final ExecutorService workers;
    private ExecutorService loop;
    private volatile boolean running;
    private volatile boolean closed;

    private ClaimQueueDrainer(Builder<E> builder) {
        this.queueKind = Objects.requireNonNull(builder.queueKind, "queueKind");
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.queue = Objects.requireNonNull(builder.queue, "queue");
        this.processor = Objects.requireNonNull(builder.processor, "processor");
        this.pollInterval = Objects.requireNonNull(builder.pollInterval, "pollInterval");
        this.lease = Objects.requireNonNull(builder.lease, "lease");
        this.drainTimeout = Objects.requireNonNull(builder.drainTimeout, "drainTimeout");

        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0");
        }
        if (builder.maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        requirePositive(pollInterval, "pollInterval");
        requirePositive(lease, "lease");
        if (drainTimeout.isNegative()) {
            throw new IllegalArgumentException("drainTimeout must be >= 0");
        }

        this.batchSize = builder.batchSize;
        this.concurrency = builder.concurrency;
        this.maxAttempts = builder.maxAttempts;
        this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new ExponentialBackoffRetryPolicy();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.workers = Executors.newFixedThreadPool(concurrency,
                new DaemonThreadFactory("reconciler-" + queueKind.tag() + "-worker-"));
    }

    public static <E extends ClaimedEvent> Builder<E> builder(QueueKind queueKind) {
        return new Builder<>(queueKind);
    }

    /**
     * Starts the control loop on its own daemon thread. Subsequent calls are no-ops.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Drainer for " + queueKind.tag() + " has been closed");
        }
        if (loop != null) {
            return;
        }
        running = true;
        loop = Executors.newSingleThreadExecutor(
                new DaemonThreadFactory("reconciler-" + queueKind.tag() + "-drainer-"));
        loop.submit(this::runLoop);
        logger.log(Level.INFO, "Started {0} drainer: batchSize={1}, concurrency={2}, pollInterval={3}",
                new Object[]{queueKind.tag(), batchSize, concurrency, pollInterval});
    }

    private void runLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            int claimed;
            try {
                claimed = drainBatch();
            } catch (Throwable t) {
                logger.log(Level.SEVERE, "Drain cycle failed for " + queueKind.tag(), t);
                claimed = 0;
            }
            if (claimed == 0) {
                try {
                    if (stopSignal.await(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                        break;
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    /**
     * Claims one batch, processes it and records every outcome. Called by the control
     * loop; may be invoked directly in tests.
     *
     * @return number of rows claimed (0 if none were pending or the claim failed)
     */
    public int drainBatch() {
        if (closed) {
            return 0;
        }
        Instant now = clock.instant();
        List<E> claimed = claim(now);
        if (claimed.isEmpty()) {
            metrics.recordOldestLagMs(queueKind, 0L);
            return 0;
        }
        metrics.incrementClaimed(queueKind, claimed.size());
        metrics.recordOldestLagMs(queueKind,
                Math.max(0L, Duration.between(claimed.get(0).createdAt(), now).toMillis()));

        List<Callable<Void>> tasks = new ArrayList<>(claimed.size());
        for (E event : claimed) {
            tasks.add(() -> {
                processOne(event);
                return null;
            });
        }
        try {
            workers.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.log(Level.WARNING, "Interrupted while waiting for {0} batch of {1}",
                    new Object[]{queueKind.tag(), claimed.size()});
        }
        return claimed.size();
    }

    private List<E> claim(Instant now) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(false);
            try {
                List<E> claimed = queue.claim(conn, now, now.plus(lease), batchSize);
                conn.commit();
                return claimed;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to claim " + queueKind.tag() + " rows", e);
            return List.of();
        }
    }

    private void processOne(E event) {
        try {
            processor.process(event);
        } catch (Exception e) {
            recordFailure(event, e);
            return;
        }
        recordSuccess(event);
    }

    private void recordSuccess(E event) {
        if (!withConnection("mark processed", event,
                conn -> queue.markProcessed(conn, event.id(), clock.instant()))) {
            return;
        }
        metrics.incrementProcessed(queueKind);
        logger.log(Level.FINE, "Processed {0}", event.describe());
    }

    private void recordFailure(E event, Exception failure) {
        String error = describeFailure(failure);
        if (event.attempts() >= maxAttempts) {
            if (!withConnection("quarantine", event,
                    conn -> queue.markQuarantined(conn, event.id(), clock.instant(), error))) {
                return;
            }
            metrics.incrementQuarantined(queueKind);
            logger.log(Level.WARNING, "Quarantined " + event.describe()
                    + " after " + event.attempts() + " attempts", failure);
            return;
        }
        long delayMs = retryPolicy.computeDelayMs(event.attempts());
        Instant nextAt = clock.instant().plusMillis(delayMs);
        if (!withConnection("mark retry", event,
                conn -> queue.markRetry(conn, event.id(), nextAt, error))) {
            return;
        }
        metrics.incrementRetried(queueKind);
        logger.log(Level.WARNING, "Attempt " + event.attempts() + " of " + event.describe()
                + " failed, retrying in " + delayMs + "ms: " + error);
    }

    private static String describeFailure(Exception failure) {
        String message = failure.getMessage();
        return message == null ? failure.getClass().getName() : failure.getClass().getSimpleName() + ": " + message;
    }

    /** @return whether the outcome was written */
    private boolean withConnection(String action, E event, SqlAction op) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            op.execute(conn);
            return true;
        } catch (SQLException | RuntimeException e) {
            // The lease still expires, so the row is offered again later.
            logger.log(Level.SEVERE, "Failed to " + action + " for " + event.describe(), e);
            return false;
        }
    }

    @FunctionalInterface
    private interface SqlAction {
        void execute(Connection conn) throws SQLException;
    }

    /**
     * Stops claiming, waits up to {@code drainTimeout} for the in-flight batch, then shuts
     * the worker pool down.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        running = false;
        stopSignal.countDown();
        try {
            if (loop != null) {
                loop.shutdown();
                if (!loop.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.log(Level.WARNING, "Drain timeout exceeded for {0}; forcing shutdown",
                            queueKind.tag());
                    loop.shutdownNow();
                    workers.shutdownNow();
                    loop.awaitTermination(5, TimeUnit.SECONDS);
                }
            }
            workers.shutdown();
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            if (loop != null) {
                loop.shutdownNow();
            }
            Thread.currentThread().interrupt();
        } finally {
            closed = true;
        }
        logger.log(Level.INFO, "Stopped {0} drainer", queueKind.tag());
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    /**
     * Builder for {@link ClaimQueueDrainer}.
     */
    public static final class Builder<E extends ClaimedEvent> {
        private final QueueKind queueKind;
        private ConnectionProvider connectionProvider;
        private ClaimQueue<E> queue;
        private EventProcessor<E> processor;
        private int batchSize = 200;
        private int concurrency = 50;
        private Duration pollInterval = Duration.ofSeconds(1);
        private Duration lease = Duration.ofSeconds(30);
        private Duration drainTimeout = Duration.ofSeconds(30);
        private RetryPolicy retryPolicy;
        private int maxAttempts = 20;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder(QueueKind queueKind) {
            this.queueKind = queueKind;
        }

        /**
         * <b>Required.</b> Source of connections for claims and outcome updates.
         */
        public Builder<E> connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <b>Required.</b> The table being drained.
         */
        public Builder<E> queue(ClaimQueue<E> queue) {
            this.queue = queue;
            return this;
        }

        /**
         * <b>Required.</b> Per-row handler.
         */
        public Builder<E> processor(EventProcessor<E> processor) {
            this.processor = processor;
            return this;
        }

        /**
         * Maximum rows per claim. Defaults to {@code 200}. Must be &gt; 0.
         */
        public Builder<E> batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Worker pool size, the most rows processed at once. Defaults to {@code 50}.
         */
        public Builder<E> concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        /**
         * Sleep after an empty claim. Defaults to 1 second.
         */
        public Builder<E> pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        /**
         * How far a claim pushes {@code available_at} out. A row not finished within the
         * lease can be claimed again. Defaults to 30 seconds.
         */
        public Builder<E> lease(Duration lease) {
            this.lease = lease;
            return this;
        }

        /**
         * How long {@link ClaimQueueDrainer#close()} waits for the in-flight batch.
         * Defaults to 30 seconds.
         */
        public Builder<E> drainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
            return this;
        }

        /**
         * Defaults to {@link ExponentialBackoffRetryPolicy} with a 1 s base and 300 s cap.
         */
        public Builder<E> retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Attempts after which a failing row is quarantined. Defaults to {@code 20}.
         */
        public Builder<E> maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder<E> metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder<E> clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @throws NullPointerException     if a required component is missing
         * @throws IllegalArgumentException if a knob is out of range
         */
        public ClaimQueueDrainer<E> build() {
            return new ClaimQueueDrainer<>(this);
        }
    }
}
