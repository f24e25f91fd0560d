package reconciler.gateway;

import reconciler.schedule.ScheduleDescription;
import reconciler.schedule.ScheduleHandle;
import reconciler.schedule.ScheduleSpec;
import reconciler.schedule.WorkAction;
import reconciler.spi.ScheduleAlreadyExistsException;
import reconciler.spi.ScheduleNotFoundException;
import reconciler.spi.SchedulerClient;
import reconciler.spi.SchedulerException;
import reconciler.spi.SchedulerTimeoutException;
import reconciler.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Idempotent adapter over a {@link SchedulerClient}.
 *
 * <ul>
 *   <li>{@link #upsert} creates, falling back to an in-place update when the handle exists.
 *   <li>{@link #delete} treats "not found" as success and says so in its result.
 *   <li>{@link #nextFireTime} retries "not found" a bounded number of times, since a
 *       freshly created schedule may not be visible yet.
 *   <li>{@link #recreate} tears a schedule down and creates it again.
 * </ul>
 *
 * <p>Every client call runs on a bounded daemon pool with its own timeout; a call that does not
 * finish in time fails with {@link SchedulerTimeoutException}. At most
 * {@link Builder#maxConcurrentCalls} calls run at once and as many more may wait; further
 * calls are rejected with {@link SchedulerException}. A client that ignores interruption
 * therefore pins at most that many threads.
 *
 * <p>The gateway owns the client: {@link #close()} closes it. Create instances via
 * {@link #builder()}. This class is thread-safe.
 */
public final class ScheduleGateway implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ScheduleGateway.class.getName());

  private final SchedulerClient client;
  private final Duration callTimeout;
  private final int describeAttempts;
  private final Duration describeBackoff;
  private final Sleeper sleeper;
  private final ThreadPoolExecutor calls;

  private ScheduleGateway(Builder builder) {
    this.client = Objects.requireNonNull(builder.client, "client");
    this.callTimeout = Objects.requireNonNull(builder.callTimeout, "callTimeout");
    this.describeBackoff = Objects.requireNonNull(builder.describeBackoff, "describeBackoff");
    this.sleeper = Objects.requireNonNull(builder.sleeper, "sleeper");
    if (callTimeout.isZero() || callTimeout.isNegative()) {
      throw new IllegalArgumentException("callTimeout must be positive");
    }
    if (builder.describeAttempts < 1) {
      throw new IllegalArgumentException("describeAttempts must be >= 1");
    }
    if (describeBackoff.isNegative()) {
      throw new IllegalArgumentException("describeBackoff must be >= 0");
    }
    if (builder.maxConcurrentCalls < 1) {
      throw new IllegalArgumentException("maxConcurrentCalls must be >= 1");
    }
    this.describeAttempts = builder.describeAttempts;
    int threads = builder.maxConcurrentCalls;
    this.calls = new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
        new ArrayBlockingQueue<>(threads),
        new DaemonThreadFactory("reconciler-scheduler-call-"),
        new ThreadPoolExecutor.AbortPolicy());
    this.calls.allowCoreThreadTimeOut(true);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Makes the schedule exist with {@code spec} and {@code action}. Applying the same
   * arguments twice leaves the same final state as applying them once.
   */
  public void upsert(ScheduleHandle handle, ScheduleSpec spec, WorkAction action) {
    String id = handle.id();
    try {
      call("create " + id, () -> {
        client.createSchedule(id, spec, action);
        return null;
      });
      logger.log(Level.FINE, "Created schedule {0}", id);
      return;
    } catch (ScheduleAlreadyExistsException e) {
      logger.log(Level.FINE, "Schedule {0} exists, updating in place", id);
    }
    try {
      call("update " + id, () -> {
        client.updateSchedule(id, spec, action);
        return null;
      });
    } catch (ScheduleNotFoundException e) {
      // Deleted between our create and update attempts.
      call("create " + id, () -> {
        client.createSchedule(id, spec, action);
        return null;
      });
    }
  }

  /**
   * Deletes the schedule.
   *
   * @return {@link DeleteOutcome#ALREADY_ABSENT} if the scheduler did not know the handle
   * @throws SchedulerException for any failure other than "not found"
   */
  public DeleteOutcome delete(ScheduleHandle handle) {
    String id = handle.id();
    try {
      call("delete " + id, () -> {
        client.deleteSchedule(id);
        return null;
      });
      logger.log(Level.FINE, "Deleted schedule {0}", id);
      return DeleteOutcome.DELETED;
    } catch (ScheduleNotFoundException e) {
      return DeleteOutcome.ALREADY_ABSENT;
    }
  }

  /**
   * Deletes and creates the schedule, resetting any recurrence state the scheduler keeps.
   */
  public void recreate(ScheduleHandle handle, ScheduleSpec spec, WorkAction action) {
    delete(handle);
    upsert(handle, spec, action);
  }

  /**
   * Asks the scheduler for the next fire time, retrying up to {@code describeAttempts}
   * times with a linearly growing pause while the handle is not visible.
   *
   * @return the next fire time, {@link NextFireTime#exhausted()} if none remain, or
   *     {@link NextFireTime#unknown()} if the handle never became visible
   * @throws SchedulerException for failures other than "not found"
   */
  public NextFireTime nextFireTime(ScheduleHandle handle) {
    String id = handle.id();
    for (int attempt = 1; attempt <= describeAttempts; attempt++) {
      try {
        ScheduleDescription description = call("describe " + id, () -> client.describeSchedule(id));
        if (!description.nextFireTimes().isEmpty()) {
          return NextFireTime.scheduled(description.nextFireTimes().get(0));
        }
        return description.paused() ? NextFireTime.unknown() : NextFireTime.exhausted();
      } catch (ScheduleNotFoundException e) {
        if (attempt == describeAttempts) {
          break;
        }
        try {
          sleeper.sleep(describeBackoff.multipliedBy(attempt));
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          return NextFireTime.unknown();
        }
      }
    }
    logger.log(Level.FINE, "Schedule {0} not visible after {1} describe attempts",
        new Object[]{id, describeAttempts});
    return NextFireTime.unknown();
  }

  private <T> T call(String operation, Callable<T> body) {
    Future<T> future;
    try {
      future = calls.submit(body);
    } catch (RuntimeException e) {
      throw new SchedulerException(operation + " rejected", e);
    }
    try {
      return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      calls.purge();
      throw new SchedulerTimeoutException(operation, callTimeout);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new SchedulerException(operation + " interrupted", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException re) {
        throw re;
      }
      if (cause instanceof Error err) {
        throw err;
      }
      throw new SchedulerException(operation + " failed", cause);
    }
  }

  /** Stops the call pool and closes the scheduler client. */
  @Override
  public void close() {
    calls.shutdownNow();
    try {
      calls.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    try {
      client.close();
    } catch (Exception e) {
      logger.log(Level.WARNING, "Failed to close scheduler client", e);
    }
  }

  /** Pause between describe attempts; replaceable in tests. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }

  /** Builder for {@link ScheduleGateway}. */
  public static final class Builder {
    private SchedulerClient client;
    private Duration callTimeout = Duration.ofSeconds(10);
    private int describeAttempts = 6;
    private Duration describeBackoff = Duration.ofMillis(150);
    private Sleeper sleeper = duration -> Thread.sleep(duration.toMillis());
    private int maxConcurrentCalls = 64;

    private Builder() {
    }

    /**
     * <b>Required.</b> The scheduler client; closed by {@link ScheduleGateway#close()}.
     */
    public Builder client(SchedulerClient client) {
      this.client = client;
      return this;
    }

    /**
     * Timeout for each individual client call. Defaults to 10 seconds.
     */
    public Builder callTimeout(Duration callTimeout) {
      this.callTimeout = callTimeout;
      return this;
    }

    /**
     * Number of describe attempts in {@link ScheduleGateway#nextFireTime}. Defaults to 6.
     */
    public Builder describeAttempts(int describeAttempts) {
      this.describeAttempts = describeAttempts;
      return this;
    }

    /**
     * Base pause between describe attempts; attempt {@code n} waits {@code n} times this.
     * Defaults to 150 ms.
     */
    public Builder describeBackoff(Duration describeBackoff) {
      this.describeBackoff = describeBackoff;
      return this;
    }

    /**
     * Upper bound on client calls running at once, which is also the number of calls that
     * may wait for a free thread. Defaults to 64.
     */
    public Builder maxConcurrentCalls(int maxConcurrentCalls) {
      this.maxConcurrentCalls = maxConcurrentCalls;
      return this;
    }

    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * @throws NullPointerException     if {@code client} is null
     * @throws IllegalArgumentException if a knob is out of range
     */
    public ScheduleGateway build() {
      return new ScheduleGateway(this);
    }
  }
}
