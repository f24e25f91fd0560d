package reconciler.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import reconciler.model.QueueKind;
import reconciler.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code reconciler.claimed}: rows claimed, tagged {@code queue=outbox|inbox}</li>
 *   <li>{@code reconciler.processed}: rows processed successfully, tagged by queue</li>
 *   <li>{@code reconciler.retried}: rows that failed and will retry, tagged by queue</li>
 *   <li>{@code reconciler.quarantined}: rows that ran out of attempts, tagged by queue</li>
 *   <li>{@code reconciler.sweep.disabled}: reminders retired by the expiry sweep</li>
 *   <li>{@code reconciler.compile.tz_fallback}: unresolvable time zones replaced by UTC</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code reconciler.lag.oldest.ms}: age of the oldest row in the last claimed batch,
 *   tagged by queue</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  static final String QUEUE_TAG = "queue";

  private final MeterRegistry registry;
  private final Map<QueueKind, QueueMeters> queues = new EnumMap<>(QueueKind.class);
  private final Counter sweepDisabled;
  private final Counter timeZoneFallback;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "reconciler"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "reconciler");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.reconciler"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    for (QueueKind queue : QueueKind.values()) {
      queues.put(queue, new QueueMeters(registry, namePrefix, queue));
    }
    this.sweepDisabled = Counter.builder(namePrefix + ".sweep.disabled")
        .description("Reminders disabled by the expiry sweep")
        .register(registry);
    this.timeZoneFallback = Counter.builder(namePrefix + ".compile.tz_fallback")
        .description("Unresolvable time zones replaced by UTC")
        .register(registry);
  }

  @Override
  public void incrementClaimed(QueueKind queue, int count) {
    if (closed) return;
    queues.get(queue).claimed.increment(count);
  }

  @Override
  public void incrementProcessed(QueueKind queue) {
    if (closed) return;
    queues.get(queue).processed.increment();
  }

  @Override
  public void incrementRetried(QueueKind queue) {
    if (closed) return;
    queues.get(queue).retried.increment();
  }

  @Override
  public void incrementQuarantined(QueueKind queue) {
    if (closed) return;
    queues.get(queue).quarantined.increment();
  }

  @Override
  public void incrementSweepDisabled(int count) {
    if (closed) return;
    sweepDisabled.increment(count);
  }

  @Override
  public void incrementTimeZoneFallback() {
    if (closed) return;
    timeZoneFallback.increment();
  }

  @Override
  public void recordOldestLagMs(QueueKind queue, long lagMs) {
    if (closed) return;
    queues.get(queue).oldestLagMs.set(Math.max(0L, lagMs));
  }

  /**
   * Removes all meters registered by this exporter from the registry, so a closed
   * reconciler leaves no stale gauges behind.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>();
    for (QueueMeters queue : queues.values()) {
      meters.addAll(queue.meters());
    }
    meters.add(sweepDisabled);
    meters.add(timeZoneFallback);
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }

  private static final class QueueMeters {
    final Counter claimed;
    final Counter processed;
    final Counter retried;
    final Counter quarantined;
    final AtomicLong oldestLagMs = new AtomicLong();
    final Gauge lag;

    QueueMeters(MeterRegistry registry, String prefix, QueueKind queue) {
      String tag = queue.tag();
      this.claimed = Counter.builder(prefix + ".claimed")
          .description("Rows claimed")
          .tag(QUEUE_TAG, tag)
          .register(registry);
      this.processed = Counter.builder(prefix + ".processed")
          .description("Rows processed successfully")
          .tag(QUEUE_TAG, tag)
          .register(registry);
      this.retried = Counter.builder(prefix + ".retried")
          .description("Rows failed and scheduled for retry")
          .tag(QUEUE_TAG, tag)
          .register(registry);
      this.quarantined = Counter.builder(prefix + ".quarantined")
          .description("Rows quarantined after exhausting attempts")
          .tag(QUEUE_TAG, tag)
          .register(registry);
      this.lag = Gauge.builder(prefix + ".lag.oldest.ms", oldestLagMs, AtomicLong::get)
          .description("Age of the oldest row in the last claimed batch")
          .tag(QUEUE_TAG, tag)
          .register(registry);
    }

    List<Meter> meters() {
      return List.of(claimed, processed, retried, quarantined, lag);
    }
  }
}
