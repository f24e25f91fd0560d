package reconciler.testing;

import reconciler.model.QueueKind;
import reconciler.spi.MetricsExporter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsExporter} that keeps counters in memory, keyed like {@code outbox.claimed}.
 */
public final class RecordingMetrics implements MetricsExporter {
  private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();
  private final Map<String, Long> gauges = new ConcurrentHashMap<>();

  @Override
  public void incrementClaimed(QueueKind queue, int count) {
    add(queue.tag() + ".claimed", count);
  }

  @Override
  public void incrementProcessed(QueueKind queue) {
    add(queue.tag() + ".processed", 1);
  }

  @Override
  public void incrementRetried(QueueKind queue) {
    add(queue.tag() + ".retried", 1);
  }

  @Override
  public void incrementQuarantined(QueueKind queue) {
    add(queue.tag() + ".quarantined", 1);
  }

  @Override
  public void incrementSweepDisabled(int count) {
    add("sweep.disabled", count);
  }

  @Override
  public void incrementTimeZoneFallback() {
    add("compile.tz_fallback", 1);
  }

  @Override
  public void recordOldestLagMs(QueueKind queue, long lagMs) {
    gauges.put(queue.tag() + ".lag", lagMs);
  }

  private void add(String name, long delta) {
    counters.computeIfAbsent(name, k -> new AtomicLong()).addAndGet(delta);
  }

  public long count(String name) {
    AtomicLong counter = counters.get(name);
    return counter == null ? 0L : counter.get();
  }

  public Long gauge(String name) {
    return gauges.get(name);
  }
}
