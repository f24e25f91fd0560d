package reconciler.schedule;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed interval recurrence: fires at every multiple of {@code every} since the epoch,
 * shifted by {@code offset}.
 */
public record IntervalSpec(Duration every, Duration offset) {

  public IntervalSpec {
    Objects.requireNonNull(every, "every");
    Objects.requireNonNull(offset, "offset");
    if (every.isNegative() || every.isZero()) {
      throw new IllegalArgumentException("every must be positive, got: " + every);
    }
    if (offset.isNegative()) {
      throw new IllegalArgumentException("offset must be >= 0, got: " + offset);
    }
  }

  public static IntervalSpec every(Duration every) {
    return new IntervalSpec(every, Duration.ZERO);
  }
}
