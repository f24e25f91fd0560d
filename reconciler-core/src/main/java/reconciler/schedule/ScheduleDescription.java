package reconciler.schedule;

import java.time.Instant;
import java.util.List;

/**
 * What the scheduler reports about an existing schedule.
 *
 * @param nextFireTimes upcoming fire times, earliest first; empty when none remain
 * @param paused        whether the schedule is paused
 */
public record ScheduleDescription(List<Instant> nextFireTimes, boolean paused) {

  public ScheduleDescription {
    nextFireTimes = List.copyOf(nextFireTimes);
  }
}
