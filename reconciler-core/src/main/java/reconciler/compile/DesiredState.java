package reconciler.compile;

import reconciler.schedule.ScheduleSpec;
import reconciler.schedule.WorkAction;

import java.util.Objects;

/**
 * Target state of one entity's external schedule.
 */
public sealed interface DesiredState {

  /** The schedule must not exist. */
  record Delete(String reason) implements DesiredState {
    public Delete {
      Objects.requireNonNull(reason, "reason");
    }
  }

  /**
   * The schedule must exist with exactly this spec and action.
   *
   * @param timeZoneFallback whether the requested zone was unresolvable and UTC was used
   */
  record Upsert(ScheduleSpec spec, WorkAction action, boolean timeZoneFallback) implements DesiredState {
    public Upsert {
      Objects.requireNonNull(spec, "spec");
      Objects.requireNonNull(action, "action");
    }
  }
}
