package reconciler.spi;

/**
 * Thrown when a schedule id is unknown to the scheduler, either because it never existed
 * or because the scheduler's control plane has not caught up yet.
 */
public class ScheduleNotFoundException extends SchedulerException {

    public ScheduleNotFoundException(String scheduleId) {
        super("Schedule not found: " + scheduleId);
    }
}
