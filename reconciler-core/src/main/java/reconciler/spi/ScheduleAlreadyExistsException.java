package reconciler.spi;

/**
 * Thrown by {@link SchedulerClient#createSchedule} when the id is already taken.
 */
public class ScheduleAlreadyExistsException extends SchedulerException {

    public ScheduleAlreadyExistsException(String scheduleId) {
        super("Schedule already exists: " + scheduleId);
    }
}
