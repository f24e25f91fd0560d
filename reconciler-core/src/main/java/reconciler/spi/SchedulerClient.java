package reconciler.spi;

import reconciler.schedule.ScheduleDescription;
import reconciler.schedule.ScheduleSpec;
import reconciler.schedule.WorkAction;

/**
 * The external scheduling service.
 *
 * <p>One instance is created at startup, shared by every component through
 * {@link reconciler.gateway.ScheduleGateway}, and closed once at shutdown after the
 * drainers have stopped. Implementations must be thread-safe.
 */
public interface SchedulerClient extends AutoCloseable {

    /**
     * Creates a schedule that starts {@code action} whenever {@code spec} fires.
     *
     * @throws ScheduleAlreadyExistsException if {@code scheduleId} is taken
     */
    void createSchedule(String scheduleId, ScheduleSpec spec, WorkAction action);

    /**
     * Replaces the spec and action of an existing schedule.
     *
     * @throws ScheduleNotFoundException if {@code scheduleId} does not exist
     */
    void updateSchedule(String scheduleId, ScheduleSpec spec, WorkAction action);

    /**
     * @throws ScheduleNotFoundException if {@code scheduleId} does not exist
     */
    void deleteSchedule(String scheduleId);

    /**
     * @throws ScheduleNotFoundException if {@code scheduleId} does not exist or is not visible yet
     */
    ScheduleDescription describeSchedule(String scheduleId);

    /**
     * Releases the connection to the scheduler. Default does nothing.
     */
    @Override
    default void close() {
    }
}
