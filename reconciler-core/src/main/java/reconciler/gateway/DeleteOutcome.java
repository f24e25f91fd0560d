package reconciler.gateway;

/**
 * Result of {@link ScheduleGateway#delete}. Both values mean the schedule is gone;
 * failures for any other reason are thrown.
 */
public enum DeleteOutcome {
  DELETED,
  ALREADY_ABSENT
}
