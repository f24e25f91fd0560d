package reconciler.spi;

import reconciler.model.QueueKind;

/**
 * Observability hook for the drainers, the sweeper and the compiler.
 *
 * <p>{@link #NOOP} discards everything.
 */
public interface MetricsExporter {

    MetricsExporter NOOP = new Noop();

    /**
     * Rows returned by one claim.
     */
    void incrementClaimed(QueueKind queue, int count);

    void incrementProcessed(QueueKind queue);

    /**
     * A row failed and was scheduled for another attempt.
     */
    void incrementRetried(QueueKind queue);

    /**
     * A row exceeded its attempt budget and was quarantined.
     */
    void incrementQuarantined(QueueKind queue);

    /**
     * Reminders disabled by the expiry sweep.
     */
    default void incrementSweepDisabled(int count) {
    }

    /**
     * A named time zone could not be resolved and UTC was used instead.
     */
    default void incrementTimeZoneFallback() {
    }

    /**
     * Age of the oldest unprocessed row in milliseconds (never negative).
     */
    void recordOldestLagMs(QueueKind queue, long lagMs);

    final class Noop implements MetricsExporter {
        @Override
        public void incrementClaimed(QueueKind queue, int count) {
        }

        @Override
        public void incrementProcessed(QueueKind queue) {
        }

        @Override
        public void incrementRetried(QueueKind queue) {
        }

        @Override
        public void incrementQuarantined(QueueKind queue) {
        }

        @Override
        public void recordOldestLagMs(QueueKind queue, long lagMs) {
        }
    }
}
