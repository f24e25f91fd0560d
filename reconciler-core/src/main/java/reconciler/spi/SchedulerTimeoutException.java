package reconciler.spi;

import java.time.Duration;

/**
 * A scheduler call did not complete within its timeout.
 */
public class SchedulerTimeoutException extends SchedulerException {

    public SchedulerTimeoutException(String operation, Duration timeout) {
        super(operation + " timed out after " + timeout.toMillis() + "ms");
    }
}
