package reconciler.spi;

/**
 * Failure reported by a {@link SchedulerClient}. Unless a subclass says otherwise it is
 * treated as transient and the row is retried.
 */
public class SchedulerException extends RuntimeException {

    public SchedulerException(String message) {
        super(message);
    }

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
