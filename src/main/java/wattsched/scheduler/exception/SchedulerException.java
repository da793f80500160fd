package wattsched.scheduler.exception;

/**
 * Base class of all fatal scheduler errors. A run that hits one stops
 * without sending further decisions.
 */
public class SchedulerException extends RuntimeException {
    public SchedulerException(String message) {
        super(message);
    }

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
