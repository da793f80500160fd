package wattsched.scheduler.exception;

/**
 * Thrown when the backend sends a malformed or out-of-order message,
 * or disconnects. The simulated clock cannot be rewound, so this is never retried.
 */
public class ProtocolException extends SchedulerException {
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
