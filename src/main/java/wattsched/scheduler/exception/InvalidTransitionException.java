package wattsched.scheduler.exception;

import wattsched.scheduler.model.PowerState;

/**
 * Thrown when a host is asked for a power or assignment change its current
 * state does not allow.
 */
public class InvalidTransitionException extends SchedulerException {

    private final int hostId;
    private final PowerState from;

    public InvalidTransitionException(int hostId, PowerState from, String message) {
        super("host " + hostId + " (" + from + "): " + message);
        this.hostId = hostId;
        this.from = from;
    }

    public int hostId() {
        return hostId;
    }

    public PowerState from() {
        return from;
    }
}
