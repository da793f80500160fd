package wattsched.scheduler.exception;

import wattsched.scheduler.model.JobState;

/**
 * Thrown when a job state change is requested from a state that does not allow it.
 */
public class InvalidJobTransitionException extends SchedulerException {

    private final String jobId;
    private final JobState from;
    private final JobState to;

    public InvalidJobTransitionException(String jobId, JobState from, JobState to) {
        super("job " + jobId + " cannot go from " + from + " to " + to);
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }

    public InvalidJobTransitionException(String jobId, String message) {
        super("job " + jobId + ": " + message);
        this.jobId = jobId;
        this.from = null;
        this.to = null;
    }

    public String jobId() {
        return jobId;
    }

    public JobState from() {
        return from;
    }

    public JobState to() {
        return to;
    }
}
