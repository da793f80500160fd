package wattsched.scheduler.model;

/**
 * Job lifecycle state.
 */
public enum JobState {
    /** Submitted, waiting for an allocation */
    PENDING,
    /** Allocated and executing on the backend */
    RUNNING,
    /** Terminated by the backend (successfully or not) */
    COMPLETED,
    /** Refused by the scheduler */
    REJECTED
}
