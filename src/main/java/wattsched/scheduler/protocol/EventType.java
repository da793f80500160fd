package wattsched.scheduler.protocol;

/**
 * Kinds of events the backend sends, by their wire name.
 */
public enum EventType {
    SIMULATION_BEGINS,
    JOB_SUBMITTED,
    JOB_COMPLETED,
    JOB_KILLED,
    RESOURCE_STATE_CHANGED,
    SIMULATION_ENDS,
    /** Answer to a CALL_ME_LATER decision */
    REQUESTED_CALL,
    /** Out-of-band information, e.g. the workload has no more jobs */
    NOTIFY,
    /** Answer to a QUERY decision */
    ANSWER
}
