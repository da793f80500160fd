package wattsched.scheduler.model;

/**
 * Why the scheduler refused a job.
 */
public enum RejectReason {
    /** Requested resources exceed the total capacity of the cluster */
    INFEASIBLE_REQUEST
}
