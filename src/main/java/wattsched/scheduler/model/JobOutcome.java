package wattsched.scheduler.model;

/**
 * How the backend terminated a job.
 */
public enum JobOutcome {
    COMPLETED_SUCCESSFULLY,
    COMPLETED_FAILED,
    COMPLETED_WALLTIME_REACHED,
    COMPLETED_KILLED;

    /**
     * Parse the backend's job_state string. Unknown values map to COMPLETED_FAILED
     * since the job is over either way.
     */
    public static JobOutcome fromWire(String value) {
        if (value == null) {
            return COMPLETED_SUCCESSFULLY;
        }
        for (JobOutcome outcome : values()) {
            if (outcome.name().equalsIgnoreCase(value.trim())) {
                return outcome;
            }
        }
        return COMPLETED_FAILED;
    }
}
