package wattsched.scheduler.model;

import java.util.Objects;

/**
 * Immutable domain model of a workload job.
 * State changes go through {@link #toBuilder()} and produce a new instance.
 */
public final class Job {

    /** Walltime value meaning "no limit announced by the workload" */
    public static final double UNLIMITED_WALLTIME = -1;

    private final String id;
    private final double submissionTime;
    private final int requestedResources;
    private final double walltime;
    private final String profile;
    private final JobState state;
    private final Allocation allocation;
    private final Double startTime;
    private final Double finishTime;
    private final JobOutcome outcome;
    private final RejectReason rejectReason;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.submissionTime = builder.submissionTime;
        this.requestedResources = builder.requestedResources;
        this.walltime = builder.walltime;
        this.profile = builder.profile;
        this.state = Objects.requireNonNull(builder.state, "state is required");
        this.allocation = builder.allocation;
        this.startTime = builder.startTime;
        this.finishTime = builder.finishTime;
        this.outcome = builder.outcome;
        this.rejectReason = builder.rejectReason;

        if (requestedResources < 1) {
            throw new IllegalArgumentException("job " + id + " requests " + requestedResources + " resources");
        }
        if (state == JobState.RUNNING && allocation == null) {
            throw new IllegalArgumentException("running job " + id + " needs an allocation");
        }
    }

    // Getters
    public String id() {
        return id;
    }

    public double submissionTime() {
        return submissionTime;
    }

    public int requestedResources() {
        return requestedResources;
    }

    public double walltime() {
        return walltime;
    }

    public String profile() {
        return profile;
    }

    public JobState state() {
        return state;
    }

    public Allocation allocation() {
        return allocation;
    }

    public Double startTime() {
        return startTime;
    }

    public Double finishTime() {
        return finishTime;
    }

    public JobOutcome outcome() {
        return outcome;
    }

    public RejectReason rejectReason() {
        return rejectReason;
    }

    /** Check if the workload announced a walltime */
    public boolean hasWalltime() {
        return walltime > 0;
    }

    /**
     * Latest time the job can still be running if started at {@code start}.
     * Unlimited jobs never finish from the scheduler's point of view.
     */
    public double projectedFinish(double start) {
        return hasWalltime() ? start + walltime : Double.POSITIVE_INFINITY;
    }

    /** Projected finish of a running job, based on its actual start time */
    public double projectedFinish() {
        if (startTime == null) {
            throw new IllegalStateException("job " + id + " has not started");
        }
        return projectedFinish(startTime);
    }

    /** Check if job is in terminal state */
    public boolean isTerminal() {
        return state == JobState.COMPLETED || state == JobState.REJECTED;
    }

    /** Create a builder from this job (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .submissionTime(submissionTime)
                .requestedResources(requestedResources)
                .walltime(walltime)
                .profile(profile)
                .state(state)
                .allocation(allocation)
                .startTime(startTime)
                .finishTime(finishTime)
                .outcome(outcome)
                .rejectReason(rejectReason);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private double submissionTime;
        private int requestedResources = 1;
        private double walltime = UNLIMITED_WALLTIME;
        private String profile;
        private JobState state = JobState.PENDING;
        private Allocation allocation;
        private Double startTime;
        private Double finishTime;
        private JobOutcome outcome;
        private RejectReason rejectReason;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder submissionTime(double submissionTime) {
            this.submissionTime = submissionTime;
            return this;
        }

        public Builder requestedResources(int requestedResources) {
            this.requestedResources = requestedResources;
            return this;
        }

        public Builder walltime(double walltime) {
            this.walltime = walltime;
            return this;
        }

        public Builder profile(String profile) {
            this.profile = profile;
            return this;
        }

        public Builder state(JobState state) {
            this.state = state;
            return this;
        }

        public Builder allocation(Allocation allocation) {
            this.allocation = allocation;
            return this;
        }

        public Builder startTime(Double startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder finishTime(Double finishTime) {
            this.finishTime = finishTime;
            return this;
        }

        public Builder outcome(JobOutcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder rejectReason(RejectReason rejectReason) {
            this.rejectReason = rejectReason;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', state=" + state + ", res=" + requestedResources + "}";
    }
}
