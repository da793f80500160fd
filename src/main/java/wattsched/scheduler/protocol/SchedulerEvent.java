package wattsched.scheduler.protocol;

import wattsched.scheduler.model.Host;
import wattsched.scheduler.model.Job;
import wattsched.scheduler.model.JobOutcome;
import wattsched.scheduler.model.PowerState;

import java.util.List;

/**
 * A decoded event from a backend batch.
 */
public interface SchedulerEvent {

    double timestamp();

    EventType type();

    /** Topology of the cluster, sent once before anything else */
    record SimulationBegins(double timestamp, List<Host> hosts) implements SchedulerEvent {
        public SimulationBegins {
            hosts = List.copyOf(hosts);
        }

        @Override
        public EventType type() {
            return EventType.SIMULATION_BEGINS;
        }
    }

    record JobSubmitted(double timestamp, Job job) implements SchedulerEvent {
        @Override
        public EventType type() {
            return EventType.JOB_SUBMITTED;
        }
    }

    record JobCompleted(double timestamp, String jobId, JobOutcome outcome, int returnCode)
            implements SchedulerEvent {
        @Override
        public EventType type() {
            return EventType.JOB_COMPLETED;
        }
    }

    record JobKilled(double timestamp, List<String> jobIds) implements SchedulerEvent {
        public JobKilled {
            jobIds = List.copyOf(jobIds);
        }

        @Override
        public EventType type() {
            return EventType.JOB_KILLED;
        }
    }

    /** Backend confirmation that hosts reached a power state */
    record ResourceStateChanged(double timestamp, List<Integer> hostIds, PowerState state)
            implements SchedulerEvent {
        public ResourceStateChanged {
            hostIds = List.copyOf(hostIds);
        }

        @Override
        public EventType type() {
            return EventType.RESOURCE_STATE_CHANGED;
        }
    }

    record SimulationEnds(double timestamp) implements SchedulerEvent {
        @Override
        public EventType type() {
            return EventType.SIMULATION_ENDS;
        }
    }

    record RequestedCall(double timestamp) implements SchedulerEvent {
        @Override
        public EventType type() {
            return EventType.REQUESTED_CALL;
        }
    }

    record Notify(double timestamp, String kind) implements SchedulerEvent {
        /** The workload source has submitted its last static job */
        public static final String NO_MORE_STATIC_JOBS = "no_more_static_job_to_submit";

        public boolean noMoreJobs() {
            return NO_MORE_STATIC_JOBS.equals(kind);
        }

        @Override
        public EventType type() {
            return EventType.NOTIFY;
        }
    }

    /** Total energy consumed by the platform so far, in joules */
    record EnergyAnswer(double timestamp, double consumedEnergy) implements SchedulerEvent {
        @Override
        public EventType type() {
            return EventType.ANSWER;
        }
    }
}
