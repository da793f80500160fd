package wattsched.scheduler.engine;

import wattsched.scheduler.model.Job;

import java.util.List;

/**
 * Hosts held for the blocked head job and the earliest time they are all expected free.
 *
 * @param jobId         the head job
 * @param start         projected start of the head job
 * @param hostIds       reserved hosts, ascending
 * @param sleepingHosts reserved hosts that are asleep and must be woken
 */
public record Reservation(String jobId, double start, List<Integer> hostIds, List<Integer> sleepingHosts) {

    public Reservation {
        hostIds = hostIds.stream().sorted().toList();
        sleepingHosts = sleepingHosts.stream().sorted().toList();
    }

    public boolean holds(int hostId) {
        return hostIds.contains(hostId);
    }

    /** A job started now on reserved hosts must be done before the head job starts */
    public boolean allowsBackfill(Job job, double now) {
        return job.projectedFinish(now) <= start;
    }
}
