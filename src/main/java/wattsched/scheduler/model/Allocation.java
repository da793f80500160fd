package wattsched.scheduler.model;

import java.util.List;
import java.util.Objects;

/**
 * Hosts committed to a running job, in ascending id order.
 */
public record Allocation(String jobId, List<Integer> hostIds, int capacity) {

    public Allocation {
        Objects.requireNonNull(jobId, "jobId is required");
        if (hostIds == null || hostIds.isEmpty()) {
            throw new IllegalArgumentException("allocation for job " + jobId + " has no hosts");
        }
        hostIds = hostIds.stream().sorted().distinct().toList();
        if (capacity < hostIds.size()) {
            throw new IllegalArgumentException("capacity " + capacity + " below host count " + hostIds.size());
        }
    }

    /** Whether this allocation satisfies the given job's request */
    public boolean covers(Job job) {
        return capacity >= job.requestedResources();
    }
}
