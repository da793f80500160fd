package wattsched.scheduler.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wattsched.scheduler.exception.InvalidJobTransitionException;
import wattsched.scheduler.model.Allocation;
import wattsched.scheduler.model.Job;
import wattsched.scheduler.model.JobOutcome;
import wattsched.scheduler.model.JobState;
import wattsched.scheduler.model.RejectReason;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Lifecycle of submitted jobs: pending in scheduling order, running, then archived.
 *
 * Scheduling order is (submission time, id). Every state change replaces the stored
 * {@link Job} with a new instance.
 */
public class JobQueueManager {

    private static final Logger log = LoggerFactory.getLogger(JobQueueManager.class);

    public static final Comparator<Job> SCHEDULING_ORDER =
            Comparator.comparingDouble(Job::submissionTime).thenComparing(Job::id);

    private final NavigableSet<Job> pending = new TreeSet<>(SCHEDULING_ORDER);
    private final Map<String, Job> pendingById = new HashMap<>();
    private final Map<String, Job> running = new LinkedHashMap<>();
    private final Map<String, Job> archive = new LinkedHashMap<>();

    private int completedCount = 0;
    private int rejectedCount = 0;

    /**
     * Enqueue a submitted job as PENDING.
     *
     * @throws InvalidJobTransitionException if the id was already seen
     */
    public void admit(Job job) {
        if (job.state() != JobState.PENDING) {
            throw new InvalidJobTransitionException(job.id(), job.state(), JobState.PENDING);
        }
        if (knows(job.id())) {
            throw new InvalidJobTransitionException(job.id(), "duplicate job id");
        }
        pending.add(job);
        pendingById.put(job.id(), job);
        log.debug("Admitted job {} (res={}, walltime={})", job.id(), job.requestedResources(), job.walltime());
    }

    /**
     * PENDING → RUNNING.
     *
     * @throws InvalidJobTransitionException if the job is not pending or the allocation is too small
     */
    public Job markRunning(String jobId, Allocation allocation, double now) {
        Job job = requirePending(jobId, JobState.RUNNING);
        if (!allocation.jobId().equals(jobId) || !allocation.covers(job)) {
            throw new InvalidJobTransitionException(jobId, "allocation " + allocation
                    + " does not cover " + job.requestedResources() + " resources");
        }
        pending.remove(job);
        pendingById.remove(jobId);

        Job started = job.toBuilder()
                .state(JobState.RUNNING)
                .allocation(allocation)
                .startTime(now)
                .build();
        running.put(jobId, started);
        return started;
    }

    /**
     * RUNNING → COMPLETED.
     *
     * @throws InvalidJobTransitionException if the job is not running
     */
    public Job markCompleted(String jobId, JobOutcome outcome, double now) {
        Job job = running.get(jobId);
        if (job == null) {
            throw new InvalidJobTransitionException(jobId, stateOf(jobId), JobState.COMPLETED);
        }
        running.remove(jobId);

        Job done = job.toBuilder()
                .state(JobState.COMPLETED)
                .outcome(outcome)
                .finishTime(now)
                .build();
        archive.put(jobId, archivable(done));
        completedCount++;
        log.debug("Job {} finished at {} ({})", jobId, now, outcome);
        return done;
    }

    /**
     * PENDING → REJECTED.
     *
     * @throws InvalidJobTransitionException if the job is not pending
     */
    public Job markRejected(String jobId, RejectReason reason, double now) {
        Job job = requirePending(jobId, JobState.REJECTED);
        pending.remove(job);
        pendingById.remove(jobId);

        Job rejected = job.toBuilder()
                .state(JobState.REJECTED)
                .rejectReason(reason)
                .finishTime(now)
                .build();
        archive.put(jobId, archivable(rejected));
        rejectedCount++;
        log.info("Rejected job {}: {} (requested {})", jobId, reason, job.requestedResources());
        return rejected;
    }

    /** Up to {@code limit} pending jobs in scheduling order */
    public List<Job> nextCandidates(int limit) {
        List<Job> out = new ArrayList<>(Math.min(limit, pending.size()));
        for (Job job : pending) {
            if (out.size() >= limit) {
                break;
            }
            out.add(job);
        }
        return out;
    }

    public List<Job> pendingJobs() {
        return List.copyOf(pending);
    }

    public List<Job> runningJobs() {
        return List.copyOf(running.values());
    }

    /** A pending or running job */
    public Optional<Job> find(String jobId) {
        Job job = pendingById.get(jobId);
        return job != null ? Optional.of(job) : Optional.ofNullable(running.get(jobId));
    }

    /** A terminal job, stripped of its allocation and profile */
    public Optional<Job> archived(String jobId) {
        return Optional.ofNullable(archive.get(jobId));
    }

    public boolean knows(String jobId) {
        return pendingById.containsKey(jobId) || running.containsKey(jobId) || archive.containsKey(jobId);
    }

    public int pendingCount() {
        return pending.size();
    }

    public int runningCount() {
        return running.size();
    }

    public int completedCount() {
        return completedCount;
    }

    public int rejectedCount() {
        return rejectedCount;
    }

    /** No job is waiting or running */
    public boolean isDrained() {
        return pending.isEmpty() && running.isEmpty();
    }

    /** Terminal record without allocation or profile, enough to recognise repeated terminations */
    private static Job archivable(Job job) {
        return job.toBuilder()
                .allocation(null)
                .profile(null)
                .build();
    }

    private Job requirePending(String jobId, JobState target) {
        Job job = pendingById.get(jobId);
        if (job == null) {
            throw new InvalidJobTransitionException(jobId, stateOf(jobId), target);
        }
        return job;
    }

    private JobState stateOf(String jobId) {
        if (running.containsKey(jobId)) {
            return JobState.RUNNING;
        }
        Job done = archive.get(jobId);
        return done != null ? done.state() : null;
    }
}
