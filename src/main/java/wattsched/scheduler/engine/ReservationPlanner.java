package wattsched.scheduler.engine;

import wattsched.scheduler.cluster.ClusterSnapshot;
import wattsched.scheduler.model.Host;
import wattsched.scheduler.model.Job;
import wattsched.scheduler.model.PowerState;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Projects when each host will next be free and reserves the earliest set covering a job.
 */
public class ReservationPlanner {

    private final double switchOnLatency;
    private final boolean wakeAllowed;

    public ReservationPlanner(double switchOnLatency, boolean wakeAllowed) {
        this.switchOnLatency = switchOnLatency;
        this.wakeAllowed = wakeAllowed;
    }

    private record Slot(Host host, double freeAt) {
    }

    private static final Comparator<Slot> EARLIEST_FIRST =
            Comparator.comparingDouble(Slot::freeAt).thenComparingInt(s -> s.host().id());

    /**
     * Reserve hosts for {@code job}.
     *
     * @param running running jobs by id, used to project when COMPUTING hosts free up
     * @return empty if the request cannot be covered by hosts with a known free time
     */
    public Optional<Reservation> plan(Job job, ClusterSnapshot snapshot, Map<String, Job> running) {
        double now = snapshot.now();
        PriorityQueue<Slot> heap = new PriorityQueue<>(EARLIEST_FIRST);
        for (Host host : snapshot.hosts()) {
            double freeAt = freeAt(host, now, running);
            if (Double.isFinite(freeAt)) {
                heap.add(new Slot(host, freeAt));
            }
        }

        List<Integer> reserved = new ArrayList<>();
        List<Integer> sleeping = new ArrayList<>();
        int capacity = 0;
        double start = now;
        while (capacity < job.requestedResources() && !heap.isEmpty()) {
            Slot slot = heap.poll();
            reserved.add(slot.host().id());
            if (slot.host().powerState() == PowerState.SLEEPING) {
                sleeping.add(slot.host().id());
            }
            capacity += slot.host().capacity();
            start = Math.max(start, slot.freeAt());
        }

        if (capacity < job.requestedResources()) {
            return Optional.empty();
        }
        return Optional.of(new Reservation(job.id(), start, reserved, sleeping));
    }

    /** Projected time a host can take a new job, infinity when unknown */
    double freeAt(Host host, double now, Map<String, Job> running) {
        return switch (host.powerState()) {
            case IDLE -> host.currentJobId() == null ? now : Double.POSITIVE_INFINITY;
            case SWITCHING_ON -> Math.max(now, deadlineOr(host, now + switchOnLatency));
            case SLEEPING -> wakeAllowed ? now + switchOnLatency : Double.POSITIVE_INFINITY;
            case SWITCHING_OFF -> wakeAllowed
                    ? Math.max(now, deadlineOr(host, now)) + switchOnLatency
                    : Double.POSITIVE_INFINITY;
            case COMPUTING -> {
                Job job = host.currentJobId() == null ? null : running.get(host.currentJobId());
                if (job == null || job.startTime() == null) {
                    yield Double.POSITIVE_INFINITY;
                }
                yield Math.max(now, job.projectedFinish());
            }
        };
    }

    private static double deadlineOr(Host host, double fallback) {
        return host.transitionDeadline() != null ? host.transitionDeadline() : fallback;
    }
}
