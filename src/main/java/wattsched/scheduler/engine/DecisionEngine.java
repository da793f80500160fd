package wattsched.scheduler.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wattsched.scheduler.cluster.ClusterSnapshot;
import wattsched.scheduler.cluster.ClusterStateTracker;
import wattsched.scheduler.energy.EnergyPolicy;
import wattsched.scheduler.model.Allocation;
import wattsched.scheduler.model.Job;
import wattsched.scheduler.model.PowerState;
import wattsched.scheduler.model.RejectReason;
import wattsched.scheduler.protocol.Decision;
import wattsched.scheduler.queue.JobQueueManager;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;

/**
 * FCFS scheduling with EASY backfilling around one head-job reservation.
 *
 * A pass rejects infeasible jobs, starts jobs in queue order while they fit, reserves
 * hosts for the first job that does not fit, backfills later jobs that cannot delay it,
 * and finally lets the energy policy put idle hosts to sleep. Reply order is rejections,
 * power-on requests, job starts, power-off requests.
 */
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    /** Slack when comparing simulated times */
    private static final double EPSILON = 1e-9;

    private final ClusterStateTracker cluster;
    private final JobQueueManager queue;
    private final EnergyPolicy energyPolicy;
    private final ReservationPlanner planner;
    private final int backfillWindow;
    private final double switchOnLatency;

    public DecisionEngine(ClusterStateTracker cluster,
                          JobQueueManager queue,
                          EnergyPolicy energyPolicy,
                          ReservationPlanner planner,
                          int backfillWindow,
                          double switchOnLatency) {
        this.cluster = cluster;
        this.queue = queue;
        this.energyPolicy = energyPolicy;
        this.planner = planner;
        this.backfillWindow = backfillWindow;
        this.switchOnLatency = switchOnLatency;
    }

    public SchedulingPass runPass(double now) {
        List<Decision> rejections = rejectInfeasible(now);
        List<Decision> powerOn = new ArrayList<>();
        List<Decision> starts = new ArrayList<>();

        Reservation reservation = null;
        double deferredWakeAt = Double.NaN;

        for (Job job : queue.nextCandidates(backfillWindow)) {
            SortedSet<Integer> free = cluster.availableHosts();

            if (reservation == null) {
                List<Integer> hosts = pick(free, job.requestedResources());
                if (hosts != null) {
                    starts.add(start(job, hosts, now));
                    continue;
                }

                Optional<Reservation> planned = planner.plan(job, cluster.snapshot(now), runningById());
                if (planned.isEmpty()) {
                    log.debug("Job {} blocked with no projected start", job.id());
                    reservation = new Reservation(job.id(), Double.POSITIVE_INFINITY, List.of(), List.of());
                    continue;
                }
                reservation = planned.get();
                log.debug("Job {} reserved {} from {}", job.id(), reservation.hostIds(), reservation.start());

                if (!reservation.sleepingHosts().isEmpty()) {
                    if (reservation.start() <= now + switchOnLatency + EPSILON) {
                        List<Integer> wake = wake(reservation, now);
                        if (!wake.isEmpty()) {
                            powerOn.add(new Decision.SetResourceState(wake, PowerState.IDLE));
                        }
                    } else {
                        deferredWakeAt = reservation.start() - switchOnLatency;
                    }
                }
                continue;
            }

            // backfill: hosts outside the reservation first, reserved ones only if the job ends in time
            List<Integer> order = new ArrayList<>();
            List<Integer> reservedFree = new ArrayList<>();
            for (int id : free) {
                if (reservation.holds(id)) {
                    reservedFree.add(id);
                } else {
                    order.add(id);
                }
            }
            if (reservation.allowsBackfill(job, now)) {
                order.addAll(reservedFree);
            }
            List<Integer> hosts = pick(order, job.requestedResources());
            if (hosts != null) {
                log.debug("Backfilling job {} on {}", job.id(), hosts);
                starts.add(start(job, hosts, now));
            }
        }

        List<Decision> powerOff = new ArrayList<>();
        Set<Integer> retained = reservation == null ? Set.of() : new HashSet<>(reservation.hostIds());
        List<Integer> sleep = energyPolicy.evaluate(cluster.snapshot(now), retained);
        for (int id : sleep) {
            cluster.requestPowerOff(id, now);
        }
        if (!sleep.isEmpty()) {
            powerOff.add(new Decision.SetResourceState(sleep, PowerState.SLEEPING));
        }

        List<Decision> decisions = new ArrayList<>(rejections.size() + powerOn.size() + starts.size() + powerOff.size());
        decisions.addAll(rejections);
        decisions.addAll(powerOn);
        decisions.addAll(starts);
        decisions.addAll(powerOff);
        return new SchedulingPass(decisions, reservation, deferredWakeAt);
    }

    private List<Decision> rejectInfeasible(double now) {
        List<Decision> out = new ArrayList<>();
        int total = cluster.totalCapacity();
        for (Job job : queue.pendingJobs()) {
            if (job.requestedResources() > total) {
                queue.markRejected(job.id(), RejectReason.INFEASIBLE_REQUEST, now);
                out.add(new Decision.RejectJob(job.id(), RejectReason.INFEASIBLE_REQUEST));
            }
        }
        return out;
    }

    private Decision start(Job job, List<Integer> hosts, double now) {
        Allocation allocation = cluster.assign(job.id(), hosts, now);
        queue.markRunning(job.id(), allocation, now);
        return new Decision.ExecuteJob(job.id(), allocation.hostIds());
    }

    private List<Integer> wake(Reservation reservation, double now) {
        ClusterSnapshot snapshot = cluster.snapshot(now);
        int deficit = cluster.capacityOf(reservation.sleepingHosts());
        List<Integer> wake = energyPolicy.planWake(snapshot, deficit);
        for (int id : wake) {
            cluster.requestPowerOn(id, now);
        }
        if (!wake.isEmpty()) {
            log.info("Waking hosts {} for job {}", wake, reservation.jobId());
        }
        return wake;
    }

    /** Hosts in the given order until their capacity covers the request, null if it never does */
    private List<Integer> pick(Collection<Integer> candidates, int requested) {
        List<Integer> hosts = new ArrayList<>();
        int capacity = 0;
        for (int id : candidates) {
            if (capacity >= requested) {
                break;
            }
            hosts.add(id);
            capacity += cluster.host(id).capacity();
        }
        return capacity >= requested ? hosts : null;
    }

    private Map<String, Job> runningById() {
        Map<String, Job> byId = new HashMap<>();
        for (Job job : queue.runningJobs()) {
            byId.put(job.id(), job);
        }
        return byId;
    }
}
