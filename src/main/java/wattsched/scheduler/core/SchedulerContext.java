package wattsched.scheduler.core;

import wattsched.scheduler.cluster.ClusterStateTracker;
import wattsched.scheduler.config.SchedulerConfig;
import wattsched.scheduler.energy.EnergyMonitor;
import wattsched.scheduler.energy.EnergyPolicy;
import wattsched.scheduler.engine.DecisionEngine;
import wattsched.scheduler.engine.ReservationPlanner;
import wattsched.scheduler.model.Host;
import wattsched.scheduler.queue.JobQueueManager;

import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * State of one simulation run, created when the backend announces the topology.
 */
public final class SchedulerContext {

    private final SchedulerConfig config;
    private final ClusterStateTracker cluster;
    private final JobQueueManager queue;
    private final EnergyPolicy energyPolicy;
    private final EnergyMonitor energyMonitor;
    private final DecisionEngine engine;
    private final SystemStateRecorder recorder;

    /** Callback times requested from the backend and not yet delivered */
    private final NavigableSet<Double> pendingCallbacks = new TreeSet<>();

    private final double startedAt;
    private boolean workloadExhausted = false;

    private SchedulerContext(SchedulerConfig config, List<Host> topology, double now) {
        this.config = config;
        this.cluster = new ClusterStateTracker(topology, config.switchOnLatency(), config.switchOffLatency());
        this.queue = new JobQueueManager();
        this.energyPolicy = new EnergyPolicy(config);
        this.energyMonitor = new EnergyMonitor(config.energyMonitoring());
        ReservationPlanner planner = new ReservationPlanner(config.switchOnLatency(),
                energyPolicy.enabled() && energyPolicy.allowWake());
        this.engine = new DecisionEngine(cluster, queue, energyPolicy, planner,
                config.backfillWindow(), config.switchOnLatency());
        this.recorder = new SystemStateRecorder(config.recordInterval(), config.maxSamples());
        this.startedAt = now;
    }

    public static SchedulerContext begin(SchedulerConfig config, List<Host> topology, double now) {
        return new SchedulerContext(config, topology, now);
    }

    public SchedulerConfig config() {
        return config;
    }

    public ClusterStateTracker cluster() {
        return cluster;
    }

    public JobQueueManager queue() {
        return queue;
    }

    public EnergyPolicy energyPolicy() {
        return energyPolicy;
    }

    public EnergyMonitor energyMonitor() {
        return energyMonitor;
    }

    public DecisionEngine engine() {
        return engine;
    }

    public SystemStateRecorder recorder() {
        return recorder;
    }

    public NavigableSet<Double> pendingCallbacks() {
        return pendingCallbacks;
    }

    public double startedAt() {
        return startedAt;
    }

    public boolean workloadExhausted() {
        return workloadExhausted;
    }

    void markWorkloadExhausted() {
        this.workloadExhausted = true;
    }

    /** Nothing more will be submitted and nothing is waiting or running */
    public boolean isFinished() {
        return workloadExhausted && queue.isDrained();
    }
}
