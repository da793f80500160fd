package wattsched.scheduler.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wattsched.scheduler.cluster.ClusterSnapshot;
import wattsched.scheduler.model.PowerState;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Samples running/waiting jobs, host power states and utilization at most once per
 * interval. Keeps the latest {@code maxSamples} samples in memory.
 */
public class SystemStateRecorder {

    private static final Logger log = LoggerFactory.getLogger(SystemStateRecorder.class);

    private final double interval;
    private final int maxSamples;
    private final Deque<SystemStateSample> samples = new ArrayDeque<>();

    private double lastRecorded = Double.NaN;

    public SystemStateRecorder(double interval, int maxSamples) {
        this.interval = interval;
        this.maxSamples = maxSamples;
    }

    /**
     * Record a sample unless one was taken less than {@code interval} ago.
     *
     * @return true if a sample was recorded
     */
    public boolean maybeRecord(ClusterSnapshot snapshot, int running, int waiting, double power) {
        double now = snapshot.now();
        if (!Double.isNaN(lastRecorded) && now - lastRecorded < interval) {
            return false;
        }
        record(snapshot, running, waiting, power);
        return true;
    }

    /** Record a sample regardless of the interval */
    public SystemStateSample record(ClusterSnapshot snapshot, int running, int waiting, double power) {
        Map<PowerState, Integer> byState = new EnumMap<>(PowerState.class);
        for (PowerState state : PowerState.values()) {
            byState.put(state, snapshot.count(state));
        }
        int total = snapshot.totalCapacity();
        double utilization = total == 0 ? 0 : (double) snapshot.capacityIn(PowerState.COMPUTING) / total;

        SystemStateSample sample = new SystemStateSample(snapshot.now(), running, waiting, byState, utilization, power);
        if (samples.size() >= maxSamples) {
            samples.removeFirst();
        }
        samples.addLast(sample);
        lastRecorded = snapshot.now();

        log.info("t={} running={} waiting={} idle={} computing={} sleeping={} switching={}/{} util={} power={}",
                sample.time(), running, waiting,
                sample.hosts(PowerState.IDLE), sample.hosts(PowerState.COMPUTING), sample.hosts(PowerState.SLEEPING),
                sample.hosts(PowerState.SWITCHING_ON), sample.hosts(PowerState.SWITCHING_OFF),
                String.format(Locale.ROOT, "%.3f", utilization), power);
        return sample;
    }

    public List<SystemStateSample> samples() {
        return List.copyOf(samples);
    }
}
