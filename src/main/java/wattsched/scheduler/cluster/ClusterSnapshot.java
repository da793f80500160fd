package wattsched.scheduler.cluster;

import wattsched.scheduler.model.Host;
import wattsched.scheduler.model.PowerState;

import java.util.Comparator;
import java.util.List;

/**
 * Read-only view of every host at one simulated time, ordered by host id.
 */
public record ClusterSnapshot(double now, List<Host> hosts) {

    public ClusterSnapshot {
        hosts = hosts.stream().sorted(Comparator.comparingInt(Host::id)).toList();
    }

    public List<Host> available() {
        return hosts.stream().filter(Host::isAvailable).toList();
    }

    public List<Host> inState(PowerState state) {
        return hosts.stream().filter(h -> h.powerState() == state).toList();
    }

    public int count(PowerState state) {
        return (int) hosts.stream().filter(h -> h.powerState() == state).count();
    }

    public int capacityIn(PowerState state) {
        return hosts.stream().filter(h -> h.powerState() == state).mapToInt(Host::capacity).sum();
    }

    public int totalCapacity() {
        return hosts.stream().mapToInt(Host::capacity).sum();
    }

    /** Hosts that are on, or on their way on */
    public int poweredOrWaking() {
        return (int) hosts.stream()
                .filter(h -> h.powerState().isPowered() || h.powerState() == PowerState.SWITCHING_ON)
                .count();
    }
}
