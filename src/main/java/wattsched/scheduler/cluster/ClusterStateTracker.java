package wattsched.scheduler.cluster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wattsched.scheduler.exception.InvalidTransitionException;
import wattsched.scheduler.exception.ProtocolException;
import wattsched.scheduler.model.Allocation;
import wattsched.scheduler.model.Host;
import wattsched.scheduler.model.PowerState;
import wattsched.scheduler.protocol.SchedulerEvent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Per-host power and assignment state, built from the topology and kept in line with
 * backend confirmations.
 *
 * Requested transitions are recorded as SWITCHING_ON / SWITCHING_OFF with an estimated
 * deadline; the backend's RESOURCE_STATE_CHANGED events are authoritative and settle them.
 */
public final class ClusterStateTracker {

    private static final Logger log = LoggerFactory.getLogger(ClusterStateTracker.class);

    private final Map<Integer, Host> hosts = new TreeMap<>();
    private final int totalCapacity;
    private final double switchOnLatency;
    private final double switchOffLatency;

    public ClusterStateTracker(List<Host> topology, double switchOnLatency, double switchOffLatency) {
        if (topology == null || topology.isEmpty()) {
            throw new IllegalArgumentException("topology has no hosts");
        }
        for (Host h : topology) {
            if (hosts.put(h.id(), h) != null) {
                throw new IllegalArgumentException("duplicate host id " + h.id());
            }
        }
        this.totalCapacity = topology.stream().mapToInt(Host::capacity).sum();
        this.switchOnLatency = switchOnLatency;
        this.switchOffLatency = switchOffLatency;
        log.info("Cluster of {} hosts, {} slots", hosts.size(), totalCapacity);
    }

    /**
     * Apply one backend event. Events that do not concern hosts are ignored.
     */
    public void applyEvent(SchedulerEvent event) {
        if (event instanceof SchedulerEvent.ResourceStateChanged changed) {
            for (int id : changed.hostIds()) {
                applyStateChange(require(id), changed.state(), changed.timestamp());
            }
        } else if (event instanceof SchedulerEvent.JobCompleted completed) {
            release(completed.jobId(), completed.timestamp());
        } else if (event instanceof SchedulerEvent.JobKilled killed) {
            for (String jobId : killed.jobIds()) {
                release(jobId, killed.timestamp());
            }
        }
    }

    private void applyStateChange(Host host, PowerState reported, double now) {
        PowerState current = host.powerState();

        if (reported == PowerState.COMPUTING) {
            throw new ProtocolException("host " + host.id() + " reported COMPUTING; that state follows allocations");
        }

        if (current == PowerState.COMPUTING) {
            if (reported == PowerState.IDLE) {
                return; // powered on while running, nothing to settle
            }
            throw new ProtocolException("host " + host.id() + " running job " + host.currentJobId()
                    + " reported " + reported);
        }

        if (reported == current) {
            log.debug("Host {} already {}", host.id(), current);
            return;
        }

        Host.Builder next = host.toBuilder().powerState(reported);
        switch (reported) {
            case IDLE -> {
                next.transitionDeadline(null).idleSince(now);
                if (current == PowerState.SWITCHING_ON) {
                    next.lastWokenAt(now);
                    log.debug("Host {} woke up at {}", host.id(), now);
                } else {
                    log.warn("Host {} went IDLE from {} without a wake request", host.id(), current);
                }
            }
            case SLEEPING -> {
                next.transitionDeadline(null).idleSince(null).lastWokenAt(null);
                if (current == PowerState.SWITCHING_OFF) {
                    log.debug("Host {} asleep at {}", host.id(), now);
                } else {
                    log.warn("Host {} went SLEEPING from {} without a sleep request", host.id(), current);
                }
            }
            case SWITCHING_ON -> next.transitionDeadline(now + switchOnLatency).idleSince(null);
            case SWITCHING_OFF -> next.transitionDeadline(now + switchOffLatency).idleSince(null);
            default -> throw new IllegalStateException("unexpected state " + reported);
        }
        hosts.put(host.id(), next.build());
    }

    /**
     * Ask a sleeping host to wake up.
     *
     * @throws InvalidTransitionException if the host is mid-transition or not sleeping
     */
    public void requestPowerOn(int hostId, double now) {
        Host host = require(hostId);
        if (host.isTransitioning()) {
            throw new InvalidTransitionException(hostId, host.powerState(), "transition already pending");
        }
        if (host.powerState() != PowerState.SLEEPING) {
            throw new InvalidTransitionException(hostId, host.powerState(), "only sleeping hosts can be woken");
        }
        hosts.put(hostId, host.toBuilder()
                .powerState(PowerState.SWITCHING_ON)
                .transitionDeadline(now + switchOnLatency)
                .build());
        log.debug("Host {} switching on, expected at {}", hostId, now + switchOnLatency);
    }

    /**
     * Ask an idle host to go to sleep.
     *
     * @throws InvalidTransitionException if the host is mid-transition, busy or not idle
     */
    public void requestPowerOff(int hostId, double now) {
        Host host = require(hostId);
        if (host.isTransitioning()) {
            throw new InvalidTransitionException(hostId, host.powerState(), "transition already pending");
        }
        if (!host.isAvailable()) {
            throw new InvalidTransitionException(hostId, host.powerState(), "only idle hosts without a job can sleep");
        }
        hosts.put(hostId, host.toBuilder()
                .powerState(PowerState.SWITCHING_OFF)
                .transitionDeadline(now + switchOffLatency)
                .idleSince(null)
                .lastWokenAt(null)
                .build());
        log.debug("Host {} switching off", hostId);
    }

    /**
     * Commit hosts to a job. All hosts are checked before any is changed.
     *
     * @throws InvalidTransitionException if any host is not available
     */
    public Allocation assign(String jobId, Collection<Integer> hostIds, double now) {
        List<Host> selected = new ArrayList<>(hostIds.size());
        for (int id : hostIds) {
            Host host = require(id);
            if (!host.isAvailable()) {
                throw new InvalidTransitionException(id, host.powerState(),
                        "not available for job " + jobId + " (job=" + host.currentJobId() + ")");
            }
            selected.add(host);
        }

        int capacity = 0;
        for (Host host : selected) {
            hosts.put(host.id(), host.toBuilder()
                    .powerState(PowerState.COMPUTING)
                    .currentJobId(jobId)
                    .idleSince(null)
                    .lastWokenAt(null)
                    .build());
            capacity += host.capacity();
        }
        return new Allocation(jobId, List.copyOf(hostIds), capacity);
    }

    /**
     * Return a job's hosts to IDLE.
     *
     * @return ids of the released hosts, empty if the job held none
     */
    public List<Integer> release(String jobId, double now) {
        List<Integer> released = new ArrayList<>();
        for (Host host : List.copyOf(hosts.values())) {
            if (jobId.equals(host.currentJobId())) {
                hosts.put(host.id(), host.toBuilder()
                        .powerState(PowerState.IDLE)
                        .currentJobId(null)
                        .idleSince(now)
                        .build());
                released.add(host.id());
            }
        }
        if (!released.isEmpty()) {
            log.debug("Released hosts {} of job {}", released, jobId);
        }
        return released;
    }

    /** Ids of IDLE hosts with no job and no pending transition, ascending */
    public SortedSet<Integer> availableHosts() {
        SortedSet<Integer> ids = new TreeSet<>();
        for (Host h : hosts.values()) {
            if (h.isAvailable()) {
                ids.add(h.id());
            }
        }
        return ids;
    }

    public Host host(int hostId) {
        return require(hostId);
    }

    public List<Host> hosts() {
        return List.copyOf(hosts.values());
    }

    public List<Integer> hostsOf(String jobId) {
        return hosts.values().stream()
                .filter(h -> jobId.equals(h.currentJobId()))
                .map(Host::id)
                .toList();
    }

    public int totalCapacity() {
        return totalCapacity;
    }

    public int capacityOf(Collection<Integer> hostIds) {
        return hostIds.stream().mapToInt(id -> require(id).capacity()).sum();
    }

    public int count(PowerState state) {
        return (int) hosts.values().stream().filter(h -> h.powerState() == state).count();
    }

    public ClusterSnapshot snapshot(double now) {
        return new ClusterSnapshot(now, List.copyOf(hosts.values()));
    }

    private Host require(int hostId) {
        Host host = hosts.get(hostId);
        if (host == null) {
            throw new ProtocolException("unknown host " + hostId);
        }
        return host;
    }
}
