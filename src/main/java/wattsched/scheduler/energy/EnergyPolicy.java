package wattsched.scheduler.energy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wattsched.scheduler.cluster.ClusterSnapshot;
import wattsched.scheduler.config.SchedulerConfig;
import wattsched.scheduler.model.Host;
import wattsched.scheduler.model.PowerState;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Threshold-with-hysteresis power policy.
 *
 * Idle hosts are put to sleep once they have been idle for {@code idleThreshold}. A host
 * that was just woken stays on until it runs a job or {@code wakeCooldown} has passed.
 * Waking is only done on request of the decision engine.
 */
public class EnergyPolicy {

    private static final Logger log = LoggerFactory.getLogger(EnergyPolicy.class);

    private final boolean enabled;
    private final boolean allowWake;
    private final double idleThreshold;
    private final double wakeCooldown;
    private final int minPoweredHosts;

    public EnergyPolicy(SchedulerConfig config) {
        this(config.energyPolicyEnabled(), config.allowWake(), config.idleThreshold(),
                config.wakeCooldown(), config.minPoweredHosts());
    }

    public EnergyPolicy(boolean enabled, boolean allowWake, double idleThreshold,
                        double wakeCooldown, int minPoweredHosts) {
        this.enabled = enabled;
        this.allowWake = allowWake;
        this.idleThreshold = idleThreshold;
        this.wakeCooldown = wakeCooldown;
        this.minPoweredHosts = minPoweredHosts;
    }

    public boolean enabled() {
        return enabled;
    }

    public boolean allowWake() {
        return allowWake;
    }

    /**
     * Hosts to put to sleep now.
     *
     * @param snapshot      cluster state after this pass's allocations
     * @param retainedHosts hosts held back for the head job's reservation
     * @return host ids in ascending order
     */
    public List<Integer> evaluate(ClusterSnapshot snapshot, Set<Integer> retainedHosts) {
        if (!enabled) {
            return List.of();
        }
        double now = snapshot.now();
        int poweredBudget = snapshot.poweredOrWaking() - minPoweredHosts;

        List<Integer> off = new ArrayList<>();
        for (Host host : snapshot.available()) {
            if (poweredBudget <= 0) {
                break;
            }
            if (retainedHosts.contains(host.id())) {
                continue;
            }
            if (host.idleDuration(now) < idleThreshold) {
                continue;
            }
            if (host.inWakeCooldown(now, wakeCooldown)) {
                log.debug("Host {} idle but still in wake cool-down", host.id());
                continue;
            }
            off.add(host.id());
            poweredBudget--;
        }
        if (!off.isEmpty()) {
            log.info("Powering off idle hosts {} at {}", off, now);
        }
        return off;
    }

    /**
     * Sleeping hosts to wake for a capacity deficit, lowest id first. Returns fewer hosts
     * than needed when sleeping capacity runs out, none when waking is disabled.
     */
    public List<Integer> planWake(ClusterSnapshot snapshot, int deficit) {
        if (!enabled || !allowWake || deficit <= 0) {
            return List.of();
        }
        List<Integer> wake = new ArrayList<>();
        int covered = 0;
        for (Host host : snapshot.inState(PowerState.SLEEPING)) {
            if (covered >= deficit) {
                break;
            }
            wake.add(host.id());
            covered += host.capacity();
        }
        return wake;
    }

    /**
     * Earliest future time at which an available host becomes eligible for power-off,
     * or NaN if none will without further events.
     */
    public double nextIdleDeadline(ClusterSnapshot snapshot) {
        if (!enabled) {
            return Double.NaN;
        }
        double now = snapshot.now();
        double next = Double.NaN;
        for (Host host : snapshot.available()) {
            if (host.idleSince() == null) {
                continue;
            }
            double at = host.idleSince() + idleThreshold;
            if (host.lastWokenAt() != null) {
                at = Math.max(at, host.lastWokenAt() + wakeCooldown);
            }
            if (at > now && (Double.isNaN(next) || at < next)) {
                next = at;
            }
        }
        return next;
    }
}
