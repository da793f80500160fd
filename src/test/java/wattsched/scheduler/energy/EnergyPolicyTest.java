package wattsched.scheduler.energy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import wattsched.scheduler.cluster.ClusterSnapshot;
import wattsched.scheduler.config.SchedulerConfig;
import wattsched.scheduler.model.Host;
import wattsched.scheduler.model.PowerState;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EnergyPolicyTest {

    private final EnergyPolicy policy = new EnergyPolicy(true, true, 100, 50, 0);

    @Test
    void powersOffHostsIdlePastThreshold() {
        ClusterSnapshot snapshot = new ClusterSnapshot(200, List.of(
                idle(0, 50.0),
                idle(1, 150.0),
                idle(2, 100.0),
                Host.builder().id(3).powerState(PowerState.COMPUTING).currentJobId("j").build()));

        assertEquals(List.of(0, 2), policy.evaluate(snapshot, Set.of()));
    }

    @Test
    void retainedHostsStayOn() {
        ClusterSnapshot snapshot = new ClusterSnapshot(500, List.of(idle(0, 0.0), idle(1, 0.0)));

        assertEquals(List.of(1), policy.evaluate(snapshot, Set.of(0)));
    }

    @Test
    @DisplayName("A freshly woken host is not put back to sleep during the cool-down")
    void wakeCooldownBlocksSleep() {
        Host woken = Host.builder().id(0).idleSince(0.0).lastWokenAt(0.0).build();

        assertEquals(List.of(), new EnergyPolicy(true, true, 10, 60, 0)
                .evaluate(new ClusterSnapshot(30, List.of(woken)), Set.of()));
        assertEquals(List.of(0), new EnergyPolicy(true, true, 10, 60, 0)
                .evaluate(new ClusterSnapshot(61, List.of(woken)), Set.of()));
    }

    @Test
    void keepsMinimumPoweredHosts() {
        EnergyPolicy keepTwo = new EnergyPolicy(true, true, 10, 0, 2);
        ClusterSnapshot snapshot = new ClusterSnapshot(100, List.of(
                idle(0, 0.0), idle(1, 0.0), idle(2, 0.0),
                Host.builder().id(3).powerState(PowerState.SLEEPING).build()));

        assertEquals(List.of(0), keepTwo.evaluate(snapshot, Set.of()));
    }

    @Test
    void disabledPolicyDoesNothing() {
        EnergyPolicy off = new EnergyPolicy(SchedulerConfig.defaults().withEnergyPolicyEnabled(false));
        ClusterSnapshot snapshot = new ClusterSnapshot(1e6, List.of(
                idle(0, 0.0), Host.builder().id(1).powerState(PowerState.SLEEPING).build()));

        assertEquals(List.of(), off.evaluate(snapshot, Set.of()));
        assertEquals(List.of(), off.planWake(snapshot, 1));
        assertTrue(Double.isNaN(off.nextIdleDeadline(snapshot)));
    }

    @Test
    void planWakeCoversDeficitLowestIdFirst() {
        ClusterSnapshot snapshot = new ClusterSnapshot(0, List.of(
                sleeping(4, 1), sleeping(1, 2), sleeping(2, 1), idle(0, 0.0)));

        assertEquals(List.of(1), policy.planWake(snapshot, 2));
        assertEquals(List.of(1, 2), policy.planWake(snapshot, 3));
        assertEquals(List.of(1, 2, 4), policy.planWake(snapshot, 9));
        assertEquals(List.of(), policy.planWake(snapshot, 0));
        assertEquals(List.of(), new EnergyPolicy(true, false, 100, 50, 0).planWake(snapshot, 2));
    }

    @Test
    void nextIdleDeadline() {
        ClusterSnapshot snapshot = new ClusterSnapshot(120, List.of(
                idle(0, 10.0),
                idle(1, 80.0),
                Host.builder().id(2).idleSince(90.0).lastWokenAt(90.0).build()));

        // host 0 is already past its threshold, host 1 crosses at 180, host 2 at max(190, 140)
        assertEquals(180.0, policy.nextIdleDeadline(snapshot));
    }

    private static Host idle(int id, Double since) {
        return Host.builder().id(id).idleSince(since).build();
    }

    private static Host sleeping(int id, int capacity) {
        return Host.builder().id(id).capacity(capacity).powerState(PowerState.SLEEPING).build();
    }
}
