package wattsched.scheduler.core;

import org.junit.jupiter.api.Test;
import wattsched.scheduler.cluster.ClusterSnapshot;
import wattsched.scheduler.model.Host;
import wattsched.scheduler.model.PowerState;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SystemStateRecorderTest {

    private static ClusterSnapshot snapshot(double now) {
        return new ClusterSnapshot(now, List.of(
                Host.builder().id(0).capacity(2).powerState(PowerState.COMPUTING).currentJobId("j").build(),
                Host.builder().id(1).capacity(2).idleSince(0.0).build(),
                Host.builder().id(2).powerState(PowerState.SLEEPING).build()));
    }

    @Test
    void samplesAtMostOncePerInterval() {
        SystemStateRecorder recorder = new SystemStateRecorder(60, 100);

        assertTrue(recorder.maybeRecord(snapshot(0), 1, 3, 0));
        assertFalse(recorder.maybeRecord(snapshot(59), 1, 3, 0));
        assertTrue(recorder.maybeRecord(snapshot(60), 1, 2, 0));

        assertEquals(2, recorder.samples().size());
        assertEquals(60.0, recorder.samples().get(1).time());
        assertEquals(2, recorder.samples().get(1).waitingJobs());
    }

    @Test
    void computesUtilizationAndStateCounts() {
        SystemStateRecorder recorder = new SystemStateRecorder(0, 10);

        SystemStateSample sample = recorder.record(snapshot(10), 1, 0, 420.0);

        assertEquals(0.4, sample.utilization(), 1e-9);
        assertEquals(1, sample.hosts(PowerState.IDLE));
        assertEquals(1, sample.hosts(PowerState.SLEEPING));
        assertEquals(0, sample.hosts(PowerState.SWITCHING_ON));
        assertEquals(420.0, sample.power());
    }

    @Test
    void keepsOnlyLatestSamples() {
        SystemStateRecorder recorder = new SystemStateRecorder(0, 3);
        for (int t = 0; t < 5; t++) {
            recorder.maybeRecord(snapshot(t), 0, 0, 0);
        }

        List<SystemStateSample> samples = recorder.samples();
        assertEquals(3, samples.size());
        assertEquals(2.0, samples.get(0).time());
        assertEquals(4.0, samples.get(2).time());
    }
}
