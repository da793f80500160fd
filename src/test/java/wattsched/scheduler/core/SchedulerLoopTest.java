package wattsched.scheduler.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import wattsched.scheduler.config.SchedulerConfig;
import wattsched.scheduler.exception.ProtocolException;
import wattsched.scheduler.model.Host;
import wattsched.scheduler.model.Job;
import wattsched.scheduler.model.JobState;
import wattsched.scheduler.model.PowerState;
import wattsched.scheduler.protocol.Decision;
import wattsched.scheduler.protocol.EventBatch;
import wattsched.scheduler.protocol.SchedulerEvent;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static wattsched.scheduler.core.ScriptedBackend.*;

class SchedulerLoopTest {

    private static SchedulerConfig config() {
        return SchedulerConfig.defaults()
                .withIdleThreshold(100)
                .withWakeCooldown(600)
                .withSwitchOnLatency(20)
                .withSwitchOffLatency(30)
                .withRecordInterval(0);
    }

    @Test
    @DisplayName("Scenario C: idle host sleeps, is woken for a job, then runs it")
    void scenarioC() {
        ScriptedBackend backend = new ScriptedBackend()
                .then(0, begins(0, 1))
                .then(100, call(100))
                .then(130, stateChanged(130, PowerState.SLEEPING, 0))
                .then(200, submit(200, "J", 1, 50))
                .then(220, stateChanged(220, PowerState.IDLE, 0))
                .then(270, completed(270, "J"))
                .then(370, call(370))
                .then(400, ends(400));

        SchedulerLoop loop = new SchedulerLoop(backend, config());
        loop.run();

        // 1. Idle detection is scheduled right away
        assertEquals(List.of(new Decision.CallMeLater(100)), backend.replyAt(0));

        // 2. The callback finds the host idle past the threshold
        assertEquals(List.of(new Decision.SetResourceState(List.of(0), PowerState.SLEEPING)), backend.replyAt(100));
        assertEquals(List.of(), backend.replyAt(130));

        // 3. The job needs the sleeping host: wake first, no allocation yet
        assertEquals(List.of(new Decision.SetResourceState(List.of(0), PowerState.IDLE)), backend.replyAt(200));

        // 4. Once confirmed, the job runs and the host is not put back to sleep
        assertEquals(List.of(new Decision.ExecuteJob("J", List.of(0))), backend.replyAt(220));

        // 5. After the job, a new idle period starts
        assertEquals(List.of(new Decision.CallMeLater(370)), backend.replyAt(270));
        assertEquals(List.of(new Decision.SetResourceState(List.of(0), PowerState.SLEEPING)), backend.replyAt(370));

        // 6. The end is acknowledged with an empty reply
        assertEquals(List.of(), backend.replyAt(400));
        assertTrue(loop.ended());
        assertEquals(JobState.COMPLETED, loop.context().queue().archived("J").orElseThrow().state());
        assertEquals(8, backend.replies().size());
    }

    @Test
    void jobEventBeforeBeginIsFatal() {
        ScriptedBackend backend = new ScriptedBackend()
                .then(0, submit(0, "J", 1, 10), begins(0, 2));

        SchedulerLoop loop = new SchedulerLoop(backend, config());

        assertThrows(ProtocolException.class, loop::run);
        assertTrue(backend.replies().isEmpty());
    }

    @Test
    void beginTwiceIsFatal() {
        SchedulerLoop loop = new SchedulerLoop(new ScriptedBackend(), config());
        loop.handleBatch(new EventBatch(0, List.of(begins(0, 1))));

        assertThrows(ProtocolException.class,
                () -> loop.handleBatch(new EventBatch(5, List.of(begins(5, 1)))));
    }

    @Test
    void emptyFirstBatchIsFatal() {
        SchedulerLoop loop = new SchedulerLoop(new ScriptedBackend(), config());
        assertThrows(ProtocolException.class, () -> loop.handleBatch(new EventBatch(0, List.of())));
    }

    @Test
    @DisplayName("SIMULATION_BEGINS must be answered before any job event")
    void beginMustArriveAlone() {
        SchedulerLoop loop = new SchedulerLoop(new ScriptedBackend(), config());

        assertThrows(ProtocolException.class,
                () -> loop.handleBatch(new EventBatch(0, List.of(begins(0, 2), submit(0, "J", 1, 10)))));
        assertNull(loop.context());
    }

    @Test
    void nothingIsAcceptedAfterTheEnd() {
        SchedulerLoop loop = new SchedulerLoop(new ScriptedBackend(), config());
        loop.handleBatch(new EventBatch(0, List.of(begins(0, 1))));

        assertEquals(List.of(), loop.handleBatch(new EventBatch(10, List.of(submit(10, "J", 1, 5), ends(10)))));
        assertThrows(ProtocolException.class, () -> loop.handleBatch(new EventBatch(20, List.of(call(20)))));
    }

    @Test
    void backendDisconnectStopsTheLoop() {
        ScriptedBackend backend = new ScriptedBackend().then(0, begins(0, 1));
        SchedulerLoop loop = new SchedulerLoop(backend, config());

        assertThrows(ProtocolException.class, loop::run);
        assertEquals(1, backend.replies().size());
    }

    @Test
    @DisplayName("No callback while an earlier one is outstanding")
    void callbacksAreNotDuplicated() {
        SchedulerLoop loop = new SchedulerLoop(new ScriptedBackend(), config());

        assertEquals(List.of(new Decision.CallMeLater(100)),
                loop.handleBatch(new EventBatch(0, List.of(begins(0, 2)))));
        assertEquals(List.of(new Decision.ExecuteJob("J", List.of(0))),
                loop.handleBatch(new EventBatch(10, List.of(submit(10, "J", 1, 5)))));
        assertEquals(List.of(),
                loop.handleBatch(new EventBatch(15, List.of(completed(15, "J")))));

        // host 1 crossed the threshold; host 0 will at 115
        assertEquals(List.of(
                        new Decision.SetResourceState(List.of(1), PowerState.SLEEPING),
                        new Decision.CallMeLater(115)),
                loop.handleBatch(new EventBatch(100, List.of(call(100)))));
        assertEquals(List.of(115.0), List.copyOf(loop.context().pendingCallbacks()));
    }

    @Test
    void noCallbacksOnceWorkloadIsDone() {
        SchedulerLoop loop = new SchedulerLoop(new ScriptedBackend(), config());
        loop.handleBatch(new EventBatch(0, List.of(begins(0, 2))));

        List<Decision> reply = loop.handleBatch(new EventBatch(0, List.of(noMoreJobs(0))));

        assertEquals(List.of(), reply);
        assertTrue(loop.context().isFinished());
    }

    @Test
    void infeasibleJobIsRejected() {
        SchedulerLoop loop = new SchedulerLoop(new ScriptedBackend(), config());
        loop.handleBatch(new EventBatch(0, List.of(begins(0, 4))));
        loop.handleBatch(new EventBatch(0, List.of(noMoreJobs(0))));

        List<Decision> reply = loop.handleBatch(new EventBatch(1, List.of(submit(1, "big", 10, 100))));

        assertEquals(1, reply.size());
        assertInstanceOf(Decision.RejectJob.class, reply.get(0));
        assertEquals(1, loop.context().queue().rejectedCount());
    }

    @Test
    void terminationOfUnknownJobIsFatal() {
        SchedulerLoop loop = new SchedulerLoop(new ScriptedBackend(), config());
        loop.handleBatch(new EventBatch(0, List.of(begins(0, 1))));

        assertThrows(ProtocolException.class,
                () -> loop.handleBatch(new EventBatch(1, List.of(completed(1, "ghost")))));
    }

    @Test
    void repeatedTerminationIsIgnored() {
        SchedulerLoop loop = new SchedulerLoop(new ScriptedBackend(), config());
        loop.handleBatch(new EventBatch(0, List.of(begins(0, 1))));
        loop.handleBatch(new EventBatch(1, List.of(submit(1, "J", 1, 10))));
        loop.handleBatch(new EventBatch(5, List.of(completed(5, "J"))));

        assertDoesNotThrow(() -> loop.handleBatch(new EventBatch(6,
                List.of(new SchedulerEvent.JobKilled(6, List.of("J"))))));
        assertEquals(1, loop.context().queue().completedCount());
    }

    @Test
    void pendingJobCannotComplete() {
        SchedulerLoop loop = new SchedulerLoop(new ScriptedBackend(), config());
        loop.handleBatch(new EventBatch(0, List.of(begins(0, 1))));
        loop.handleBatch(new EventBatch(1, List.of(submit(1, "A", 1, 1000))));
        loop.handleBatch(new EventBatch(2, List.of(submit(2, "B", 1, 10))));

        assertThrows(ProtocolException.class,
                () -> loop.handleBatch(new EventBatch(3, List.of(completed(3, "B")))));
    }

    @Test
    @DisplayName("Energy is queried at start and on callbacks, answers update the monitor")
    void energyMonitoring() {
        SchedulerConfig cfg = config().withEnergyMonitoring(true).withRecordInterval(60);
        SchedulerLoop loop = new SchedulerLoop(new ScriptedBackend(), cfg);

        List<Decision> first = loop.handleBatch(new EventBatch(0, List.of(begins(0, 2))));
        assertTrue(first.contains(new Decision.QueryConsumedEnergy()));

        List<Decision> withJob = loop.handleBatch(new EventBatch(10, List.of(
                new SchedulerEvent.EnergyAnswer(10, 0),
                submit(10, "J", 1, 500))));
        assertFalse(withJob.contains(new Decision.QueryConsumedEnergy()));
        // the monitoring tick at 70 comes before idle detection at 100
        assertTrue(withJob.contains(new Decision.CallMeLater(70)));

        List<Decision> onCall = loop.handleBatch(new EventBatch(70, List.of(
                call(70),
                new SchedulerEvent.EnergyAnswer(70, 6000))));
        assertTrue(onCall.contains(new Decision.QueryConsumedEnergy()));
        assertEquals(100.0, loop.context().energyMonitor().power(), 1e-9);
    }

    @Test
    void recordsSystemState() {
        SchedulerLoop loop = new SchedulerLoop(new ScriptedBackend(), config());
        loop.handleBatch(new EventBatch(0, List.of(begins(0, 2))));
        loop.handleBatch(new EventBatch(5, List.of(submit(5, "J", 1, 100))));

        List<SystemStateSample> samples = loop.context().recorder().samples();
        assertEquals(2, samples.size());
        SystemStateSample last = samples.get(1);
        assertEquals(1, last.runningJobs());
        assertEquals(1, last.hosts(PowerState.COMPUTING));
        assertEquals(0.5, last.utilization(), 1e-9);
    }

    @Test
    void topologyWithSleepingHostsIsTracked() {
        SchedulerLoop loop = new SchedulerLoop(new ScriptedBackend(), config());
        loop.handleBatch(new EventBatch(0, List.of(new SchedulerEvent.SimulationBegins(0, List.of(
                Host.builder().id(0).idleSince(0.0).build(),
                Host.builder().id(1).powerState(PowerState.SLEEPING).build())))));

        assertEquals(1, loop.context().cluster().count(PowerState.SLEEPING));
        assertEquals(2, loop.context().cluster().totalCapacity());
    }

    @Test
    @DisplayName("Replaying the same batches gives the same replies and the same final state")
    void replayIsDeterministic() {
        ScriptedBackend first = replayScript();
        ScriptedBackend second = replayScript();
        SchedulerLoop a = new SchedulerLoop(first, config());
        SchedulerLoop b = new SchedulerLoop(second, config());

        // 1. Run both loops over identical scripts
        a.run();
        b.run();

        // 2. Every reply matches
        assertEquals(first.replies(), second.replies());

        // 3. Hosts and jobs end in the same states
        assertEquals(hostStates(a), hostStates(b));
        for (String id : List.of("A", "B", "C", "huge")) {
            assertEquals(a.context().queue().archived(id).map(Job::state),
                    b.context().queue().archived(id).map(Job::state));
        }
        assertEquals(a.context().queue().completedCount(), b.context().queue().completedCount());
        assertEquals(a.context().queue().rejectedCount(), b.context().queue().rejectedCount());
        assertEquals(List.copyOf(a.context().pendingCallbacks()), List.copyOf(b.context().pendingCallbacks()));
    }

    private static ScriptedBackend replayScript() {
        return new ScriptedBackend()
                .then(0, begins(0, 3))
                .then(5, submit(5, "A", 2, 50), submit(5, "B", 2, 30), submit(5, "huge", 9, 10))
                .then(20, submit(20, "C", 1, 10))
                .then(30, completed(30, "C"))
                .then(55, completed(55, "A"))
                .then(85, completed(85, "B"), noMoreJobs(85))
                .then(185, call(185))
                .then(215, stateChanged(215, PowerState.SLEEPING, 0, 1, 2))
                .then(300, ends(300));
    }

    private static List<String> hostStates(SchedulerLoop loop) {
        return loop.context().cluster().hosts().stream()
                .map(h -> h.id() + ":" + h.powerState() + ":" + h.currentJobId())
                .toList();
    }
}
