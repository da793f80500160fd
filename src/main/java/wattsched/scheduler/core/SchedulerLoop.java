package wattsched.scheduler.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wattsched.scheduler.cluster.ClusterSnapshot;
import wattsched.scheduler.config.SchedulerConfig;
import wattsched.scheduler.engine.SchedulingPass;
import wattsched.scheduler.exception.ProtocolException;
import wattsched.scheduler.model.Job;
import wattsched.scheduler.model.JobOutcome;
import wattsched.scheduler.model.JobState;
import wattsched.scheduler.protocol.Decision;
import wattsched.scheduler.protocol.EventBatch;
import wattsched.scheduler.protocol.EventType;
import wattsched.scheduler.protocol.ProtocolTransport;
import wattsched.scheduler.protocol.SchedulerEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Request/reply loop with the simulation backend.
 *
 * Each batch is applied in order, followed by one decision pass; the reply carries every
 * decision for that timestamp. The loop ends after answering SIMULATION_ENDS.
 */
public class SchedulerLoop {

    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    private final ProtocolTransport transport;
    private final SchedulerConfig config;

    private SchedulerContext context;
    private boolean ended = false;
    private boolean queryEnergy = false;

    public SchedulerLoop(ProtocolTransport transport, SchedulerConfig config) {
        this.transport = transport;
        this.config = config;
    }

    /**
     * Serve batches until the simulation ends.
     *
     * @throws wattsched.scheduler.exception.SchedulerException on any fatal error; nothing
     *         more is sent to the backend
     */
    public void run() {
        log.info("Scheduler loop started with {}", config);
        while (!ended) {
            EventBatch batch = transport.receiveBatch();
            List<Decision> decisions = handleBatch(batch);
            transport.sendDecisions(batch.timestamp(), decisions);
        }
        log.info("Simulation over, scheduler loop stopped");
    }

    /**
     * Apply one batch and compute the reply for it.
     */
    public List<Decision> handleBatch(EventBatch batch) {
        if (ended) {
            throw new ProtocolException("batch at " + batch.timestamp() + " after SIMULATION_ENDS");
        }
        double now = batch.timestamp();
        if (context == null && batch.events().isEmpty()) {
            throw new ProtocolException("empty batch before SIMULATION_BEGINS");
        }
        if (batch.events().size() > 1
                && batch.events().stream().anyMatch(e -> e.type() == EventType.SIMULATION_BEGINS)) {
            throw new ProtocolException("SIMULATION_BEGINS must arrive alone, got " + batch.events().size() + " events");
        }

        for (SchedulerEvent event : batch.events()) {
            apply(event);
        }
        if (ended) {
            summarize(now);
            return List.of();
        }
        SchedulingPass pass = context.engine().runPass(now);
        List<Decision> decisions = new ArrayList<>(pass.decisions());

        if (queryEnergy && context.energyMonitor().enabled()) {
            decisions.add(new Decision.QueryConsumedEnergy());
        }
        queryEnergy = false;

        requestCallback(now, pass).ifPresent(decisions::add);

        ClusterSnapshot snapshot = context.cluster().snapshot(now);
        context.recorder().maybeRecord(snapshot, context.queue().runningCount(),
                context.queue().pendingCount(), context.energyMonitor().power());

        log.debug("Reply at {}: {} decisions", now, decisions.size());
        return decisions;
    }

    private void apply(SchedulerEvent event) {
        if (event instanceof SchedulerEvent.SimulationBegins begins) {
            if (context != null) {
                throw new ProtocolException("SIMULATION_BEGINS received twice");
            }
            context = SchedulerContext.begin(config, begins.hosts(), begins.timestamp());
            queryEnergy = true;
            log.info("Simulation begins at {} with {} hosts", begins.timestamp(), begins.hosts().size());
            return;
        }
        if (context == null) {
            throw new ProtocolException(event.type() + " before SIMULATION_BEGINS");
        }

        switch (event.type()) {
            case JOB_SUBMITTED -> context.queue().admit(((SchedulerEvent.JobSubmitted) event).job());
            case JOB_COMPLETED -> {
                SchedulerEvent.JobCompleted completed = (SchedulerEvent.JobCompleted) event;
                if (isRunning(completed.jobId())) {
                    context.cluster().applyEvent(completed);
                    context.queue().markCompleted(completed.jobId(), completed.outcome(), completed.timestamp());
                }
            }
            case JOB_KILLED -> {
                SchedulerEvent.JobKilled killed = (SchedulerEvent.JobKilled) event;
                List<String> live = killed.jobIds().stream().filter(this::isRunning).toList();
                context.cluster().applyEvent(killed);
                for (String jobId : live) {
                    context.queue().markCompleted(jobId, JobOutcome.COMPLETED_KILLED, killed.timestamp());
                }
            }
            case RESOURCE_STATE_CHANGED -> context.cluster().applyEvent(event);
            case REQUESTED_CALL -> {
                context.pendingCallbacks().headSet(event.timestamp(), true).clear();
                queryEnergy = true;
            }
            case NOTIFY -> {
                SchedulerEvent.Notify notify = (SchedulerEvent.Notify) event;
                if (notify.noMoreJobs()) {
                    context.markWorkloadExhausted();
                    log.info("Workload exhausted at {}", notify.timestamp());
                } else {
                    log.debug("Ignoring notification {}", notify.kind());
                }
            }
            case ANSWER -> {
                SchedulerEvent.EnergyAnswer answer = (SchedulerEvent.EnergyAnswer) event;
                context.energyMonitor().onAnswer(answer.timestamp(), answer.consumedEnergy());
            }
            case SIMULATION_ENDS -> ended = true;
            default -> throw new ProtocolException("unexpected event " + event.type());
        }
    }

    /**
     * True if the job is running. A job that already finished is ignored; a pending or
     * unknown one cannot finish and is a protocol error.
     */
    private boolean isRunning(String jobId) {
        Optional<Job> live = context.queue().find(jobId);
        if (live.isPresent()) {
            if (live.get().state() != JobState.RUNNING) {
                throw new ProtocolException("job " + jobId + " finished without having started");
            }
            return true;
        }
        if (context.queue().archived(jobId).isPresent()) {
            log.info("Ignoring repeated termination of job {}", jobId);
            return false;
        }
        throw new ProtocolException("termination of unknown job " + jobId);
    }

    /**
     * Ask to be called back at the earliest time something will change without a backend
     * event, unless an earlier callback is already outstanding.
     */
    private Optional<Decision> requestCallback(double now, SchedulingPass pass) {
        if (context.isFinished()) {
            return Optional.empty();
        }
        double at = Double.NaN;
        if (pass.hasDeferredWake()) {
            at = pass.deferredWakeAt();
        }
        at = earliest(at, context.energyPolicy().nextIdleDeadline(context.cluster().snapshot(now)));
        if (context.energyMonitor().enabled() && config.recordInterval() > 0 && !context.queue().isDrained()) {
            at = earliest(at, now + config.recordInterval());
        }

        if (Double.isNaN(at) || at <= now) {
            return Optional.empty();
        }
        Double outstanding = context.pendingCallbacks().floor(at);
        if (outstanding != null) {
            return Optional.empty();
        }
        context.pendingCallbacks().add(at);
        log.debug("Callback requested at {}", at);
        return Optional.of(new Decision.CallMeLater(at));
    }

    private static double earliest(double a, double b) {
        if (Double.isNaN(a)) {
            return b;
        }
        if (Double.isNaN(b)) {
            return a;
        }
        return Math.min(a, b);
    }

    private void summarize(double now) {
        ClusterSnapshot snapshot = context.cluster().snapshot(now);
        context.recorder().record(snapshot, context.queue().runningCount(),
                context.queue().pendingCount(), context.energyMonitor().power());
        log.info("Simulation ends at {} after {} s: {} completed, {} rejected, {} still pending, {} J consumed",
                now, now - context.startedAt(), context.queue().completedCount(), context.queue().rejectedCount(),
                context.queue().pendingCount(), context.energyMonitor().consumedEnergy());
    }

    /** Context of the current run, null before SIMULATION_BEGINS */
    public SchedulerContext context() {
        return context;
    }

    public boolean ended() {
        return ended;
    }
}
