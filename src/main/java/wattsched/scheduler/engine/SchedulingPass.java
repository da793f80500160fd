package wattsched.scheduler.engine;

import wattsched.scheduler.protocol.Decision;

import java.util.List;

/**
 * Outcome of one decision pass.
 *
 * @param decisions     decisions in reply order
 * @param reservation   head-job reservation, null when no job is blocked
 * @param deferredWakeAt time at which reserved sleeping hosts should be woken, NaN if none
 */
public record SchedulingPass(List<Decision> decisions, Reservation reservation, double deferredWakeAt) {

    public SchedulingPass {
        decisions = List.copyOf(decisions);
    }

    public boolean hasDeferredWake() {
        return !Double.isNaN(deferredWakeAt);
    }
}
