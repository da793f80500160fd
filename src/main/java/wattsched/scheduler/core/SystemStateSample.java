package wattsched.scheduler.core;

import wattsched.scheduler.model.PowerState;

import java.util.Map;

/**
 * One point-in-time record of the system.
 *
 * @param utilization computing capacity over total capacity
 * @param power       average watts from the energy monitor, 0 when unknown
 */
public record SystemStateSample(double time,
                                int runningJobs,
                                int waitingJobs,
                                Map<PowerState, Integer> hostsByState,
                                double utilization,
                                double power) {

    public SystemStateSample {
        hostsByState = Map.copyOf(hostsByState);
    }

    public int hosts(PowerState state) {
        return hostsByState.getOrDefault(state, 0);
    }
}
