package wattsched.scheduler.model;

import java.util.Locale;

/**
 * Power posture of a host.
 */
public enum PowerState {
    /** Powered on, no job assigned */
    IDLE,
    /** Powered on and running a job */
    COMPUTING,
    /** Waking up, not allocatable until confirmed IDLE */
    SWITCHING_ON,
    /** Going to sleep */
    SWITCHING_OFF,
    /** Powered down */
    SLEEPING;

    /** Lowercase name used on the wire when no pstate mapping applies */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** True for SWITCHING_ON and SWITCHING_OFF */
    public boolean isTransitional() {
        return this == SWITCHING_ON || this == SWITCHING_OFF;
    }

    /** True while the host draws full power (IDLE or COMPUTING) */
    public boolean isPowered() {
        return this == IDLE || this == COMPUTING;
    }

    public static PowerState fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("power state is required");
        }
        return PowerState.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
