package wattsched.scheduler.model;

import java.util.Objects;

/**
 * Immutable domain model of a compute host from the cluster topology.
 */
public final class Host {
    private final int id;
    private final String name;
    private final int capacity;
    private final PowerState powerState;
    private final String currentJobId; // null when no job is assigned
    private final Double transitionDeadline; // estimated end of SWITCHING_ON/OFF
    private final Double idleSince;
    private final Double lastWokenAt; // cleared once the host runs a job

    private Host(Builder builder) {
        this.id = builder.id;
        this.name = builder.name != null ? builder.name : "host" + builder.id;
        this.capacity = builder.capacity;
        this.powerState = Objects.requireNonNull(builder.powerState, "powerState is required");
        this.currentJobId = builder.currentJobId;
        this.transitionDeadline = builder.transitionDeadline;
        this.idleSince = builder.idleSince;
        this.lastWokenAt = builder.lastWokenAt;

        if (id < 0) {
            throw new IllegalArgumentException("host id must be non-negative: " + id);
        }
        if (capacity < 1) {
            throw new IllegalArgumentException("host " + id + " capacity must be positive: " + capacity);
        }
    }

    // Getters
    public int id() {
        return id;
    }

    public String name() {
        return name;
    }

    public int capacity() {
        return capacity;
    }

    public PowerState powerState() {
        return powerState;
    }

    public String currentJobId() {
        return currentJobId;
    }

    public Double transitionDeadline() {
        return transitionDeadline;
    }

    public Double idleSince() {
        return idleSince;
    }

    public Double lastWokenAt() {
        return lastWokenAt;
    }

    /** Powered on, no job, no transition in flight */
    public boolean isAvailable() {
        return powerState == PowerState.IDLE && currentJobId == null;
    }

    public boolean isTransitioning() {
        return powerState.isTransitional();
    }

    /** How long the host has been available, zero if it is not */
    public double idleDuration(double now) {
        if (!isAvailable() || idleSince == null) {
            return 0;
        }
        return Math.max(0, now - idleSince);
    }

    /** Woken recently and has not run a job since */
    public boolean inWakeCooldown(double now, double cooldown) {
        return lastWokenAt != null && now < lastWokenAt + cooldown;
    }

    /** Create a builder from this host (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .capacity(capacity)
                .powerState(powerState)
                .currentJobId(currentJobId)
                .transitionDeadline(transitionDeadline)
                .idleSince(idleSince)
                .lastWokenAt(lastWokenAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int id;
        private String name;
        private int capacity = 1;
        private PowerState powerState = PowerState.IDLE;
        private String currentJobId;
        private Double transitionDeadline;
        private Double idleSince;
        private Double lastWokenAt;

        public Builder id(int id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder powerState(PowerState powerState) {
            this.powerState = powerState;
            return this;
        }

        public Builder currentJobId(String currentJobId) {
            this.currentJobId = currentJobId;
            return this;
        }

        public Builder transitionDeadline(Double transitionDeadline) {
            this.transitionDeadline = transitionDeadline;
            return this;
        }

        public Builder idleSince(Double idleSince) {
            this.idleSince = idleSince;
            return this;
        }

        public Builder lastWokenAt(Double lastWokenAt) {
            this.lastWokenAt = lastWokenAt;
            return this;
        }

        public Host build() {
            return new Host(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Host host))
            return false;
        return id == host.id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return "Host{id=" + id + ", state=" + powerState + ", job=" + currentJobId + "}";
    }
}
