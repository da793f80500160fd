package wattsched.scheduler.config;

/**
 * Configuration holder for scheduler settings.
 * All settings have sensible defaults; times are simulated seconds.
 */
public final class SchedulerConfig {

    // Transport settings
    private String host = "127.0.0.1";
    private int port = 28000;
    private int maxFrameBytes = 16 * 1024 * 1024;

    // Scheduling settings
    private int backfillWindow = 64;

    // Energy policy settings
    private boolean energyPolicyEnabled = true;
    private double idleThreshold = 1800;
    private double wakeCooldown = 600;
    private double switchOnLatency = 150;
    private double switchOffLatency = 60;
    private int minPoweredHosts = 0;
    private boolean allowWake = true;

    // Protocol settings
    private String pstateOn = "idle";
    private String pstateSleep = "sleeping";

    // Monitoring settings
    private boolean energyMonitoring = false;
    private double recordInterval = 60;
    private int maxSamples = 10_000;

    private SchedulerConfig() {
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig();
    }

    public static SchedulerConfig fromEnv() {
        return defaults().applyEnv();
    }

    /**
     * Override settings from environment variables.
     */
    public SchedulerConfig applyEnv() {
        String host = System.getenv("WATTSCHED_HOST");
        if (host != null && !host.isBlank()) {
            this.host = host;
        }

        String port = System.getenv("WATTSCHED_PORT");
        if (port != null && !port.isBlank()) {
            this.port = Integer.parseInt(port.trim());
        }

        String idle = System.getenv("WATTSCHED_IDLE_THRESHOLD");
        if (idle != null && !idle.isBlank()) {
            this.idleThreshold = Double.parseDouble(idle.trim());
        }

        String energy = System.getenv("WATTSCHED_ENERGY_MONITORING");
        if (energy != null && !energy.isBlank()) {
            this.energyMonitoring = Boolean.parseBoolean(energy.trim());
        }

        return this;
    }

    // Getters
    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public int maxFrameBytes() {
        return maxFrameBytes;
    }

    public int backfillWindow() {
        return backfillWindow;
    }

    public boolean energyPolicyEnabled() {
        return energyPolicyEnabled;
    }

    public double idleThreshold() {
        return idleThreshold;
    }

    public double wakeCooldown() {
        return wakeCooldown;
    }

    public double switchOnLatency() {
        return switchOnLatency;
    }

    public double switchOffLatency() {
        return switchOffLatency;
    }

    public int minPoweredHosts() {
        return minPoweredHosts;
    }

    public boolean allowWake() {
        return allowWake;
    }

    public String pstateOn() {
        return pstateOn;
    }

    public String pstateSleep() {
        return pstateSleep;
    }

    public boolean energyMonitoring() {
        return energyMonitoring;
    }

    public double recordInterval() {
        return recordInterval;
    }

    public int maxSamples() {
        return maxSamples;
    }

    // Fluent setters for testing/customization
    public SchedulerConfig withHost(String host) {
        this.host = host;
        return this;
    }

    public SchedulerConfig withPort(int port) {
        this.port = port;
        return this;
    }

    public SchedulerConfig withMaxFrameBytes(int maxFrameBytes) {
        this.maxFrameBytes = maxFrameBytes;
        return this;
    }

    public SchedulerConfig withBackfillWindow(int backfillWindow) {
        if (backfillWindow < 1) {
            throw new IllegalArgumentException("backfill window must be positive");
        }
        this.backfillWindow = backfillWindow;
        return this;
    }

    public SchedulerConfig withEnergyPolicyEnabled(boolean enabled) {
        this.energyPolicyEnabled = enabled;
        return this;
    }

    public SchedulerConfig withIdleThreshold(double seconds) {
        this.idleThreshold = requireNonNegative("idle threshold", seconds);
        return this;
    }

    public SchedulerConfig withWakeCooldown(double seconds) {
        this.wakeCooldown = requireNonNegative("wake cooldown", seconds);
        return this;
    }

    public SchedulerConfig withSwitchOnLatency(double seconds) {
        this.switchOnLatency = requireNonNegative("switch-on latency", seconds);
        return this;
    }

    public SchedulerConfig withSwitchOffLatency(double seconds) {
        this.switchOffLatency = requireNonNegative("switch-off latency", seconds);
        return this;
    }

    public SchedulerConfig withMinPoweredHosts(int hosts) {
        this.minPoweredHosts = Math.max(0, hosts);
        return this;
    }

    public SchedulerConfig withAllowWake(boolean allowWake) {
        this.allowWake = allowWake;
        return this;
    }

    public SchedulerConfig withPstates(String on, String sleep) {
        if (on == null || sleep == null || on.equals(sleep)) {
            throw new IllegalArgumentException("pstates for on and sleep must be distinct");
        }
        this.pstateOn = on;
        this.pstateSleep = sleep;
        return this;
    }

    public SchedulerConfig withEnergyMonitoring(boolean enabled) {
        this.energyMonitoring = enabled;
        return this;
    }

    public SchedulerConfig withRecordInterval(double seconds) {
        this.recordInterval = requireNonNegative("record interval", seconds);
        return this;
    }

    public SchedulerConfig withMaxSamples(int maxSamples) {
        this.maxSamples = Math.max(1, maxSamples);
        return this;
    }

    private static double requireNonNegative(String what, double value) {
        if (value < 0 || Double.isNaN(value)) {
            throw new IllegalArgumentException(what + " must be >= 0: " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "SchedulerConfig{" +
                "endpoint=" + host + ":" + port +
                ", backfillWindow=" + backfillWindow +
                ", energyPolicy=" + energyPolicyEnabled +
                ", idleThreshold=" + idleThreshold +
                ", wakeCooldown=" + wakeCooldown +
                ", energyMonitoring=" + energyMonitoring +
                '}';
    }
}
