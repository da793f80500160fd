package wattsched.scheduler.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads scheduler settings from an INI file.
 * Supports sections [TRANSPORT], [SCHEDULER], [ENERGY], [PROTOCOL], [MONITORING];
 * every section and key is optional and falls back to {@link SchedulerConfig#defaults()}.
 */
public final class IniLoader {

    /** Bundled defaults on the classpath */
    public static final String DEFAULT_RESOURCE = "/wattsched.ini";

    private IniLoader() {
    }

    public static SchedulerConfig load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        }
    }

    /** Load the bundled {@code wattsched.ini}, or plain defaults if it is missing */
    public static SchedulerConfig loadDefaults() throws IOException {
        try (InputStream in = IniLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            return in == null ? SchedulerConfig.defaults() : load(in);
        }
    }

    public static SchedulerConfig load(InputStream in) throws IOException {
        Ini ini = new Ini(in);
        SchedulerConfig cfg = SchedulerConfig.defaults();

        try {
            // TRANSPORT
            Profile.Section transport = ini.get("TRANSPORT");
            String host = opt(transport, "host");
            if (host != null) cfg.withHost(host);
            Integer port = optInt(transport, "port");
            if (port != null) cfg.withPort(port);
            Integer maxFrame = optInt(transport, "max_frame_bytes");
            if (maxFrame != null) cfg.withMaxFrameBytes(maxFrame);

            // SCHEDULER
            Profile.Section scheduler = ini.get("SCHEDULER");
            Integer window = optInt(scheduler, "backfill_window");
            if (window != null) cfg.withBackfillWindow(window);

            // ENERGY
            Profile.Section energy = ini.get("ENERGY");
            String enabled = opt(energy, "enabled");
            if (enabled != null) cfg.withEnergyPolicyEnabled(Boolean.parseBoolean(enabled));
            Double idle = optDouble(energy, "idle_threshold");
            if (idle != null) cfg.withIdleThreshold(idle);
            Double cooldown = optDouble(energy, "wake_cooldown");
            if (cooldown != null) cfg.withWakeCooldown(cooldown);
            Double on = optDouble(energy, "switch_on_latency");
            if (on != null) cfg.withSwitchOnLatency(on);
            Double off = optDouble(energy, "switch_off_latency");
            if (off != null) cfg.withSwitchOffLatency(off);
            Integer minPowered = optInt(energy, "min_powered_hosts");
            if (minPowered != null) cfg.withMinPoweredHosts(minPowered);
            String allowWake = opt(energy, "allow_wake");
            if (allowWake != null) cfg.withAllowWake(Boolean.parseBoolean(allowWake));

            // PROTOCOL
            Profile.Section protocol = ini.get("PROTOCOL");
            String pstateOn = opt(protocol, "pstate_on");
            String pstateSleep = opt(protocol, "pstate_sleep");
            if (pstateOn != null || pstateSleep != null) {
                cfg.withPstates(pstateOn != null ? pstateOn : cfg.pstateOn(),
                        pstateSleep != null ? pstateSleep : cfg.pstateSleep());
            }

            // MONITORING
            Profile.Section monitoring = ini.get("MONITORING");
            String energyMonitoring = opt(monitoring, "energy");
            if (energyMonitoring != null) cfg.withEnergyMonitoring(Boolean.parseBoolean(energyMonitoring));
            Double record = optDouble(monitoring, "record_interval");
            if (record != null) cfg.withRecordInterval(record);
            Integer maxSamples = optInt(monitoring, "max_samples");
            if (maxSamples != null) cfg.withMaxSamples(maxSamples);
        } catch (IllegalArgumentException e) {
            throw new IOException("invalid scheduler configuration: " + e.getMessage(), e);
        }

        return cfg;
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        if (s == null) return null;
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static Integer optInt(Profile.Section s, String key) {
        String v = opt(s, key);
        return v == null ? null : Integer.valueOf(v);
    }

    private static Double optDouble(Profile.Section s, String key) {
        String v = opt(s, key);
        return v == null ? null : Double.valueOf(v);
    }
}
