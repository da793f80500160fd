package wattsched.scheduler.config;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class IniLoaderTest {

    @Test
    void loadsTestConfiguration() throws Exception {
        SchedulerConfig cfg;
        try (InputStream in = getClass().getResourceAsStream("/scheduler-test.ini")) {
            assertNotNull(in, "scheduler-test.ini must be on the test classpath");
            cfg = IniLoader.load(in);
        }

        assertEquals(29123, cfg.port());
        assertEquals(8, cfg.backfillWindow());
        assertEquals(300.0, cfg.idleThreshold());
        assertEquals(120.0, cfg.wakeCooldown());
        assertEquals(20.0, cfg.switchOnLatency());
        assertEquals(2, cfg.minPoweredHosts());
        assertFalse(cfg.allowWake());
        assertEquals("0", cfg.pstateOn());
        assertEquals("13", cfg.pstateSleep());
        assertTrue(cfg.energyMonitoring());
        assertEquals(0.0, cfg.recordInterval());
    }

    @Test
    void missingSectionsKeepDefaults() throws Exception {
        SchedulerConfig cfg = load("""
                [SCHEDULER]
                backfill_window = 3
                """);

        SchedulerConfig defaults = SchedulerConfig.defaults();
        assertEquals(3, cfg.backfillWindow());
        assertEquals(defaults.port(), cfg.port());
        assertEquals(defaults.idleThreshold(), cfg.idleThreshold());
        assertEquals(defaults.pstateOn(), cfg.pstateOn());
    }

    @Test
    void bundledDefaultsMatchCodeDefaults() throws Exception {
        SchedulerConfig bundled = IniLoader.loadDefaults();
        SchedulerConfig defaults = SchedulerConfig.defaults();

        assertEquals(defaults.port(), bundled.port());
        assertEquals(defaults.idleThreshold(), bundled.idleThreshold());
        assertEquals(defaults.switchOnLatency(), bundled.switchOnLatency());
        assertEquals(defaults.backfillWindow(), bundled.backfillWindow());
    }

    @Test
    void invalidValuesAreReported() {
        assertThrows(IOException.class, () -> load("""
                [ENERGY]
                idle_threshold = soon
                """));
        assertThrows(IOException.class, () -> load("""
                [PROTOCOL]
                pstate_on = 0
                pstate_sleep = 0
                """));
        assertThrows(IOException.class, () -> load("""
                [SCHEDULER]
                backfill_window = 0
                """));
    }

    @Test
    void fluentSettersValidate() {
        assertThrows(IllegalArgumentException.class, () -> SchedulerConfig.defaults().withIdleThreshold(-1));
        assertEquals(0, SchedulerConfig.defaults().withMinPoweredHosts(-4).minPoweredHosts());
    }

    private static SchedulerConfig load(String ini) throws IOException {
        return IniLoader.load(new ByteArrayInputStream(ini.getBytes(StandardCharsets.UTF_8)));
    }
}
