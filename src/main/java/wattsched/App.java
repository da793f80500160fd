package wattsched;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wattsched.scheduler.config.Dependencies;
import wattsched.scheduler.config.IniLoader;
import wattsched.scheduler.config.SchedulerConfig;
import wattsched.scheduler.exception.SchedulerException;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Scheduler entry point.
 *
 * Usage: {@code wattsched [config.ini]}. Without an argument the bundled
 * {@code wattsched.ini} is used; environment variables override both.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * @return process exit status: 0 after a clean simulation end, 1 on fatal errors
     */
    static int run(String[] args) {
        SchedulerConfig config;
        try {
            config = args.length > 0 ? IniLoader.load(Path.of(args[0])) : IniLoader.loadDefaults();
            config.applyEnv();
        } catch (IOException | IllegalArgumentException e) {
            log.error("Cannot load configuration: {}", e.getMessage());
            return 1;
        }

        try (Dependencies deps = Dependencies.create(config)) {
            deps.schedulerLoop().run();
            return 0;
        } catch (SchedulerException e) {
            log.error("Scheduler stopped on fatal error", e);
            return 1;
        } catch (Exception e) {
            // bind failures surface from Netty as undeclared checked exceptions
            log.error("Scheduler failed", e);
            return 1;
        }
    }
}
