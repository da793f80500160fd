package wattsched.scheduler.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wattsched.scheduler.core.SchedulerLoop;
import wattsched.scheduler.protocol.FrameChannel;
import wattsched.scheduler.protocol.FramedTransport;
import wattsched.scheduler.protocol.ProtocolCodec;
import wattsched.scheduler.protocol.ProtocolTransport;
import wattsched.scheduler.server.NettyFrameChannel;

/**
 * Manual dependency injection container.
 * Creates and wires the transport and the scheduler loop.
 *
 * Usage:
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(SchedulerConfig.fromEnv())) {
 *     deps.schedulerLoop().run();
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final SchedulerConfig config;
    private final ProtocolCodec codec;
    private final FrameChannel channel;
    private final ProtocolTransport transport;
    private final SchedulerLoop schedulerLoop;

    private Dependencies(SchedulerConfig config, FrameChannel channel) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        this.codec = new ProtocolCodec(config.pstateOn(), config.pstateSleep());
        this.channel = channel;
        this.transport = new FramedTransport(channel, codec);
        this.schedulerLoop = new SchedulerLoop(transport, config);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config, listening for the backend on the
     * configured endpoint.
     */
    public static Dependencies create(SchedulerConfig config) {
        return new Dependencies(config,
                NettyFrameChannel.bind(config.host(), config.port(), config.maxFrameBytes()));
    }

    /**
     * Create dependencies over an existing frame channel.
     */
    public static Dependencies create(SchedulerConfig config, FrameChannel channel) {
        return new Dependencies(config, channel);
    }

    // Getters
    public SchedulerConfig config() {
        return config;
    }

    public ProtocolCodec codec() {
        return codec;
    }

    public ProtocolTransport transport() {
        return transport;
    }

    public SchedulerLoop schedulerLoop() {
        return schedulerLoop;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");
        try {
            transport.close();
        } catch (RuntimeException e) {
            log.warn("Error closing transport: {}", e.getMessage());
        }
        log.info("Dependencies closed");
    }
}
