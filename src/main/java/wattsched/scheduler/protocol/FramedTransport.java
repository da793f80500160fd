package wattsched.scheduler.protocol;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wattsched.scheduler.exception.ProtocolException;

import java.util.List;

/**
 * {@link ProtocolTransport} over a {@link FrameChannel}, using {@link ProtocolCodec}
 * for the payloads. Owns the logical-clock handshake: one reply per batch, same
 * timestamp, and batch timestamps that never go backwards.
 */
public final class FramedTransport implements ProtocolTransport {

    private static final Logger log = LoggerFactory.getLogger(FramedTransport.class);

    private final FrameChannel channel;
    private final ProtocolCodec codec;

    private double clock = Double.NaN;
    private boolean awaitingReply = false;
    private long batches = 0;

    public FramedTransport(FrameChannel channel, ProtocolCodec codec) {
        this.channel = channel;
        this.codec = codec;
    }

    @Override
    public EventBatch receiveBatch() {
        if (awaitingReply) {
            throw new ProtocolException("batch at " + clock + " has not been answered yet");
        }

        EventBatch batch = codec.decodeBatch(channel.readFrame());

        if (!Double.isNaN(clock) && batch.timestamp() < clock) {
            throw new ProtocolException("clock went backwards: " + batch.timestamp() + " < " + clock);
        }
        clock = batch.timestamp();
        awaitingReply = true;
        batches++;

        log.debug("Batch #{} at {} with {} events", batches, clock, batch.events().size());
        return batch;
    }

    @Override
    public void sendDecisions(double timestamp, List<Decision> decisions) {
        if (!awaitingReply) {
            throw new ProtocolException("no batch to answer at " + timestamp);
        }
        if (Double.compare(timestamp, clock) != 0) {
            throw new ProtocolException("reply timestamp " + timestamp + " does not match batch " + clock);
        }

        channel.writeFrame(codec.encodeReply(timestamp, decisions));
        awaitingReply = false;

        log.debug("Replied at {} with {} decisions", timestamp, decisions.size());
    }

    @Override
    public double clock() {
        return clock;
    }

    /** Number of batches received so far */
    public long batches() {
        return batches;
    }

    @Override
    public void close() {
        channel.close();
    }
}
