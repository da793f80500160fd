package wattsched.scheduler.protocol;

/**
 * Raw, ordered, blocking frame exchange with the backend.
 */
public interface FrameChannel extends AutoCloseable {

    /**
     * Block until a complete frame arrives.
     *
     * @throws wattsched.scheduler.exception.ProtocolException if the backend disconnected
     */
    byte[] readFrame();

    void writeFrame(byte[] frame);

    @Override
    void close();
}
