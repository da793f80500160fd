package wattsched.scheduler.protocol;

import java.util.List;

/**
 * Request/reply exchange with the simulation backend.
 *
 * Every batch returned by {@link #receiveBatch()} must be answered by exactly one
 * {@link #sendDecisions(double, List)} call carrying the batch's timestamp before
 * the next batch is requested.
 */
public interface ProtocolTransport extends AutoCloseable {

    /**
     * Block until the backend sends the next batch.
     *
     * @throws wattsched.scheduler.exception.ProtocolException on malformed data,
     *         ordering violations or disconnect
     */
    EventBatch receiveBatch();

    /**
     * Reply to the current batch.
     *
     * @param timestamp the timestamp of the batch being answered
     * @param decisions decisions in the order the backend should apply them
     */
    void sendDecisions(double timestamp, List<Decision> decisions);

    /** Latest timestamp observed from the backend, NaN before the first batch */
    double clock();

    @Override
    void close();
}
