package in.the13th.intel.transport.ws;

/**
 * One live stream observer as seen by {@link StreamHub}.
 *
 * {@link #send(String)} must not block and must not throw; problems are reported as
 * {@link SendResult#FAILED}.
 */
public interface ObserverChannel {

    SendResult send(String text);

    /**
     * Remote address or another human-readable label for logs.
     */
    String describe();

    void close();
}
