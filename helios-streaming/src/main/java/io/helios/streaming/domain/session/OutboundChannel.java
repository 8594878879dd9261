package io.helios.streaming.domain.session;

/**
 * Outbound side of one client connection.
 */
public interface OutboundChannel {

    /**
     * Queue one text frame for delivery.
     *
     * @return false if the peer is gone and the frame was not accepted
     */
    boolean send(String text);

    boolean isOpen();

    /**
     * Close the underlying connection. Safe to call more than once.
     */
    void close();

    /**
     * Human-readable peer description for logs.
     */
    String describe();
}
