package org.iconoglott.transport;

/**
 * The outbound side of a connection.
 */
@FunctionalInterface
public interface MessageSink {

    /**
     * Sends one encoded message to the peer.
     * @param message The JSON text.
     */
    void send(String message);
}
