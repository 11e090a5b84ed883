package com.phillippitts.funnel.service.transport;

/**
 * Opens streaming connections to the relay's {@code /recordings/{sessionId}/stream} endpoint.
 */
public interface StreamTransport {

    /**
     * Establishes the duplex connection for {@code sessionId}, blocking until it is open.
     *
     * @throws com.phillippitts.funnel.exception.ConnectionFailureException if the connection cannot be
     *         established within the configured timeout
     */
    StreamConnection connect(String sessionId, TransportListener listener);
}
