package com.phillippitts.funnel.service.relay;

import com.phillippitts.funnel.domain.TranscriptEvent;

/**
 * Outbound half of a client's streaming connection, as seen by the relay.
 */
public interface ClientEventSink {

    /** Sends an event frame; silently skipped if the connection is already closed. */
    void send(TranscriptEvent event);

    boolean isOpen();

    /** Closes the client connection after a fatal error. */
    void closeWithError(String reason);
}
