package com.phillippitts.funnel.service.transport;

import com.phillippitts.funnel.domain.StreamConfig;

/**
 * One open streaming connection to the relay, owned by exactly one recording.
 *
 * <p>Outbound order is the call order; callers keep all sends on one thread.
 * {@link #close()} may race with sends from an error path and is idempotent.
 */
public interface StreamConnection extends AutoCloseable {

    String sessionId();

    /**
     * Sends the one-time config frame.
     *
     * @throws com.phillippitts.funnel.exception.ConnectionFailureException if the send fails
     */
    void sendConfig(StreamConfig config);

    /**
     * Sends one binary PCM frame.
     *
     * @throws com.phillippitts.funnel.exception.ConnectionFailureException if the send fails
     */
    void sendAudio(byte[] pcm);

    boolean isOpen();

    /** Closes the connection normally. Safe to call more than once. */
    @Override
    void close();
}
