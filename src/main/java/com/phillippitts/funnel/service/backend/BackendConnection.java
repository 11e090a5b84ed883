package com.phillippitts.funnel.service.backend;

/**
 * Live duplex connection to the transcription backend for one session.
 *
 * <p>Owned by exactly one relay session and never shared; released exactly once.
 */
public interface BackendConnection extends AutoCloseable {

    /**
     * Forwards one PCM frame verbatim.
     *
     * @throws com.phillippitts.funnel.exception.BackendUnavailableException if the connection is not open
     */
    void sendAudio(byte[] pcm);

    /**
     * Sends the explicit close-stream signal: the backend flushes, emits its terminal metadata
     * event and then closes. Only the first call has an effect.
     */
    void closeStream();

    boolean isOpen();

    /** Closes the connection. Safe to call more than once. */
    @Override
    void close();
}
