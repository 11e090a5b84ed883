package com.phillippitts.funnel.service.backend;

import com.phillippitts.funnel.domain.StreamConfig;

import java.util.concurrent.CompletableFuture;

/**
 * Streaming transcription service the relay forwards audio to.
 */
public interface TranscriptionBackend {

    /**
     * Opens a backend connection for a session.
     *
     * @return a future completed with the open connection, or exceptionally with
     *         {@link com.phillippitts.funnel.exception.BackendUnavailableException}
     */
    CompletableFuture<BackendConnection> connect(String sessionId, StreamConfig config, BackendListener listener);

    /** Whether credentials are configured; an unconfigured backend refuses every connection. */
    boolean isConfigured();
}
