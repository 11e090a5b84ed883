package com.phillippitts.funnel.exception;

/**
 * Thrown when audio arrives for a session whose transcription backend connection
 * is not open, or when the backend cannot be reached at all.
 */
public class BackendUnavailableException extends FunnelException {

    private final String sessionId;

    public BackendUnavailableException(String sessionId) {
        super("Transcription backend unavailable for session " + sessionId);
        this.sessionId = sessionId;
    }

    public BackendUnavailableException(String sessionId, Throwable cause) {
        super("Transcription backend unavailable for session " + sessionId, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
