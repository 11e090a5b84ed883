package com.phillippitts.funnel.exception;

/**
 * Thrown when a client opens a stream for a session id that is already registered.
 */
public class DuplicateSessionException extends FunnelException {

    private final String sessionId;

    public DuplicateSessionException(String sessionId) {
        super("Session already exists: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
