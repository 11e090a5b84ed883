package com.phillippitts.funnel.exception;

/**
 * Thrown when an operation names a session id the relay does not know
 * (never created, or already evicted).
 */
public class UnknownSessionException extends FunnelException {

    private final String sessionId;

    public UnknownSessionException(String sessionId) {
        super("Unknown session: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
