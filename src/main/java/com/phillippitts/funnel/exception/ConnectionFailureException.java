package com.phillippitts.funnel.exception;

/**
 * Thrown when a streaming connection cannot be established, is never acknowledged,
 * or drops while audio is still flowing.
 */
public class ConnectionFailureException extends FunnelException {

    private final String sessionId;

    public ConnectionFailureException(String message) {
        super(message);
        this.sessionId = "unknown";
    }

    public ConnectionFailureException(String message, String sessionId) {
        super(message + " (session: " + sessionId + ")");
        this.sessionId = sessionId;
    }

    public ConnectionFailureException(String message, String sessionId, Throwable cause) {
        super(message + " (session: " + sessionId + ")", cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
