package com.phillippitts.funnel.exception;

/**
 * Thrown when a stream configuration frame is malformed or describes an unsupported format.
 */
public class InvalidStreamConfigException extends FunnelException {

    private final String reason;

    public InvalidStreamConfigException(String reason) {
        super("Invalid stream config: " + reason);
        this.reason = reason;
    }

    public InvalidStreamConfigException(String reason, Throwable cause) {
        super("Invalid stream config: " + reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
