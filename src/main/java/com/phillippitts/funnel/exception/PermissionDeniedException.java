package com.phillippitts.funnel.exception;

/**
 * Thrown when the operating system refuses microphone access.
 * Raised before any network activity so the recording returns to idle.
 */
public class PermissionDeniedException extends FunnelException {

    public PermissionDeniedException(String message) {
        super(message);
    }

    public PermissionDeniedException(String message, Throwable cause) {
        super(message, cause);
    }
}
