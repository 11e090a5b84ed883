package com.phillippitts.funnel.exception;

/**
 * Base exception for all Funnel application-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class FunnelException extends RuntimeException {

    public FunnelException(String message) {
        super(message);
    }

    public FunnelException(String message, Throwable cause) {
        super(message, cause);
    }

    public FunnelException(Throwable cause) {
        super(cause);
    }
}
