package com.phillippitts.funnel.exception;

/**
 * Thrown when captured audio cannot be converted to 16-bit PCM.
 */
public class EncodingFailureException extends FunnelException {

    public EncodingFailureException(String message) {
        super(message);
    }

    public EncodingFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
