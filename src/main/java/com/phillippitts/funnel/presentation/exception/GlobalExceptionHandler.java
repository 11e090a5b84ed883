package com.phillippitts.funnel.presentation.exception;

import com.phillippitts.funnel.exception.BackendUnavailableException;
import com.phillippitts.funnel.exception.ConnectionFailureException;
import com.phillippitts.funnel.exception.DuplicateSessionException;
import com.phillippitts.funnel.exception.InvalidStreamConfigException;
import com.phillippitts.funnel.exception.UnknownSessionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts relay exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping backend details away from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Session id never registered or already evicted (HTTP 404).
     */
    @ExceptionHandler(UnknownSessionException.class)
    ResponseEntity<ApiError> handleUnknownSession(UnknownSessionException ex) {
        LOG.warn("Unknown session: {}", ex.getSessionId());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Recording session not found",
                "No session with id " + ex.getSessionId() + " (it may have expired)",
                Instant.now()
            ));
    }

    /**
     * Session id already in use (HTTP 409).
     */
    @ExceptionHandler(DuplicateSessionException.class)
    ResponseEntity<ApiError> handleDuplicateSession(DuplicateSessionException ex) {
        LOG.warn("Duplicate session: {}", ex.getSessionId());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Recording session already exists",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - malformed or unsupported stream config (HTTP 400).
     */
    @ExceptionHandler(InvalidStreamConfigException.class)
    ResponseEntity<ApiError> handleInvalidConfig(InvalidStreamConfigException ex) {
        LOG.warn("Invalid stream config: {}", ex.getReason());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid stream configuration",
                ex.getReason(),
                Instant.now()
            ));
    }

    /**
     * Session failed before or during finalize (HTTP 502).
     */
    @ExceptionHandler(ConnectionFailureException.class)
    ResponseEntity<ApiError> handleConnectionFailure(ConnectionFailureException ex) {
        LOG.error("Recording session {} failed: {}", ex.getSessionId(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_GATEWAY)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Recording session failed",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Transient error - transcription backend unreachable (HTTP 503).
     */
    @ExceptionHandler(BackendUnavailableException.class)
    ResponseEntity<ApiError> handleBackendUnavailable(BackendUnavailableException ex) {
        LOG.error("Transcription backend unavailable for session {}", ex.getSessionId(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Transcription service temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
