package com.phillippitts.funnel.service.audio.capture;

import java.time.Instant;

/**
 * Published when microphone capture fails (permissions, device errors, encoding, etc.).
 *
 * Payload contains the recording id, a short reason and timestamp. Avoids any PII.
 */
public record CaptureErrorEvent(String sessionId, String reason, Instant at) {

    public static final String MIC_UNAVAILABLE = "MIC_UNAVAILABLE";
    public static final String MIC_PERMISSION_DENIED = "MIC_PERMISSION_DENIED";
    public static final String ENCODING_FAILURE = "ENCODING_FAILURE";
    public static final String CAPTURE_ERROR = "CAPTURE_ERROR";
}
