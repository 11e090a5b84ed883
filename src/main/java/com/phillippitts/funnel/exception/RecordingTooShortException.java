package com.phillippitts.funnel.exception;

import java.time.Duration;

/**
 * Thrown when a recording is stopped before the configured minimum duration elapsed.
 * No finalize request is sent for such recordings.
 */
public class RecordingTooShortException extends FunnelException {

    private final Duration elapsed;
    private final Duration minimum;

    public RecordingTooShortException(Duration elapsed, Duration minimum) {
        super("Recording too short: " + elapsed.toMillis() + "ms (minimum " + minimum.toMillis() + "ms)");
        this.elapsed = elapsed;
        this.minimum = minimum;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public Duration getMinimum() {
        return minimum;
    }
}
