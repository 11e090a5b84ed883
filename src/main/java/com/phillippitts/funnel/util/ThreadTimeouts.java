package com.phillippitts.funnel.util;

import java.time.Duration;

/**
 * Standard timeout values for thread lifecycle management.
 *
 * <p>Used by the capture service and the outbound frame sender when stopping their
 * worker threads.
 *
 * @since 1.0
 */
public final class ThreadTimeouts {

    /**
     * Timeout for the audio capture thread to terminate during a normal stop.
     *
     * <p>Longer than one chunk read so the last partial chunk is still delivered.
     */
    public static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofMillis(1000);

    /** Timeout for the capture thread during forced shutdown (best-effort). */
    public static final Duration CAPTURE_THREAD_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Timeout for the sender thread after cancellation; it is not draining anything. */
    public static final Duration SENDER_CANCEL_TIMEOUT = Duration.ofMillis(500);

    private ThreadTimeouts() {
        // Utility class - prevent instantiation
    }

    /**
     * Joins {@code thread} for at most {@code timeout}, restoring the interrupt flag if
     * interrupted.
     *
     * @return {@code true} if the thread is no longer alive
     */
    public static boolean join(Thread thread, Duration timeout) {
        if (thread == null || !thread.isAlive()) {
            return true;
        }
        if (thread == Thread.currentThread()) {
            return false;
        }
        try {
            thread.join(Math.max(1L, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !thread.isAlive();
    }
}
