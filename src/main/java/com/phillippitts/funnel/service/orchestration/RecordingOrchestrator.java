package com.phillippitts.funnel.service.orchestration;

import com.phillippitts.funnel.domain.AssembledTranscript;
import com.phillippitts.funnel.domain.RecordingState;
import com.phillippitts.funnel.domain.TranscriptSegment;
import com.phillippitts.funnel.service.audio.source.AudioSource;

import java.util.List;
import java.util.Optional;

/**
 * Client-facing start/stop contract for live recordings.
 *
 * <p>This orchestrator sequences microphone permission, the streaming connection, audio capture
 * and the finalize handshake, and exposes one lifecycle per recording through
 * {@link RecordingState}.
 *
 * <p><b>Thread Safety:</b> Implementations must be thread-safe; UI threads, transport I/O
 * threads and the capture thread all report into it. Only one recording is active at a time.
 *
 * <p><b>Session Lifecycle:</b>
 * <ol>
 *   <li>{@link #start()} connects, sends the config frame and waits for {@code ready}</li>
 *   <li>Audio streams until {@link #stop()}</li>
 *   <li>{@link #stop()} stops capture, drains queued frames, finalizes, and only then closes
 *       the streaming connection</li>
 * </ol>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * String id = orchestrator.start();
 * // ... user speaks ...
 * orchestrator.stop().ifPresent(t -> show(t.transcript()));
 * }</pre>
 *
 * @since 1.0
 */
public interface RecordingOrchestrator {

    /**
     * Starts a recording from the configured audio source.
     *
     * @return the new session id
     * @throws com.phillippitts.funnel.exception.PermissionDeniedException if microphone access is refused;
     *         the state returns to IDLE and no connection is attempted
     * @throws com.phillippitts.funnel.exception.ConnectionFailureException if the relay cannot be reached
     *         or never reports ready; the session is FAILED
     * @throws IllegalStateException if a recording is already in progress
     */
    String start();

    /** Same as {@link #start()} with an explicit source. */
    String start(AudioSource source);

    /**
     * Stops the active recording and returns its finalized transcript.
     *
     * <p>A no-op returning {@link Optional#empty()} unless the recording is STREAMING, so repeated
     * calls are safe.
     *
     * @throws com.phillippitts.funnel.exception.RecordingTooShortException if stopped before the minimum
     *         duration; the session is abandoned without finalizing
     * @throws com.phillippitts.funnel.exception.ConnectionFailureException if the finalize call fails
     */
    Optional<AssembledTranscript> stop();

    /** State of the current (or most recent) recording; IDLE if there was none. */
    RecordingState state();

    Optional<String> currentSessionId();

    /** Reason the current recording failed, if it did. */
    Optional<String> failureReason();

    /** Live loudness in [0, 1] for the level meter. */
    double audioLevel();

    /** Segments received while streaming, interim ones included, in arrival order. */
    List<TranscriptSegment> liveSegments();
}
