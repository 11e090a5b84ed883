package com.phillippitts.funnel.service.audio.capture;

import com.phillippitts.funnel.service.audio.AudioFrame;
import com.phillippitts.funnel.service.audio.source.AudioSource;

import java.util.function.Consumer;

/**
 * Streaming audio capture service.
 *
 * Contract:
 * - One active capture at a time
 * - Frames are PCM16LE mono, delivered in capture order on a dedicated capture thread
 * - The frame consumer must not block; it runs on the capture thread
 * - Failures are published as {@link CaptureErrorEvent}, never thrown to the consumer
 */
public interface AudioCaptureService {

    /**
     * Starts capturing from {@code source}. Fails if another capture is active.
     *
     * @param sessionId recording the frames belong to
     * @param source    where samples come from
     * @param frames    receiver of encoded frames
     */
    void startCapture(String sessionId, AudioSource source, Consumer<AudioFrame> frames);

    /**
     * Stops the capture and waits for the capture thread to deliver its last frame.
     * No-op if the session is not capturing.
     */
    void stopCapture(String sessionId);

    /** Stops the capture without delivering any further frames. No-op if already stopped. */
    void cancelCapture(String sessionId);

    boolean isCapturing();

    /** Most recent loudness in [0, 1]; 0 when idle. */
    double currentLevel();
}
