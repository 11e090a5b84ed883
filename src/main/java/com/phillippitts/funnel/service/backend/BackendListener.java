package com.phillippitts.funnel.service.backend;

import com.phillippitts.funnel.domain.TranscriptSegment;

/**
 * Callbacks from a backend connection, invoked on the backend client's I/O threads.
 */
public interface BackendListener {

    /** A recognized segment, final or interim. Segments with no text are never delivered. */
    void onTranscript(TranscriptSegment segment);

    /**
     * The terminal metadata event: all submitted audio has been processed and no further segments
     * will arrive.
     *
     * @param durationSeconds total audio duration the backend processed
     */
    void onMetadata(double durationSeconds);

    void onError(Throwable error);

    /** The backend connection closed. Called at most once. */
    void onClosed(int code, String reason);
}
