package com.phillippitts.funnel.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Result of finalizing a session: the transcript assembled from final segments plus the
 * diagnostics the finalize endpoint reports.
 *
 * @param sessionId          the finalized session
 * @param transcript         final segment texts joined in arrival order (empty for silent recordings)
 * @param durationSeconds    processed audio duration reported by the backend, or derived from bytes
 * @param segments           final segments in arrival order
 * @param audioBytesReceived PCM bytes the relay forwarded for this session
 * @param timedOut           {@code true} if the terminal metadata event never arrived (partial result)
 * @param processingTimeMs   wall time spent in the finalize handshake
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AssembledTranscript(
        String sessionId,
        String transcript,
        double durationSeconds,
        List<TranscriptSegment> segments,
        long audioBytesReceived,
        boolean timedOut,
        long processingTimeMs
) {

    public AssembledTranscript {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(transcript, "transcript must not be null");
        segments = segments == null ? List.of() : List.copyOf(segments);
        if (durationSeconds < 0.0) {
            throw new IllegalArgumentException("durationSeconds must not be negative");
        }
    }

    @JsonProperty("segmentCount")
    public int segmentCount() {
        return segments.size();
    }

    @JsonProperty("transcriptLength")
    public int transcriptLength() {
        return transcript.length();
    }
}
