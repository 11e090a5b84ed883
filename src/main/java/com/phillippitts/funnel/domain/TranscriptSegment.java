package com.phillippitts.funnel.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One transcript fragment reported by the transcription backend.
 *
 * <p>Only segments with {@code isFinal = true} contribute to the assembled transcript.
 * Interim segments are advisory and are superseded by later segments covering the same range.
 *
 * @param text       recognized text (never null, may be empty)
 * @param confidence recognition confidence between 0.0 and 1.0
 * @param start      offset of the segment start from the stream start, in seconds
 * @param end        offset of the segment end from the stream start, in seconds
 * @param isFinal    whether the backend will not revise this segment
 */
public record TranscriptSegment(
        String text,
        double confidence,
        double start,
        double end,
        @JsonProperty("isFinal") boolean isFinal
) {

    public TranscriptSegment {
        Objects.requireNonNull(text, "text must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        if (end < start) {
            throw new IllegalArgumentException("end (" + end + ") must not precede start (" + start + ")");
        }
    }

    /** Convenience factory for a final segment. */
    public static TranscriptSegment finalSegment(String text, double confidence, double start, double end) {
        return new TranscriptSegment(text, confidence, start, end, true);
    }
}
