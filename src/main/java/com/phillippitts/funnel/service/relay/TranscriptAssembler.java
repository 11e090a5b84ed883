package com.phillippitts.funnel.service.relay;

import com.phillippitts.funnel.domain.TranscriptSegment;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds transcript text from segments in arrival order.
 *
 * <p>Only final segments count; their text is trimmed, blanks are skipped, and the rest is
 * joined with single spaces. No segments yields an empty string.
 */
public final class TranscriptAssembler {

    private TranscriptAssembler() {
        // Utility class
    }

    public static List<TranscriptSegment> finalSegments(List<TranscriptSegment> segments) {
        return segments.stream()
                .filter(TranscriptSegment::isFinal)
                .filter(s -> !s.text().isBlank())
                .toList();
    }

    public static String assemble(List<TranscriptSegment> segments) {
        return finalSegments(segments).stream()
                .map(s -> s.text().trim())
                .collect(Collectors.joining(" "));
    }
}
