package com.phillippitts.funnel.service.backend;

import com.phillippitts.funnel.domain.TranscriptSegment;

/**
 * One parsed inbound backend frame.
 *
 * @param kind     frame category
 * @param segment  populated for {@link Kind#RESULTS} with non-blank text
 * @param duration populated for {@link Kind#METADATA}
 * @param error    populated for {@link Kind#ERROR}
 */
record BackendMessage(Kind kind, TranscriptSegment segment, double duration, String error) {

    enum Kind { RESULTS, METADATA, ERROR, IGNORED }

    static BackendMessage results(TranscriptSegment segment) {
        return new BackendMessage(Kind.RESULTS, segment, 0.0, null);
    }

    static BackendMessage metadata(double duration) {
        return new BackendMessage(Kind.METADATA, null, duration, null);
    }

    static BackendMessage error(String error) {
        return new BackendMessage(Kind.ERROR, null, 0.0, error);
    }

    static BackendMessage ignored() {
        return new BackendMessage(Kind.IGNORED, null, 0.0, null);
    }
}
