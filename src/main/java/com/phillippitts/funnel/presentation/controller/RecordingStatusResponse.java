package com.phillippitts.funnel.presentation.controller;

import com.phillippitts.funnel.domain.RecordingState;
import com.phillippitts.funnel.service.relay.FinalizePhase;
import com.phillippitts.funnel.service.relay.RelaySession;

import java.time.Instant;

/**
 * Snapshot of a relay session returned by {@code GET /recordings/{sessionId}}.
 */
record RecordingStatusResponse(
        String sessionId,
        RecordingState state,
        FinalizePhase finalizePhase,
        Integer sampleRate,
        long audioBytesReceived,
        long framesRejected,
        int segmentCount,
        Instant createdAt,
        Instant startedAt,
        Instant endedAt,
        String failureReason
) {

    static RecordingStatusResponse from(RelaySession session) {
        return new RecordingStatusResponse(
                session.id(),
                session.state(),
                session.phase(),
                session.config() == null ? null : session.config().sampleRate(),
                session.audioBytesReceived(),
                session.framesRejected(),
                session.segmentCount(),
                session.createdAt(),
                session.startedAt(),
                session.endedAt(),
                session.failureReason());
    }
}
