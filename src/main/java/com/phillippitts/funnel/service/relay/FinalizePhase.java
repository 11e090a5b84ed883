package com.phillippitts.funnel.service.relay;

/**
 * Progress of the finalize handshake for one session.
 *
 * <pre>
 * NOT_STARTED → [AWAITING_TRAILING_AUDIO →] AWAITING_BACKEND_FLUSH → ASSEMBLING_TRANSCRIPT → DONE
 *                                                                 ↘ TIMED_OUT → ASSEMBLING_TRANSCRIPT → DONE
 * </pre>
 *
 * <p>{@code AWAITING_TRAILING_AUDIO} is entered only when the finalize request says how many
 * bytes the client sent.
 */
public enum FinalizePhase {
    NOT_STARTED,
    AWAITING_TRAILING_AUDIO,
    AWAITING_BACKEND_FLUSH,
    TIMED_OUT,
    ASSEMBLING_TRANSCRIPT,
    DONE
}
