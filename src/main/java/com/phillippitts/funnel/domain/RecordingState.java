package com.phillippitts.funnel.domain;

/**
 * Lifecycle states of a recording session, shared by the client state machine and the relay.
 *
 * <p><b>Transitions:</b>
 * <pre>
 * IDLE → CONNECTING → STREAMING → FINALIZING → COMPLETED
 *   any non-terminal state → FAILED
 *   CONNECTING → IDLE (microphone permission denied, before any network activity)
 * </pre>
 *
 * <p>States only move forward; {@link #COMPLETED} and {@link #FAILED} are terminal.
 */
public enum RecordingState {
    IDLE,
    CONNECTING,
    STREAMING,
    FINALIZING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Returns whether moving from this state to {@code target} is a legal edge.
     *
     * @param target the requested next state
     * @return {@code true} if the transition is allowed
     */
    public boolean canTransitionTo(RecordingState target) {
        if (target == null || isTerminal()) {
            return false;
        }
        if (target == FAILED) {
            return true;
        }
        return switch (this) {
            case IDLE -> target == CONNECTING;
            case CONNECTING -> target == STREAMING || target == FINALIZING || target == IDLE;
            case STREAMING -> target == FINALIZING;
            case FINALIZING -> target == COMPLETED;
            default -> false;
        };
    }
}
