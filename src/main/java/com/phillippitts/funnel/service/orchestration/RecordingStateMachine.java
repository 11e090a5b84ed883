package com.phillippitts.funnel.service.orchestration;

import com.phillippitts.funnel.domain.RecordingState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe state holder for one recording session.
 *
 * <p>This class guards the lifecycle of a single session, on the client and on the relay.
 * Every transition is checked against {@link RecordingState#canTransitionTo(RecordingState)},
 * so states only move forward and terminal states are final.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → CONNECTING → STREAMING → FINALIZING → COMPLETED
 * CONNECTING → IDLE (permission denied)
 * any non-terminal → FAILED
 * </pre>
 *
 * <p><b>Thread Safety:</b> All public methods are thread-safe and use a
 * {@link ReentrantLock}. Error paths may race with a normal stop; exactly one of them
 * wins each transition.
 *
 * @since 1.0
 */
public final class RecordingStateMachine {

    private static final Logger LOG = LogManager.getLogger(RecordingStateMachine.class);

    private final String sessionId;
    private final Lock lock = new ReentrantLock();
    private RecordingState state;

    public RecordingStateMachine(String sessionId) {
        this(sessionId, RecordingState.IDLE);
    }

    public RecordingStateMachine(String sessionId, RecordingState initial) {
        if (sessionId == null) {
            throw new NullPointerException("sessionId cannot be null");
        }
        if (initial == null) {
            throw new NullPointerException("initial state cannot be null");
        }
        this.sessionId = sessionId;
        this.state = initial;
    }

    /**
     * Moves to {@code target} if the edge is legal.
     *
     * @return {@code true} if the transition happened
     */
    public boolean tryTransition(RecordingState target) {
        lock.lock();
        try {
            if (!state.canTransitionTo(target)) {
                return false;
            }
            LOG.debug("Session {}: {} → {}", sessionId, state, target);
            state = target;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves to {@code target}, failing loudly on an illegal edge.
     *
     * @throws IllegalStateException if the transition is not allowed from the current state
     */
    public void transition(RecordingState target) {
        lock.lock();
        try {
            if (!tryTransition(target)) {
                throw new IllegalStateException(
                        "Illegal transition " + state + " → " + target + " for session " + sessionId);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves from {@code expected} to {@code target} only if the current state is {@code expected}.
     *
     * @return {@code true} if the transition happened
     */
    public boolean compareAndTransition(RecordingState expected, RecordingState target) {
        lock.lock();
        try {
            return state == expected && tryTransition(target);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fails the session unless it already reached a terminal state.
     *
     * @return {@code true} if this call moved the session to FAILED
     */
    public boolean fail() {
        return tryTransition(RecordingState.FAILED);
    }

    public RecordingState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isIn(RecordingState... candidates) {
        RecordingState current = state();
        for (RecordingState s : candidates) {
            if (s == current) {
                return true;
            }
        }
        return false;
    }

    public String sessionId() {
        return sessionId;
    }
}
