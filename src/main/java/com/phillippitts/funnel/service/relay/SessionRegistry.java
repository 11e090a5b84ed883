package com.phillippitts.funnel.service.relay;

import com.phillippitts.funnel.config.properties.RelayProperties;
import com.phillippitts.funnel.domain.AssembledTranscript;
import com.phillippitts.funnel.domain.RecordingState;
import com.phillippitts.funnel.domain.StreamConfig;
import com.phillippitts.funnel.domain.TranscriptEvent;
import com.phillippitts.funnel.domain.TranscriptSegment;
import com.phillippitts.funnel.exception.BackendUnavailableException;
import com.phillippitts.funnel.exception.DuplicateSessionException;
import com.phillippitts.funnel.exception.InvalidStreamConfigException;
import com.phillippitts.funnel.exception.UnknownSessionException;
import com.phillippitts.funnel.service.backend.BackendConnection;
import com.phillippitts.funnel.service.backend.BackendListener;
import com.phillippitts.funnel.service.backend.TranscriptionBackend;
import com.phillippitts.funnel.service.events.SessionFailedEvent;
import com.phillippitts.funnel.service.metrics.RelayMetrics;
import com.phillippitts.funnel.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Maps session ids to live relay sessions and routes traffic between clients and the
 * transcription backend.
 *
 * <p><b>Isolation:</b> each session owns its backend connection, its segment buffer and its
 * serial mailbox; the only shared structure is the id → session map.
 *
 * <p><b>Ordering:</b> audio frames, backend events and the finalize close-stream signal for one
 * session all run on that session's mailbox, so the backend sees audio in arrival order and the
 * close-stream signal after the last frame.
 *
 * <p><b>Lifecycle:</b> sessions are created CONNECTING when a client opens its stream, become
 * STREAMING once the backend connection is open (the client is then sent {@code ready}), and are
 * evicted {@code funnel.relay.retention} after reaching COMPLETED or FAILED.
 *
 * @since 1.0
 */
@Service
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    static final String REJECT_NOT_READY = "not_ready";
    static final String REJECT_FINALIZING = "finalizing";
    static final String REJECT_BACKEND_UNAVAILABLE = "backend_unavailable";

    private final ConcurrentMap<String, RelaySession> sessions = new ConcurrentHashMap<>();
    private final TranscriptionBackend backend;
    private final FinalizationCoordinator coordinator;
    private final RelayProperties props;
    private final RelayMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final Executor relayExecutor;

    public SessionRegistry(TranscriptionBackend backend,
                           FinalizationCoordinator coordinator,
                           RelayProperties props,
                           RelayMetrics metrics,
                           ApplicationEventPublisher publisher,
                           @Qualifier("relayExecutor") Executor relayExecutor) {
        this.backend = backend;
        this.coordinator = coordinator;
        this.props = props;
        this.metrics = metrics;
        this.publisher = publisher;
        this.relayExecutor = relayExecutor;
        metrics.bindActiveSessions(this::activeSessions);
    }

    /**
     * Registers a new session for a freshly opened client stream.
     *
     * @throws DuplicateSessionException if the id is already registered
     */
    public RelaySession createSession(String sessionId, ClientEventSink client) {
        RelaySession session = new RelaySession(sessionId, client, relayExecutor);
        RelaySession existing = sessions.putIfAbsent(sessionId, session);
        if (existing != null) {
            throw new DuplicateSessionException(sessionId);
        }
        metrics.incrementSessionsCreated();
        LOG.info("Session {} registered", sessionId);
        return session;
    }

    /**
     * Applies the client's config frame and opens the backend connection.
     *
     * <p>A second config frame is ignored. The client is sent {@code ready} once the backend
     * connection is open.
     *
     * @throws UnknownSessionException      if the session is not registered
     * @throws InvalidStreamConfigException if the format is unsupported; the session is failed
     */
    public void configure(String sessionId, StreamConfig config) {
        RelaySession session = get(sessionId);
        try {
            validate(config);
        } catch (InvalidStreamConfigException e) {
            fail(session, "invalid_config", e.getMessage());
            throw e;
        }
        if (!session.setConfig(config)) {
            LOG.warn("Session {} sent a second config frame; ignoring", sessionId);
            return;
        }
        LOG.info("Session {} configured: {} {}Hz x{}", sessionId, config.format(), config.sampleRate(),
                config.channels());
        backend.connect(sessionId, config, new SessionBackendListener(session))
                .whenComplete((connection, error) ->
                        runOnMailbox(session, () -> onBackendConnected(session, connection, error)));
    }

    private void validate(StreamConfig config) {
        if (!StreamConfig.PCM16.equalsIgnoreCase(config.format())) {
            throw new InvalidStreamConfigException("unsupported format '" + config.format() + "'");
        }
        if (config.channels() != 1) {
            throw new InvalidStreamConfigException("channels must be 1, got " + config.channels());
        }
        if (config.sampleRate() < props.getMinSampleRate() || config.sampleRate() > props.getMaxSampleRate()) {
            throw new InvalidStreamConfigException("sampleRate " + config.sampleRate() + " outside ["
                    + props.getMinSampleRate() + ", " + props.getMaxSampleRate() + "]");
        }
    }

    private void onBackendConnected(RelaySession session, BackendConnection connection, Throwable error) {
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            LOG.warn("Backend connection failed for {}: {}", session.id(), cause.getMessage());
            fail(session, "backend_unavailable", "Transcription service unavailable");
            return;
        }
        session.connection(connection);
        if (session.isConnectionReleased()
                || !session.stateMachine().compareAndTransition(RecordingState.CONNECTING, RecordingState.STREAMING)) {
            LOG.info("Session {} is {}; discarding late backend connection", session.id(), session.state());
            connection.close();
            return;
        }
        session.startedAt(Instant.now());
        session.sendToClient(TranscriptEvent.ready());
        LOG.info("Session {} streaming", session.id());
    }

    /**
     * Forwards one binary audio frame to the session's backend connection.
     *
     * <p>Frames that arrive before the session is ready, or after the backend input was closed
     * by finalize, are dropped and counted. Frames that arrive while finalize waits for
     * trailing audio are still forwarded. Every frame counts toward {@link RelaySession#bytesArrived()}.
     *
     * @throws UnknownSessionException     if the session is not registered
     * @throws BackendUnavailableException if the session failed or its backend connection is closed
     */
    public void appendAudio(String sessionId, byte[] frame) {
        RelaySession session = get(sessionId);
        RecordingState state = session.state();
        switch (state) {
            case CONNECTING -> {
                reject(session, REJECT_NOT_READY);
                session.recordArrival(frame.length);
                return;
            }
            case COMPLETED -> {
                reject(session, REJECT_FINALIZING);
                session.recordArrival(frame.length);
                return;
            }
            case FAILED -> throw new BackendUnavailableException(sessionId);
            default -> {
                // STREAMING or FINALIZING
            }
        }
        BackendConnection connection = session.connection();
        if (connection == null || !connection.isOpen()) {
            if (state == RecordingState.FINALIZING) {
                reject(session, REJECT_FINALIZING);
                session.recordArrival(frame.length);
                return;
            }
            throw new BackendUnavailableException(sessionId);
        }
        // Queue first: a finalize woken by this arrival must find the frame ahead of close-stream
        runOnMailbox(session, () -> forwardAudio(session, frame));
        session.recordArrival(frame.length);
    }

    private void forwardAudio(RelaySession session, byte[] frame) {
        if (session.isInputClosed()) {
            reject(session, REJECT_FINALIZING);
            return;
        }
        BackendConnection connection = session.connection();
        try {
            connection.sendAudio(frame);
            session.addAudioBytes(frame.length);
            metrics.recordAudioBytes(frame.length);
        } catch (BackendUnavailableException e) {
            reject(session, REJECT_BACKEND_UNAVAILABLE);
            if (session.state() == RecordingState.STREAMING) {
                fail(session, "backend_unavailable", "Transcription service unavailable");
            }
        }
    }

    private void reject(RelaySession session, String reason) {
        long rejected = session.rejectFrame();
        metrics.incrementFramesRejected(reason);
        if (rejected == 1 || rejected % 100 == 0) {
            LOG.warn("Session {} dropped {} audio frames ({})", session.id(), rejected, reason);
        }
    }

    /**
     * Appends a backend segment to the session's buffer and forwards it to the client with the
     * running transcript. Runs on the session's mailbox.
     *
     * @throws UnknownSessionException if the session is not registered
     */
    public void appendTranscript(String sessionId, TranscriptSegment segment) {
        RelaySession session = get(sessionId);
        runOnMailbox(session, () -> {
            if (session.state().isTerminal()) {
                LOG.debug("Late segment for {} in state {}; ignoring", sessionId, session.state());
                return;
            }
            session.appendSegment(segment);
            if (segment.isFinal()) {
                LOG.debug("Final segment for {}: '{}'", sessionId, LogSanitizer.preview(segment.text()));
            }
            session.sendToClient(TranscriptEvent.transcript(segment, session.runningTranscript()));
        });
    }

    /**
     * Runs the finalize handshake. Blocks for at most {@code funnel.relay.finalize-timeout} plus
     * assembly time.
     *
     * @throws UnknownSessionException if the session is not registered
     */
    public AssembledTranscript finalize(String sessionId) {
        return finalize(sessionId, null);
    }

    /**
     * Runs the finalize handshake, first waiting (within the finalize timeout) until
     * {@code expectedBytes} of audio have arrived from the client.
     *
     * @param expectedBytes bytes the client reports having sent, or {@code null} if unknown
     * @throws UnknownSessionException if the session is not registered
     */
    public AssembledTranscript finalize(String sessionId, Long expectedBytes) {
        return coordinator.finalize(get(sessionId), expectedBytes);
    }

    /**
     * Called when the client's streaming connection closes. A session still connecting or
     * streaming is failed; one that is finalizing carries on.
     */
    public void onClientDisconnected(String sessionId, int closeCode) {
        RelaySession session = sessions.get(sessionId);
        if (session == null) {
            return;
        }
        session.detachClient();
        if (session.stateMachine().isIn(RecordingState.CONNECTING, RecordingState.STREAMING)) {
            LOG.warn("Client of {} disconnected mid-stream (code {})", sessionId, closeCode);
            runOnMailbox(session, () -> fail(session, "connection_lost", null));
        } else {
            LOG.debug("Client of {} disconnected in state {}", sessionId, session.state());
        }
    }

    public Optional<RelaySession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * @throws UnknownSessionException if the session is not registered
     */
    public RelaySession get(String sessionId) {
        RelaySession session = sessions.get(sessionId);
        if (session == null) {
            throw new UnknownSessionException(sessionId);
        }
        return session;
    }

    public int activeSessions() {
        return (int) sessions.values().stream().filter(s -> !s.state().isTerminal()).count();
    }

    public int size() {
        return sessions.size();
    }

    /**
     * Removes sessions that have been COMPLETED or FAILED for longer than the retention window.
     */
    @Scheduled(fixedDelayString = "${funnel.relay.sweep-interval-ms:5000}")
    public void evictExpired() {
        evictExpired(Instant.now());
    }

    // Package-private for tests
    int evictExpired(Instant now) {
        Duration retention = props.getRetention();
        int evicted = 0;
        for (RelaySession session : sessions.values()) {
            Instant terminalAt = session.terminalAt();
            if (terminalAt != null && session.state().isTerminal()
                    && Duration.between(terminalAt, now).compareTo(retention) >= 0) {
                if (sessions.remove(session.id(), session)) {
                    session.releaseConnection();
                    session.mailbox().shutdown();
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            LOG.debug("Evicted {} expired sessions; {} remain", evicted, sessions.size());
        }
        return evicted;
    }

    @PreDestroy
    public void shutdown() {
        for (RelaySession session : sessions.values()) {
            session.releaseConnection();
            session.mailbox().shutdown();
        }
        sessions.clear();
    }

    /**
     * Fails the session unless it is already terminal, tells the client, and releases the
     * backend connection.
     */
    void fail(RelaySession session, String reason, String clientMessage) {
        if (!session.stateMachine().fail()) {
            return;
        }
        session.failureReason(reason);
        session.markTerminal();
        session.metadata().completeExceptionally(new IllegalStateException("session failed: " + reason));
        LOG.warn("Session {} failed: {}", session.id(), reason);
        metrics.incrementSessionsFailed(reason);
        publisher.publishEvent(new SessionFailedEvent(session.id(), SessionFailedEvent.ROLE_RELAY, reason, Instant.now()));
        if (clientMessage != null) {
            session.sendToClient(TranscriptEvent.error(clientMessage));
            session.closeClientWithError(reason);
        }
        session.releaseConnection();
    }

    private void runOnMailbox(RelaySession session, Runnable task) {
        try {
            session.mailbox().execute(task);
        } catch (RejectedExecutionException e) {
            LOG.debug("Session {} mailbox closed; task dropped", session.id());
        }
    }

    /** Routes backend callbacks for one session onto its mailbox. */
    private final class SessionBackendListener implements BackendListener {
        private final RelaySession session;

        SessionBackendListener(RelaySession session) {
            this.session = session;
        }

        @Override
        public void onTranscript(TranscriptSegment segment) {
            if (sessions.get(session.id()) == session) {
                appendTranscript(session.id(), segment);
            }
        }

        @Override
        public void onMetadata(double durationSeconds) {
            runOnMailbox(session, () -> {
                LOG.info("Backend reported {}s processed for {}", durationSeconds, session.id());
                session.metadata().complete(durationSeconds);
                session.sendToClient(TranscriptEvent.metadata(durationSeconds));
            });
        }

        @Override
        public void onError(Throwable error) {
            runOnMailbox(session, () -> {
                LOG.warn("Backend error for {}: {}", session.id(), error.getMessage());
                backendGone(session, "backend_error");
            });
        }

        @Override
        public void onClosed(int code, String reason) {
            runOnMailbox(session, () -> {
                LOG.info("Backend connection for {} closed ({} {})", session.id(), code, reason);
                backendGone(session, "backend_closed");
            });
        }

        private void backendGone(RelaySession session, String reason) {
            if (session.stateMachine().isIn(RecordingState.CONNECTING, RecordingState.STREAMING)) {
                fail(session, reason, "Transcription service error");
            } else if (session.state() == RecordingState.FINALIZING) {
                // Finalize degrades to a partial result
                session.metadata().completeExceptionally(new IllegalStateException(reason));
            }
        }
    }
}
