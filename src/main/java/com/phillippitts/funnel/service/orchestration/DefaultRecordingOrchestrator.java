package com.phillippitts.funnel.service.orchestration;

import com.phillippitts.funnel.config.properties.AudioCaptureProperties;
import com.phillippitts.funnel.config.properties.ClientProperties;
import com.phillippitts.funnel.domain.AssembledTranscript;
import com.phillippitts.funnel.domain.RecordingState;
import com.phillippitts.funnel.domain.StreamConfig;
import com.phillippitts.funnel.domain.TranscriptEvent;
import com.phillippitts.funnel.domain.TranscriptSegment;
import com.phillippitts.funnel.exception.ConnectionFailureException;
import com.phillippitts.funnel.exception.FunnelException;
import com.phillippitts.funnel.exception.PermissionDeniedException;
import com.phillippitts.funnel.exception.RecordingTooShortException;
import com.phillippitts.funnel.service.audio.capture.AudioCaptureService;
import com.phillippitts.funnel.service.audio.capture.CaptureErrorEvent;
import com.phillippitts.funnel.service.audio.source.AudioSource;
import com.phillippitts.funnel.service.audio.source.AudioSourceFactory;
import com.phillippitts.funnel.service.audio.source.MicrophonePermission;
import com.phillippitts.funnel.service.events.SessionFailedEvent;
import com.phillippitts.funnel.service.transport.AudioFrameSender;
import com.phillippitts.funnel.service.transport.FinalizeClient;
import com.phillippitts.funnel.service.transport.StreamConnection;
import com.phillippitts.funnel.service.transport.StreamTransport;
import com.phillippitts.funnel.service.transport.TransportListener;
import com.phillippitts.funnel.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Default implementation of {@link RecordingOrchestrator}.
 *
 * <p><b>Start:</b> IDLE → CONNECTING, permission check (live sources only), connect, send the
 * config frame, wait for {@code ready}, → STREAMING, then start the sender and the capture.
 * Audio is never captured before {@code ready}.
 *
 * <p><b>Stop:</b> STREAMING → FINALIZING, stop capture (the capture thread delivers its last
 * frame), drain the outbound queue, call finalize, → COMPLETED, and close the connection last.
 *
 * <p><b>Error Handling:</b> capture errors, transport errors, relay {@code error} events and drops
 * while CONNECTING or STREAMING fail the session and release its resources. Release is
 * idempotent and may race with a normal stop. Drops after finalizing began are only logged.
 *
 * @since 1.0
 */
public class DefaultRecordingOrchestrator implements RecordingOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultRecordingOrchestrator.class);

    private final AudioCaptureService captureService;
    private final StreamTransport transport;
    private final FinalizeClient finalizeClient;
    private final AudioSourceFactory sourceFactory;
    private final MicrophonePermission permission;
    private final ClientProperties clientProps;
    private final AudioCaptureProperties captureProps;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final Object lifecycleLock = new Object();
    private volatile RecordingSession current;

    public DefaultRecordingOrchestrator(AudioCaptureService captureService,
                                        StreamTransport transport,
                                        FinalizeClient finalizeClient,
                                        AudioSourceFactory sourceFactory,
                                        MicrophonePermission permission,
                                        ClientProperties clientProps,
                                        AudioCaptureProperties captureProps,
                                        ApplicationEventPublisher publisher) {
        this(captureService, transport, finalizeClient, sourceFactory, permission,
                clientProps, captureProps, publisher, Clock.systemUTC());
    }

    // Package-private for tests
    DefaultRecordingOrchestrator(AudioCaptureService captureService,
                                 StreamTransport transport,
                                 FinalizeClient finalizeClient,
                                 AudioSourceFactory sourceFactory,
                                 MicrophonePermission permission,
                                 ClientProperties clientProps,
                                 AudioCaptureProperties captureProps,
                                 ApplicationEventPublisher publisher,
                                 Clock clock) {
        this.captureService = Objects.requireNonNull(captureService, "captureService must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.finalizeClient = Objects.requireNonNull(finalizeClient, "finalizeClient must not be null");
        this.sourceFactory = Objects.requireNonNull(sourceFactory, "sourceFactory must not be null");
        this.permission = Objects.requireNonNull(permission, "permission must not be null");
        this.clientProps = Objects.requireNonNull(clientProps, "clientProps must not be null");
        this.captureProps = Objects.requireNonNull(captureProps, "captureProps must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String start() {
        return start(sourceFactory.create());
    }

    @Override
    public String start(AudioSource source) {
        Objects.requireNonNull(source, "source must not be null");
        RecordingSession session;
        synchronized (lifecycleLock) {
            RecordingSession existing = current;
            if (existing != null && !existing.state().isTerminal() && existing.state() != RecordingState.IDLE) {
                throw new IllegalStateException("A recording is already in progress: " + existing.id());
            }
            session = new RecordingSession(UUID.randomUUID().toString(), source);
            current = session;
        }
        ThreadContext.put("sessionId", session.id());
        try {
            session.stateMachine().transition(RecordingState.CONNECTING);
            checkPermission(session);
            connect(session);
            awaitReady(session);
            beginStreaming(session);
            LOG.info("Recording started from {}", source.name());
            return session.id();
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    private void checkPermission(RecordingSession session) {
        if (!session.source().isLive()) {
            return;
        }
        try {
            permission.check();
        } catch (PermissionDeniedException e) {
            session.stateMachine().transition(RecordingState.IDLE);
            LOG.warn("Microphone permission denied; recording not started");
            throw e;
        }
    }

    private void connect(RecordingSession session) {
        try {
            StreamConnection connection = transport.connect(session.id(), new SessionListener(session));
            session.connection(connection);
            connection.sendConfig(StreamConfig.pcm16Mono(session.source().sampleRate()));
        } catch (RuntimeException e) {
            fail(session, "connect_failed", e);
            throw asConnectionFailure(session, "Cannot open streaming connection", e);
        }
    }

    private void awaitReady(RecordingSession session) {
        Duration timeout = clientProps.getReadyTimeout();
        boolean ready;
        try {
            ready = session.awaitReady(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(session, "interrupted", e);
            throw new ConnectionFailureException("Interrupted while waiting for ready", session.id(), e);
        }
        if (!ready) {
            String reason = session.failureReason() != null ? session.failureReason() : "ready_timeout";
            fail(session, reason, null);
            throw new ConnectionFailureException(
                    "Relay not ready (" + reason + ") within " + timeout.toMillis() + "ms", session.id());
        }
    }

    private void beginStreaming(RecordingSession session) {
        if (!session.stateMachine().compareAndTransition(RecordingState.CONNECTING, RecordingState.STREAMING)) {
            throw new ConnectionFailureException("Session left CONNECTING before streaming", session.id());
        }
        session.startedAt(clock.instant());
        AudioFrameSender sender = new AudioFrameSender(session.connection(), captureProps.getQueueCapacity(),
                error -> fail(session, "send_failed", error));
        session.sender(sender);
        try {
            sender.start();
            captureService.startCapture(session.id(), session.source(), sender::offer);
        } catch (RuntimeException e) {
            fail(session, "capture_start_failed", e);
            throw asConnectionFailure(session, "Cannot start capture", e);
        }
    }

    @Override
    public Optional<AssembledTranscript> stop() {
        RecordingSession session = current;
        if (session == null || session.state() != RecordingState.STREAMING) {
            LOG.debug("stop() ignored; state is {}", session == null ? RecordingState.IDLE : session.state());
            return Optional.empty();
        }
        ThreadContext.put("sessionId", session.id());
        try {
            Duration elapsed = Duration.between(session.startedAt(), clock.instant());
            Duration minimum = clientProps.getMinRecordingDuration();
            if (elapsed.compareTo(minimum) < 0) {
                if (session.stateMachine().fail()) {
                    session.markFailed("too_short");
                    release(session);
                    LOG.info("Recording abandoned after {}ms (minimum {}ms)", elapsed.toMillis(), minimum.toMillis());
                    throw new RecordingTooShortException(elapsed, minimum);
                }
                return Optional.empty();
            }
            if (!session.stateMachine().compareAndTransition(RecordingState.STREAMING, RecordingState.FINALIZING)) {
                LOG.debug("stop() lost a race; state is {}", session.state());
                return Optional.empty();
            }
            session.endedAt(clock.instant());
            return Optional.of(finalizeSession(session));
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    private AssembledTranscript finalizeSession(RecordingSession session) {
        try {
            // Order matters: stop the hand-off, flush what is queued, then finalize
            captureService.stopCapture(session.id());
            AudioFrameSender sender = session.sender();
            if (sender != null && !sender.drain(clientProps.getDrainTimeout())) {
                LOG.warn("Not all queued audio was sent before finalize");
            }
            long bytesSent = sender == null ? FinalizeClient.UNKNOWN_BYTES_SENT : sender.bytesSent();
            AssembledTranscript result = finalizeClient.finalizeRecording(session.id(), bytesSent);
            session.stateMachine().transition(RecordingState.COMPLETED);
            LOG.info("Recording completed: duration={}s, segments={}, transcript='{}'",
                    result.durationSeconds(), result.segmentCount(), LogSanitizer.preview(result.transcript()));
            return result;
        } catch (RuntimeException e) {
            fail(session, "finalize_failed", e);
            throw asConnectionFailure(session, "Finalize failed", e);
        } finally {
            // The connection outlives the finalize call
            release(session);
        }
    }

    @Override
    public RecordingState state() {
        RecordingSession session = current;
        return session == null ? RecordingState.IDLE : session.state();
    }

    @Override
    public Optional<String> currentSessionId() {
        RecordingSession session = current;
        return session == null ? Optional.empty() : Optional.of(session.id());
    }

    @Override
    public Optional<String> failureReason() {
        RecordingSession session = current;
        return session == null ? Optional.empty() : Optional.ofNullable(session.failureReason());
    }

    @Override
    public double audioLevel() {
        return state() == RecordingState.STREAMING ? captureService.currentLevel() : 0.0;
    }

    @Override
    public List<TranscriptSegment> liveSegments() {
        RecordingSession session = current;
        return session == null ? List.of() : session.liveSegments();
    }

    @EventListener
    public void onCaptureError(CaptureErrorEvent event) {
        RecordingSession session = current;
        if (session != null && session.id().equals(event.sessionId())) {
            fail(session, "capture_" + event.reason().toLowerCase(), null);
        }
    }

    /**
     * Fails the session if it is still connecting or streaming, then releases its resources.
     */
    private void fail(RecordingSession session, String reason, Throwable cause) {
        if (session.state() == RecordingState.FINALIZING && !"finalize_failed".equals(reason)) {
            LOG.info("Ignoring {} for {} while finalizing", reason, session.id());
            return;
        }
        if (!session.stateMachine().fail()) {
            return;
        }
        session.markFailed(reason);
        if (cause != null) {
            LOG.warn("Recording {} failed: {} ({})", session.id(), reason, cause.toString());
        } else {
            LOG.warn("Recording {} failed: {}", session.id(), reason);
        }
        publisher.publishEvent(new SessionFailedEvent(session.id(), SessionFailedEvent.ROLE_CLIENT, reason, Instant.now()));
        release(session);
    }

    private void release(RecordingSession session) {
        if (!session.markReleased()) {
            return;
        }
        captureService.cancelCapture(session.id());
        AudioFrameSender sender = session.sender();
        if (sender != null) {
            sender.cancel();
        }
        StreamConnection connection = session.connection();
        if (connection != null) {
            connection.close();
        }
        LOG.debug("Released resources of {}", session.id());
    }

    private static FunnelException asConnectionFailure(RecordingSession session, String message, RuntimeException e) {
        if (e instanceof FunnelException fe) {
            return fe;
        }
        return new ConnectionFailureException(message, session.id(), e);
    }

    private final class SessionListener implements TransportListener {
        private final RecordingSession session;

        SessionListener(RecordingSession session) {
            this.session = session;
        }

        @Override
        public void onEvent(TranscriptEvent event) {
            switch (event.type()) {
                case READY -> session.markReady();
                case TRANSCRIPT -> session.addLiveSegment(event.segment());
                case ERROR -> fail(session, "relay_error", new ConnectionFailureException(
                        "Relay reported: " + event.message(), session.id()));
                case METADATA -> LOG.debug("Relay processed {}s of audio for {}",
                        event.durationSeconds(), session.id());
            }
        }

        @Override
        public void onError(Throwable error) {
            fail(session, "transport_error", error);
        }

        @Override
        public void onClosed(int code, String reason) {
            if (session.stateMachine().isIn(RecordingState.CONNECTING, RecordingState.STREAMING)) {
                fail(session, "connection_lost", new ConnectionFailureException(
                        "Streaming connection closed: " + code + " " + reason, session.id()));
            } else {
                LOG.debug("Streaming connection of {} closed in state {}", session.id(), session.state());
            }
        }
    }
}
