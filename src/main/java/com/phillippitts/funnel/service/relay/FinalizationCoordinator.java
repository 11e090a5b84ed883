package com.phillippitts.funnel.service.relay;

import com.phillippitts.funnel.config.properties.RelayProperties;
import com.phillippitts.funnel.domain.AssembledTranscript;
import com.phillippitts.funnel.domain.RecordingState;
import com.phillippitts.funnel.domain.StreamConfig;
import com.phillippitts.funnel.domain.TranscriptSegment;
import com.phillippitts.funnel.exception.BackendUnavailableException;
import com.phillippitts.funnel.exception.ConnectionFailureException;
import com.phillippitts.funnel.service.backend.BackendConnection;
import com.phillippitts.funnel.service.metrics.RelayMetrics;
import com.phillippitts.funnel.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the finalize handshake for one relay session.
 *
 * <p>The handshake moves the session to FINALIZING. When the caller says how many bytes the
 * client sent, it first waits for that much audio to arrive, since the finalize request may
 * overtake frames still in flight on the streaming connection. It then queues the backend
 * close-stream signal behind any audio still on the session's mailbox and waits for the
 * backend's terminal metadata event. Both waits share one {@code funnel.relay.finalize-timeout}. Final
 * segments collected up to that point are assembled into the transcript. If the metadata event
 * never arrives the result is returned anyway, flagged {@code timedOut}.
 *
 * <p>Finalize is idempotent: concurrent or repeated calls for the same session share one
 * handshake and receive the same result.
 */
@Component
public class FinalizationCoordinator {

    private static final Logger LOG = LogManager.getLogger(FinalizationCoordinator.class);

    static final String OUTCOME_COMPLETE = "complete";
    static final String OUTCOME_TIMEOUT = "timeout";

    private final RelayProperties props;
    private final RelayMetrics metrics;

    public FinalizationCoordinator(RelayProperties props, RelayMetrics metrics) {
        this.props = props;
        this.metrics = metrics;
    }

    /**
     * @throws ConnectionFailureException if the session failed before or during finalize
     */
    public AssembledTranscript finalize(RelaySession session) {
        return finalize(session, null);
    }

    /**
     * @param expectedBytes bytes the client reports having sent, or {@code null} if unknown;
     *                      ignored when joining a finalize already in progress
     * @throws ConnectionFailureException if the session failed before or during finalize
     */
    public AssembledTranscript finalize(RelaySession session, Long expectedBytes) {
        CompletableFuture<AssembledTranscript> existing = session.finalizeResult();
        if (existing != null) {
            LOG.debug("Finalize for {} already requested; joining it", session.id());
            return await(session, existing);
        }
        if (session.state() == RecordingState.FAILED) {
            throw new ConnectionFailureException("Session failed: " + session.failureReason(), session.id());
        }
        CompletableFuture<AssembledTranscript> future = new CompletableFuture<>();
        if (!session.claimFinalize(future)) {
            return await(session, session.finalizeResult());
        }
        try {
            AssembledTranscript result = handshake(session, expectedBytes);
            future.complete(result);
            return result;
        } catch (RuntimeException e) {
            future.completeExceptionally(e);
            throw e;
        }
    }

    private AssembledTranscript handshake(RelaySession session, Long expectedBytes) {
        long startNanos = System.nanoTime();
        long deadline = startNanos + props.getFinalizeTimeout().toNanos();
        if (!session.stateMachine().tryTransition(RecordingState.FINALIZING)) {
            throw new ConnectionFailureException("Cannot finalize session in state " + session.state(), session.id());
        }
        session.endedAt(Instant.now());
        LOG.info("Finalizing {} ({} bytes received, {} expected)", session.id(), session.audioBytesReceived(),
                expectedBytes == null ? "unknown" : expectedBytes);

        boolean trailingAudioComplete = awaitTrailingAudio(session, expectedBytes, deadline);
        session.phase(FinalizePhase.AWAITING_BACKEND_FLUSH);
        Double reportedDuration = awaitBackendFlush(session, deadline);
        boolean timedOut = !trailingAudioComplete
                || (reportedDuration == null && session.connection() != null);
        if (timedOut) {
            session.phase(FinalizePhase.TIMED_OUT);
        }

        session.phase(FinalizePhase.ASSEMBLING_TRANSCRIPT);
        List<TranscriptSegment> finals = TranscriptAssembler.finalSegments(snapshotSegments(session));
        String transcript = TranscriptAssembler.assemble(finals);
        double duration = resolveDuration(session, reportedDuration);
        long processingMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        if (!session.stateMachine().compareAndTransition(RecordingState.FINALIZING, RecordingState.COMPLETED)) {
            throw new ConnectionFailureException("Session failed during finalize: " + session.failureReason(),
                    session.id());
        }
        session.phase(FinalizePhase.DONE);
        session.markTerminal();
        session.releaseConnection();
        metrics.recordFinalizeLatency(timedOut ? OUTCOME_TIMEOUT : OUTCOME_COMPLETE, processingMs);

        if (timedOut) {
            LOG.warn("Finalize for {} timed out after {}; returning partial transcript ({} segments)",
                    session.id(), props.getFinalizeTimeout(), finals.size());
        } else {
            LOG.info("Finalized {}: {} segments, {}s, {}ms: '{}'", session.id(), finals.size(), duration,
                    processingMs, LogSanitizer.preview(transcript));
        }
        return new AssembledTranscript(session.id(), transcript, duration, finals,
                session.audioBytesReceived(), timedOut, processingMs);
    }

    /**
     * @return {@code false} if fewer than {@code expectedBytes} arrived before the deadline
     */
    private boolean awaitTrailingAudio(RelaySession session, Long expectedBytes, long deadline) {
        if (expectedBytes == null || session.bytesArrived() >= expectedBytes) {
            return true;
        }
        session.phase(FinalizePhase.AWAITING_TRAILING_AUDIO);
        LOG.debug("Waiting for {} of {} bytes from {}", expectedBytes - session.bytesArrived(), expectedBytes,
                session.id());
        try {
            if (session.awaitArrivals(expectedBytes, deadline - System.nanoTime())) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.warn("Only {} of {} bytes arrived from {} before close-stream", session.bytesArrived(), expectedBytes,
                session.id());
        return false;
    }

    /**
     * Sends close-stream after queued audio and waits for the backend's metadata.
     *
     * @return the reported duration, or {@code null} if none arrived in time
     */
    private Double awaitBackendFlush(RelaySession session, long deadline) {
        BackendConnection connection = session.connection();
        if (connection == null) {
            LOG.info("Session {} never reached the backend; nothing to flush", session.id());
            return null;
        }
        try {
            session.mailbox().execute(() -> {
                session.closeInput();
                try {
                    connection.closeStream();
                } catch (BackendUnavailableException e) {
                    session.metadata().completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            session.metadata().completeExceptionally(e);
        }
        try {
            return session.metadata().get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            LOG.warn("No metadata from backend for {} within {}", session.id(), props.getFinalizeTimeout());
            return null;
        } catch (ExecutionException e) {
            LOG.warn("Backend flush for {} ended early: {}", session.id(), e.getCause().getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    private List<TranscriptSegment> snapshotSegments(RelaySession session) {
        try {
            return session.mailbox().submit(session::segments).get(props.getFinalizeTimeout().toMillis(),
                    TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException | ExecutionException | TimeoutException e) {
            throw new ConnectionFailureException("Could not assemble transcript", session.id(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionFailureException("Interrupted while assembling transcript", session.id(), e);
        }
    }

    private double resolveDuration(RelaySession session, Double reported) {
        StreamConfig config = session.config();
        double derived = config == null || config.byteRate() == 0
                ? 0.0
                : (double) session.audioBytesReceived() / config.byteRate();
        if (reported == null) {
            return derived;
        }
        if (Math.abs(reported - derived) > props.getDurationToleranceSeconds()) {
            LOG.warn("Backend duration {}s for {} differs from {}s of audio received", reported, session.id(),
                    derived);
        }
        return Math.max(0.0, reported);
    }

    private static AssembledTranscript await(RelaySession session, CompletableFuture<AssembledTranscript> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new ConnectionFailureException("Finalize failed", session.id(), e.getCause());
        }
    }
}
