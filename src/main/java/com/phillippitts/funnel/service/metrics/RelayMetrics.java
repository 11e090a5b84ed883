package com.phillippitts.funnel.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Centralized metrics for the streaming relay.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Sessions created, failed (by reason) and currently active</li>
 *   <li>Audio bytes forwarded and frames rejected (by reason)</li>
 *   <li>Finalize latency by outcome ({@code complete} or {@code timeout})</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer under the {@code funnel.relay} prefix.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class RelayMetrics {

    private static final String METRIC_PREFIX = "funnel.relay";

    private final MeterRegistry registry;
    private final Counter sessionsCreated;
    private final Counter audioBytes;

    public RelayMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.sessionsCreated = Counter.builder(METRIC_PREFIX + ".sessions.created")
                .description("Number of streaming sessions opened")
                .register(registry);
        this.audioBytes = Counter.builder(METRIC_PREFIX + ".audio.bytes")
                .description("PCM bytes forwarded to the transcription backend")
                .baseUnit("bytes")
                .register(registry);
    }

    /**
     * Registers the active-session gauge.
     *
     * @param activeSessions supplier of the current number of non-terminal sessions
     */
    public void bindActiveSessions(Supplier<Number> activeSessions) {
        Gauge.builder(METRIC_PREFIX + ".sessions.active", activeSessions)
                .description("Sessions that are connecting, streaming or finalizing")
                .register(registry);
    }

    public void incrementSessionsCreated() {
        sessionsCreated.increment();
    }

    /**
     * Increments the failure counter.
     *
     * @param reason failure reason (backend_unavailable, connection_lost, etc.)
     */
    public void incrementSessionsFailed(String reason) {
        Counter.builder(METRIC_PREFIX + ".sessions.failed")
                .description("Number of sessions that ended Failed")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordAudioBytes(int bytes) {
        audioBytes.increment(bytes);
    }

    /**
     * Counts a dropped inbound audio frame.
     *
     * @param reason why it was dropped (not_ready, finalizing)
     */
    public void incrementFramesRejected(String reason) {
        Counter.builder(METRIC_PREFIX + ".frames.rejected")
                .description("Inbound audio frames not forwarded to the backend")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records the duration of one finalize handshake.
     *
     * @param outcome {@code complete} or {@code timeout}
     * @param durationMillis duration in milliseconds
     */
    public void recordFinalizeLatency(String outcome, long durationMillis) {
        Timer.builder(METRIC_PREFIX + ".finalize.latency")
                .description("Time from finalize request to assembled transcript")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationMillis, TimeUnit.MILLISECONDS);
    }
}
