package com.phillippitts.funnel.service.relay;

import com.phillippitts.funnel.config.properties.RelayProperties;
import com.phillippitts.funnel.domain.AssembledTranscript;
import com.phillippitts.funnel.domain.RecordingState;
import com.phillippitts.funnel.domain.StreamConfig;
import com.phillippitts.funnel.domain.TranscriptSegment;
import com.phillippitts.funnel.exception.ConnectionFailureException;
import com.phillippitts.funnel.service.metrics.RelayMetrics;
import com.phillippitts.funnel.testutil.EventCapturingPublisher;
import com.phillippitts.funnel.testutil.FakeTranscriptionBackend;
import com.phillippitts.funnel.testutil.RecordingClientSink;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.awaitility.Awaitility.await;

class FinalizationCoordinatorTest {

    private static final Duration FINALIZE_TIMEOUT = Duration.ofMillis(300);
    private static final StreamConfig PCM16_16K = StreamConfig.pcm16Mono(16_000);

    private FakeTranscriptionBackend backend;
    private SimpleMeterRegistry meterRegistry;
    private SessionRegistry registry;
    private ExecutorService callers;

    @BeforeEach
    void setUp() {
        backend = new FakeTranscriptionBackend();
        meterRegistry = new SimpleMeterRegistry();
        RelayProperties props = new RelayProperties(FINALIZE_TIMEOUT, Duration.ofSeconds(60),
                null, null, null, null);
        RelayMetrics metrics = new RelayMetrics(meterRegistry);
        registry = new SessionRegistry(backend, new FinalizationCoordinator(props, metrics), props, metrics,
                new EventCapturingPublisher(), Runnable::run);
        callers = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
    }

    private void openStreaming(String id) {
        registry.createSession(id, new RecordingClientSink());
        registry.configure(id, PCM16_16K);
    }

    @Test
    void zeroAudioYieldsEmptyTranscript() {
        openStreaming("s1");

        AssembledTranscript result = registry.finalize("s1");

        assertThat(result.transcript()).isEmpty();
        assertThat(result.durationSeconds()).isZero();
        assertThat(result.segments()).isEmpty();
        assertThat(result.timedOut()).isFalse();
        assertThat(registry.get("s1").state()).isEqualTo(RecordingState.COMPLETED);
        assertThat(registry.get("s1").phase()).isEqualTo(FinalizePhase.DONE);
    }

    @Test
    void closeStreamIsSentAfterQueuedAudioAndConnectionReleased() {
        openStreaming("s1");
        registry.appendAudio("s1", new byte[32_000]);

        registry.finalize("s1");

        FakeTranscriptionBackend.FakeConnection connection = backend.connection("s1");
        assertThat(connection.bytesReceived()).isEqualTo(32_000);
        assertThat(connection.isStreamClosed()).isTrue();
        assertThat(connection.isClosed()).isTrue();
    }

    @Test
    void durationMatchesAudioStreamed() {
        openStreaming("s1");
        for (int i = 0; i < 5; i++) {
            registry.appendAudio("s1", new byte[32_000]);
        }

        AssembledTranscript result = registry.finalize("s1");

        assertThat(result.durationSeconds()).isCloseTo(5.0, within(0.2));
        assertThat(result.audioBytesReceived()).isEqualTo(160_000);
    }

    @Test
    void onlyFinalSegmentsAreAssembledInArrivalOrder() {
        backend.withScript(
                TranscriptSegment.finalSegment("  the quick ", 0.9, 0.0, 0.8),
                new TranscriptSegment("brow", 0.3, 0.8, 1.0, false),
                TranscriptSegment.finalSegment("brown fox", 0.92, 0.8, 1.6),
                TranscriptSegment.finalSegment("  ", 0.5, 1.6, 1.7));
        openStreaming("s1");

        AssembledTranscript result = registry.finalize("s1");

        assertThat(result.transcript()).isEqualTo("the quick brown fox");
        assertThat(result.segments()).hasSize(2).allMatch(TranscriptSegment::isFinal);
        assertThat(result.segmentCount()).isEqualTo(2);
    }

    @Test
    void missingMetadataReturnsPartialResultAfterTimeout() {
        backend.withScript(TranscriptSegment.finalSegment("partial", 0.8, 0.0, 0.5)).withoutMetadata();
        openStreaming("s1");
        registry.appendAudio("s1", new byte[16_000]);

        long start = System.nanoTime();
        AssembledTranscript result = registry.finalize("s1");
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(result.timedOut()).isTrue();
        assertThat(result.transcript()).isEqualTo("partial");
        assertThat(result.durationSeconds()).isCloseTo(0.5, within(0.01));
        assertThat(elapsedMs).isGreaterThanOrEqualTo(FINALIZE_TIMEOUT.toMillis() - 50);
        assertThat(registry.get("s1").state()).isEqualTo(RecordingState.COMPLETED);
        Timer timer = meterRegistry.find("funnel.relay.finalize.latency").tag("outcome", "timeout").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
    }

    @Test
    void backendClosingDuringFinalizeEndsWaitEarly() throws Exception {
        backend.withoutMetadata();
        openStreaming("s1");
        FakeTranscriptionBackend.FakeConnection connection = backend.connection("s1");

        Future<AssembledTranscript> pending = callers.submit(() -> registry.finalize("s1"));
        await().atMost(2, TimeUnit.SECONDS)
                .until(() -> registry.get("s1").phase() == FinalizePhase.AWAITING_BACKEND_FLUSH);
        connection.listener().onClosed(1000, "done");

        AssembledTranscript result = pending.get(2, TimeUnit.SECONDS);
        assertThat(result.timedOut()).isTrue();
        assertThat(registry.get("s1").state()).isEqualTo(RecordingState.COMPLETED);
    }

    @Test
    void audioStillInFlightWhenFinalizeArrivesIsForwarded() throws Exception {
        openStreaming("s1");
        registry.appendAudio("s1", new byte[32_000]);

        Future<AssembledTranscript> pending = callers.submit(() -> registry.finalize("s1", 64_000L));
        await().atMost(2, TimeUnit.SECONDS)
                .until(() -> registry.get("s1").phase() == FinalizePhase.AWAITING_TRAILING_AUDIO);
        assertThat(registry.get("s1").state()).isEqualTo(RecordingState.FINALIZING);
        registry.appendAudio("s1", new byte[32_000]);

        AssembledTranscript result = pending.get(2, TimeUnit.SECONDS);
        assertThat(result.audioBytesReceived()).isEqualTo(64_000);
        assertThat(result.durationSeconds()).isCloseTo(2.0, within(0.01));
        assertThat(result.timedOut()).isFalse();
        assertThat(registry.get("s1").framesRejected()).isZero();
        assertThat(backend.connection("s1").bytesReceived()).isEqualTo(64_000);
    }

    @Test
    void trailingAudioThatNeverArrivesIsReportedAsTimedOut() {
        openStreaming("s1");
        registry.appendAudio("s1", new byte[32_000]);

        long start = System.nanoTime();
        AssembledTranscript result = registry.finalize("s1", 64_000L);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(result.timedOut()).isTrue();
        assertThat(result.audioBytesReceived()).isEqualTo(32_000);
        assertThat(elapsedMs).isLessThan(FINALIZE_TIMEOUT.toMillis() + 1_000);
        assertThat(meterRegistry.find("funnel.relay.finalize.latency").tag("outcome", "timeout").timer())
                .isNotNull();
    }

    @Test
    void clientDetachingStopsTheTrailingAudioWait() throws Exception {
        openStreaming("s1");
        Future<AssembledTranscript> pending = callers.submit(() -> registry.finalize("s1", 64_000L));
        await().atMost(2, TimeUnit.SECONDS)
                .until(() -> registry.get("s1").phase() == FinalizePhase.AWAITING_TRAILING_AUDIO);

        registry.onClientDisconnected("s1", 1000);

        AssembledTranscript result = pending.get(FINALIZE_TIMEOUT.toMillis() / 2, TimeUnit.MILLISECONDS);
        assertThat(result.timedOut()).isTrue();
        assertThat(registry.get("s1").state()).isEqualTo(RecordingState.COMPLETED);
    }

    @Test
    void finalizeTwiceReturnsSameResult() {
        backend.withScript(TranscriptSegment.finalSegment("once", 0.9, 0.0, 0.5));
        openStreaming("s1");

        AssembledTranscript first = registry.finalize("s1");
        AssembledTranscript second = registry.finalize("s1");

        assertThat(second).isSameAs(first);
        assertThat(meterRegistry.find("funnel.relay.finalize.latency").timer().count()).isEqualTo(1);
    }

    @Test
    void concurrentFinalizeSharesOneHandshake() throws Exception {
        backend.withoutMetadata();
        openStreaming("s1");

        Future<AssembledTranscript> a = callers.submit(() -> registry.finalize("s1"));
        Future<AssembledTranscript> b = callers.submit(() -> registry.finalize("s1"));

        assertThat(a.get(2, TimeUnit.SECONDS)).isSameAs(b.get(2, TimeUnit.SECONDS));
    }

    @Test
    void failedSessionCannotBeFinalized() {
        openStreaming("s1");
        registry.onClientDisconnected("s1", 1006);

        assertThatThrownBy(() -> registry.finalize("s1"))
                .isInstanceOf(ConnectionFailureException.class)
                .hasMessageContaining("connection_lost");
    }

    @Test
    void sessionFinalizedBeforeBackendConnectsCompletesEmpty() {
        CompletableFuture<Void> gate = new CompletableFuture<>();
        backend.gatedBy(gate);
        registry.createSession("s1", new RecordingClientSink());
        registry.configure("s1", PCM16_16K);

        AssembledTranscript result = registry.finalize("s1");
        gate.complete(null);

        assertThat(result.transcript()).isEmpty();
        assertThat(result.timedOut()).isFalse();
        assertThat(registry.get("s1").state()).isEqualTo(RecordingState.COMPLETED);
        assertThat(backend.connection("s1").isClosed()).isTrue();
    }
}
