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
import com.phillippitts.funnel.service.events.SessionFailedEvent;
import com.phillippitts.funnel.service.metrics.RelayMetrics;
import com.phillippitts.funnel.testutil.EventCapturingPublisher;
import com.phillippitts.funnel.testutil.FakeTranscriptionBackend;
import com.phillippitts.funnel.testutil.RecordingClientSink;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class SessionRegistryTest {

    private static final StreamConfig PCM16_16K = StreamConfig.pcm16Mono(16_000);

    private FakeTranscriptionBackend backend;
    private SimpleMeterRegistry meterRegistry;
    private EventCapturingPublisher publisher;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        backend = new FakeTranscriptionBackend();
        meterRegistry = new SimpleMeterRegistry();
        publisher = new EventCapturingPublisher();
        registry = registryOn(Runnable::run);
    }

    private SessionRegistry registryOn(Executor relayExecutor) {
        RelayProperties props = new RelayProperties(Duration.ofMillis(300), Duration.ofSeconds(60),
                null, null, null, null);
        RelayMetrics metrics = new RelayMetrics(meterRegistry);
        return new SessionRegistry(backend, new FinalizationCoordinator(props, metrics), props, metrics,
                publisher, relayExecutor);
    }

    @Test
    void newSessionStartsConnecting() {
        RelaySession session = registry.createSession("s1", new RecordingClientSink());

        assertThat(session.state()).isEqualTo(RecordingState.CONNECTING);
        assertThat(registry.get("s1")).isSameAs(session);
        assertThat(registry.activeSessions()).isEqualTo(1);
    }

    @Test
    void duplicateSessionIdIsRejected() {
        registry.createSession("s1", new RecordingClientSink());

        assertThatThrownBy(() -> registry.createSession("s1", new RecordingClientSink()))
                .isInstanceOf(DuplicateSessionException.class);
    }

    @Test
    void configOpensBackendAndSendsReady() {
        RecordingClientSink sink = new RecordingClientSink();
        registry.createSession("s1", sink);

        registry.configure("s1", PCM16_16K);

        assertThat(registry.get("s1").state()).isEqualTo(RecordingState.STREAMING);
        assertThat(registry.get("s1").startedAt()).isNotNull();
        assertThat(sink.eventsOfType(TranscriptEvent.Type.READY)).hasSize(1);
        assertThat(backend.connection("s1")).isNotNull();
    }

    @Test
    void secondConfigFrameIsIgnored() {
        RecordingClientSink sink = new RecordingClientSink();
        registry.createSession("s1", sink);
        registry.configure("s1", PCM16_16K);

        registry.configure("s1", StreamConfig.pcm16Mono(8_000));

        assertThat(registry.get("s1").config().sampleRate()).isEqualTo(16_000);
        assertThat(sink.eventsOfType(TranscriptEvent.Type.READY)).hasSize(1);
    }

    @Test
    void unsupportedConfigFailsSessionAndNotifiesClient() {
        RecordingClientSink sink = new RecordingClientSink();
        registry.createSession("s1", sink);

        assertThatThrownBy(() -> registry.configure("s1", new StreamConfig("pcm16", 16_000, 2)))
                .isInstanceOf(InvalidStreamConfigException.class)
                .hasMessageContaining("channels");

        assertThat(registry.get("s1").state()).isEqualTo(RecordingState.FAILED);
        assertThat(sink.eventsOfType(TranscriptEvent.Type.ERROR)).hasSize(1);
        assertThat(sink.isOpen()).isFalse();
    }

    @Test
    void sampleRateOutsideRangeIsRejected() {
        registry.createSession("s1", new RecordingClientSink());

        assertThatThrownBy(() -> registry.configure("s1", StreamConfig.pcm16Mono(96_000)))
                .isInstanceOf(InvalidStreamConfigException.class)
                .hasMessageContaining("sampleRate");
    }

    @Test
    void audioIsForwardedInArrivalOrder() {
        registry.createSession("s1", new RecordingClientSink());
        registry.configure("s1", PCM16_16K);

        registry.appendAudio("s1", new byte[]{1, 0});
        registry.appendAudio("s1", new byte[]{2, 0, 2, 0});
        registry.appendAudio("s1", new byte[]{3, 0});

        FakeTranscriptionBackend.FakeConnection connection = backend.connection("s1");
        assertThat(connection.frames()).extracting(f -> f[0]).containsExactly((byte) 1, (byte) 2, (byte) 3);
        assertThat(registry.get("s1").audioBytesReceived()).isEqualTo(8);
        assertThat(meterRegistry.get("funnel.relay.audio.bytes").counter().count()).isEqualTo(8.0);
    }

    @Test
    void audioBeforeReadyIsDroppedAndCounted() {
        registry.createSession("s1", new RecordingClientSink());

        registry.appendAudio("s1", new byte[320]);

        assertThat(registry.get("s1").framesRejected()).isEqualTo(1);
        assertThat(registry.get("s1").audioBytesReceived()).isZero();
        Counter rejected = meterRegistry.find("funnel.relay.frames.rejected").tag("reason", "not_ready").counter();
        assertThat(rejected).isNotNull();
        assertThat(rejected.count()).isEqualTo(1.0);
    }

    @Test
    void audioAfterFinalizeIsDropped() {
        registry.createSession("s1", new RecordingClientSink());
        registry.configure("s1", PCM16_16K);
        registry.finalize("s1");

        registry.appendAudio("s1", new byte[320]);

        assertThat(registry.get("s1").framesRejected()).isEqualTo(1);
        assertThat(meterRegistry.find("funnel.relay.frames.rejected").tag("reason", "finalizing").counter())
                .isNotNull();
    }

    @Test
    void frameQueuedBehindCloseStreamIsRejectedAndCounted() throws Exception {
        Queue<Runnable> queued = new ConcurrentLinkedQueue<>();
        SessionRegistry manual = registryOn(queued::add);
        manual.createSession("s1", new RecordingClientSink());
        manual.configure("s1", PCM16_16K);
        runAll(queued);
        assertThat(manual.get("s1").state()).isEqualTo(RecordingState.STREAMING);
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<AssembledTranscript> pending = caller.submit(() -> manual.finalize("s1"));
            await().pollDelay(Duration.ZERO).pollInterval(Duration.ofMillis(5)).atMost(Duration.ofSeconds(2))
                    .until(() -> !queued.isEmpty());

            // Still FINALIZING with an open connection, so the frame lands on the mailbox after close-stream
            manual.appendAudio("s1", new byte[320]);
            await().pollDelay(Duration.ZERO).pollInterval(Duration.ofMillis(5)).atMost(Duration.ofSeconds(2))
                    .until(() -> {
                        runAll(queued);
                        return pending.isDone();
                    });

            AssembledTranscript result = pending.get();
            assertThat(result.timedOut()).isFalse();
            assertThat(result.audioBytesReceived()).isZero();
        } finally {
            caller.shutdownNow();
        }
        assertThat(backend.connection("s1").frames()).isEmpty();
        assertThat(manual.get("s1").framesRejected()).isEqualTo(1);
        assertThat(manual.get("s1").bytesArrived()).isEqualTo(320);
        assertThat(meterRegistry.get("funnel.relay.frames.rejected").tag("reason", "finalizing").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void frameRefusedByBackendIsCountedAndFailsSession() {
        registry.createSession("s1", new RecordingClientSink());
        registry.configure("s1", PCM16_16K);
        backend.connection("s1").closeStream();

        registry.appendAudio("s1", new byte[320]);

        RelaySession session = registry.get("s1");
        assertThat(session.framesRejected()).isEqualTo(1);
        assertThat(session.audioBytesReceived()).isZero();
        assertThat(session.state()).isEqualTo(RecordingState.FAILED);
        assertThat(meterRegistry.get("funnel.relay.frames.rejected").tag("reason", "backend_unavailable")
                .counter().count()).isEqualTo(1.0);
    }

    private static void runAll(Queue<Runnable> queued) {
        Runnable task;
        while ((task = queued.poll()) != null) {
            task.run();
        }
    }

    @Test
    void unknownSessionIsReported() {
        assertThatThrownBy(() -> registry.appendAudio("nope", new byte[2]))
                .isInstanceOf(UnknownSessionException.class);
        assertThatThrownBy(() -> registry.finalize("nope"))
                .isInstanceOf(UnknownSessionException.class);
    }

    @Test
    void backendConnectFailureFailsSession() {
        backend.failingConnects();
        RecordingClientSink sink = new RecordingClientSink();
        registry.createSession("s1", sink);

        registry.configure("s1", PCM16_16K);

        RelaySession session = registry.get("s1");
        assertThat(session.state()).isEqualTo(RecordingState.FAILED);
        assertThat(session.failureReason()).isEqualTo("backend_unavailable");
        assertThat(sink.eventsOfType(TranscriptEvent.Type.ERROR))
                .singleElement()
                .extracting(TranscriptEvent::message)
                .isEqualTo("Transcription service unavailable");
        assertThat(publisher.eventsOfType(SessionFailedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.role()).isEqualTo(SessionFailedEvent.ROLE_RELAY));
        assertThatThrownBy(() -> registry.appendAudio("s1", new byte[2]))
                .isInstanceOf(BackendUnavailableException.class);
    }

    @Test
    void transcriptEventsCarryRunningTranscriptOfFinalSegmentsOnly() {
        RecordingClientSink sink = new RecordingClientSink();
        registry.createSession("s1", sink);
        registry.configure("s1", PCM16_16K);

        registry.appendTranscript("s1", TranscriptSegment.finalSegment("hello", 0.9, 0.0, 0.5));
        registry.appendTranscript("s1", new TranscriptSegment("wor", 0.4, 0.5, 0.7, false));
        registry.appendTranscript("s1", TranscriptSegment.finalSegment("world", 0.95, 0.5, 1.0));

        assertThat(sink.eventsOfType(TranscriptEvent.Type.TRANSCRIPT))
                .extracting(TranscriptEvent::fullTranscript)
                .containsExactly("hello", "hello", "hello world");
        assertThat(registry.get("s1").segmentCount()).isEqualTo(3);
    }

    @Test
    void backendMetadataIsForwardedToClient() {
        RecordingClientSink sink = new RecordingClientSink();
        registry.createSession("s1", sink);
        registry.configure("s1", PCM16_16K);

        backend.connection("s1").listener().onMetadata(2.5);

        assertThat(sink.eventsOfType(TranscriptEvent.Type.METADATA))
                .singleElement()
                .extracting(TranscriptEvent::durationSeconds)
                .isEqualTo(2.5);
    }

    @Test
    void backendClosingMidStreamFailsSession() {
        RecordingClientSink sink = new RecordingClientSink();
        registry.createSession("s1", sink);
        registry.configure("s1", PCM16_16K);

        backend.connection("s1").listener().onClosed(1011, "internal error");

        assertThat(registry.get("s1").state()).isEqualTo(RecordingState.FAILED);
        assertThat(registry.get("s1").failureReason()).isEqualTo("backend_closed");
        assertThat(sink.eventsOfType(TranscriptEvent.Type.ERROR)).hasSize(1);
        assertThat(sink.isOpen()).isFalse();
    }

    @Test
    void clientDisconnectMidStreamFailsSessionAndReleasesBackend() {
        registry.createSession("s1", new RecordingClientSink());
        registry.configure("s1", PCM16_16K);

        registry.onClientDisconnected("s1", 1006);

        RelaySession session = registry.get("s1");
        assertThat(session.state()).isEqualTo(RecordingState.FAILED);
        assertThat(session.failureReason()).isEqualTo("connection_lost");
        assertThat(session.isClientAttached()).isFalse();
        assertThat(backend.connection("s1").isClosed()).isTrue();
        assertThat(meterRegistry.find("funnel.relay.sessions.failed").tag("reason", "connection_lost").counter())
                .isNotNull();
    }

    @Test
    void clientDisconnectAfterCompletionKeepsResult() {
        registry.createSession("s1", new RecordingClientSink());
        registry.configure("s1", PCM16_16K);
        registry.finalize("s1");

        registry.onClientDisconnected("s1", 1000);

        assertThat(registry.get("s1").state()).isEqualTo(RecordingState.COMPLETED);
    }

    @Test
    void sessionsAreIsolated() {
        RecordingClientSink sinkA = new RecordingClientSink();
        RecordingClientSink sinkB = new RecordingClientSink();
        registry.createSession("a", sinkA);
        registry.createSession("b", sinkB);
        registry.configure("a", PCM16_16K);
        registry.configure("b", PCM16_16K);

        registry.appendAudio("a", new byte[640]);
        registry.appendTranscript("a", TranscriptSegment.finalSegment("only a", 0.9, 0.0, 0.02));
        backend.connection("a").listener().onError(new IllegalStateException("boom"));

        assertThat(registry.get("a").state()).isEqualTo(RecordingState.FAILED);
        assertThat(registry.get("b").state()).isEqualTo(RecordingState.STREAMING);
        assertThat(backend.connection("b").bytesReceived()).isZero();
        assertThat(sinkB.eventsOfType(TranscriptEvent.Type.TRANSCRIPT)).isEmpty();
        assertThat(sinkB.eventsOfType(TranscriptEvent.Type.ERROR)).isEmpty();
        assertThat(registry.activeSessions()).isEqualTo(1);
    }

    @Test
    void terminalSessionsAreEvictedAfterRetention() {
        registry.createSession("done", new RecordingClientSink());
        registry.configure("done", PCM16_16K);
        registry.finalize("done");
        registry.createSession("live", new RecordingClientSink());

        assertThat(registry.evictExpired(Instant.now())).isZero();
        int evicted = registry.evictExpired(Instant.now().plus(Duration.ofSeconds(61)));

        assertThat(evicted).isEqualTo(1);
        assertThat(registry.find("done")).isEmpty();
        assertThat(registry.find("live")).isPresent();
        assertThatThrownBy(() -> registry.finalize("done")).isInstanceOf(UnknownSessionException.class);
    }

    @Test
    void activeSessionsGaugeTracksNonTerminalSessions() {
        registry.createSession("s1", new RecordingClientSink());
        registry.createSession("s2", new RecordingClientSink());

        assertThat(meterRegistry.get("funnel.relay.sessions.active").gauge().value()).isEqualTo(2.0);
        assertThat(meterRegistry.get("funnel.relay.sessions.created").counter().count()).isEqualTo(2.0);
    }
}
