package com.phillippitts.funnel.service.relay;

import com.phillippitts.funnel.domain.AssembledTranscript;
import com.phillippitts.funnel.domain.RecordingState;
import com.phillippitts.funnel.domain.StreamConfig;
import com.phillippitts.funnel.domain.TranscriptEvent;
import com.phillippitts.funnel.domain.TranscriptSegment;
import com.phillippitts.funnel.service.backend.BackendConnection;
import com.phillippitts.funnel.service.orchestration.RecordingStateMachine;
import com.phillippitts.funnel.util.SerialExecutor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Relay-side state of one recording session.
 *
 * <p>All mutation of the segment buffer and all traffic on the backend connection runs on the
 * session's {@link #mailbox()}, one task at a time, in submission order. Counters and state that
 * other threads read (status endpoint, sweeper) are atomics or volatile.
 */
public final class RelaySession {

    private final String id;
    private final RecordingStateMachine stateMachine;
    private final SerialExecutor mailbox;
    private final Instant createdAt;
    private final List<TranscriptSegment> segments = new ArrayList<>();
    private final AtomicLong audioBytesReceived = new AtomicLong();
    private final AtomicLong framesRejected = new AtomicLong();
    private final AtomicReference<StreamConfig> config = new AtomicReference<>();
    private final CompletableFuture<Double> metadata = new CompletableFuture<>();
    private final AtomicReference<CompletableFuture<AssembledTranscript>> finalizeResult = new AtomicReference<>();
    private final AtomicBoolean connectionReleased = new AtomicBoolean(false);
    private final AtomicBoolean inputClosed = new AtomicBoolean(false);
    private final Object arrivalLock = new Object();
    private long bytesArrived;
    private boolean clientGone;

    private volatile ClientEventSink client;
    private volatile BackendConnection connection;
    private volatile Instant startedAt;
    private volatile Instant endedAt;
    private volatile Instant terminalAt;
    private volatile FinalizePhase phase = FinalizePhase.NOT_STARTED;
    private volatile int segmentCount;
    private volatile String failureReason;

    RelaySession(String id, ClientEventSink client, Executor pool) {
        this.id = id;
        this.client = client;
        this.stateMachine = new RecordingStateMachine(id, RecordingState.CONNECTING);
        this.mailbox = new SerialExecutor(pool, Map.of("sessionId", id));
        this.createdAt = Instant.now();
    }

    public String id() {
        return id;
    }

    public RecordingState state() {
        return stateMachine.state();
    }

    RecordingStateMachine stateMachine() {
        return stateMachine;
    }

    SerialExecutor mailbox() {
        return mailbox;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    void startedAt(Instant at) {
        this.startedAt = at;
    }

    public Instant endedAt() {
        return endedAt;
    }

    void endedAt(Instant at) {
        this.endedAt = at;
    }

    public Instant terminalAt() {
        return terminalAt;
    }

    void markTerminal() {
        if (terminalAt == null) {
            terminalAt = Instant.now();
        }
    }

    public FinalizePhase phase() {
        return phase;
    }

    void phase(FinalizePhase phase) {
        this.phase = phase;
    }

    public long audioBytesReceived() {
        return audioBytesReceived.get();
    }

    void addAudioBytes(int n) {
        audioBytesReceived.addAndGet(n);
    }

    /** Bytes the client has sent so far, whether forwarded or rejected. */
    public long bytesArrived() {
        synchronized (arrivalLock) {
            return bytesArrived;
        }
    }

    void recordArrival(int n) {
        synchronized (arrivalLock) {
            bytesArrived += n;
            arrivalLock.notifyAll();
        }
    }

    /**
     * Blocks until at least {@code expected} bytes have arrived from the client, the client
     * detaches, or the timeout elapses.
     *
     * @return {@code true} if the expected byte count arrived
     */
    boolean awaitArrivals(long expected, long timeoutNanos) throws InterruptedException {
        long deadline = System.nanoTime() + timeoutNanos;
        synchronized (arrivalLock) {
            while (bytesArrived < expected) {
                long remaining = deadline - System.nanoTime();
                if (clientGone || remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(arrivalLock, remaining);
            }
            return true;
        }
    }

    /** Marks the backend input closed; frames still queued on the mailbox are rejected. */
    void closeInput() {
        inputClosed.set(true);
    }

    boolean isInputClosed() {
        return inputClosed.get();
    }

    public long framesRejected() {
        return framesRejected.get();
    }

    long rejectFrame() {
        return framesRejected.incrementAndGet();
    }

    public int segmentCount() {
        return segmentCount;
    }

    public String failureReason() {
        return failureReason;
    }

    void failureReason(String reason) {
        if (failureReason == null) {
            failureReason = reason;
        }
    }

    public StreamConfig config() {
        return config.get();
    }

    /** @return {@code false} if a config was already set */
    boolean setConfig(StreamConfig streamConfig) {
        return config.compareAndSet(null, streamConfig);
    }

    BackendConnection connection() {
        return connection;
    }

    void connection(BackendConnection connection) {
        this.connection = connection;
    }

    CompletableFuture<Double> metadata() {
        return metadata;
    }

    CompletableFuture<AssembledTranscript> finalizeResult() {
        return finalizeResult.get();
    }

    /** @return {@code true} if {@code future} became this session's finalize result */
    boolean claimFinalize(CompletableFuture<AssembledTranscript> future) {
        return finalizeResult.compareAndSet(null, future);
    }

    // Mailbox-only below

    void appendSegment(TranscriptSegment segment) {
        segments.add(segment);
        segmentCount = segments.size();
    }

    List<TranscriptSegment> segments() {
        return List.copyOf(segments);
    }

    String runningTranscript() {
        return TranscriptAssembler.assemble(segments);
    }

    // Client connection

    void sendToClient(TranscriptEvent event) {
        ClientEventSink sink = client;
        if (sink != null && sink.isOpen()) {
            sink.send(event);
        }
    }

    void closeClientWithError(String reason) {
        ClientEventSink sink = client;
        if (sink != null && sink.isOpen()) {
            sink.closeWithError(reason);
        }
    }

    void detachClient() {
        client = null;
        synchronized (arrivalLock) {
            clientGone = true;
            arrivalLock.notifyAll();
        }
    }

    boolean isClientAttached() {
        return client != null;
    }

    /** Closes the backend connection; only the first call has an effect. */
    void releaseConnection() {
        if (connectionReleased.compareAndSet(false, true)) {
            BackendConnection c = connection;
            if (c != null) {
                c.close();
            }
        }
    }

    boolean isConnectionReleased() {
        return connectionReleased.get();
    }
}
