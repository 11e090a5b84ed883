package com.phillippitts.funnel.service.orchestration;

import com.phillippitts.funnel.domain.RecordingState;
import com.phillippitts.funnel.domain.TranscriptSegment;
import com.phillippitts.funnel.service.audio.source.AudioSource;
import com.phillippitts.funnel.service.transport.AudioFrameSender;
import com.phillippitts.funnel.service.transport.StreamConnection;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Client-side state of one recording attempt: lifecycle, timing, the resources it owns and the
 * segments received while streaming.
 */
final class RecordingSession {

    private final String id;
    private final AudioSource source;
    private final RecordingStateMachine stateMachine;
    private final CountDownLatch readyOrFailed = new CountDownLatch(1);
    private final List<TranscriptSegment> liveSegments = new CopyOnWriteArrayList<>();
    private final AtomicBoolean released = new AtomicBoolean(false);

    private volatile boolean ready;
    private volatile Instant startedAt;
    private volatile Instant endedAt;
    private volatile String failureReason;
    private volatile StreamConnection connection;
    private volatile AudioFrameSender sender;

    RecordingSession(String id, AudioSource source) {
        this.id = id;
        this.source = source;
        this.stateMachine = new RecordingStateMachine(id);
    }

    String id() {
        return id;
    }

    AudioSource source() {
        return source;
    }

    RecordingStateMachine stateMachine() {
        return stateMachine;
    }

    RecordingState state() {
        return stateMachine.state();
    }

    void markReady() {
        ready = true;
        readyOrFailed.countDown();
    }

    /** Wakes a thread blocked in {@link #awaitReady(Duration)} after a failure. */
    void markFailed(String reason) {
        if (failureReason == null) {
            failureReason = reason;
        }
        readyOrFailed.countDown();
    }

    /**
     * @return {@code true} if the ready event arrived within {@code timeout}
     */
    boolean awaitReady(Duration timeout) throws InterruptedException {
        readyOrFailed.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        return ready && failureReason == null;
    }

    boolean isReady() {
        return ready;
    }

    String failureReason() {
        return failureReason;
    }

    /**
     * Adds a segment to the live view. Earlier interim segments covering any of the same time
     * range are superseded and removed.
     */
    synchronized void addLiveSegment(TranscriptSegment segment) {
        liveSegments.removeIf(earlier -> !earlier.isFinal() && overlaps(earlier, segment));
        liveSegments.add(segment);
    }

    static boolean overlaps(TranscriptSegment a, TranscriptSegment b) {
        if (a.start() == b.start()) {
            return true;
        }
        return a.start() < b.end() && b.start() < a.end();
    }

    List<TranscriptSegment> liveSegments() {
        return List.copyOf(liveSegments);
    }

    Instant startedAt() {
        return startedAt;
    }

    void startedAt(Instant at) {
        this.startedAt = at;
    }

    Instant endedAt() {
        return endedAt;
    }

    void endedAt(Instant at) {
        this.endedAt = at;
    }

    StreamConnection connection() {
        return connection;
    }

    void connection(StreamConnection connection) {
        this.connection = connection;
    }

    AudioFrameSender sender() {
        return sender;
    }

    void sender(AudioFrameSender sender) {
        this.sender = sender;
    }

    /** @return {@code true} exactly once, for the caller that should release resources */
    boolean markReleased() {
        return released.compareAndSet(false, true);
    }
}
