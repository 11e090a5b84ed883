package com.phillippitts.funnel.service.transport;

import com.phillippitts.funnel.service.audio.AudioFrame;
import com.phillippitts.funnel.util.ThreadTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Hands frames from the capture thread to the network through a bounded queue.
 *
 * <p>{@link #offer(AudioFrame)} never blocks: when the queue is full the frame is dropped and
 * counted. A single {@code audio-sender} thread takes frames in order and writes them to the
 * connection, so outbound order equals capture order.
 *
 * <p>Stop sequence: {@link #drain(Duration)} sends everything already queued and then ends the
 * thread; {@link #cancel()} discards the queue. Both are idempotent.
 */
public class AudioFrameSender {

    private static final Logger LOG = LogManager.getLogger(AudioFrameSender.class);

    private static final long POLL_MILLIS = 50;

    private final String sessionId;
    private final StreamConnection connection;
    private final BlockingQueue<AudioFrame> queue;
    private final Consumer<Throwable> onSendFailure;
    private final AtomicLong framesSent = new AtomicLong();
    private final AtomicLong bytesSent = new AtomicLong();
    private final AtomicLong framesDropped = new AtomicLong();

    private volatile boolean draining;
    private volatile boolean canceled;
    private volatile Thread thread;

    public AudioFrameSender(StreamConnection connection, int capacity, Consumer<Throwable> onSendFailure) {
        this.connection = Objects.requireNonNull(connection);
        this.sessionId = connection.sessionId();
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.onSendFailure = Objects.requireNonNull(onSendFailure);
    }

    public synchronized void start() {
        if (thread != null) {
            throw new IllegalStateException("Sender already started");
        }
        Thread t = new Thread(this::run, "audio-sender");
        t.setDaemon(true);
        thread = t;
        t.start();
    }

    /**
     * Enqueues a frame without blocking.
     *
     * @return {@code false} if the frame was dropped (queue full, draining or canceled)
     */
    public boolean offer(AudioFrame frame) {
        if (draining || canceled) {
            return false;
        }
        if (queue.offer(frame)) {
            return true;
        }
        long dropped = framesDropped.incrementAndGet();
        if (dropped == 1 || dropped % 50 == 0) {
            LOG.warn("Outbound queue full for {}; dropped {} frames so far", sessionId, dropped);
        }
        return false;
    }

    /**
     * Stops accepting frames, sends everything queued, and waits for the sender thread to finish.
     *
     * @return {@code true} if every queued frame was handed to the connection within {@code timeout}
     */
    public boolean drain(Duration timeout) {
        draining = true;
        boolean done = ThreadTimeouts.join(thread, timeout);
        if (!done) {
            LOG.warn("Drain of {} did not finish within {}ms; {} frames left", sessionId,
                    timeout.toMillis(), queue.size());
        }
        return done && queue.isEmpty();
    }

    /** Discards queued frames and stops the sender thread. */
    public void cancel() {
        canceled = true;
        queue.clear();
        Thread t = thread;
        if (t != null && t != Thread.currentThread()) {
            t.interrupt();
            ThreadTimeouts.join(t, ThreadTimeouts.SENDER_CANCEL_TIMEOUT);
        }
    }

    public long framesSent() {
        return framesSent.get();
    }

    public long bytesSent() {
        return bytesSent.get();
    }

    public long framesDropped() {
        return framesDropped.get();
    }

    public int queued() {
        return queue.size();
    }

    private void run() {
        ThreadContext.put("sessionId", sessionId);
        try {
            while (!canceled) {
                AudioFrame frame = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (frame == null) {
                    if (draining) {
                        break;
                    }
                    continue;
                }
                connection.sendAudio(frame.pcm());
                framesSent.incrementAndGet();
                bytesSent.addAndGet(frame.byteLength());
            }
            LOG.debug("Sender finished: {} frames, {} bytes, {} dropped",
                    framesSent.get(), bytesSent.get(), framesDropped.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Sender interrupted after {} frames", framesSent.get());
        } catch (RuntimeException e) {
            LOG.warn("Sending audio failed after {} frames: {}", framesSent.get(), e.getMessage());
            queue.clear();
            if (!canceled) {
                onSendFailure.accept(e);
            }
        } finally {
            ThreadContext.remove("sessionId");
        }
    }
}
