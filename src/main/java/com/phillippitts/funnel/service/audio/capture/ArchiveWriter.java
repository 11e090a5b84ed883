package com.phillippitts.funnel.service.audio.capture;

import com.phillippitts.funnel.service.audio.AudioFrame;
import com.phillippitts.funnel.service.audio.archive.ArchiveSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Moves archival off the capture thread.
 *
 * <p>The capture thread calls {@link #offer(AudioFrame)}, which never blocks. A dedicated
 * {@code audio-archive} thread opens the sink, writes frames in order and closes the sink after
 * {@link #finish()}. A full queue drops the frame; an open or write failure disables archival
 * for the rest of the capture.
 */
class ArchiveWriter {

    private static final Logger LOG = LogManager.getLogger(ArchiveWriter.class);

    private static final long POLL_MILLIS = 50;

    private final String sessionId;
    private final StreamingAudioCaptureService.ArchiveProvider provider;
    private final BlockingQueue<AudioFrame> queue;
    private final AtomicLong framesDropped = new AtomicLong();

    private volatile boolean finishing;
    private volatile boolean disabled;
    private volatile Thread thread;

    ArchiveWriter(String sessionId, StreamingAudioCaptureService.ArchiveProvider provider, int capacity) {
        this.sessionId = Objects.requireNonNull(sessionId);
        this.provider = Objects.requireNonNull(provider);
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    void start() {
        Thread t = new Thread(this::run, "audio-archive");
        t.setDaemon(true);
        thread = t;
        t.start();
    }

    /**
     * Enqueues a frame for archival without blocking.
     *
     * @return {@code false} if the frame was not queued
     */
    boolean offer(AudioFrame frame) {
        if (disabled || finishing) {
            return false;
        }
        if (queue.offer(frame)) {
            return true;
        }
        long dropped = framesDropped.incrementAndGet();
        if (dropped == 1 || dropped % 50 == 0) {
            LOG.warn("Archive queue full for {}; {} frames not archived", sessionId, dropped);
        }
        return false;
    }

    /** Stops accepting frames; the writer thread archives what is queued and closes the sink. */
    void finish() {
        finishing = true;
    }

    long framesDropped() {
        return framesDropped.get();
    }

    boolean isDisabled() {
        return disabled;
    }

    Thread thread() {
        return thread;
    }

    private void run() {
        ThreadContext.put("sessionId", sessionId);
        ArchiveSink sink = null;
        try {
            sink = provider.open(sessionId);
            while (true) {
                AudioFrame frame = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (frame == null) {
                    if (finishing) {
                        break;
                    }
                    continue;
                }
                sink.write(frame);
            }
        } catch (IOException | RuntimeException e) {
            LOG.warn("Archival disabled for {}: {}", sessionId, e.getMessage());
            disable();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Archive writer for {} interrupted", sessionId);
            disable();
        } finally {
            close(sink);
            ThreadContext.remove("sessionId");
        }
    }

    private void disable() {
        disabled = true;
        queue.clear();
    }

    private void close(ArchiveSink sink) {
        if (sink == null) {
            return;
        }
        try {
            sink.close();
        } catch (IOException e) {
            LOG.warn("Failed to close archive for {}: {}", sessionId, e.getMessage());
        }
    }
}
