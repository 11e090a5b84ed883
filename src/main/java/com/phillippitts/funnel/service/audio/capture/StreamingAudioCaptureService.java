package com.phillippitts.funnel.service.audio.capture;

import com.phillippitts.funnel.config.properties.AudioCaptureProperties;
import com.phillippitts.funnel.exception.EncodingFailureException;
import com.phillippitts.funnel.service.audio.AudioFormat;
import com.phillippitts.funnel.service.audio.AudioFrame;
import com.phillippitts.funnel.service.audio.archive.ArchiveSink;
import com.phillippitts.funnel.service.audio.archive.PcmFileArchiveSink;
import com.phillippitts.funnel.service.audio.source.AudioSource;
import com.phillippitts.funnel.service.audio.source.SampleStream;
import com.phillippitts.funnel.util.ThreadTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import jakarta.annotation.PreDestroy;
import javax.sound.sampled.LineUnavailableException;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Capture service that reads chunks from an {@link AudioSource}, encodes them to PCM16LE and hands
 * each frame to a consumer as soon as it is read.
 *
 * <p>Runs one daemon thread ({@code audio-capture}) per capture. The thread never blocks on
 * anything but the source itself: the consumer is expected to enqueue and return. Each frame is
 * also offered to an optional {@link ArchiveWriter}, which writes on its own thread; an archive
 * failure disables archival for the rest of the capture and is otherwise ignored.
 *
 * <p>Thread-safe for a single active capture.
 */
public class StreamingAudioCaptureService implements AudioCaptureService {

    private static final Logger LOG = LogManager.getLogger(StreamingAudioCaptureService.class);

    /** Abstraction to open an archive for a session (for testing). */
    public interface ArchiveProvider {
        ArchiveSink open(String sessionId) throws IOException;
    }

    private final AudioCaptureProperties props;
    private final ApplicationEventPublisher publisher;
    private final ArchiveProvider archiveProvider;

    private final Object lock = new Object();
    private Session current;
    private volatile double level;

    public StreamingAudioCaptureService(AudioCaptureProperties props, ApplicationEventPublisher publisher) {
        this(props, publisher, defaultArchiveProvider(props));
    }

    // Package-private for tests
    StreamingAudioCaptureService(AudioCaptureProperties props,
                                 ApplicationEventPublisher publisher,
                                 ArchiveProvider archiveProvider) {
        this.props = Objects.requireNonNull(props);
        this.publisher = Objects.requireNonNull(publisher);
        this.archiveProvider = archiveProvider;
    }

    private static ArchiveProvider defaultArchiveProvider(AudioCaptureProperties props) {
        if (props.getArchiveDir() == null) {
            return null;
        }
        Path dir = Path.of(props.getArchiveDir());
        return sessionId -> PcmFileArchiveSink.open(dir, sessionId);
    }

    @PreDestroy
    public void shutdown() {
        Thread captureThread = null;
        synchronized (lock) {
            if (current != null && current.active.get()) {
                LOG.info("Shutting down with active capture {}; forcing cleanup", current.id);
                current.canceled = true;
                current.active.set(false);
                captureThread = current.thread;
                current = null;
            }
        }
        // Join thread outside lock to avoid deadlock
        ThreadTimeouts.join(captureThread, ThreadTimeouts.CAPTURE_THREAD_SHUTDOWN_TIMEOUT);
    }

    @Override
    public void startCapture(String sessionId, AudioSource source, Consumer<AudioFrame> frames) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(frames, "frames");
        synchronized (lock) {
            if (current != null && current.active.get()) {
                throw new IllegalStateException("Another capture is already active: " + current.id);
            }
            Session s = new Session(sessionId, source, frames);
            s.active.set(true);
            Thread t = new Thread(() -> doCapture(s), "audio-capture");
            t.setDaemon(true);
            s.thread = t;
            current = s;
            t.start();
        }
    }

    @Override
    public void stopCapture(String sessionId) {
        Thread captureThread;
        synchronized (lock) {
            if (current == null || !current.id.equals(sessionId)) {
                return;
            }
            current.active.set(false);
            captureThread = current.thread;
        }
        // Join outside the lock so the last chunk is delivered before the caller drains
        if (!ThreadTimeouts.join(captureThread, ThreadTimeouts.CAPTURE_THREAD_STOP_TIMEOUT)) {
            LOG.warn("Capture thread did not terminate within {}ms",
                    ThreadTimeouts.CAPTURE_THREAD_STOP_TIMEOUT.toMillis());
        }
        synchronized (lock) {
            if (current != null && current.id.equals(sessionId)) {
                current = null;
            }
        }
        level = 0.0;
    }

    @Override
    public void cancelCapture(String sessionId) {
        synchronized (lock) {
            if (current == null || !current.id.equals(sessionId)) {
                return;
            }
            current.canceled = true;
            current.active.set(false);
            current = null;
        }
        level = 0.0;
    }

    @Override
    public boolean isCapturing() {
        synchronized (lock) {
            return current != null && current.active.get();
        }
    }

    @Override
    public double currentLevel() {
        return level;
    }

    private void doCapture(Session s) {
        ThreadContext.put("sessionId", s.id);
        ArchiveWriter archive = startArchive(s.id);
        int samplesPerChunk = AudioFormat.samplesPerChunk(s.source.sampleRate(), props.getChunkMillis());
        float[] buf = new float[samplesPerChunk];
        long frames = 0;
        long samples = 0;
        try (SampleStream stream = s.source.open()) {
            LOG.info("Audio capture started: source={}, rate={}Hz, chunk={}ms",
                    s.source.name(), s.source.sampleRate(), props.getChunkMillis());
            while (s.active.get()) {
                int n = stream.read(buf);
                if (n < 0) {
                    LOG.info("Audio source {} reached end of stream", s.source.name());
                    break;
                }
                if (n == 0 || s.canceled) {
                    continue;
                }
                AudioFrame frame = AudioFrame.fromSamples(buf, n);
                level = frame.level();
                s.frames.accept(frame);
                if (archive != null) {
                    archive.offer(frame);
                }
                frames++;
                samples += n;
            }
            LOG.info("Audio capture completed: {} frames, {} samples", frames, samples);
        } catch (LineUnavailableException e) {
            LOG.warn("Microphone unavailable: {}", e.getMessage());
            publishError(s, CaptureErrorEvent.MIC_UNAVAILABLE);
        } catch (SecurityException se) {
            LOG.warn("Microphone access denied: {}", se.getMessage());
            publishError(s, CaptureErrorEvent.MIC_PERMISSION_DENIED);
        } catch (EncodingFailureException ee) {
            LOG.warn("Audio encoding failed: {}", ee.getMessage());
            publishError(s, CaptureErrorEvent.ENCODING_FAILURE);
        } catch (Exception e) {
            LOG.warn("Capture failed: {}", e.toString());
            publishError(s, CaptureErrorEvent.CAPTURE_ERROR);
        } finally {
            s.active.set(false);
            if (archive != null) {
                archive.finish();
            }
            ThreadContext.remove("sessionId");
        }
    }

    private void publishError(Session s, String reason) {
        if (s.canceled) {
            LOG.debug("Capture {} already canceled; not publishing {}", s.id, reason);
            return;
        }
        publisher.publishEvent(new CaptureErrorEvent(s.id, reason, Instant.now()));
    }

    private ArchiveWriter startArchive(String sessionId) {
        if (archiveProvider == null) {
            return null;
        }
        ArchiveWriter writer = new ArchiveWriter(sessionId, archiveProvider, props.getQueueCapacity());
        writer.start();
        return writer;
    }

    private static final class Session {
        final String id;
        final AudioSource source;
        final Consumer<AudioFrame> frames;
        final AtomicBoolean active = new AtomicBoolean(false);
        volatile boolean canceled = false;
        volatile Thread thread;

        Session(String id, AudioSource source, Consumer<AudioFrame> frames) {
            this.id = id;
            this.source = source;
            this.frames = frames;
        }
    }
}
