package com.phillippitts.funnel.service.audio.source;

import com.phillippitts.funnel.exception.EncodingFailureException;
import com.phillippitts.funnel.service.audio.PcmEncoder;

import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Plays back an audio file (any format Java Sound can decode, typically WAV) as a sample stream.
 *
 * <p>Used for deterministic runs without a microphone. With {@code realtime} pacing the stream
 * blocks so samples are delivered no faster than the file's own rate, which makes it
 * indistinguishable from a live device to everything downstream.
 */
public class FilePlaybackAudioSource implements AudioSource {

    private final Path file;
    private final boolean realtime;
    private final javax.sound.sampled.AudioFormat fileFormat;

    /**
     * @throws EncodingFailureException if the file cannot be read or is not a supported audio format
     */
    public FilePlaybackAudioSource(Path file, boolean realtime) {
        this.file = Objects.requireNonNull(file, "file");
        this.realtime = realtime;
        try {
            this.fileFormat = AudioSystem.getAudioFileFormat(file.toFile()).getFormat();
        } catch (UnsupportedAudioFileException | IOException e) {
            throw new EncodingFailureException("Unreadable audio file: " + file.getFileName(), e);
        }
    }

    @Override
    public String name() {
        return "file(" + file.getFileName() + ")";
    }

    @Override
    public int sampleRate() {
        return Math.round(fileFormat.getSampleRate());
    }

    @Override
    public boolean isLive() {
        return false;
    }

    @Override
    public SampleStream open() throws IOException {
        AudioInputStream source;
        try {
            source = AudioSystem.getAudioInputStream(file.toFile());
        } catch (UnsupportedAudioFileException e) {
            throw new IOException("Unsupported audio file: " + file.getFileName(), e);
        }
        javax.sound.sampled.AudioFormat in = source.getFormat();
        javax.sound.sampled.AudioFormat pcm16 = new javax.sound.sampled.AudioFormat(
                javax.sound.sampled.AudioFormat.Encoding.PCM_SIGNED,
                in.getSampleRate(), 16, in.getChannels(), 2 * in.getChannels(), in.getSampleRate(), false);
        AudioInputStream converted;
        try {
            converted = in.matches(pcm16) ? source : AudioSystem.getAudioInputStream(pcm16, source);
        } catch (IllegalArgumentException e) {
            source.close();
            throw new EncodingFailureException("Cannot convert " + in + " to 16-bit PCM", e);
        }
        return new FileSampleStream(converted, in.getChannels(), in.getSampleRate(), realtime);
    }

    private static final class FileSampleStream implements SampleStream {
        private final AudioInputStream in;
        private final int channels;
        private final float sampleRate;
        private final boolean realtime;
        private final long startNanos = System.nanoTime();
        private long samplesDelivered;
        private byte[] bytes = new byte[0];

        FileSampleStream(AudioInputStream in, int channels, float sampleRate, boolean realtime) {
            this.in = in;
            this.channels = Math.max(1, channels);
            this.sampleRate = sampleRate;
            this.realtime = realtime;
        }

        @Override
        public int read(float[] buffer) throws IOException {
            int frameBytes = 2 * channels;
            int wanted = buffer.length * frameBytes;
            if (bytes.length != wanted) {
                bytes = new byte[wanted];
            }
            int filled = 0;
            while (filled < wanted) {
                int n = in.read(bytes, filled, wanted - filled);
                if (n < 0) {
                    break;
                }
                filled += n;
            }
            int frames = filled / frameBytes;
            if (frames == 0) {
                return -1;
            }
            float[] decoded = PcmEncoder.decodeFirstChannel(bytes, frames * frameBytes, channels);
            System.arraycopy(decoded, 0, buffer, 0, decoded.length);
            samplesDelivered += decoded.length;
            pace();
            return decoded.length;
        }

        private void pace() throws IOException {
            if (!realtime) {
                return;
            }
            long dueNanos = (long) (samplesDelivered / (double) sampleRate * 1_000_000_000L);
            long waitMillis = (dueNanos - (System.nanoTime() - startNanos)) / 1_000_000L;
            if (waitMillis > 0) {
                try {
                    Thread.sleep(waitMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Interrupted during playback", e);
                }
            }
        }

        @Override
        public void close() throws IOException {
            in.close();
        }
    }
}
