package com.phillippitts.funnel.service.audio.source;

import com.phillippitts.funnel.service.audio.AudioFormat;
import com.phillippitts.funnel.service.audio.PcmEncoder;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Live microphone source backed by a Java Sound {@link TargetDataLine}.
 *
 * <p>The line is opened as 16-bit signed little-endian mono at the configured rate. If the
 * device only delivers interleaved multi-channel audio, the first channel is kept.
 */
public class MicrophoneAudioSource implements AudioSource {

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final int sampleRate;
    private final String deviceName;
    private final DataLineProvider provider;

    public MicrophoneAudioSource(int sampleRate, String deviceName) {
        this(sampleRate, deviceName, defaultProvider());
    }

    public MicrophoneAudioSource(int sampleRate, String deviceName, DataLineProvider provider) {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive");
        }
        this.sampleRate = sampleRate;
        this.deviceName = deviceName;
        this.provider = Objects.requireNonNull(provider);
    }

    @Override
    public String name() {
        return "microphone(" + (deviceName != null ? deviceName : "default") + ")";
    }

    @Override
    public int sampleRate() {
        return sampleRate;
    }

    @Override
    public boolean isLive() {
        return true;
    }

    @Override
    public SampleStream open() throws LineUnavailableException {
        TargetDataLine line = provider.open(AudioFormat.javaSoundFormat(sampleRate), Optional.ofNullable(deviceName));
        line.start();
        return new LineSampleStream(line);
    }

    static DataLineProvider defaultProvider() {
        return (format, device) -> {
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    private static final class LineSampleStream implements SampleStream {
        private final TargetDataLine line;
        private final int channels;
        private byte[] bytes = new byte[0];

        LineSampleStream(TargetDataLine line) {
            this.line = line;
            this.channels = Math.max(1, line.getFormat().getChannels());
        }

        @Override
        public int read(float[] buffer) {
            int wanted = buffer.length * 2 * channels;
            if (bytes.length != wanted) {
                bytes = new byte[wanted];
            }
            int n = line.read(bytes, 0, wanted);
            if (n <= 0) {
                return line.isOpen() ? 0 : -1;
            }
            float[] decoded = PcmEncoder.decodeFirstChannel(bytes, n, channels);
            System.arraycopy(decoded, 0, buffer, 0, decoded.length);
            return decoded.length;
        }

        @Override
        public void close() throws IOException {
            try {
                line.stop();
            } finally {
                line.close();
            }
        }
    }
}
