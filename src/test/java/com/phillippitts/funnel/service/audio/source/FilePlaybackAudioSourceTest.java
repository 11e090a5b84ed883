package com.phillippitts.funnel.service.audio.source;

import com.phillippitts.funnel.exception.EncodingFailureException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FilePlaybackAudioSourceTest {

    @TempDir
    Path dir;

    private Path writeWav(String name, float sampleRate, int channels, short value, int frames) throws Exception {
        AudioFormat format = new AudioFormat(sampleRate, 16, channels, true, false);
        byte[] pcm = new byte[frames * 2 * channels];
        for (int i = 0; i < pcm.length; i += 2) {
            pcm[i] = (byte) (value & 0xFF);
            pcm[i + 1] = (byte) ((value >> 8) & 0xFF);
        }
        Path file = dir.resolve(name);
        try (AudioInputStream in = new AudioInputStream(new ByteArrayInputStream(pcm), format, frames)) {
            AudioSystem.write(in, AudioFileFormat.Type.WAVE, file.toFile());
        }
        return file;
    }

    @Test
    void reportsNativeRateAndIsNotLive() throws Exception {
        FilePlaybackAudioSource source = new FilePlaybackAudioSource(writeWav("a.wav", 22_050f, 1, (short) 0, 100), false);

        assertThat(source.sampleRate()).isEqualTo(22_050);
        assertThat(source.isLive()).isFalse();
        assertThat(source.name()).isEqualTo("file(a.wav)");
    }

    @Test
    void readsAllSamplesThenSignalsEnd() throws Exception {
        FilePlaybackAudioSource source = new FilePlaybackAudioSource(writeWav("b.wav", 16_000f, 1, (short) 16_384, 2500), false);
        float[] buf = new float[1000];
        int total = 0;

        try (SampleStream stream = source.open()) {
            int n;
            while ((n = stream.read(buf)) > 0) {
                assertThat(buf[0]).isCloseTo(0.5f, within(0.001f));
                total += n;
            }
            assertThat(n).isEqualTo(-1);
        }

        assertThat(total).isEqualTo(2500);
    }

    @Test
    void stereoFilesAreDownmixedToFirstChannel() throws Exception {
        FilePlaybackAudioSource source = new FilePlaybackAudioSource(writeWav("c.wav", 16_000f, 2, (short) -16_384, 400), false);
        float[] buf = new float[400];

        try (SampleStream stream = source.open()) {
            assertThat(stream.read(buf)).isEqualTo(400);
        }

        assertThat(buf[399]).isCloseTo(-0.5f, within(0.001f));
    }

    @Test
    void realtimePacingTakesAboutTheFileDuration() throws Exception {
        // 200ms of audio
        FilePlaybackAudioSource source = new FilePlaybackAudioSource(writeWav("d.wav", 16_000f, 1, (short) 0, 3200), true);
        float[] buf = new float[800];
        long start = System.nanoTime();

        try (SampleStream stream = source.open()) {
            while (stream.read(buf) > 0) {
                // drain
            }
        }

        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;
        assertThat(elapsedMs).isGreaterThanOrEqualTo(150);
    }

    @Test
    void unreadableFileIsRejected() throws Exception {
        Path bogus = dir.resolve("bogus.wav");
        Files.writeString(bogus, "not audio");

        assertThatThrownBy(() -> new FilePlaybackAudioSource(bogus, false))
                .isInstanceOf(EncodingFailureException.class)
                .hasMessageContaining("bogus.wav");
    }
}
