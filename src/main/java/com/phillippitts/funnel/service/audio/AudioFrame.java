package com.phillippitts.funnel.service.audio;

import java.util.Objects;

/**
 * One chunk of captured audio in wire format, plus its loudness.
 *
 * <p>Carries no sequence number: order is given by the single connection a session owns.
 *
 * @param pcm         PCM16LE mono bytes
 * @param sampleCount number of samples in {@code pcm}
 * @param level       loudness in [0, 1], see {@link LoudnessMeter}
 */
public record AudioFrame(byte[] pcm, int sampleCount, double level) {

    public AudioFrame {
        Objects.requireNonNull(pcm, "pcm must not be null");
        if (pcm.length != sampleCount * 2) {
            throw new IllegalArgumentException(
                    "pcm length " + pcm.length + " does not match " + sampleCount + " samples");
        }
    }

    /** Encodes {@code count} float samples into a frame. */
    public static AudioFrame fromSamples(float[] samples, int count) {
        byte[] pcm = PcmEncoder.encode(samples, count);
        return new AudioFrame(pcm, count, LoudnessMeter.level(pcm, pcm.length));
    }

    public int byteLength() {
        return pcm.length;
    }
}
