package com.phillippitts.funnel.domain;

import java.util.Objects;

/**
 * The one-time configuration frame a client sends before any audio.
 *
 * @param format     wire sample format, always {@value #PCM16} for this protocol
 * @param sampleRate rate of the PCM that follows, in Hz
 * @param channels   channel count, always 1
 */
public record StreamConfig(String format, int sampleRate, int channels) {

    public static final String PCM16 = "pcm16";

    public StreamConfig {
        Objects.requireNonNull(format, "format must not be null");
    }

    public static StreamConfig pcm16Mono(int sampleRate) {
        return new StreamConfig(PCM16, sampleRate, 1);
    }

    /** Bytes per second of audio described by this config (16-bit samples). */
    public int byteRate() {
        return sampleRate * channels * 2;
    }
}
