package com.phillippitts.funnel.service.audio;

import com.phillippitts.funnel.exception.EncodingFailureException;

/**
 * Converts between normalized float samples and PCM16LE bytes.
 *
 * <p>Encoding maps {@code s} to {@code round(clamp(s, -1, 1) * 32767)}; NaN encodes as 0.
 * The output always holds exactly one 16-bit sample per input sample.
 *
 * @since 1.0
 */
public final class PcmEncoder {

    private static final int MAX_SAMPLE = 32_767;

    private PcmEncoder() {
        // Utility class
    }

    /**
     * Encodes float samples to little-endian signed 16-bit PCM.
     *
     * @param samples normalized samples, nominally in [-1.0, 1.0]
     * @return PCM16LE bytes, {@code 2 * samples.length} long
     * @throws EncodingFailureException if {@code samples} is null
     */
    public static byte[] encode(float[] samples) {
        if (samples == null) {
            throw new EncodingFailureException("Sample buffer is null");
        }
        return encode(samples, samples.length);
    }

    public static byte[] encode(float[] samples, int count) {
        if (samples == null) {
            throw new EncodingFailureException("Sample buffer is null");
        }
        if (count < 0 || count > samples.length) {
            throw new EncodingFailureException("Sample count " + count + " outside buffer of " + samples.length);
        }
        byte[] out = new byte[count * 2];
        for (int i = 0; i < count; i++) {
            short v = toPcm16(samples[i]);
            out[2 * i] = (byte) (v & 0xFF);
            out[2 * i + 1] = (byte) ((v >> 8) & 0xFF);
        }
        return out;
    }

    /** Maps one normalized sample to a 16-bit value. */
    public static short toPcm16(float sample) {
        if (Float.isNaN(sample)) {
            return 0;
        }
        float clamped = Math.max(-1.0f, Math.min(1.0f, sample));
        return (short) Math.round(clamped * MAX_SAMPLE);
    }

    /**
     * Decodes interleaved PCM16LE into normalized floats, keeping only the first channel.
     *
     * @param pcm      PCM16LE bytes
     * @param length   number of valid bytes in {@code pcm}
     * @param channels interleaved channel count of {@code pcm}
     * @return one float per frame, in [-1.0, 1.0]
     */
    public static float[] decodeFirstChannel(byte[] pcm, int length, int channels) {
        if (pcm == null || channels <= 0) {
            throw new EncodingFailureException("Invalid PCM buffer or channel count " + channels);
        }
        int frameBytes = 2 * channels;
        int frames = Math.min(length, pcm.length) / frameBytes;
        float[] out = new float[frames];
        for (int f = 0; f < frames; f++) {
            int i = f * frameBytes;
            int sample = (pcm[i] & 0xFF) | (pcm[i + 1] << 8);
            out[f] = Math.max(-1.0f, sample / (float) MAX_SAMPLE);
        }
        return out;
    }
}
