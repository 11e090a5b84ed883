package com.phillippitts.funnel.service.audio;

/**
 * Single source of truth for the wire audio format.
 * Always 16-bit signed PCM, mono, little-endian; the sample rate is declared per session.
 */
public final class AudioFormat {

    /** Default capture sample rate in Hz. */
    public static final int DEFAULT_SAMPLE_RATE = 16_000;
    /** Wire bits per sample. */
    public static final int BITS_PER_SAMPLE = 16;
    /** Wire channel count (mono). */
    public static final int CHANNELS = 1;

    /** Signed PCM flag for Java Sound. */
    public static final boolean SIGNED = true;
    /** Endian flag for Java Sound (false = little-endian). */
    public static final boolean BIG_ENDIAN = false;

    /** Bytes per PCM frame (sample for all channels). */
    public static final int BLOCK_ALIGN = (BITS_PER_SAMPLE / 8) * CHANNELS; // 2 bytes

    /** Largest PCM16 magnitude, used as the loudness reference. */
    public static final double MAX_AMPLITUDE = 32_768.0;

    private AudioFormat() {}

    /** Bytes per second at the given sample rate. */
    public static int byteRate(int sampleRate) {
        return sampleRate * BLOCK_ALIGN;
    }

    /** Number of samples in one chunk of {@code chunkMillis} at {@code sampleRate}. */
    public static int samplesPerChunk(int sampleRate, int chunkMillis) {
        return Math.max(1, (int) ((long) sampleRate * chunkMillis / 1000L));
    }

    /** Java Sound format descriptor for the wire format at {@code sampleRate}. */
    public static javax.sound.sampled.AudioFormat javaSoundFormat(float sampleRate) {
        return new javax.sound.sampled.AudioFormat(sampleRate, BITS_PER_SAMPLE, CHANNELS, SIGNED, BIG_ENDIAN);
    }
}
