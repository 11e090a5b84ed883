package com.phillippitts.funnel.service.audio;

/**
 * Computes the normalized loudness signal shown as the recording level meter.
 *
 * <p><b>Algorithm:</b>
 * <ol>
 *   <li>RMS of the frame's 16-bit samples</li>
 *   <li>Convert to decibels: {@code 20 * log10(rms / 32768)}</li>
 *   <li>Normalize over the fixed window [{@value #MIN_DB} dB, {@value #MAX_DB} dB] and clamp to [0, 1]</li>
 *   <li>Apply a {@value #CURVE_EXPONENT} power curve</li>
 * </ol>
 *
 * <p>The result is UI telemetry only and is never sent on the wire.
 *
 * @since 1.0
 */
public final class LoudnessMeter {

    static final double MIN_DB = -50.0;
    static final double MAX_DB = -10.0;
    static final double CURVE_EXPONENT = 2.5;

    private LoudnessMeter() {
        // Utility class
    }

    /**
     * Loudness of a PCM16LE frame.
     *
     * @param pcm    PCM16LE mono bytes
     * @param length number of valid bytes
     * @return loudness in [0.0, 1.0]
     */
    public static double level(byte[] pcm, int length) {
        return normalize(calculateRms(pcm, length));
    }

    /** Loudness of normalized float samples (scaled to the PCM16 range first). */
    public static double level(float[] samples, int count) {
        if (samples == null || count <= 0) {
            return 0.0;
        }
        double sumSquares = 0.0;
        int n = Math.min(count, samples.length);
        for (int i = 0; i < n; i++) {
            double s = PcmEncoder.toPcm16(samples[i]);
            sumSquares += s * s;
        }
        return normalize(Math.sqrt(sumSquares / n));
    }

    /**
     * Maps an RMS amplitude (0..32768) to the normalized, curved loudness value.
     */
    static double normalize(double rms) {
        if (Double.isNaN(rms) || rms <= 0.0) {
            return 0.0;
        }
        if (Double.isInfinite(rms)) {
            return 1.0;
        }
        double db = 20.0 * Math.log10(rms / AudioFormat.MAX_AMPLITUDE);
        double normalized = (db - MIN_DB) / (MAX_DB - MIN_DB);
        double clamped = Math.max(0.0, Math.min(1.0, normalized));
        return Math.pow(clamped, CURVE_EXPONENT);
    }

    static double calculateRms(byte[] pcm, int length) {
        if (pcm == null) {
            return 0.0;
        }
        long sumSquares = 0;
        int sampleCount = 0;
        int end = Math.min(length, pcm.length);
        for (int i = 0; i + 1 < end; i += 2) {
            int sample = (pcm[i] & 0xFF) | (pcm[i + 1] << 8);
            sumSquares += (long) sample * sample;
            sampleCount++;
        }
        if (sampleCount == 0) {
            return 0.0;
        }
        return Math.sqrt((double) sumSquares / sampleCount);
    }
}
