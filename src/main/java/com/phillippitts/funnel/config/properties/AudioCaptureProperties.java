package com.phillippitts.funnel.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for client-side audio capture.
 *
 * Wire format (enforced by the encoder): 16-bit PCM, mono, little-endian.
 */
@Validated
@ConfigurationProperties(prefix = "funnel.client.capture")
public class AudioCaptureProperties {

    /** Where audio comes from for new recordings. */
    public enum Source { MICROPHONE, FILE }

    private final Source source;

    /** Audio file played back when {@code source=FILE}. */
    private final String file;

    /** Microphone capture rate in Hz; files keep their native rate. */
    @Min(8000)
    @Max(48_000)
    private final int sampleRate;

    /** Audio per outbound frame in milliseconds. */
    @Min(10)
    @Max(1000)
    private final int chunkMillis;

    /** Outbound frames buffered between the capture thread and the sender. */
    @Min(1)
    private final int queueCapacity;

    /** Optional input device name hint; falls back to system default when null/blank. */
    private final String deviceName;

    /** Directory for raw PCM archives; archival is off when null/blank. */
    private final String archiveDir;

    @ConstructorBinding
    public AudioCaptureProperties(Source source,
                                  String file,
                                  Integer sampleRate,
                                  Integer chunkMillis,
                                  Integer queueCapacity,
                                  String deviceName,
                                  String archiveDir) {
        this.source = source == null ? Source.MICROPHONE : source;
        this.file = blankToNull(file);
        this.sampleRate = sampleRate == null ? 16_000 : sampleRate;
        this.chunkMillis = chunkMillis == null ? 100 : chunkMillis;
        this.queueCapacity = queueCapacity == null ? 100 : queueCapacity;
        this.deviceName = blankToNull(deviceName);
        this.archiveDir = blankToNull(archiveDir);
    }

    public Source getSource() { return source; }
    public String getFile() { return file; }
    public int getSampleRate() { return sampleRate; }
    public int getChunkMillis() { return chunkMillis; }
    public int getQueueCapacity() { return queueCapacity; }
    public String getDeviceName() { return deviceName; }
    public String getArchiveDir() { return archiveDir; }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }
}
