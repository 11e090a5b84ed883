package com.phillippitts.funnel.config.properties;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the relay (session registry and finalization).
 */
@Validated
@ConfigurationProperties(prefix = "funnel.relay")
public class RelayProperties {

    /** Upper bound on waiting for the backend's terminal metadata event. */
    private final Duration finalizeTimeout;

    /** How long terminal sessions stay registered (cached finalize result, status endpoint). */
    private final Duration retention;

    /** Period of the eviction sweep in milliseconds. */
    @Min(100)
    private final long sweepIntervalMs;

    @Min(1000)
    private final int minSampleRate;

    @Min(1000)
    private final int maxSampleRate;

    /** Allowed gap between reported and byte-derived duration before a warning is logged. */
    @DecimalMin("0.0")
    private final double durationToleranceSeconds;

    @ConstructorBinding
    public RelayProperties(Duration finalizeTimeout,
                           Duration retention,
                           Long sweepIntervalMs,
                           Integer minSampleRate,
                           Integer maxSampleRate,
                           Double durationToleranceSeconds) {
        this.finalizeTimeout = finalizeTimeout == null ? Duration.ofSeconds(30) : finalizeTimeout;
        this.retention = retention == null ? Duration.ofSeconds(60) : retention;
        this.sweepIntervalMs = sweepIntervalMs == null ? 5000L : sweepIntervalMs;
        this.minSampleRate = minSampleRate == null ? 8000 : minSampleRate;
        this.maxSampleRate = maxSampleRate == null ? 48_000 : maxSampleRate;
        this.durationToleranceSeconds = durationToleranceSeconds == null ? 0.5 : durationToleranceSeconds;
    }

    /** Defaults for tests: 30s finalize timeout, 60s retention. */
    public RelayProperties() {
        this(null, null, null, null, null, null);
    }

    public Duration getFinalizeTimeout() { return finalizeTimeout; }
    public Duration getRetention() { return retention; }
    public long getSweepIntervalMs() { return sweepIntervalMs; }
    public int getMinSampleRate() { return minSampleRate; }
    public int getMaxSampleRate() { return maxSampleRate; }
    public double getDurationToleranceSeconds() { return durationToleranceSeconds; }
}
