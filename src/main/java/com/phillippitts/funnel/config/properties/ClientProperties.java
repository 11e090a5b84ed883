package com.phillippitts.funnel.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the recording client (state machine, transport, finalize call).
 */
@Validated
@ConfigurationProperties(prefix = "funnel.client")
public class ClientProperties {

    private final boolean enabled;

    /** Base HTTP URL of the relay; the streaming URL is derived by switching the scheme to ws. */
    @NotBlank
    private final String serverUrl;

    /** Bound on connect plus waiting for the relay's ready event. */
    private final Duration readyTimeout;

    /** Recordings stopped earlier than this are rejected without finalizing. */
    private final Duration minRecordingDuration;

    /** Bound on flushing queued frames to the socket at stop. */
    private final Duration drainTimeout;

    /** Read timeout for the finalize call; must exceed the relay's finalize timeout. */
    private final Duration finalizeReadTimeout;

    @ConstructorBinding
    public ClientProperties(Boolean enabled,
                            String serverUrl,
                            Duration readyTimeout,
                            Duration minRecordingDuration,
                            Duration drainTimeout,
                            Duration finalizeReadTimeout) {
        this.enabled = enabled != null && enabled;
        this.serverUrl = serverUrl == null ? "http://localhost:8080" : stripTrailingSlash(serverUrl);
        this.readyTimeout = readyTimeout == null ? Duration.ofSeconds(10) : readyTimeout;
        this.minRecordingDuration = minRecordingDuration == null ? Duration.ofMillis(500) : minRecordingDuration;
        this.drainTimeout = drainTimeout == null ? Duration.ofSeconds(5) : drainTimeout;
        this.finalizeReadTimeout = finalizeReadTimeout == null ? Duration.ofSeconds(40) : finalizeReadTimeout;
    }

    public boolean isEnabled() { return enabled; }
    public String getServerUrl() { return serverUrl; }
    public Duration getReadyTimeout() { return readyTimeout; }
    public Duration getMinRecordingDuration() { return minRecordingDuration; }
    public Duration getDrainTimeout() { return drainTimeout; }
    public Duration getFinalizeReadTimeout() { return finalizeReadTimeout; }

    /** Streaming endpoint base, e.g. {@code ws://localhost:8080}. */
    public String getStreamBaseUrl() {
        if (serverUrl.startsWith("https://")) {
            return "wss://" + serverUrl.substring("https://".length());
        }
        if (serverUrl.startsWith("http://")) {
            return "ws://" + serverUrl.substring("http://".length());
        }
        return serverUrl;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
