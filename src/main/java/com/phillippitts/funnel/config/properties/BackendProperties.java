package com.phillippitts.funnel.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the streaming transcription backend (Deepgram-compatible live API).
 */
@Validated
@ConfigurationProperties(prefix = "funnel.backend")
public class BackendProperties {

    @NotBlank
    private final String url;

    /** API key sent as {@code Authorization: Token <key>}; blank means unconfigured. */
    private final String apiKey;

    @NotBlank
    private final String model;

    @NotBlank
    private final String language;

    private final boolean punctuate;

    private final boolean interimResults;

    private final Duration connectTimeout;

    @ConstructorBinding
    public BackendProperties(String url,
                             String apiKey,
                             String model,
                             String language,
                             Boolean punctuate,
                             Boolean interimResults,
                             Duration connectTimeout) {
        this.url = url == null ? "wss://api.deepgram.com/v1/listen" : url;
        this.apiKey = (apiKey == null || apiKey.isBlank()) ? null : apiKey;
        this.model = model == null ? "nova-2" : model;
        this.language = language == null ? "en-US" : language;
        this.punctuate = punctuate == null || punctuate;
        this.interimResults = interimResults != null && interimResults;
        this.connectTimeout = connectTimeout == null ? Duration.ofSeconds(10) : connectTimeout;
    }

    public String getUrl() { return url; }
    public String getApiKey() { return apiKey; }
    public String getModel() { return model; }
    public String getLanguage() { return language; }
    public boolean isPunctuate() { return punctuate; }
    public boolean isInterimResults() { return interimResults; }
    public Duration getConnectTimeout() { return connectTimeout; }

    public boolean isConfigured() {
        return apiKey != null;
    }
}
