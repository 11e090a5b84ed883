package com.phillippitts.funnel.config;

import com.phillippitts.funnel.config.properties.BackendProperties;
import com.phillippitts.funnel.service.backend.TranscriptionBackend;
import com.phillippitts.funnel.service.backend.WebSocketTranscriptionBackend;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

/**
 * Wires the relay's outbound connection to the transcription backend.
 */
@Configuration
public class RelayConfig {

    private static final Logger LOG = LogManager.getLogger(RelayConfig.class);

    @Bean
    public TranscriptionBackend transcriptionBackend(BackendProperties backendProperties) {
        if (!backendProperties.isConfigured()) {
            LOG.warn("funnel.backend.api-key is not set; streams will fail with backend_unavailable");
        }
        return new WebSocketTranscriptionBackend(new StandardWebSocketClient(), backendProperties);
    }
}
