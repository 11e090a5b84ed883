package com.phillippitts.funnel.config;

import com.phillippitts.funnel.presentation.websocket.RecordingStreamHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the streaming endpoint {@code /recordings/{sessionId}/stream}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    /** Large enough for several seconds of 48kHz PCM16 in one frame. */
    static final int MAX_BINARY_MESSAGE_BYTES = 512 * 1024;
    static final int MAX_TEXT_MESSAGE_BYTES = 64 * 1024;

    private final RecordingStreamHandler recordingStreamHandler;

    public WebSocketConfig(RecordingStreamHandler recordingStreamHandler) {
        this.recordingStreamHandler = recordingStreamHandler;
    }

    /**
     * Raises the container's message buffers; Tomcat's 8KB default closes the stream with 1009
     * on ordinary audio chunks.
     */
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(MAX_TEXT_MESSAGE_BYTES);
        container.setMaxBinaryMessageBufferSize(MAX_BINARY_MESSAGE_BYTES);
        return container;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(recordingStreamHandler, RecordingStreamHandler.PATH_PATTERN)
                .setAllowedOriginPatterns("*");
    }
}
