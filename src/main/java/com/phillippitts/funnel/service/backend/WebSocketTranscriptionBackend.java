package com.phillippitts.funnel.service.backend;

import com.phillippitts.funnel.config.properties.BackendProperties;
import com.phillippitts.funnel.domain.StreamConfig;
import com.phillippitts.funnel.exception.BackendUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deepgram-compatible live transcription client.
 *
 * <p>Connects to {@code <url>?encoding=linear16&sample_rate=..&channels=1&model=..&language=..
 * &punctuate=..&interim_results=..} with {@code Authorization: Token <apiKey>}. Audio is
 * forwarded as binary frames; the close-stream signal is the text frame
 * {@code {"type":"CloseStream"}}.
 */
public class WebSocketTranscriptionBackend implements TranscriptionBackend {

    private static final Logger LOG = LogManager.getLogger(WebSocketTranscriptionBackend.class);

    static final String CLOSE_STREAM = "{\"type\":\"CloseStream\"}";

    private final WebSocketClient client;
    private final BackendProperties props;

    public WebSocketTranscriptionBackend(WebSocketClient client, BackendProperties props) {
        this.client = Objects.requireNonNull(client);
        this.props = Objects.requireNonNull(props);
    }

    @Override
    public boolean isConfigured() {
        return props.isConfigured();
    }

    @Override
    public CompletableFuture<BackendConnection> connect(String sessionId, StreamConfig config, BackendListener listener) {
        if (!isConfigured()) {
            return CompletableFuture.failedFuture(new BackendUnavailableException(sessionId,
                    new IllegalStateException("funnel.backend.api-key is not configured")));
        }
        URI uri = buildUri(config);
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.add("Authorization", "Token " + props.getApiKey());
        LOG.info("Connecting to transcription backend {} for session {}", uri.getHost(), sessionId);
        return client.execute(new Handler(listener), headers, uri)
                .orTimeout(props.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((session, error) -> {
                    if (error != null) {
                        throw new BackendUnavailableException(sessionId, error);
                    }
                    return (BackendConnection) new Connection(sessionId, session);
                });
    }

    // Package-private for tests
    URI buildUri(StreamConfig config) {
        return UriComponentsBuilder.fromUriString(props.getUrl())
                .queryParam("encoding", "linear16")
                .queryParam("sample_rate", config.sampleRate())
                .queryParam("channels", config.channels())
                .queryParam("model", props.getModel())
                .queryParam("language", props.getLanguage())
                .queryParam("punctuate", props.isPunctuate())
                .queryParam("interim_results", props.isInterimResults())
                .build()
                .toUri();
    }

    private static final class Handler extends AbstractWebSocketHandler {
        private final BackendListener listener;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        Handler(BackendListener listener) {
            this.listener = listener;
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            BackendMessage parsed = BackendMessageParser.parse(message.getPayload());
            switch (parsed.kind()) {
                case RESULTS -> listener.onTranscript(parsed.segment());
                case METADATA -> listener.onMetadata(parsed.duration());
                case ERROR -> listener.onError(new IllegalStateException("Backend error: " + parsed.error()));
                default -> {
                    // keep-alives, speech markers
                }
            }
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            listener.onError(exception);
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            if (closed.compareAndSet(false, true)) {
                listener.onClosed(status.getCode(), status.getReason());
            }
        }
    }

    private static final class Connection implements BackendConnection {
        private final String sessionId;
        private final WebSocketSession session;
        private final AtomicBoolean streamClosed = new AtomicBoolean(false);
        private final AtomicBoolean closed = new AtomicBoolean(false);

        Connection(String sessionId, WebSocketSession session) {
            this.sessionId = sessionId;
            this.session = session;
        }

        @Override
        public void sendAudio(byte[] pcm) {
            if (streamClosed.get()) {
                throw new BackendUnavailableException(sessionId);
            }
            send(new BinaryMessage(pcm));
        }

        @Override
        public void closeStream() {
            if (streamClosed.compareAndSet(false, true)) {
                send(new TextMessage(CLOSE_STREAM));
            }
        }

        private void send(WebSocketMessage<?> message) {
            synchronized (session) {
                if (!session.isOpen()) {
                    throw new BackendUnavailableException(sessionId);
                }
                try {
                    session.sendMessage(message);
                } catch (IOException | IllegalStateException e) {
                    throw new BackendUnavailableException(sessionId, e);
                }
            }
        }

        @Override
        public boolean isOpen() {
            return !closed.get() && session.isOpen();
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            synchronized (session) {
                try {
                    if (session.isOpen()) {
                        session.close(CloseStatus.NORMAL);
                    }
                } catch (IOException e) {
                    LOG.warn("Error closing backend connection for {}: {}", sessionId, e.getMessage());
                }
            }
        }
    }
}
