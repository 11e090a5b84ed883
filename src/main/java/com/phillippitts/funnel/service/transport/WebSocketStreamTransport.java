package com.phillippitts.funnel.service.transport;

import com.phillippitts.funnel.domain.StreamConfig;
import com.phillippitts.funnel.domain.TranscriptEvent;
import com.phillippitts.funnel.exception.ConnectionFailureException;
import com.phillippitts.funnel.protocol.StreamProtocol;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link StreamTransport} over a Spring {@link WebSocketClient}.
 */
public class WebSocketStreamTransport implements StreamTransport {

    private static final Logger LOG = LogManager.getLogger(WebSocketStreamTransport.class);

    private final WebSocketClient client;
    private final String streamBaseUrl;
    private final Duration connectTimeout;

    /**
     * @param client         WebSocket client implementation
     * @param streamBaseUrl  e.g. {@code ws://localhost:8080}
     * @param connectTimeout bound on the opening handshake
     */
    public WebSocketStreamTransport(WebSocketClient client, String streamBaseUrl, Duration connectTimeout) {
        this.client = Objects.requireNonNull(client);
        this.streamBaseUrl = Objects.requireNonNull(streamBaseUrl);
        this.connectTimeout = Objects.requireNonNull(connectTimeout);
    }

    @Override
    public StreamConnection connect(String sessionId, TransportListener listener) {
        URI uri = URI.create(streamBaseUrl + "/recordings/" + sessionId + "/stream");
        Handler handler = new Handler(listener);
        try {
            WebSocketSession session = client.execute(handler, uri.toString())
                    .get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            LOG.info("Streaming connection open: {}", uri);
            return new Connection(sessionId, session);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionFailureException("Interrupted while connecting", sessionId, e);
        } catch (ExecutionException e) {
            throw new ConnectionFailureException("Cannot connect to " + uri, sessionId, e.getCause());
        } catch (TimeoutException e) {
            throw new ConnectionFailureException(
                    "Connect timed out after " + connectTimeout.toMillis() + "ms", sessionId, e);
        }
    }

    private static final class Handler extends AbstractWebSocketHandler {
        private final TransportListener listener;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        Handler(TransportListener listener) {
            this.listener = Objects.requireNonNull(listener);
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            TranscriptEvent event = StreamProtocol.parseEvent(message.getPayload());
            if (event != null) {
                listener.onEvent(event);
            }
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            LOG.warn("Streaming transport error: {}", exception.toString());
            listener.onError(exception);
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            if (closed.compareAndSet(false, true)) {
                listener.onClosed(status.getCode(), status.getReason());
            }
        }
    }

    private static final class Connection implements StreamConnection {
        private final String sessionId;
        private final WebSocketSession session;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        Connection(String sessionId, WebSocketSession session) {
            this.sessionId = sessionId;
            this.session = session;
        }

        @Override
        public String sessionId() {
            return sessionId;
        }

        @Override
        public void sendConfig(StreamConfig config) {
            send(new TextMessage(StreamProtocol.encodeConfig(config)));
        }

        @Override
        public void sendAudio(byte[] pcm) {
            send(new BinaryMessage(pcm));
        }

        private void send(org.springframework.web.socket.WebSocketMessage<?> message) {
            synchronized (session) {
                if (!session.isOpen()) {
                    throw new ConnectionFailureException("Streaming connection is closed", sessionId);
                }
                try {
                    session.sendMessage(message);
                } catch (IOException | IllegalStateException e) {
                    throw new ConnectionFailureException("Send failed", sessionId, e);
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
                    LOG.warn("Error closing streaming connection {}: {}", sessionId, e.getMessage());
                }
            }
        }
    }
}
