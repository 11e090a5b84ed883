package com.phillippitts.funnel.presentation.websocket;

import com.phillippitts.funnel.domain.StreamConfig;
import com.phillippitts.funnel.domain.TranscriptEvent;
import com.phillippitts.funnel.exception.BackendUnavailableException;
import com.phillippitts.funnel.exception.DuplicateSessionException;
import com.phillippitts.funnel.exception.InvalidStreamConfigException;
import com.phillippitts.funnel.exception.UnknownSessionException;
import com.phillippitts.funnel.protocol.StreamProtocol;
import com.phillippitts.funnel.service.relay.ClientEventSink;
import com.phillippitts.funnel.service.relay.SessionRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Relay side of the streaming connection at {@code /recordings/{sessionId}/stream}.
 *
 * <p>Text frames carry the one-time config; binary frames carry raw PCM16 audio. Outbound
 * event frames are written through a {@link ConcurrentWebSocketSessionDecorator} because backend
 * callbacks and the request thread may send concurrently.
 */
@Component
public class RecordingStreamHandler extends AbstractWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(RecordingStreamHandler.class);

    public static final String PATH_PATTERN = "/recordings/*/stream";

    private static final Pattern PATH = Pattern.compile("^/recordings/([A-Za-z0-9._-]{1,128})/stream/?$");
    private static final String ATTR_SESSION_ID = "funnel.sessionId";
    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int SEND_BUFFER_LIMIT = 1024 * 1024;

    private final SessionRegistry registry;

    public RecordingStreamHandler(SessionRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String sessionId = extractSessionId(session.getUri());
        if (sessionId == null) {
            LOG.warn("Rejecting stream with malformed path {}", session.getUri());
            session.close(CloseStatus.BAD_DATA.withReason("invalid session id"));
            return;
        }
        session.getAttributes().put(ATTR_SESSION_ID, sessionId);
        ThreadContext.put("sessionId", sessionId);
        try {
            registry.createSession(sessionId, new SocketEventSink(sessionId, session));
            LOG.info("Client stream opened for {} from {}", sessionId, session.getRemoteAddress());
        } catch (DuplicateSessionException e) {
            LOG.warn("Rejecting second stream for {}", sessionId);
            session.getAttributes().remove(ATTR_SESSION_ID);
            session.close(CloseStatus.POLICY_VIOLATION.withReason("session already exists"));
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        String sessionId = sessionId(session);
        if (sessionId == null) {
            return;
        }
        ThreadContext.put("sessionId", sessionId);
        try {
            String payload = message.getPayload();
            String type = StreamProtocol.peekType(payload);
            if (!StreamProtocol.TYPE_CONFIG.equals(type)) {
                LOG.debug("Ignoring text frame of type {} from {}", type, sessionId);
                return;
            }
            StreamConfig config = StreamProtocol.parseConfig(payload);
            registry.configure(sessionId, config);
        } catch (InvalidStreamConfigException e) {
            LOG.warn("Bad config from {}: {}", sessionId, e.getReason());
            closeQuietly(session, CloseStatus.BAD_DATA.withReason("invalid config"));
        } catch (UnknownSessionException e) {
            closeQuietly(session, CloseStatus.SERVER_ERROR.withReason("unknown session"));
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) throws Exception {
        String sessionId = sessionId(session);
        if (sessionId == null) {
            return;
        }
        ByteBuffer buffer = message.getPayload();
        byte[] frame = new byte[buffer.remaining()];
        buffer.get(frame);
        try {
            registry.appendAudio(sessionId, frame);
        } catch (BackendUnavailableException e) {
            LOG.debug("Audio for {} refused: backend unavailable", sessionId);
            closeQuietly(session, CloseStatus.SERVER_ERROR.withReason("backend unavailable"));
        } catch (UnknownSessionException e) {
            closeQuietly(session, CloseStatus.SERVER_ERROR.withReason("unknown session"));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.warn("Transport error on stream {}: {}", sessionId(session), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String sessionId = sessionId(session);
        if (sessionId != null) {
            registry.onClientDisconnected(sessionId, status.getCode());
        }
    }

    @Override
    public boolean supportsPartialMessages() {
        return false;
    }

    static String extractSessionId(URI uri) {
        if (uri == null || uri.getPath() == null) {
            return null;
        }
        Matcher m = PATH.matcher(uri.getPath());
        return m.matches() ? m.group(1) : null;
    }

    private static String sessionId(WebSocketSession session) {
        Object id = session.getAttributes().get(ATTR_SESSION_ID);
        return id instanceof String s ? s : null;
    }

    private static void closeQuietly(WebSocketSession session, CloseStatus status) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(status);
        } catch (IOException e) {
            LOG.debug("Close of stream {} failed: {}", session.getId(), e.getMessage());
        }
    }

    /** Writes event frames to one client connection. */
    private static final class SocketEventSink implements ClientEventSink {
        private final String sessionId;
        private final WebSocketSession session;

        SocketEventSink(String sessionId, WebSocketSession raw) {
            this.sessionId = sessionId;
            this.session = new ConcurrentWebSocketSessionDecorator(raw, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT);
        }

        @Override
        public void send(TranscriptEvent event) {
            try {
                session.sendMessage(new TextMessage(StreamProtocol.encodeEvent(event)));
            } catch (IOException | IllegalStateException | SessionLimitExceededException e) {
                LOG.warn("Could not send {} event to {}: {}", event.type().wireName(), sessionId, e.getMessage());
            }
        }

        @Override
        public boolean isOpen() {
            return session.isOpen();
        }

        @Override
        public void closeWithError(String reason) {
            closeQuietly(session, CloseStatus.SERVER_ERROR.withReason(reason));
        }
    }
}
