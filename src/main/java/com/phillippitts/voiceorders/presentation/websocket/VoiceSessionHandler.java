package com.phillippitts.voiceorders.presentation.websocket;

import com.phillippitts.voiceorders.config.properties.BackendProperties;
import com.phillippitts.voiceorders.exception.MissingCredentialException;
import com.phillippitts.voiceorders.exception.PipelineTerminatedException;
import com.phillippitts.voiceorders.service.events.PipelineTerminatedEvent;
import com.phillippitts.voiceorders.service.pipeline.FrameSink;
import com.phillippitts.voiceorders.service.session.ActiveSessionRegistry;
import com.phillippitts.voiceorders.service.session.VoiceSession;
import com.phillippitts.voiceorders.service.session.VoiceSessionFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Voice sessions on {@code /api/ws}: one pipeline per connection.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li>Without a backend API key the connection is closed at once with 1011 (server error).</li>
 *   <li>Otherwise a session is opened; inbound JSON is decoded and queued downstream, frames
 *       leaving the pipeline are encoded and sent back.</li>
 *   <li>If a stage fails the pipeline terminates and the socket is closed with 1011.</li>
 *   <li>Teardown (stop pipeline, unregister) runs once on every exit path.</li>
 * </ol>
 */
@Component
public class VoiceSessionHandler extends TextWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(VoiceSessionHandler.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 2 * 1024 * 1024;

    private final VoiceSessionFactory sessionFactory;
    private final ActiveSessionRegistry registry;
    private final BackendProperties backendProperties;
    private final ApplicationEventPublisher events;
    private final JsonFrameSerializer serializer = new JsonFrameSerializer();
    private final Map<String, VoiceSession> sessions = new ConcurrentHashMap<>();

    public VoiceSessionHandler(VoiceSessionFactory sessionFactory,
                               ActiveSessionRegistry registry,
                               BackendProperties backendProperties,
                               ApplicationEventPublisher events) {
        this.sessionFactory = sessionFactory;
        this.registry = registry;
        this.backendProperties = backendProperties;
        this.events = events;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession socket) throws IOException {
        if (!backendProperties.hasApiKey()) {
            MissingCredentialException missing = new MissingCredentialException("voice.backend.api-key");
            LOG.error("Refusing voice connection {}: {}", socket.getId(), missing.getMessage());
            socket.close(CloseStatus.SERVER_ERROR.withReason("Backend API key not configured"));
            return;
        }

        WebSocketSession out = new ConcurrentWebSocketSessionDecorator(socket, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        String sessionId = socket.getId();
        ThreadContext.put("sessionId", sessionId);
        try {
            VoiceSession session = sessionFactory.open(sessionId, outputSink(out));
            sessions.put(sessionId, session);
            registry.register(session, reason -> closeQuietly(out, CloseStatus.GOING_AWAY.withReason(reason)));
            session.whenTerminated().whenComplete((ok, error) -> {
                if (error != null) {
                    onTerminated(out, unwrap(error));
                }
            });
            LOG.info("Voice connection established: session={}, remote={}", sessionId, socket.getRemoteAddress());
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession socket, TextMessage message) {
        VoiceSession session = sessions.get(socket.getId());
        if (session == null || !session.isOpen()) {
            return;
        }
        ThreadContext.put("sessionId", socket.getId());
        try {
            serializer.deserialize(message.getPayload()).ifPresent(session::receive);
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    @Override
    public void handleTransportError(WebSocketSession socket, Throwable exception) {
        LOG.warn("Voice socket {} transport error: {}", socket.getId(), exception.getMessage());
        teardown(socket.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession socket, CloseStatus status) {
        teardown(socket.getId());
        LOG.info("Voice connection closed: session={}, status={}", socket.getId(), status);
    }

    int openSessionCount() {
        return sessions.size();
    }

    private FrameSink outputSink(WebSocketSession out) {
        return frame -> serializer.serialize(frame).ifPresent(text -> {
            try {
                out.sendMessage(new TextMessage(text));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to send to session " + out.getId(), e);
            }
        });
    }

    private void onTerminated(WebSocketSession out, Throwable error) {
        String stage = error instanceof PipelineTerminatedException pte && pte.getStageName() != null
                ? pte.getStageName() : "unknown";
        Throwable cause = error.getCause() != null ? error.getCause() : error;
        events.publishEvent(new PipelineTerminatedEvent(out.getId(), stage,
                String.valueOf(cause.getMessage()), Instant.now()));
        closeQuietly(out, CloseStatus.SERVER_ERROR);
        teardown(out.getId());
    }

    private void teardown(String sessionId) {
        VoiceSession session = sessions.remove(sessionId);
        if (session != null) {
            session.close();
            registry.unregister(sessionId);
        }
    }

    private static void closeQuietly(WebSocketSession socket, CloseStatus status) {
        if (!socket.isOpen()) {
            return;
        }
        try {
            socket.close(status);
        } catch (IOException e) {
            LOG.debug("Close of session {} failed: {}", socket.getId(), e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
