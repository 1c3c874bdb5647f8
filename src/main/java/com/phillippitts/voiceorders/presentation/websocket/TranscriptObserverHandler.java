package com.phillippitts.voiceorders.presentation.websocket;

import com.phillippitts.voiceorders.service.transcript.TranscriptHub;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Passive transcript observers on {@code /api/transcription}.
 *
 * <p>Inbound text is read and discarded (keep-alive). Unsubscribing runs on every exit path:
 * normal close and transport errors both end in {@link #afterConnectionClosed}.
 */
@Component
public class TranscriptObserverHandler extends TextWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(TranscriptObserverHandler.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 1024 * 1024;

    private final TranscriptHub hub;
    private final Map<String, WebSocketTranscriptSubscriber> subscribers = new ConcurrentHashMap<>();

    public TranscriptObserverHandler(TranscriptHub hub) {
        this.hub = hub;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketTranscriptSubscriber subscriber = new WebSocketTranscriptSubscriber(
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
        subscribers.put(session.getId(), subscriber);
        hub.subscribe(subscriber);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        LOG.trace("Observer {} keep-alive ({} chars)", session.getId(), message.getPayloadLength());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.warn("Observer socket {} transport error: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketTranscriptSubscriber subscriber = subscribers.remove(session.getId());
        if (subscriber != null) {
            hub.unsubscribe(subscriber);
        }
        LOG.debug("Observer socket {} closed: {}", session.getId(), status);
    }
}
