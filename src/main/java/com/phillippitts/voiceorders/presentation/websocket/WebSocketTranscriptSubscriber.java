package com.phillippitts.voiceorders.presentation.websocket;

import com.phillippitts.voiceorders.service.transcript.TranscriptSubscriber;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Objects;

/**
 * Transcript observer backed by a WebSocket session.
 */
final class WebSocketTranscriptSubscriber implements TranscriptSubscriber {

    private final WebSocketSession session;

    WebSocketTranscriptSubscriber(WebSocketSession session) {
        this.session = Objects.requireNonNull(session, "session");
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(String payload) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("Observer socket " + session.getId() + " is closed");
        }
        session.sendMessage(new TextMessage(payload));
    }
}
