package com.phillippitts.voiceorders.config;

import com.phillippitts.voiceorders.presentation.websocket.TranscriptObserverHandler;
import com.phillippitts.voiceorders.presentation.websocket.VoiceSessionHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * WebSocket endpoints.
 *
 * <ul>
 *   <li>{@code /api/ws} - voice sessions</li>
 *   <li>{@code /api/transcription} - live transcript observers</li>
 * </ul>
 * Any origin is accepted; the browser front end is served separately.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final VoiceSessionHandler voiceSessionHandler;
    private final TranscriptObserverHandler transcriptObserverHandler;

    public WebSocketConfig(VoiceSessionHandler voiceSessionHandler,
                           TranscriptObserverHandler transcriptObserverHandler) {
        this.voiceSessionHandler = voiceSessionHandler;
        this.transcriptObserverHandler = transcriptObserverHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(voiceSessionHandler, "/api/ws").setAllowedOrigins("*");
        registry.addHandler(transcriptObserverHandler, "/api/transcription").setAllowedOrigins("*");
    }
}
