package com.phillippitts.voiceorders.presentation.websocket;

import com.phillippitts.voiceorders.domain.transcript.Speaker;
import com.phillippitts.voiceorders.service.transcript.TranscriptHub;
import com.phillippitts.voiceorders.testutil.RecordingSubscriber;
import com.phillippitts.voiceorders.testutil.SyncExecutor;
import org.json.JSONArray;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TranscriptObserverHandlerTest {

    private TranscriptHub hub;
    private TranscriptObserverHandler handler;

    @BeforeEach
    void setUp() {
        hub = new TranscriptHub(new SyncExecutor(), Clock.systemUTC());
        handler = new TranscriptObserverHandler(hub);
    }

    @Test
    void subscribesOnConnectAndUnsubscribesOnClose() {
        WebSocketSession socket = openSocket("obs-1");

        handler.afterConnectionEstablished(socket);
        assertThat(hub.subscriberCount()).isEqualTo(1);

        handler.afterConnectionClosed(socket, CloseStatus.NORMAL);
        assertThat(hub.subscriberCount()).isZero();
    }

    @Test
    void lateObserverReceivesCurrentTranscript() throws Exception {
        hub.subscribe(new RecordingSubscriber("first"));
        hub.addMessage(Speaker.USER, "Where is order 1003?");
        WebSocketSession socket = openSocket("obs-2");

        handler.afterConnectionEstablished(socket);

        ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
        verify(socket, atLeastOnce()).sendMessage(sent.capture());
        JSONArray snapshot = new JSONArray(sent.getValue().getPayload());
        assertThat(snapshot.getJSONObject(0).getString("message")).isEqualTo("Where is order 1003?");
    }

    @Test
    void lastObserverLeavingClearsTranscript() {
        WebSocketSession socket = openSocket("obs-3");
        handler.afterConnectionEstablished(socket);
        hub.addMessage(Speaker.BOT, "Hello");

        handler.afterConnectionClosed(socket, CloseStatus.GOING_AWAY);

        assertThat(hub.entries()).isEmpty();
    }

    @Test
    void ignoresKeepAliveText() {
        WebSocketSession socket = openSocket("obs-4");
        handler.afterConnectionEstablished(socket);

        handler.handleTextMessage(socket, new TextMessage("ping"));

        assertThat(hub.subscriberCount()).isEqualTo(1);
        assertThat(hub.entries()).isEmpty();
    }

    @Test
    void closeOfUnknownSocketIsHarmless() {
        handler.afterConnectionClosed(openSocket("never-opened"), CloseStatus.NORMAL);

        assertThat(hub.subscriberCount()).isZero();
    }

    private static WebSocketSession openSocket(String id) {
        WebSocketSession socket = mock(WebSocketSession.class);
        when(socket.getId()).thenReturn(id);
        when(socket.isOpen()).thenReturn(true);
        return socket;
    }
}
