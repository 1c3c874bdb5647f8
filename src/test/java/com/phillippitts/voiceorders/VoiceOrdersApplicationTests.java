package com.phillippitts.voiceorders;

import com.phillippitts.voiceorders.service.transcript.TranscriptHub;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@Tag("integration")
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "voice.backend.api-key=",
        "orders.snapshot-path=classpath:data/orders-fixture.json"
    }
)
class VoiceOrdersApplicationTests {

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate rest;

    @Autowired
    private TranscriptHub hub;

    @Test
    @SuppressWarnings("rawtypes")
    void rootAnswersBanner() {
        ResponseEntity<Map> response = rest.getForEntity("/", Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).containsEntry("message", "Voice Orders service is running");
    }

    @Test
    @SuppressWarnings("rawtypes")
    void healthReportsLoadedSnapshot() {
        ResponseEntity<Map> response = rest.getForEntity("/health", Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody())
                .containsEntry("status", "healthy")
                .containsEntry("database", "static-json");
    }

    @Test
    void actuatorHealthIsUp() {
        ResponseEntity<String> response = rest.getForEntity("/actuator/health", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).contains("\"status\":\"UP\"");
    }

    @Test
    void sessionGaugesArePublished() {
        assertThat(rest.getForEntity("/actuator/metrics/voiceorders.sessions.active", String.class).getStatusCode())
                .isEqualTo(HttpStatus.OK);
        assertThat(rest.getForEntity("/actuator/metrics/voiceorders.transcript.subscribers", String.class)
                .getStatusCode()).isEqualTo(HttpStatus.OK);
    }

    @Test
    void observerSocketSubscribesToTranscript() throws Exception {
        WebSocketSession session = new StandardWebSocketClient()
                .execute(new TextWebSocketHandler(), "ws://localhost:" + port + "/api/transcription")
                .get(5, TimeUnit.SECONDS);

        await().atMost(Duration.ofSeconds(5)).until(() -> hub.subscriberCount() == 1);

        session.close();
        await().atMost(Duration.ofSeconds(5)).until(() -> hub.subscriberCount() == 0);
    }

    @Test
    void voiceSocketIsRefusedWithoutApiKey() throws Exception {
        AtomicReference<CloseStatus> closed = new AtomicReference<>();
        new StandardWebSocketClient()
                .execute(new TextWebSocketHandler() {
                    @Override
                    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
                        closed.set(status);
                    }
                }, "ws://localhost:" + port + "/api/ws")
                .get(5, TimeUnit.SECONDS);

        await().atMost(Duration.ofSeconds(5)).until(() -> closed.get() != null);
        assertThat(closed.get().getCode()).isEqualTo(CloseStatus.SERVER_ERROR.getCode());
    }
}
