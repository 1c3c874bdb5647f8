package com.phillippitts.voiceorders.service.backend;

import com.phillippitts.voiceorders.domain.frame.AudioChunk;
import com.phillippitts.voiceorders.domain.frame.FrameDirection;
import com.phillippitts.voiceorders.domain.frame.LifecycleEvent;
import com.phillippitts.voiceorders.domain.frame.LifecycleKind;
import com.phillippitts.voiceorders.domain.frame.TextChunk;
import com.phillippitts.voiceorders.domain.frame.TransportMessage;
import com.phillippitts.voiceorders.service.metrics.VoicePipelineMetrics;
import com.phillippitts.voiceorders.service.pipeline.Emission;
import com.phillippitts.voiceorders.testutil.EventCapturingPublisher;
import com.phillippitts.voiceorders.testutil.FakeTextToSpeechClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TextToSpeechStageTest {

    private FakeTextToSpeechClient client;
    private TextToSpeechStage stage;

    @BeforeEach
    void setUp() {
        // 250 ms of 16 kHz mono audio
        client = new FakeTextToSpeechClient(8000);
        stage = new TextToSpeechStage(client, "session-1",
                new VoicePipelineMetrics(new SimpleMeterRegistry()), new EventCapturingPublisher());
    }

    @Test
    void framesAudioWithBotEventsSentUpstream() {
        List<Emission> out = handle(new TextChunk(" Your order has shipped. "));

        assertThat(client.requests).containsExactly("Your order has shipped.");
        assertThat(out).hasSize(5);
        assertThat(out.get(0)).isEqualTo(Emission.upstream(LifecycleEvent.of(LifecycleKind.BOT_STARTED)));
        assertThat(out.get(4)).isEqualTo(Emission.upstream(LifecycleEvent.of(LifecycleKind.BOT_STOPPED)));
        assertThat(out.subList(1, 4)).allSatisfy(e -> {
            assertThat(e.direction()).isEqualTo(FrameDirection.DOWNSTREAM);
            assertThat(e.frame()).isInstanceOf(AudioChunk.class);
        });
        assertThat(out.subList(1, 4)).extracting(e -> ((AudioChunk) e.frame()).size())
                .containsExactly(3200, 3200, 1600);
    }

    @Test
    void blankTextIsAbsorbed() {
        assertThat(handle(new TextChunk(""))).isEmpty();
        assertThat(client.requests).isEmpty();
    }

    @Test
    void failureStillStopsBotWithoutAudio() {
        client.shouldFail = true;

        List<Emission> out = handle(new TextChunk("hello"));

        assertThat(out).hasSize(2);
        assertThat(out.get(0)).isEqualTo(Emission.upstream(LifecycleEvent.of(LifecycleKind.BOT_STOPPED)));
        assertThat(out.get(1).frame()).isInstanceOfSatisfying(TransportMessage.class,
                message -> assertThat(message.jsonPayload()).contains("text-to-speech"));
        assertThat(out).extracting(Emission::frame)
                .doesNotContain(LifecycleEvent.of(LifecycleKind.BOT_STARTED))
                .noneMatch(f -> f instanceof AudioChunk);
    }

    private List<Emission> handle(TextChunk chunk) {
        return stage.handle(chunk, FrameDirection.DOWNSTREAM).toCompletableFuture().join();
    }
}
