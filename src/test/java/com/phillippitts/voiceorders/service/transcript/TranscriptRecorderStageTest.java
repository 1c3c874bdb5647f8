package com.phillippitts.voiceorders.service.transcript;

import com.phillippitts.voiceorders.domain.frame.FrameDirection;
import com.phillippitts.voiceorders.domain.frame.LifecycleEvent;
import com.phillippitts.voiceorders.domain.frame.LifecycleKind;
import com.phillippitts.voiceorders.domain.frame.TextChunk;
import com.phillippitts.voiceorders.domain.frame.TransportMessage;
import com.phillippitts.voiceorders.domain.transcript.Speaker;
import com.phillippitts.voiceorders.domain.transcript.TranscriptEntry;
import com.phillippitts.voiceorders.service.backend.TextToSpeechStage;
import com.phillippitts.voiceorders.service.metrics.VoicePipelineMetrics;
import com.phillippitts.voiceorders.service.pipeline.Emission;
import com.phillippitts.voiceorders.service.pipeline.Pipeline;
import com.phillippitts.voiceorders.service.pipeline.PipelineTask;
import com.phillippitts.voiceorders.testutil.EventCapturingPublisher;
import com.phillippitts.voiceorders.testutil.FakeTextToSpeechClient;
import com.phillippitts.voiceorders.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.json.JSONArray;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptRecorderStageTest {

    private TranscriptHub hub;

    @BeforeEach
    void setUp() {
        hub = new TranscriptHub(new SyncExecutor(), Clock.systemDefaultZone());
    }

    @Test
    void userUtteranceIsRecordedAndSnapshotEmittedFirst() {
        TranscriptRecorderStage stage = new TranscriptRecorderStage(Speaker.USER, hub);
        TextChunk chunk = new TextChunk("  order 1003  ");

        List<Emission> out = stage.process(chunk, FrameDirection.DOWNSTREAM);

        assertThat(hub.entries()).extracting(TranscriptEntry::text).containsExactly("order 1003");
        assertThat(out).hasSize(2);
        assertThat(out.get(0).direction()).isEqualTo(FrameDirection.DOWNSTREAM);
        JSONArray snapshot = new JSONArray(((TransportMessage) out.get(0).frame()).jsonPayload());
        assertThat(snapshot.getJSONObject(0).getString("type")).isEqualTo("user");
        assertThat(snapshot.getJSONObject(0).getString("message")).isEqualTo("order 1003");
        assertThat(out.get(1)).isEqualTo(Emission.downstream(chunk));
    }

    @Test
    void blankUserTextIsNotRecorded() {
        TranscriptRecorderStage stage = new TranscriptRecorderStage(Speaker.USER, hub);
        TextChunk blank = new TextChunk("   ");

        assertThat(stage.process(blank, FrameDirection.DOWNSTREAM)).containsExactly(Emission.downstream(blank));
        assertThat(hub.entries()).isEmpty();
    }

    @Test
    void botChunksAreJoinedUntilBotStops() {
        TranscriptRecorderStage stage = new TranscriptRecorderStage(Speaker.BOT, hub);

        stage.process(new TextChunk("Hel"), FrameDirection.DOWNSTREAM);
        stage.process(new TextChunk("lo"), FrameDirection.DOWNSTREAM);
        assertThat(stage.pendingText()).isEqualTo("Hello");
        assertThat(hub.entries()).isEmpty();

        stage.process(LifecycleEvent.of(LifecycleKind.BOT_STOPPED), FrameDirection.UPSTREAM);

        assertThat(hub.entries()).singleElement().satisfies(entry -> {
            assertThat(entry.speaker()).isEqualTo(Speaker.BOT);
            assertThat(entry.text()).isEqualTo("Hello");
        });
        assertThat(stage.pendingText()).isEmpty();
    }

    @Test
    void secondBotStopAddsNothing() {
        TranscriptRecorderStage stage = new TranscriptRecorderStage(Speaker.BOT, hub);
        stage.process(new TextChunk("Hi"), FrameDirection.DOWNSTREAM);
        stage.process(LifecycleEvent.of(LifecycleKind.BOT_STOPPED), FrameDirection.UPSTREAM);

        stage.process(LifecycleEvent.of(LifecycleKind.BOT_STOPPED), FrameDirection.DOWNSTREAM);

        assertThat(hub.entries()).hasSize(1);
    }

    @Test
    void failedSynthesisDoesNotJoinReplies() {
        FakeTextToSpeechClient tts = new FakeTextToSpeechClient(3200);
        tts.failingTexts.add("First reply.");
        TextToSpeechStage speaker = new TextToSpeechStage(tts, "s1",
                new VoicePipelineMetrics(new SimpleMeterRegistry()), new EventCapturingPublisher());
        PipelineTask task = new Pipeline(List.of(new TranscriptRecorderStage(Speaker.BOT, hub), speaker))
                .start("s1", frame -> { });

        task.queueFrame(new TextChunk("First reply."), FrameDirection.DOWNSTREAM).join();
        task.queueFrame(new TextChunk("Second reply."), FrameDirection.DOWNSTREAM).join();

        assertThat(hub.entries()).extracting(TranscriptEntry::text).containsExactly("First reply.", "Second reply.");
    }

    @Test
    void botRecorderForwardsEverything() {
        TranscriptRecorderStage stage = new TranscriptRecorderStage(Speaker.BOT, hub);
        TextChunk chunk = new TextChunk("Your order has shipped.");
        LifecycleEvent stopped = LifecycleEvent.of(LifecycleKind.BOT_STOPPED);

        assertThat(stage.process(chunk, FrameDirection.DOWNSTREAM)).containsExactly(Emission.downstream(chunk));
        assertThat(stage.process(stopped, FrameDirection.UPSTREAM)).containsExactly(Emission.upstream(stopped));
    }

    @Test
    void userRecorderIgnoresBotStop() {
        TranscriptRecorderStage stage = new TranscriptRecorderStage(Speaker.USER, hub);

        stage.process(LifecycleEvent.of(LifecycleKind.BOT_STOPPED), FrameDirection.UPSTREAM);

        assertThat(hub.entries()).isEmpty();
    }

    @Test
    void namesIncludeSpeaker() {
        assertThat(new TranscriptRecorderStage(Speaker.USER, hub).name()).isEqualTo("TranscriptRecorder(user)");
        assertThat(new TranscriptRecorderStage(Speaker.BOT, hub).name()).isEqualTo("TranscriptRecorder(bot)");
    }
}
