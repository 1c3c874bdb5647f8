package com.phillippitts.voiceorders.service.backend;

import com.phillippitts.voiceorders.domain.frame.AudioChunk;
import com.phillippitts.voiceorders.domain.frame.Frame;
import com.phillippitts.voiceorders.domain.frame.FrameDirection;
import com.phillippitts.voiceorders.domain.frame.LifecycleEvent;
import com.phillippitts.voiceorders.domain.frame.LifecycleKind;
import com.phillippitts.voiceorders.domain.frame.TextChunk;
import com.phillippitts.voiceorders.service.audio.AudioFormat;
import com.phillippitts.voiceorders.service.metrics.VoicePipelineMetrics;
import com.phillippitts.voiceorders.service.pipeline.Emission;
import org.springframework.context.ApplicationEventPublisher;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Speaks each assistant reply.
 *
 * <p>A downstream {@link TextChunk} is consumed. The synthesized audio is emitted downstream in
 * {@value #CHUNK_MS} ms chunks, framed by {@code BOT_STARTED} and {@code BOT_STOPPED} events sent
 * upstream, where the state tracker and the bot transcript recorder observe them. A failed
 * synthesis still sends {@code BOT_STOPPED} so the reply buffered so far is closed off.
 */
public final class TextToSpeechStage extends BackendStage {

    static final int CHUNK_MS = 100;

    private final TextToSpeechClient client;

    public TextToSpeechStage(TextToSpeechClient client, String sessionId,
                             VoicePipelineMetrics metrics, ApplicationEventPublisher events) {
        super("text-to-speech", sessionId, metrics, events);
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public CompletionStage<List<Emission>> handle(Frame frame, FrameDirection direction) {
        if (!(frame instanceof TextChunk chunk) || direction != FrameDirection.DOWNSTREAM) {
            return CompletableFuture.completedFuture(List.of(Emission.forward(frame, direction)));
        }
        String text = chunk.text().trim();
        if (text.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return call(() -> client.synthesize(text), this::speak,
                List.of(Emission.upstream(LifecycleEvent.of(LifecycleKind.BOT_STOPPED))));
    }

    private List<Emission> speak(SynthesizedAudio audio) {
        List<Emission> out = new ArrayList<>();
        out.add(Emission.upstream(LifecycleEvent.of(LifecycleKind.BOT_STARTED)));
        int step = Math.max(AudioFormat.BYTES_PER_SAMPLE * audio.channels(),
                AudioFormat.bytesFor(CHUNK_MS, audio.sampleRate(), audio.channels()));
        byte[] pcm = audio.pcm();
        for (int offset = 0; offset < pcm.length; offset += step) {
            byte[] slice = Arrays.copyOfRange(pcm, offset, Math.min(pcm.length, offset + step));
            out.add(Emission.downstream(new AudioChunk(slice, audio.sampleRate(), audio.channels())));
        }
        out.add(Emission.upstream(LifecycleEvent.of(LifecycleKind.BOT_STOPPED)));
        return out;
    }
}
