package com.phillippitts.voiceorders.service.backend;

import com.phillippitts.voiceorders.domain.frame.AudioChunk;
import com.phillippitts.voiceorders.domain.frame.Frame;
import com.phillippitts.voiceorders.domain.frame.FrameDirection;
import com.phillippitts.voiceorders.domain.frame.LifecycleEvent;
import com.phillippitts.voiceorders.domain.frame.LifecycleKind;
import com.phillippitts.voiceorders.domain.frame.TextChunk;
import com.phillippitts.voiceorders.service.metrics.VoicePipelineMetrics;
import com.phillippitts.voiceorders.service.pipeline.Emission;
import com.phillippitts.voiceorders.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Turns one user turn of audio into a {@link TextChunk}.
 *
 * <p>Inbound audio is consumed: chunks between {@code USER_STARTED} and {@code USER_STOPPED}
 * are buffered, the rest is discarded. On {@code USER_STOPPED} the buffer is transcribed; the
 * stop event is forwarded first, then the trimmed transcript if it is not blank.
 */
public final class SpeechToTextStage extends BackendStage {

    private static final Logger LOG = LogManager.getLogger(SpeechToTextStage.class);

    private final SpeechToTextClient client;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private boolean capturing;
    private int sampleRate;
    private int channels;

    public SpeechToTextStage(SpeechToTextClient client, String sessionId,
                             VoicePipelineMetrics metrics, ApplicationEventPublisher events) {
        super("speech-to-text", sessionId, metrics, events);
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public CompletionStage<List<Emission>> handle(Frame frame, FrameDirection direction) {
        if (direction != FrameDirection.DOWNSTREAM) {
            return forward(frame, direction);
        }
        if (frame instanceof AudioChunk chunk) {
            if (capturing) {
                buffer.writeBytes(chunk.pcm());
                sampleRate = chunk.sampleRate();
                channels = chunk.channels();
            }
            return CompletableFuture.completedFuture(List.of());
        }
        if (frame instanceof LifecycleEvent event && event.is(LifecycleKind.USER_STARTED)) {
            capturing = true;
            buffer.reset();
        } else if (frame instanceof LifecycleEvent event && event.is(LifecycleKind.USER_STOPPED) && capturing) {
            capturing = false;
            return transcribe(frame, direction);
        }
        return forward(frame, direction);
    }

    private CompletionStage<List<Emission>> transcribe(Frame stopEvent, FrameDirection direction) {
        byte[] pcm = buffer.toByteArray();
        buffer.reset();
        if (pcm.length == 0) {
            return forward(stopEvent, direction);
        }
        LOG.debug("Transcribing user turn: bytes={}, sampleRate={}", pcm.length, sampleRate);
        List<Emission> stopOnly = List.of(Emission.forward(stopEvent, direction));
        return call(() -> client.transcribe(pcm, sampleRate, channels), transcript -> {
            String text = transcript == null ? "" : transcript.trim();
            if (text.isEmpty()) {
                LOG.debug("Empty transcription; nothing to forward");
                return stopOnly;
            }
            LOG.info("User said: '{}'", LogSanitizer.preview(text));
            List<Emission> out = new ArrayList<>(stopOnly);
            out.add(Emission.downstream(new TextChunk(text)));
            return out;
        }, stopOnly);
    }

    private static CompletionStage<List<Emission>> forward(Frame frame, FrameDirection direction) {
        return CompletableFuture.completedFuture(List.of(Emission.forward(frame, direction)));
    }

    boolean isCapturing() {
        return capturing;
    }
}
