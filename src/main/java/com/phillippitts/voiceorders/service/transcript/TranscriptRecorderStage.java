package com.phillippitts.voiceorders.service.transcript;

import com.phillippitts.voiceorders.domain.frame.Frame;
import com.phillippitts.voiceorders.domain.frame.FrameDirection;
import com.phillippitts.voiceorders.domain.frame.LifecycleEvent;
import com.phillippitts.voiceorders.domain.frame.LifecycleKind;
import com.phillippitts.voiceorders.domain.frame.TextChunk;
import com.phillippitts.voiceorders.domain.frame.TransportMessage;
import com.phillippitts.voiceorders.domain.transcript.Speaker;
import com.phillippitts.voiceorders.service.pipeline.Emission;
import com.phillippitts.voiceorders.service.pipeline.SynchronousStage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Records finalized utterances of one speaker into the {@link TranscriptHub}.
 *
 * <ul>
 *   <li>{@link Speaker#USER}: every downstream {@link TextChunk} is one utterance. It is added to the
 *       hub and a message carrying the full transcript (the same array observers receive) is
 *       emitted downstream before the chunk is forwarded.</li>
 *   <li>{@link Speaker#BOT}: downstream chunks are buffered. A {@code BOT_STOPPED} event, in either
 *       direction, flushes the trimmed buffer as one utterance.</li>
 * </ul>
 * Every frame is forwarded.
 */
public final class TranscriptRecorderStage extends SynchronousStage {

    private static final Logger LOG = LogManager.getLogger(TranscriptRecorderStage.class);

    private final Speaker speaker;
    private final TranscriptHub hub;
    private final StringBuilder buffer = new StringBuilder();

    public TranscriptRecorderStage(Speaker speaker, TranscriptHub hub) {
        this.speaker = Objects.requireNonNull(speaker, "speaker");
        this.hub = Objects.requireNonNull(hub, "hub");
    }

    @Override
    public String name() {
        return "TranscriptRecorder(" + speaker.wireValue() + ")";
    }

    @Override
    protected List<Emission> process(Frame frame, FrameDirection direction) {
        if (frame instanceof TextChunk chunk && direction == FrameDirection.DOWNSTREAM) {
            if (speaker == Speaker.USER) {
                return recordUser(chunk, direction);
            }
            buffer.append(chunk.text());
        } else if (speaker == Speaker.BOT && frame instanceof LifecycleEvent event
                && event.is(LifecycleKind.BOT_STOPPED)) {
            flush();
        }
        return pass(frame, direction);
    }

    private List<Emission> recordUser(TextChunk chunk, FrameDirection direction) {
        String text = chunk.text().trim();
        if (text.isEmpty()) {
            return pass(chunk, direction);
        }
        hub.addMessage(Speaker.USER, text);
        TransportMessage snapshot = new TransportMessage(hub.snapshotJson());
        return List.of(Emission.downstream(snapshot), Emission.forward(chunk, direction));
    }

    private void flush() {
        String text = buffer.toString().trim();
        buffer.setLength(0);
        if (text.isEmpty()) {
            LOG.debug("Bot stopped with an empty buffer; nothing recorded");
            return;
        }
        hub.addMessage(Speaker.BOT, text);
    }

    /** Text buffered for the bot since the last flush. */
    String pendingText() {
        return buffer.toString();
    }
}
