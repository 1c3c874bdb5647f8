package com.phillippitts.voiceorders.service.conversation;

import com.phillippitts.voiceorders.domain.conversation.ConversationState;
import com.phillippitts.voiceorders.domain.frame.Frame;
import com.phillippitts.voiceorders.domain.frame.FrameDirection;
import com.phillippitts.voiceorders.domain.frame.LifecycleEvent;
import com.phillippitts.voiceorders.domain.frame.TransportMessage;
import com.phillippitts.voiceorders.service.pipeline.Emission;
import com.phillippitts.voiceorders.service.pipeline.SynchronousStage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.util.List;
import java.util.Optional;

/**
 * Tells the client whether the assistant is listening, processing or responding.
 *
 * <p>Lifecycle frames map to states as follows:
 * <pre>
 * SESSION_START → LISTENING
 * USER_STARTED  → LISTENING
 * USER_STOPPED  → PROCESSING
 * BOT_STARTED   → RESPONDING
 * BOT_STOPPED   → LISTENING
 * </pre>
 * A {@code {"type":"state","value":...}} message is emitted downstream only when the mapped state
 * differs from the last one emitted. The first mapped state is always emitted. Every frame is
 * forwarded after the notification.
 */
public final class ConversationStateStage extends SynchronousStage {

    private static final Logger LOG = LogManager.getLogger(ConversationStateStage.class);

    private ConversationState lastEmitted;

    /**
     * Observes one frame and returns the notification it causes, if any.
     */
    public Optional<TransportMessage> observe(Frame frame) {
        if (!(frame instanceof LifecycleEvent event)) {
            return Optional.empty();
        }
        ConversationState next = switch (event.kind()) {
            case SESSION_START, USER_STARTED, BOT_STOPPED -> ConversationState.LISTENING;
            case USER_STOPPED -> ConversationState.PROCESSING;
            case BOT_STARTED -> ConversationState.RESPONDING;
        };
        if (next == lastEmitted) {
            return Optional.empty();
        }
        lastEmitted = next;
        LOG.info("Conversation state: {} (after {})", next.wireValue(), event.kind());
        JSONObject payload = new JSONObject()
                .put("type", "state")
                .put("value", next.wireValue());
        return Optional.of(new TransportMessage(payload.toString()));
    }

    public Optional<ConversationState> currentState() {
        return Optional.ofNullable(lastEmitted);
    }

    @Override
    protected List<Emission> process(Frame frame, FrameDirection direction) {
        return observe(frame)
                .map(message -> List.of(Emission.downstream(message), Emission.forward(frame, direction)))
                .orElseGet(() -> pass(frame, direction));
    }
}
