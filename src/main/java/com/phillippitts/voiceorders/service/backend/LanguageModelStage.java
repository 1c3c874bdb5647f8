package com.phillippitts.voiceorders.service.backend;

import com.phillippitts.voiceorders.domain.conversation.MessageRole;
import com.phillippitts.voiceorders.domain.frame.Frame;
import com.phillippitts.voiceorders.domain.frame.FrameDirection;
import com.phillippitts.voiceorders.domain.frame.TextChunk;
import com.phillippitts.voiceorders.service.conversation.ConversationContext;
import com.phillippitts.voiceorders.service.metrics.VoicePipelineMetrics;
import com.phillippitts.voiceorders.service.pipeline.Emission;
import com.phillippitts.voiceorders.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Answers each user utterance with the language model.
 *
 * <p>A downstream {@link TextChunk} is consumed: it is appended to the conversation as a user
 * message, the full history (including any system facts injected upstream) is sent to the
 * model, and the reply is appended as an assistant message and emitted as a new {@link TextChunk}.
 */
public final class LanguageModelStage extends BackendStage {

    private static final Logger LOG = LogManager.getLogger(LanguageModelStage.class);

    private final LanguageModelClient client;
    private final ConversationContext context;

    public LanguageModelStage(LanguageModelClient client, ConversationContext context, String sessionId,
                              VoicePipelineMetrics metrics, ApplicationEventPublisher events) {
        super("language-model", sessionId, metrics, events);
        this.client = Objects.requireNonNull(client, "client");
        this.context = Objects.requireNonNull(context, "context");
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
        context.appendMessage(MessageRole.USER, text);
        return call(() -> client.complete(context.messages()), reply -> {
            String answer = reply == null ? "" : reply.trim();
            if (answer.isEmpty()) {
                LOG.warn("Language model returned an empty reply");
                return List.of();
            }
            context.appendMessage(MessageRole.ASSISTANT, answer);
            LOG.info("Assistant reply: '{}'", LogSanitizer.preview(answer));
            return List.of(Emission.downstream(new TextChunk(answer)));
        }, List.of());
    }
}
