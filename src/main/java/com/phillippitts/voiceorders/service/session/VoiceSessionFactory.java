package com.phillippitts.voiceorders.service.session;

import com.phillippitts.voiceorders.config.properties.SessionProperties;
import com.phillippitts.voiceorders.config.properties.VadProperties;
import com.phillippitts.voiceorders.domain.transcript.Speaker;
import com.phillippitts.voiceorders.service.audio.AudioLoggingStage;
import com.phillippitts.voiceorders.service.audio.VoiceActivityStage;
import com.phillippitts.voiceorders.service.backend.LanguageModelClient;
import com.phillippitts.voiceorders.service.backend.LanguageModelStage;
import com.phillippitts.voiceorders.service.backend.SpeechToTextClient;
import com.phillippitts.voiceorders.service.backend.SpeechToTextStage;
import com.phillippitts.voiceorders.service.backend.TextToSpeechClient;
import com.phillippitts.voiceorders.service.backend.TextToSpeechStage;
import com.phillippitts.voiceorders.service.conversation.ConversationContext;
import com.phillippitts.voiceorders.service.conversation.ConversationStateStage;
import com.phillippitts.voiceorders.service.conversation.InMemoryConversationContext;
import com.phillippitts.voiceorders.service.conversation.SystemFactLedger;
import com.phillippitts.voiceorders.service.metrics.VoicePipelineMetrics;
import com.phillippitts.voiceorders.service.orders.OrderDataStore;
import com.phillippitts.voiceorders.service.orders.OrderKnowledgeStage;
import com.phillippitts.voiceorders.service.pipeline.FrameSink;
import com.phillippitts.voiceorders.service.pipeline.FrameStage;
import com.phillippitts.voiceorders.service.pipeline.Pipeline;
import com.phillippitts.voiceorders.service.pipeline.PipelineTask;
import com.phillippitts.voiceorders.service.transcript.TranscriptHub;
import com.phillippitts.voiceorders.service.transcript.TranscriptRecorderStage;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Builds the stage list of a new voice session and starts its pipeline.
 *
 * <p>Stage order:
 * <pre>
 * AudioLogging → VoiceActivity → ConversationState → SpeechToText → OrderKnowledge
 *   → TranscriptRecorder(user) → LanguageModel → TranscriptRecorder(bot) → TextToSpeech
 * </pre>
 * Every session gets its own stages and conversation context; only the order store and the
 * transcript hub are shared.
 */
@Component
public class VoiceSessionFactory {

    private final OrderDataStore orderDataStore;
    private final TranscriptHub transcriptHub;
    private final SpeechToTextClient speechToText;
    private final LanguageModelClient languageModel;
    private final TextToSpeechClient textToSpeech;
    private final SessionProperties sessionProperties;
    private final VadProperties vadProperties;
    private final VoicePipelineMetrics metrics;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    public VoiceSessionFactory(OrderDataStore orderDataStore,
                               TranscriptHub transcriptHub,
                               SpeechToTextClient speechToText,
                               LanguageModelClient languageModel,
                               TextToSpeechClient textToSpeech,
                               SessionProperties sessionProperties,
                               VadProperties vadProperties,
                               VoicePipelineMetrics metrics,
                               ApplicationEventPublisher events,
                               Clock clock) {
        this.orderDataStore = orderDataStore;
        this.transcriptHub = transcriptHub;
        this.speechToText = speechToText;
        this.languageModel = languageModel;
        this.textToSpeech = textToSpeech;
        this.sessionProperties = sessionProperties;
        this.vadProperties = vadProperties;
        this.metrics = metrics;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Starts a session whose downstream output goes to {@code output}.
     */
    public VoiceSession open(String sessionId, FrameSink output) {
        ConversationContext context = new InMemoryConversationContext(sessionProperties.systemPrompt());
        OrderKnowledgeStage orderKnowledge =
                new OrderKnowledgeStage(orderDataStore, new SystemFactLedger(context), metrics);

        List<FrameStage> stages = List.of(
                new AudioLoggingStage(sessionProperties.audioLogInterval()),
                new VoiceActivityStage(vadProperties.enabled(), vadProperties.silenceThreshold(),
                        vadProperties.startMs(), vadProperties.stopMs()),
                new ConversationStateStage(),
                new SpeechToTextStage(speechToText, sessionId, metrics, events),
                orderKnowledge,
                new TranscriptRecorderStage(Speaker.USER, transcriptHub),
                new LanguageModelStage(languageModel, context, sessionId, metrics, events),
                new TranscriptRecorderStage(Speaker.BOT, transcriptHub),
                new TextToSpeechStage(textToSpeech, sessionId, metrics, events));

        PipelineTask task = new Pipeline(stages).start(sessionId, output);
        return new VoiceSession(sessionId, task, context, orderKnowledge, clock);
    }
}
