package com.phillippitts.voiceorders.service.session;

import com.phillippitts.voiceorders.domain.frame.Frame;
import com.phillippitts.voiceorders.domain.frame.FrameDirection;
import com.phillippitts.voiceorders.service.conversation.ConversationContext;
import com.phillippitts.voiceorders.service.orders.OrderKnowledgeStage;
import com.phillippitts.voiceorders.service.pipeline.PipelineTask;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * One running voice conversation: its pipeline task plus the per-session state other components inspect.
 */
public final class VoiceSession {

    private final String id;
    private final PipelineTask task;
    private final ConversationContext context;
    private final OrderKnowledgeStage orderKnowledge;
    private final Clock clock;
    private volatile Instant lastActivity;

    VoiceSession(String id, PipelineTask task, ConversationContext context,
                 OrderKnowledgeStage orderKnowledge, Clock clock) {
        this.id = Objects.requireNonNull(id, "id");
        this.task = Objects.requireNonNull(task, "task");
        this.context = Objects.requireNonNull(context, "context");
        this.orderKnowledge = Objects.requireNonNull(orderKnowledge, "orderKnowledge");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lastActivity = clock.instant();
    }

    public String id() {
        return id;
    }

    /**
     * Queues an inbound frame from the client.
     */
    public CompletableFuture<Void> receive(Frame frame) {
        lastActivity = clock.instant();
        return task.queueFrame(frame, FrameDirection.DOWNSTREAM);
    }

    /**
     * Completes normally on {@link #close()}, exceptionally with a
     * {@link com.phillippitts.voiceorders.exception.PipelineTerminatedException} when a stage failed.
     */
    public CompletableFuture<Void> whenTerminated() {
        return task.whenTerminated();
    }

    public boolean isOpen() {
        return task.isRunning();
    }

    public void close() {
        task.stop();
    }

    public Duration idleFor() {
        return Duration.between(lastActivity, clock.instant());
    }

    public ConversationContext context() {
        return context;
    }

    public OrderKnowledgeStage orderKnowledge() {
        return orderKnowledge;
    }
}
