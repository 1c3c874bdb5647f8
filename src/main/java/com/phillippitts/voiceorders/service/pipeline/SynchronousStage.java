package com.phillippitts.voiceorders.service.pipeline;

import com.phillippitts.voiceorders.domain.frame.Frame;
import com.phillippitts.voiceorders.domain.frame.FrameDirection;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Base class for stages that finish their work on the calling thread.
 */
public abstract class SynchronousStage implements FrameStage {

    @Override
    public final CompletionStage<List<Emission>> handle(Frame frame, FrameDirection direction) {
        return CompletableFuture.completedFuture(process(frame, direction));
    }

    /**
     * Processes one frame synchronously. Runtime exceptions terminate the session.
     */
    protected abstract List<Emission> process(Frame frame, FrameDirection direction);

    protected static List<Emission> pass(Frame frame, FrameDirection direction) {
        return List.of(Emission.forward(frame, direction));
    }
}
