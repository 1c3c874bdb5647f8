package com.phillippitts.voiceorders.service.pipeline;

import java.util.List;
import java.util.Objects;

/**
 * Ordered list of stages for one voice session.
 *
 * <p>Downstream frames visit stages 1 to N, upstream frames N to 1. A pipeline is started
 * once; the returned {@link PipelineTask} owns the running session.
 */
public final class Pipeline {

    private final List<FrameStage> stages;

    public Pipeline(List<? extends FrameStage> stages) {
        Objects.requireNonNull(stages, "stages");
        if (stages.isEmpty()) {
            throw new IllegalArgumentException("A pipeline needs at least one stage");
        }
        this.stages = List.copyOf(stages);
    }

    public List<FrameStage> stages() {
        return stages;
    }

    /**
     * Creates the runner for this pipeline and queues the session start frame.
     *
     * @param sessionId    session identifier used in logs and termination signals
     * @param outputSink   receives frames leaving the tail downstream
     * @return the running task
     */
    public PipelineTask start(String sessionId, FrameSink outputSink) {
        PipelineTask task = new PipelineTask(sessionId, stages, outputSink);
        task.start();
        return task;
    }
}
