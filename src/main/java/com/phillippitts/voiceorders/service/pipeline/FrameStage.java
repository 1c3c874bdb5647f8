package com.phillippitts.voiceorders.service.pipeline;

import com.phillippitts.voiceorders.domain.frame.Frame;
import com.phillippitts.voiceorders.domain.frame.FrameDirection;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * A single processing unit in a voice session pipeline.
 *
 * <p>For every frame it receives a stage completes with the frames that continue through the
 * pipeline. It may:
 * <ul>
 *   <li>pass the frame on unchanged ({@code List.of(Emission.forward(frame, direction))})</li>
 *   <li>transform it, or absorb it by returning an empty list (only for frames it consumes)</li>
 *   <li>originate new frames in either direction, before or after the original</li>
 * </ul>
 *
 * <p>Frame kinds a stage does not handle must be forwarded verbatim. Stages that call external
 * services complete the returned stage later; the engine never blocks a thread waiting for it.
 *
 * <p>A stage instance belongs to exactly one session and is never invoked concurrently.
 */
public interface FrameStage {

    /**
     * Processes one frame.
     *
     * @param frame     the frame
     * @param direction direction the frame is travelling
     * @return the frames to continue with, in order; an exceptional completion terminates the session
     */
    CompletionStage<List<Emission>> handle(Frame frame, FrameDirection direction);

    /**
     * Name used in logs and termination signals.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
