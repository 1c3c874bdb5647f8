package com.phillippitts.voiceorders.service.pipeline;

import com.phillippitts.voiceorders.domain.frame.Frame;

/**
 * Receives frames that leave the tail of the pipeline travelling downstream (the output transport).
 */
@FunctionalInterface
public interface FrameSink {

    /**
     * Delivers one outbound frame. A runtime exception terminates the session.
     */
    void deliver(Frame frame);
}
