package com.phillippitts.voiceorders.service.pipeline;

import com.phillippitts.voiceorders.domain.frame.Frame;
import com.phillippitts.voiceorders.domain.frame.FrameDirection;

import java.util.Objects;

/**
 * A frame produced by a stage together with the direction it continues in.
 *
 * @param frame     the frame to pass on
 * @param direction where it travels next
 */
public record Emission(Frame frame, FrameDirection direction) {

    public Emission {
        Objects.requireNonNull(frame, "frame");
        Objects.requireNonNull(direction, "direction");
    }

    public static Emission forward(Frame frame, FrameDirection direction) {
        return new Emission(frame, direction);
    }

    public static Emission downstream(Frame frame) {
        return new Emission(frame, FrameDirection.DOWNSTREAM);
    }

    public static Emission upstream(Frame frame) {
        return new Emission(frame, FrameDirection.UPSTREAM);
    }
}
