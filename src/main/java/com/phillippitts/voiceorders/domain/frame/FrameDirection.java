package com.phillippitts.voiceorders.domain.frame;

/**
 * Direction a frame travels through the pipeline.
 */
public enum FrameDirection {
    /** Toward the output transport (stage 1 to N). */
    DOWNSTREAM,
    /** Toward the input transport (stage N to 1). */
    UPSTREAM
}
