package com.phillippitts.voiceorders.domain.frame;

/**
 * Control events that describe who is speaking.
 */
public enum LifecycleKind {
    SESSION_START,
    USER_STARTED,
    USER_STOPPED,
    BOT_STARTED,
    BOT_STOPPED
}
