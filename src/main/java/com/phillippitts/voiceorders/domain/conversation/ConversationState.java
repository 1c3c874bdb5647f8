package com.phillippitts.voiceorders.domain.conversation;

/**
 * What the assistant is doing from the caller's point of view.
 */
public enum ConversationState {
    LISTENING("listening"),
    PROCESSING("processing"),
    RESPONDING("responding");

    private final String wireValue;

    ConversationState(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
