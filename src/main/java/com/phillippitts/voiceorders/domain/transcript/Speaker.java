package com.phillippitts.voiceorders.domain.transcript;

/**
 * Who produced an utterance. {@link #wireValue()} is the value sent to transcript observers.
 */
public enum Speaker {
    USER("user"),
    BOT("bot");

    private final String wireValue;

    Speaker(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
