package com.phillippitts.voiceorders.exception;

/**
 * Thrown when a speech-to-text, language model or text-to-speech backend call fails.
 * Sessions recover from it by apologising to the caller; it never terminates a pipeline.
 */
public class BackendCallException extends VoiceOrdersException {

    private final String backendName;

    public BackendCallException(String message, String backendName) {
        super(message + " (backend: " + backendName + ")");
        this.backendName = backendName;
    }

    public BackendCallException(String message, String backendName, Throwable cause) {
        super(message + " (backend: " + backendName + ")", cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
