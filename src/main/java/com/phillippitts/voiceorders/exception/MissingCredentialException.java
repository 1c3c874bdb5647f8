package com.phillippitts.voiceorders.exception;

/**
 * Thrown when a credential required to open a voice session is not configured.
 */
public class MissingCredentialException extends VoiceOrdersException {

    private final String propertyName;

    public MissingCredentialException(String propertyName) {
        super("Required credential is not configured: " + propertyName);
        this.propertyName = propertyName;
    }

    public String getPropertyName() {
        return propertyName;
    }
}
