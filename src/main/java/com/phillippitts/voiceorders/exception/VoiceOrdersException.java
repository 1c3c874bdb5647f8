package com.phillippitts.voiceorders.exception;

/**
 * Base exception for all voice-orders application errors.
 * Domain exceptions extend this class so they can be handled in one place.
 */
public class VoiceOrdersException extends RuntimeException {

    public VoiceOrdersException(String message) {
        super(message);
    }

    public VoiceOrdersException(String message, Throwable cause) {
        super(message, cause);
    }

    public VoiceOrdersException(Throwable cause) {
        super(cause);
    }
}
