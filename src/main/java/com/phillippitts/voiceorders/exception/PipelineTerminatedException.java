package com.phillippitts.voiceorders.exception;

/**
 * Signals that a session pipeline stopped because a stage failed.
 * The session owner closes the transport when it sees this.
 */
public class PipelineTerminatedException extends VoiceOrdersException {

    private final String sessionId;
    private final String stageName;

    public PipelineTerminatedException(String sessionId, String stageName, Throwable cause) {
        super("Pipeline for session " + sessionId + " terminated in stage " + stageName, cause);
        this.sessionId = sessionId;
        this.stageName = stageName;
    }

    public PipelineTerminatedException(String sessionId, String message) {
        super(message + " (session: " + sessionId + ")");
        this.sessionId = sessionId;
        this.stageName = "none";
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getStageName() {
        return stageName;
    }
}
