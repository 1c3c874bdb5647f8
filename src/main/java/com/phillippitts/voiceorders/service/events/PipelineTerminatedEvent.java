package com.phillippitts.voiceorders.service.events;

import java.time.Instant;

/**
 * Published when a voice session's pipeline ends because a stage failed.
 *
 * @param sessionId  terminated session
 * @param stage      name of the failing stage
 * @param reason     failure message
 * @param occurredAt when the session was torn down
 */
public record PipelineTerminatedEvent(String sessionId, String stage, String reason, Instant occurredAt) {}
