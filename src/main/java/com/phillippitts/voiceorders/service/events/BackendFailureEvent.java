package com.phillippitts.voiceorders.service.events;

import java.time.Instant;

/**
 * Published when a speech, language or voice backend call fails. The session keeps running.
 *
 * @param sessionId  session that issued the call
 * @param backend    backend name, e.g. {@code speech-to-text}
 * @param reason     failure message
 * @param occurredAt when the failure was observed
 */
public record BackendFailureEvent(String sessionId, String backend, String reason, Instant occurredAt) {}
