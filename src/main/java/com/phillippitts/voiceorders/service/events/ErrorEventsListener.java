package com.phillippitts.voiceorders.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for operational error events. Throttled per key to avoid log spam
 * when a backend is down for every session at once.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onBackendFailure(BackendFailureEvent e) {
        if (shouldLog("backend-" + e.backend())) {
            LOG.warn("Backend {} is failing (session={}): {}. Check voice.backend.* settings and the API key.",
                    e.backend(), e.sessionId(), e.reason());
        }
    }

    @EventListener
    void onPipelineTerminated(PipelineTerminatedEvent e) {
        if (shouldLog("pipeline-" + e.stage())) {
            LOG.error("Voice session {} terminated by stage {}: {}", e.sessionId(), e.stage(), e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
