package com.phillippitts.voiceorders.service.session;

import com.phillippitts.voiceorders.config.properties.SessionProperties;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks open voice sessions, closes idle ones and closes all of them on shutdown.
 *
 * <p>The closer registered with a session closes its transport; the transport handler then
 * runs the usual teardown, which unregisters the session.
 */
@Component
public class ActiveSessionRegistry {

    private static final Logger LOG = LogManager.getLogger(ActiveSessionRegistry.class);

    /**
     * Closes the transport of a session.
     */
    @FunctionalInterface
    public interface SessionCloser {
        void close(String reason);
    }

    private record Entry(VoiceSession session, SessionCloser closer) {}

    private final Map<String, Entry> sessions = new ConcurrentHashMap<>();
    private final Duration idleTimeout;

    public ActiveSessionRegistry(SessionProperties properties) {
        this.idleTimeout = Duration.ofSeconds(properties.idleTimeoutSeconds());
    }

    public void register(VoiceSession session, SessionCloser closer) {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(closer, "closer");
        sessions.put(session.id(), new Entry(session, closer));
        LOG.info("Voice session registered: id={}, active={}", session.id(), sessions.size());
    }

    public void unregister(String sessionId) {
        if (sessions.remove(sessionId) != null) {
            LOG.info("Voice session unregistered: id={}, active={}", sessionId, sessions.size());
        }
    }

    public int activeCount() {
        return sessions.size();
    }

    /**
     * Closes sessions without inbound frames for longer than the idle timeout.
     */
    @Scheduled(fixedRate = 30_000)
    public void closeIdleSessions() {
        for (Entry entry : List.copyOf(sessions.values())) {
            Duration idle = entry.session().idleFor();
            if (idle.compareTo(idleTimeout) > 0) {
                LOG.info("Closing idle voice session: id={}, idleSeconds={}", entry.session().id(), idle.toSeconds());
                closeQuietly(entry, "idle timeout");
            }
        }
    }

    @PreDestroy
    public void closeAll() {
        if (!sessions.isEmpty()) {
            LOG.info("Closing {} voice session(s) on shutdown", sessions.size());
        }
        for (Entry entry : List.copyOf(sessions.values())) {
            closeQuietly(entry, "server shutdown");
        }
    }

    private void closeQuietly(Entry entry, String reason) {
        entry.session().close();
        try {
            entry.closer().close(reason);
        } catch (RuntimeException e) {
            LOG.warn("Failed to close transport of session {}: {}", entry.session().id(), e.getMessage());
        } finally {
            unregister(entry.session().id());
        }
    }
}
