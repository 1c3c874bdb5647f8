package com.phillippitts.voiceorders.config;

import com.phillippitts.voiceorders.service.session.ActiveSessionRegistry;
import com.phillippitts.voiceorders.service.transcript.TranscriptHub;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Gauges for live session state and the backend pool, exposed via Micrometer.
 *
 * <ul>
 *   <li>voiceorders.sessions.active - open voice sessions</li>
 *   <li>voiceorders.transcript.subscribers - connected transcript observers</li>
 *   <li>voiceorders.backend.pool.active / .queued - backend executor load</li>
 * </ul>
 *
 * <p>Available via {@code GET /actuator/metrics/voiceorders.sessions.active} or Prometheus.
 * Additionally logs a summary every 5 minutes.
 */
@Configuration
public class VoiceOrdersMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(VoiceOrdersMetricsConfig.class);

    private final ActiveSessionRegistry sessionRegistry;
    private final TranscriptHub transcriptHub;
    private final ObjectProvider<ThreadPoolTaskExecutor> backendExecutorProvider;

    public VoiceOrdersMetricsConfig(ActiveSessionRegistry sessionRegistry,
                                    TranscriptHub transcriptHub,
                                    @Qualifier("backendExecutor") ObjectProvider<ThreadPoolTaskExecutor> backendExecutorProvider) {
        this.sessionRegistry = sessionRegistry;
        this.transcriptHub = transcriptHub;
        this.backendExecutorProvider = backendExecutorProvider;
    }

    @Bean
    public MeterBinder voiceOrdersGauges() {
        return registry -> {
            Gauge.builder("voiceorders.sessions.active", sessionRegistry, ActiveSessionRegistry::activeCount)
                    .description("Open voice sessions")
                    .register(registry);

            Gauge.builder("voiceorders.transcript.subscribers", transcriptHub, TranscriptHub::subscriberCount)
                    .description("Connected transcript observers")
                    .register(registry);

            ThreadPoolExecutor executor = backendExecutorProvider.getObject().getThreadPoolExecutor();
            Gauge.builder("voiceorders.backend.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Backend calls in progress")
                    .register(registry);

            Gauge.builder("voiceorders.backend.pool.queued", executor, e -> e.getQueue().size())
                    .description("Backend calls waiting for a thread")
                    .register(registry);
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logSessionSummary() {
        ThreadPoolExecutor executor = backendExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Voice service summary: sessions={}, observers={}, backendActive={}, backendQueued={}",
                sessionRegistry.activeCount(),
                transcriptHub.subscriberCount(),
                executor.getActiveCount(),
                executor.getQueue().size());
    }
}
