package com.phillippitts.voiceorders.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for voice sessions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Backend call latency and failures per backend</li>
 *   <li>Order lookups by result</li>
 *   <li>System facts injected per tag</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class VoicePipelineMetrics {

    private static final String METRIC_PREFIX = "voiceorders";

    private final MeterRegistry registry;

    public VoicePipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long a backend call took, successful or not.
     *
     * @param backend backend name (speech-to-text, language-model, text-to-speech)
     * @param durationNanos duration in nanoseconds
     */
    public void recordBackendLatency(String backend, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".backend.latency")
                .description("Time taken by speech, language model and synthesis backends")
                .tag("backend", backend)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param backend backend name (speech-to-text, language-model, text-to-speech)
     * @param reason exception simple name
     */
    public void incrementBackendFailure(String backend, String reason) {
        Counter.builder(METRIC_PREFIX + ".backend.failure")
                .description("Number of failed backend calls")
                .tag("backend", backend)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementOrderLookup(boolean found) {
        Counter.builder(METRIC_PREFIX + ".orders.lookup")
                .description("Number of order lookups by result")
                .tag("result", found ? "found" : "not_found")
                .register(registry)
                .increment();
    }

    public void incrementFactInjected(String tag) {
        Counter.builder(METRIC_PREFIX + ".facts.injected")
                .description("Number of system facts added to conversation contexts")
                .tag("tag", tag)
                .register(registry)
                .increment();
    }
}
