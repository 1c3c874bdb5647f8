package com.phillippitts.voiceorders.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class VoicePipelineMetricsTest {

    private MeterRegistry registry;
    private VoicePipelineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new VoicePipelineMetrics(registry);
    }

    @Test
    void shouldRecordLatencyPerBackend() {
        metrics.recordBackendLatency("speech-to-text", TimeUnit.MILLISECONDS.toNanos(120));
        metrics.recordBackendLatency("speech-to-text", TimeUnit.MILLISECONDS.toNanos(80));
        metrics.recordBackendLatency("language-model", TimeUnit.MILLISECONDS.toNanos(900));

        Timer stt = registry.find("voiceorders.backend.latency").tag("backend", "speech-to-text").timer();
        Timer llm = registry.find("voiceorders.backend.latency").tag("backend", "language-model").timer();

        assertThat(stt).isNotNull();
        assertThat(stt.count()).isEqualTo(2);
        assertThat(stt.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(200.0);
        assertThat(llm).isNotNull();
        assertThat(llm.count()).isEqualTo(1);
    }

    @Test
    void shouldCountFailuresByBackendAndReason() {
        metrics.incrementBackendFailure("text-to-speech", "BackendCallException");
        metrics.incrementBackendFailure("text-to-speech", "BackendCallException");
        metrics.incrementBackendFailure("text-to-speech", "IllegalStateException");

        Counter counter = registry.find("voiceorders.backend.failure")
                .tag("backend", "text-to-speech")
                .tag("reason", "BackendCallException")
                .counter();

        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(2.0);
    }

    @Test
    void shouldCountOrderLookupsByResult() {
        metrics.incrementOrderLookup(true);
        metrics.incrementOrderLookup(false);
        metrics.incrementOrderLookup(false);

        assertThat(registry.find("voiceorders.orders.lookup").tag("result", "found").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("voiceorders.orders.lookup").tag("result", "not_found").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void shouldCountInjectedFactsByTag() {
        metrics.incrementFactInjected("order-lookup");

        Counter counter = registry.find("voiceorders.facts.injected").tag("tag", "order-lookup").counter();

        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(1.0);
    }
}
