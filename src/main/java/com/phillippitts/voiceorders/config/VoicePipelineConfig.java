package com.phillippitts.voiceorders.config;

import com.phillippitts.voiceorders.config.properties.BackendProperties;
import com.phillippitts.voiceorders.config.properties.OrderDataProperties;
import com.phillippitts.voiceorders.service.backend.LanguageModelClient;
import com.phillippitts.voiceorders.service.backend.SpeechToTextClient;
import com.phillippitts.voiceorders.service.backend.TextToSpeechClient;
import com.phillippitts.voiceorders.service.backend.groq.GroqLanguageModelClient;
import com.phillippitts.voiceorders.service.backend.groq.GroqSpeechToTextClient;
import com.phillippitts.voiceorders.service.backend.groq.GroqTextToSpeechClient;
import com.phillippitts.voiceorders.service.orders.OrderDataStore;
import com.phillippitts.voiceorders.service.orders.StaticJsonOrderDataStore;
import com.phillippitts.voiceorders.service.transcript.TranscriptHub;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Shared collaborators of the voice sessions: the order store, the transcript hub and the backend clients.
 */
@Configuration
public class VoicePipelineConfig {

    private static final Logger LOG = LogManager.getLogger(VoicePipelineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Loads the order snapshot once at startup. A missing or malformed snapshot does not stop
     * the application; it is reported by the health checks.
     */
    @Bean
    public OrderDataStore orderDataStore(OrderDataProperties properties, ResourceLoader resourceLoader) {
        return StaticJsonOrderDataStore.load(resourceLoader.getResource(properties.snapshotPath()));
    }

    /**
     * The process-wide transcript, shared by every voice session and observer.
     */
    @Bean
    public TranscriptHub transcriptHub(@Qualifier("transcriptExecutor") Executor transcriptExecutor, Clock clock) {
        return new TranscriptHub(transcriptExecutor, clock);
    }

    @Bean
    public RestClient backendRestClient(BackendProperties properties) {
        if (!properties.hasApiKey()) {
            LOG.warn("voice.backend.api-key is not set; voice sessions will be refused");
        }
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.timeoutMs());
        requestFactory.setReadTimeout(properties.timeoutMs());
        return RestClient.builder()
                .baseUrl(properties.baseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + (properties.hasApiKey() ? properties.apiKey() : ""))
                .build();
    }

    @Bean
    public SpeechToTextClient speechToTextClient(RestClient backendRestClient,
                                                 @Qualifier("backendExecutor") Executor backendExecutor,
                                                 BackendProperties properties) {
        return new GroqSpeechToTextClient(backendRestClient, backendExecutor, properties);
    }

    @Bean
    public LanguageModelClient languageModelClient(RestClient backendRestClient,
                                                   @Qualifier("backendExecutor") Executor backendExecutor,
                                                   BackendProperties properties) {
        return new GroqLanguageModelClient(backendRestClient, backendExecutor, properties);
    }

    @Bean
    public TextToSpeechClient textToSpeechClient(RestClient backendRestClient,
                                                 @Qualifier("backendExecutor") Executor backendExecutor,
                                                 BackendProperties properties) {
        return new GroqTextToSpeechClient(backendRestClient, backendExecutor, properties);
    }
}
