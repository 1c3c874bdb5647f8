package com.phillippitts.voiceorders.service.backend.groq;

import com.phillippitts.voiceorders.config.properties.BackendProperties;
import com.phillippitts.voiceorders.exception.BackendCallException;
import com.phillippitts.voiceorders.service.audio.WavCodec;
import com.phillippitts.voiceorders.service.backend.SynthesizedAudio;
import com.phillippitts.voiceorders.service.backend.TextToSpeechClient;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Speech synthesis with {@code POST /audio/speech}, requesting WAV and unwrapping it to PCM.
 */
public class GroqTextToSpeechClient extends GroqClientSupport implements TextToSpeechClient {

    private final BackendProperties properties;

    public GroqTextToSpeechClient(RestClient restClient, Executor executor, BackendProperties properties) {
        super(restClient, executor, "text-to-speech");
        this.properties = properties;
    }

    @Override
    public CompletableFuture<SynthesizedAudio> synthesize(String text) {
        String request = GroqJson.speechRequest(properties.ttsModel(), properties.ttsVoice(), text);
        return async(() -> {
            byte[] wav = rest().post()
                    .uri("/audio/speech")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(byte[].class);
            if (wav == null || wav.length == 0) {
                throw new BackendCallException("Empty speech response", backendName());
            }
            try {
                WavCodec.Decoded decoded = WavCodec.unwrap(wav);
                return new SynthesizedAudio(decoded.pcm(), decoded.sampleRate(), decoded.channels());
            } catch (IllegalArgumentException e) {
                throw new BackendCallException("Unreadable speech audio: " + e.getMessage(), backendName(), e);
            }
        });
    }
}
