package com.phillippitts.voiceorders.service.backend.groq;

import com.phillippitts.voiceorders.config.properties.BackendProperties;
import com.phillippitts.voiceorders.service.audio.WavCodec;
import com.phillippitts.voiceorders.service.backend.SpeechToTextClient;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Transcribes audio with {@code POST /audio/transcriptions}. PCM is sent as a WAV file upload.
 */
public class GroqSpeechToTextClient extends GroqClientSupport implements SpeechToTextClient {

    private final BackendProperties properties;

    public GroqSpeechToTextClient(RestClient restClient, Executor executor, BackendProperties properties) {
        super(restClient, executor, "speech-to-text");
        this.properties = properties;
    }

    @Override
    public CompletableFuture<String> transcribe(byte[] pcm, int sampleRate, int channels) {
        byte[] wav = WavCodec.wrap(pcm, sampleRate, channels);
        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("file", new ByteArrayResource(wav) {
            @Override
            public String getFilename() {
                return "audio.wav";
            }
        });
        form.add("model", properties.sttModel());
        form.add("language", properties.language());
        form.add("response_format", "json");

        return async(() -> {
            String body = rest().post()
                    .uri("/audio/transcriptions")
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(form)
                    .retrieve()
                    .body(String.class);
            return GroqJson.transcriptText(body == null ? "{}" : body, backendName());
        });
    }
}
