package com.phillippitts.voiceorders.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the speech, language and voice backends (Groq OpenAI-compatible API).
 * Binds to properties prefixed with "voice.backend".
 *
 * <p>Example application.properties:
 * <pre>
 * voice.backend.api-key=${GROQ_API_KEY:}
 * voice.backend.stt-model=whisper-large-v3-turbo
 * voice.backend.llm-model=llama-3.3-70b-versatile
 * </pre>
 *
 * <p>The API key may be blank at startup; voice sessions are then refused.
 *
 * @param apiKey    bearer token for the backend API
 * @param baseUrl   API root, without trailing slash
 * @param sttModel  transcription model
 * @param llmModel  chat completion model
 * @param ttsModel  speech synthesis model
 * @param ttsVoice  synthesis voice
 * @param timeoutMs per-request timeout in milliseconds
 * @param language  ISO-639-1 language hint for transcription
 */
@ConfigurationProperties(prefix = "voice.backend")
@Validated
public record BackendProperties(
        String apiKey,

        @NotBlank(message = "Backend base URL must not be blank")
        @DefaultValue("https://api.groq.com/openai/v1") String baseUrl,

        @NotBlank(message = "STT model must not be blank")
        @DefaultValue("whisper-large-v3-turbo") String sttModel,

        @NotBlank(message = "LLM model must not be blank")
        @DefaultValue("llama-3.3-70b-versatile") String llmModel,

        @NotBlank(message = "TTS model must not be blank")
        @DefaultValue("playai-tts") String ttsModel,

        @NotBlank(message = "TTS voice must not be blank")
        @DefaultValue("Celeste-PlayAI") String ttsVoice,

        @Positive(message = "Timeout must be positive")
        @DefaultValue("30000") int timeoutMs,

        @NotBlank(message = "Language must not be blank")
        @DefaultValue("en") String language
) {
    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
