package com.phillippitts.voiceorders.service.backend.groq;

import com.phillippitts.voiceorders.config.properties.BackendProperties;
import com.phillippitts.voiceorders.domain.conversation.ChatMessage;
import com.phillippitts.voiceorders.service.backend.LanguageModelClient;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Chat completions with {@code POST /chat/completions}.
 */
public class GroqLanguageModelClient extends GroqClientSupport implements LanguageModelClient {

    private final BackendProperties properties;

    public GroqLanguageModelClient(RestClient restClient, Executor executor, BackendProperties properties) {
        super(restClient, executor, "language-model");
        this.properties = properties;
    }

    @Override
    public CompletableFuture<String> complete(List<ChatMessage> messages) {
        String request = GroqJson.chatRequest(properties.llmModel(), List.copyOf(messages));
        return async(() -> {
            String body = rest().post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(String.class);
            return GroqJson.completionContent(body == null ? "{}" : body, backendName());
        });
    }
}
