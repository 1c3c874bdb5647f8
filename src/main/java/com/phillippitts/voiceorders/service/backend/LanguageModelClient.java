package com.phillippitts.voiceorders.service.backend;

import com.phillippitts.voiceorders.domain.conversation.ChatMessage;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Produces the assistant's next reply from the full conversation history.
 */
public interface LanguageModelClient {

    CompletableFuture<String> complete(List<ChatMessage> messages);
}
