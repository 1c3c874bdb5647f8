package com.phillippitts.voiceorders.domain.conversation;

import java.util.Objects;

/**
 * A message in the language model conversation history.
 *
 * @param role    author role
 * @param content message text
 */
public record ChatMessage(MessageRole role, String content) {

    public ChatMessage {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
    }
}
