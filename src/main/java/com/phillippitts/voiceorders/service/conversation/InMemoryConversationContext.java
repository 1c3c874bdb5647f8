package com.phillippitts.voiceorders.service.conversation;

import com.phillippitts.voiceorders.domain.conversation.ChatMessage;
import com.phillippitts.voiceorders.domain.conversation.MessageRole;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-session conversation history kept in memory, seeded with the assistant system prompt.
 */
public final class InMemoryConversationContext implements ConversationContext {

    private final Lock lock = new ReentrantLock();
    private final List<ChatMessage> messages = new ArrayList<>();

    public InMemoryConversationContext() {
    }

    public InMemoryConversationContext(String systemPrompt) {
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(new ChatMessage(MessageRole.SYSTEM, systemPrompt));
        }
    }

    @Override
    public void appendMessage(MessageRole role, String content) {
        ChatMessage message = new ChatMessage(Objects.requireNonNull(role, "role"),
                Objects.requireNonNull(content, "content"));
        lock.lock();
        try {
            messages.add(message);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ChatMessage> messages() {
        lock.lock();
        try {
            return List.copyOf(messages);
        } finally {
            lock.unlock();
        }
    }
}
