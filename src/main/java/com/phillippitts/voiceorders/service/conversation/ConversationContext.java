package com.phillippitts.voiceorders.service.conversation;

import com.phillippitts.voiceorders.domain.conversation.ChatMessage;
import com.phillippitts.voiceorders.domain.conversation.MessageRole;

import java.util.List;

/**
 * Mutable message history handed to the language model on every turn.
 *
 * <p>Stages receive this capability at construction; they never reach a shared instance.
 * Implementations must tolerate appends from the session thread and from backend callbacks.
 */
public interface ConversationContext {

    /**
     * Appends a message to the end of the history.
     */
    void appendMessage(MessageRole role, String content);

    /**
     * Returns an immutable copy of the history in append order.
     */
    List<ChatMessage> messages();
}
