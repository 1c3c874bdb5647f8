package com.phillippitts.voiceorders.service.conversation;

import com.phillippitts.voiceorders.domain.conversation.ChatMessage;
import com.phillippitts.voiceorders.domain.conversation.MessageRole;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryConversationContextTest {

    @Test
    void seedsSystemPrompt() {
        InMemoryConversationContext context = new InMemoryConversationContext("Be brief.");

        assertThat(context.messages()).containsExactly(new ChatMessage(MessageRole.SYSTEM, "Be brief."));
    }

    @Test
    void blankPromptIsNotSeeded() {
        assertThat(new InMemoryConversationContext("  ").messages()).isEmpty();
    }

    @Test
    void returnsImmutableSnapshot() {
        InMemoryConversationContext context = new InMemoryConversationContext();
        List<ChatMessage> snapshot = context.messages();

        context.appendMessage(MessageRole.USER, "hi");

        assertThat(snapshot).isEmpty();
        assertThatThrownBy(() -> snapshot.add(new ChatMessage(MessageRole.USER, "x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void toleratesConcurrentAppends() throws InterruptedException {
        InMemoryConversationContext context = new InMemoryConversationContext();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        int perThread = 250;
        CountDownLatch done = new CountDownLatch(4);
        try {
            for (int t = 0; t < 4; t++) {
                pool.execute(() -> {
                    for (int i = 0; i < perThread; i++) {
                        context.appendMessage(MessageRole.USER, "m" + i);
                    }
                    done.countDown();
                });
            }
            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(context.messages()).hasSize(4 * perThread);
    }
}
