package com.phillippitts.voiceorders.service.conversation;

import com.phillippitts.voiceorders.domain.conversation.ChatMessage;
import com.phillippitts.voiceorders.domain.conversation.MessageRole;
import com.phillippitts.voiceorders.domain.conversation.SystemFact;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SystemFactLedgerTest {

    private InMemoryConversationContext context;
    private SystemFactLedger ledger;

    @BeforeEach
    void setUp() {
        context = new InMemoryConversationContext();
        ledger = new SystemFactLedger(context);
    }

    @Test
    void injectsIdenticalContentOnlyOnce() {
        assertThat(ledger.inject(new SystemFact("order-lookup", "Order 1003 shipped"))).isTrue();
        assertThat(ledger.inject(new SystemFact("order-lookup", "Order 1003 shipped"))).isFalse();

        assertThat(context.messages())
                .containsExactly(new ChatMessage(MessageRole.SYSTEM, "Order 1003 shipped"));
    }

    @Test
    void injectsChangedContentUnderSameTag() {
        ledger.inject(new SystemFact("order-lookup", "Order 1003 shipped"));
        ledger.inject(new SystemFact("order-lookup", "Order 1004 pending"));

        assertThat(context.messages()).hasSize(2);
        assertThat(ledger.lastContent("order-lookup")).contains("Order 1004 pending");
    }

    @Test
    void tagsAreIndependent() {
        ledger.inject(new SystemFact("a", "same text"));
        ledger.inject(new SystemFact("b", "same text"));

        assertThat(context.messages()).hasSize(2);
    }

    @Test
    void revertingToEarlierContentInjectsAgain() {
        ledger.inject(new SystemFact("order-lookup", "first"));
        ledger.inject(new SystemFact("order-lookup", "second"));
        ledger.inject(new SystemFact("order-lookup", "first"));

        assertThat(context.messages()).extracting(ChatMessage::content)
                .containsExactly("first", "second", "first");
    }

    @Test
    void unknownTagHasNoContent() {
        assertThat(ledger.lastContent("missing")).isEmpty();
    }
}
