package com.phillippitts.voiceorders.service.orders;

import com.phillippitts.voiceorders.domain.conversation.ChatMessage;
import com.phillippitts.voiceorders.domain.conversation.MessageRole;
import com.phillippitts.voiceorders.domain.frame.FrameDirection;
import com.phillippitts.voiceorders.domain.frame.LifecycleEvent;
import com.phillippitts.voiceorders.domain.frame.LifecycleKind;
import com.phillippitts.voiceorders.domain.frame.TextChunk;
import com.phillippitts.voiceorders.service.conversation.InMemoryConversationContext;
import com.phillippitts.voiceorders.service.conversation.SystemFactLedger;
import com.phillippitts.voiceorders.service.metrics.VoicePipelineMetrics;
import com.phillippitts.voiceorders.service.pipeline.Emission;
import com.phillippitts.voiceorders.testutil.TestOrders;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OrderKnowledgeStageTest {

    private InMemoryConversationContext context;
    private SystemFactLedger ledger;
    private MeterRegistry registry;
    private OrderKnowledgeStage stage;

    @BeforeEach
    void setUp() {
        context = new InMemoryConversationContext("You are a helpful assistant.");
        ledger = new SystemFactLedger(context);
        registry = new SimpleMeterRegistry();
        stage = new OrderKnowledgeStage(TestOrders.fixture(), ledger, new VoicePipelineMetrics(registry));
    }

    @Test
    void asksForOrderNumberThenInjectsLookup() {
        send("What's my order status?");

        assertThat(stage.isAwaitingOrderNumber()).isTrue();
        assertThat(ledger.lastContent(OrderKnowledgeStage.KNOWLEDGE_BASE_TAG))
                .contains(OrderKnowledgeStage.ASK_FOR_ORDER_NUMBER);
        assertThat(systemMessages()).hasSize(2);

        send("My order number is 1003");

        assertThat(stage.isAwaitingOrderNumber()).isFalse();
        assertThat(stage.lastOrderNumber()).contains("1003");
        String fact = ledger.lastContent(OrderKnowledgeStage.ORDER_LOOKUP_TAG).orElseThrow();
        assertThat(fact).startsWith("Order lookup result for order number 1003:");
        assertThat(fact).contains("- Status: shipped");
        assertThat(fact).contains("Wireless Headphones");
        assertThat(fact).contains("Hint for tone: Order 1003 has shipped.");
        assertThat(systemMessages()).hasSize(3);
        assertThat(lastMessage().content()).isEqualTo(fact);
    }

    @Test
    void asksForOrderNumberOnlyOncePerRequest() {
        send("what's my order status");
        send("I asked about my order status");

        assertThat(systemMessages()).hasSize(2);
    }

    @Test
    void reportsUnknownOrder() {
        send("order number 4242");

        String fact = ledger.lastContent(OrderKnowledgeStage.ORDER_NOT_FOUND_TAG).orElseThrow();
        assertThat(fact).startsWith("No order was found with number 4242.");
        assertThat(fact).contains("Do not guess any details.");
        assertThat(registry.get("voiceorders.orders.lookup").tag("result", "not_found").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void notFoundKeepsWaitingForANumber() {
        send("check my order please");
        send("it's 4242");

        assertThat(stage.isAwaitingOrderNumber()).isTrue();
    }

    @Test
    void ignoresRepeatedOrderNumber() {
        send("order 1003");
        send("yes, order 1003 again");

        assertThat(systemMessages()).hasSize(2);
        assertThat(registry.get("voiceorders.orders.lookup").tag("result", "found").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void switchesToNewOrderNumber() {
        send("order 1003");
        send("actually order 1004");

        assertThat(stage.lastOrderNumber()).contains("1004");
        assertThat(ledger.lastContent(OrderKnowledgeStage.ORDER_LOOKUP_TAG).orElseThrow())
                .contains("Order #1004 Details:")
                .contains("is pending");
        assertThat(systemMessages()).hasSize(3);
    }

    @Test
    void treatsOverlongNumberAsNotFound() {
        send("order 99999999999999999999999");

        assertThat(ledger.lastContent(OrderKnowledgeStage.ORDER_NOT_FOUND_TAG)).isPresent();
    }

    @Test
    void alwaysForwardsFrameUnchanged() {
        TextChunk chunk = new TextChunk("order 1003");

        List<Emission> out = stage.process(chunk, FrameDirection.DOWNSTREAM);

        assertThat(out).containsExactly(Emission.downstream(chunk));
    }

    @Test
    void ignoresUpstreamTextAndOtherFrames() {
        stage.process(new TextChunk("order 1003"), FrameDirection.UPSTREAM);
        LifecycleEvent event = LifecycleEvent.of(LifecycleKind.USER_STOPPED);

        List<Emission> out = stage.process(event, FrameDirection.DOWNSTREAM);

        assertThat(out).containsExactly(Emission.downstream(event));
        assertThat(stage.lastOrderNumber()).isEmpty();
        assertThat(systemMessages()).hasSize(1);
    }

    @Test
    void countsInjectedFactsByTag() {
        send("what's my order status");
        send("order 1003");

        assertThat(registry.get("voiceorders.facts.injected")
                .tag("tag", OrderKnowledgeStage.KNOWLEDGE_BASE_TAG).counter().count()).isEqualTo(1.0);
        assertThat(registry.get("voiceorders.facts.injected")
                .tag("tag", OrderKnowledgeStage.ORDER_LOOKUP_TAG).counter().count()).isEqualTo(1.0);
    }

    private void send(String text) {
        stage.process(new TextChunk(text), FrameDirection.DOWNSTREAM);
    }

    private List<ChatMessage> systemMessages() {
        return context.messages().stream()
                .filter(m -> m.role() == MessageRole.SYSTEM)
                .toList();
    }

    private ChatMessage lastMessage() {
        List<ChatMessage> messages = context.messages();
        return messages.get(messages.size() - 1);
    }
}
