package com.phillippitts.voiceorders.service.orders;

import com.phillippitts.voiceorders.domain.conversation.SystemFact;
import com.phillippitts.voiceorders.domain.frame.Frame;
import com.phillippitts.voiceorders.domain.frame.FrameDirection;
import com.phillippitts.voiceorders.domain.frame.TextChunk;
import com.phillippitts.voiceorders.domain.order.OrderRecord;
import com.phillippitts.voiceorders.service.conversation.SystemFactLedger;
import com.phillippitts.voiceorders.service.metrics.VoicePipelineMetrics;
import com.phillippitts.voiceorders.service.pipeline.Emission;
import com.phillippitts.voiceorders.service.pipeline.SynchronousStage;
import com.phillippitts.voiceorders.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Injects order knowledge into the conversation when the caller asks about an order.
 *
 * <p>For every downstream {@link TextChunk}:
 * <ol>
 *   <li>If the text carries an order number different from the last one seen in this session,
 *       the order is looked up and either its summary ({@value #ORDER_LOOKUP_TAG}) or a not-found
 *       notice ({@value #ORDER_NOT_FOUND_TAG}) is injected as a system fact.</li>
 *   <li>Otherwise, if the text asks about an order status and no order number has been requested
 *       yet, an instruction to ask for the number ({@value #KNOWLEDGE_BASE_TAG}) is injected.</li>
 * </ol>
 * The frame itself is always forwarded unchanged.
 */
public final class OrderKnowledgeStage extends SynchronousStage {

    private static final Logger LOG = LogManager.getLogger(OrderKnowledgeStage.class);

    public static final String ORDER_LOOKUP_TAG = "order-lookup";
    public static final String ORDER_NOT_FOUND_TAG = "order-not-found";
    public static final String KNOWLEDGE_BASE_TAG = "order-knowledge-base";

    static final String ASK_FOR_ORDER_NUMBER =
            "The user asked for an order status but has not yet provided an order number."
                    + " Ask directly for the order number, mentioning you need it to fetch accurate details.";

    private final OrderDataStore store;
    private final OrderSummaryFormatter formatter;
    private final SystemFactLedger ledger;
    private final VoicePipelineMetrics metrics;

    private boolean awaitingOrderNumber;
    private String lastOrderNumber;

    public OrderKnowledgeStage(OrderDataStore store, SystemFactLedger ledger, VoicePipelineMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store");
        this.formatter = new OrderSummaryFormatter(store);
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    protected List<Emission> process(Frame frame, FrameDirection direction) {
        if (frame instanceof TextChunk chunk && direction == FrameDirection.DOWNSTREAM) {
            inspect(chunk.text());
        }
        return pass(frame, direction);
    }

    /**
     * Applies the order rules to one transcribed utterance.
     */
    void inspect(String rawText) {
        String text = rawText == null ? "" : rawText.trim();
        if (text.isEmpty()) {
            return;
        }
        Optional<String> orderNumber = OrderRequestParser.extractOrderNumber(text);
        LOG.info("Transcription received: text='{}', orderNumber={}",
                LogSanitizer.preview(text), orderNumber.orElse("none"));

        if (orderNumber.isPresent()) {
            handleOrderNumber(orderNumber.get());
            return;
        }
        if (OrderRequestParser.isOrderStatusRequest(text) && !awaitingOrderNumber) {
            awaitingOrderNumber = true;
            inject(new SystemFact(KNOWLEDGE_BASE_TAG, ASK_FOR_ORDER_NUMBER));
        }
    }

    private void handleOrderNumber(String orderNumber) {
        if (orderNumber.equals(lastOrderNumber)) {
            LOG.debug("Order number {} already handled in this session", orderNumber);
            return;
        }
        lastOrderNumber = orderNumber;

        Optional<OrderRecord> order = lookup(orderNumber);
        metrics.incrementOrderLookup(order.isPresent());
        if (order.isPresent()) {
            awaitingOrderNumber = false;
            inject(new SystemFact(ORDER_LOOKUP_TAG, lookupFact(orderNumber, order.get())));
        } else {
            inject(new SystemFact(ORDER_NOT_FOUND_TAG, notFoundFact(orderNumber)));
        }
    }

    private Optional<OrderRecord> lookup(String orderNumber) {
        try {
            return store.getOrder(Long.parseLong(orderNumber));
        } catch (NumberFormatException e) {
            LOG.warn("Order number out of range: {}", LogSanitizer.truncate(orderNumber, 32));
            return Optional.empty();
        }
    }

    private String lookupFact(String orderNumber, OrderRecord order) {
        String hint = "Order " + order.id() + " " + OrderSummaryFormatter.toneHint(order.status());
        return "Order lookup result for order number " + orderNumber + ":\n"
                + formatter.formatDetails(order) + "\n"
                + "Use ONLY this data when responding."
                + " State the order status and delivery expectation exactly as shown,"
                + " and mention key items only if needed."
                + " Never invent additional products, dates, or amounts."
                + " Hint for tone: " + hint;
    }

    private static String notFoundFact(String orderNumber) {
        return "No order was found with number " + orderNumber + "."
                + " Tell the user you couldn't locate that order in the dataset,"
                + " and politely ask them to confirm the digits or share a different order number."
                + " Do not guess any details.";
    }

    private void inject(SystemFact fact) {
        if (ledger.inject(fact)) {
            metrics.incrementFactInjected(fact.tag());
        }
    }

    public boolean isAwaitingOrderNumber() {
        return awaitingOrderNumber;
    }

    public Optional<String> lastOrderNumber() {
        return Optional.ofNullable(lastOrderNumber);
    }
}
