package com.phillippitts.voiceorders.service.orders;

import com.phillippitts.voiceorders.domain.order.OrderLine;
import com.phillippitts.voiceorders.domain.order.OrderRecord;
import com.phillippitts.voiceorders.domain.order.OrderStatus;

import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Renders order details as plain text for the language model.
 *
 * <p>Example:
 * <pre>
 * Order #1003 Details:
 * - Order Date: 2024-03-02 15:45
 * - Status: shipped
 * - Total Amount: $104.97
 *
 * Items:
 *   - Wireless Mouse
 *     Quantity: 2
 *     Price: $24.99 each
 *     Subtotal: $49.98
 * </pre>
 * The total is the stored order total; it is not recomputed from the lines.
 */
public final class OrderSummaryFormatter {

    private static final DateTimeFormatter ORDER_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final OrderDataStore store;

    public OrderSummaryFormatter(OrderDataStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public String formatDetails(OrderRecord order) {
        List<OrderLine> lines = store.getItems(order.id());
        StringJoiner out = new StringJoiner("\n");
        out.add("Order #" + order.id() + " Details:");
        out.add("- Order Date: " + ORDER_DATE.format(order.timestamp()));
        out.add("- Status: " + order.status().value());
        out.add("- Total Amount: " + money(order.totalAmount()));
        out.add("");
        out.add("Items:");
        if (lines.isEmpty()) {
            out.add("  No items recorded for this order.");
        }
        for (OrderLine line : lines) {
            out.add("  - " + line.product().name());
            out.add("    Quantity: " + line.quantity());
            out.add("    Price: " + money(line.unitPrice()) + " each");
            out.add("    Subtotal: " + money(line.subtotal()));
        }
        return out.toString();
    }

    /**
     * One fixed sentence per status telling the assistant how to phrase the update.
     */
    public static String toneHint(OrderStatus status) {
        return switch (status) {
            case PENDING -> "is pending and awaiting processing."
                    + " Let the customer know we'll update them once it starts moving.";
            case PROCESSING -> "is being prepared right now."
                    + " Share a reassuring update and let them know we'll notify them once it ships.";
            case SHIPPED -> "has shipped."
                    + " Review the provided delivery estimate and repeat it back accurately.";
            case DELIVERED -> "has already been delivered."
                    + " Confirm the delivery date and offer follow-up help if needed.";
            case CANCELLED -> "was cancelled."
                    + " Clarify the cancellation and offer to help place a new order if appropriate.";
        };
    }

    static String money(BigDecimal amount) {
        return String.format(Locale.ROOT, "$%.2f", amount);
    }
}
