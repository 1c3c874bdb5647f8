package com.phillippitts.voiceorders.domain.order;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Immutable order header loaded from the order snapshot.
 *
 * <p>{@code totalAmount} is stored as given and is never reconciled with the item subtotals.
 *
 * @param id          order number
 * @param customerId  owning customer
 * @param timestamp   when the order was placed
 * @param totalAmount total recorded on the order
 * @param status      fulfilment status
 */
public record OrderRecord(
        long id,
        long customerId,
        LocalDateTime timestamp,
        BigDecimal totalAmount,
        OrderStatus status
) {
    public OrderRecord {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(totalAmount, "totalAmount");
        Objects.requireNonNull(status, "status");
    }
}
