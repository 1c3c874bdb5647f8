package com.phillippitts.voiceorders.domain.order;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One line of an order as stored in the snapshot.
 *
 * @param orderId   owning order
 * @param productId referenced product
 * @param quantity  units ordered
 * @param unitPrice price charged per unit
 */
public record OrderItemRecord(long orderId, long productId, int quantity, BigDecimal unitPrice) {

    public OrderItemRecord {
        Objects.requireNonNull(unitPrice, "unitPrice");
    }
}
