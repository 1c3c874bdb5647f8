package com.phillippitts.voiceorders.domain.order;

import java.util.Locale;

/**
 * Fulfilment status of an order, with the lowercase value used in the snapshot and in summaries.
 */
public enum OrderStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    SHIPPED("shipped"),
    DELIVERED("delivered"),
    CANCELLED("cancelled");

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses a snapshot status value (case-insensitive).
     *
     * @throws IllegalArgumentException if the value is not a known status
     */
    public static OrderStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Order status must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (OrderStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown order status: " + value);
    }
}
