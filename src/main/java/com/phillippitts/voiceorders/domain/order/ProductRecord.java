package com.phillippitts.voiceorders.domain.order;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Catalogue product referenced by order lines.
 *
 * @param id            product id
 * @param name          display name
 * @param description   optional description (may be null)
 * @param price         list price
 * @param stockQuantity units in stock
 * @param sku           stock keeping unit
 */
public record ProductRecord(
        long id,
        String name,
        String description,
        BigDecimal price,
        int stockQuantity,
        String sku
) {
    public ProductRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(sku, "sku");
    }
}
