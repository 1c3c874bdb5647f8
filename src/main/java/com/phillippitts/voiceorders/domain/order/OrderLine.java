package com.phillippitts.voiceorders.domain.order;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * An order line resolved against its product.
 *
 * @param product   resolved product
 * @param quantity  units ordered
 * @param unitPrice price charged per unit (may differ from the product list price)
 */
public record OrderLine(ProductRecord product, int quantity, BigDecimal unitPrice) {

    public OrderLine {
        Objects.requireNonNull(product, "product");
        Objects.requireNonNull(unitPrice, "unitPrice");
    }

    /** {@code quantity * unitPrice}. */
    public BigDecimal subtotal() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }
}
