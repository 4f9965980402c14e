package com.stockledger.dto;

import java.math.BigDecimal;

/**
 * Partial product update. A null field keeps the stored value.
 */
public record ProductUpdate(
        String name,
        BigDecimal price,
        Integer quantity,
        String category) {

    public static ProductUpdate quantity(int quantity) {
        return new ProductUpdate(null, null, quantity, null);
    }
}
