package com.stockledger.dto;

import java.math.BigDecimal;

public record PurchaseLine(
        String productName,
        int quantity,
        BigDecimal price) {
}
