package com.stockledger.dto;

import java.math.BigDecimal;

public record PurchaseItemRow(
        Long itemId,
        Long productId,
        int quantity,
        BigDecimal pricePerUnit,
        String productName) {
}
