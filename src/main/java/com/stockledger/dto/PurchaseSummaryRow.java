package com.stockledger.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record PurchaseSummaryRow(
        Long purchaseId,
        Long customerId,
        BigDecimal totalAmount,
        LocalDateTime purchaseDate,
        String customerName) {
}
