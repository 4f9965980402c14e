package com.stockledger.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * What a completed purchase hands back to the caller, including the lines in
 * the shape the audit trail records them.
 */
public record PurchaseReceipt(
        Long purchaseId,
        String customerName,
        BigDecimal totalAmount,
        List<PurchaseLine> lines) {
}
