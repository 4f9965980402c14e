package com.stockledger.dto;

public record InventoryChange(
        String productName,
        int oldQuantity,
        int newQuantity) {
}
