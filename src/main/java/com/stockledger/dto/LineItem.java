package com.stockledger.dto;

/**
 * One requested line of a purchase: which product and how many units.
 */
public record LineItem(Long productId, int quantity) {
}
