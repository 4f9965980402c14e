package com.stockledger.exception;

/**
 * Thrown when a stock change would drive a product's quantity below zero.
 */
public class InsufficientStockException extends InventoryException {

    public InsufficientStockException(String message) {
        super(message);
    }

    public InsufficientStockException(String message, Throwable cause) {
        super(message, cause);
    }
}
