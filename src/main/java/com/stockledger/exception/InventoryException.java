package com.stockledger.exception;

/**
 * Base type for every failure the console reports back to the user.
 * The message is meant to be shown as-is.
 */
public class InventoryException extends RuntimeException {

    public InventoryException(String message) {
        super(message);
    }

    public InventoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
