package com.stockledger.exception;

/**
 * Thrown when a unique product name or customer email is already taken.
 * Raised both by the lookup before the insert and by the unique constraint itself.
 */
public class DuplicateEntryException extends InventoryException {

    public DuplicateEntryException(String message) {
        super(message);
    }

    public DuplicateEntryException(String message, Throwable cause) {
        super(message, cause);
    }
}
