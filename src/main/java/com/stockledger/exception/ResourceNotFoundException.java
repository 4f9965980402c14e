package com.stockledger.exception;

/**
 * Thrown when a product, customer or purchase id does not exist.
 */
public class ResourceNotFoundException extends InventoryException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
