package com.stockledger.exception;

/**
 * Invalid or missing input, e.g. a blank name or a negative price.
 */
public class ValidationException extends InventoryException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
