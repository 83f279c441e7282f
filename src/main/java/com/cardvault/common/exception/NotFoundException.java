package com.cardvault.common.exception;

/**
 * Raised when an operation targets a card that does not exist.
 * An expected outcome, not a failure.
 */
public class NotFoundException extends RuntimeException {
    
    public NotFoundException(String message) {
        super(message);
    }
}
