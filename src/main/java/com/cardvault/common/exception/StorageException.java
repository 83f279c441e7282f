package com.cardvault.common.exception;

/**
 * Failure of the underlying photo storage.
 */
public class StorageException extends RuntimeException {
    
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
