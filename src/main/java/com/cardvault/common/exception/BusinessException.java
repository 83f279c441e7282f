package com.cardvault.common.exception;

/**
 * Rule violation detected before any mutation, carrying a stable error code.
 */
public class BusinessException extends RuntimeException {
    
    private final String code;
    
    public BusinessException(String code, String message) {
        super(message);
        this.code = code;
    }
    
    public String getCode() {
        return code;
    }
}
