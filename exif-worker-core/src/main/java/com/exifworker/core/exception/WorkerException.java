package com.exifworker.core.exception;

/**
 * Base exception for worker infrastructure errors.
 */
public class WorkerException extends RuntimeException {
    
    private final String errorCode;
    
    public WorkerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public WorkerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
