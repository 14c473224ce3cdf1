package com.exifworker.runtime;

/**
 * Exception thrown by task handlers on failure.
 */
public class TaskException extends Exception {
    
    private final String errorCode;
    
    public TaskException(String errorCode, String message) {
        this(errorCode, message, null);
    }
    
    public TaskException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
    
    /**
     * Always false for the tasks of this worker.
     */
    public boolean isRetryable() {
        return false;
    }
    
    /**
     * Create a non-retryable exception (permanent failure).
     */
    public static TaskException permanent(String errorCode, String message) {
        return new TaskException(errorCode, message);
    }
}
