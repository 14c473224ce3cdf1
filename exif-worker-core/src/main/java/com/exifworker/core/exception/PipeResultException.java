package com.exifworker.core.exception;

/**
 * Thrown when the result piped in from a previous stage cannot be decoded.
 */
public class PipeResultException extends WorkerException {
    
    public static final String ERROR_CODE = "INVALID_PIPE_RESULT";
    
    public PipeResultException(String reason, Throwable cause) {
        super(ERROR_CODE, "Invalid pipe result: " + reason, cause);
    }
}
