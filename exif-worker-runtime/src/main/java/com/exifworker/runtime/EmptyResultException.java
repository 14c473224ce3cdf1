package com.exifworker.runtime;

/**
 * Thrown when a task finishes without producing a single output file.
 */
public class EmptyResultException extends TaskException {
    
    public static final String ERROR_CODE = "EMPTY_RESULT";
    
    public EmptyResultException(String message) {
        super(ERROR_CODE, message);
    }
}
