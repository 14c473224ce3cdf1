package com.exifworker.core.exception;

/**
 * Thrown when no task is registered under the requested name.
 */
public class TaskNotFoundException extends WorkerException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public TaskNotFoundException(String taskName) {
        super(ERROR_CODE, String.format("Task not found: %s", taskName));
    }
}
