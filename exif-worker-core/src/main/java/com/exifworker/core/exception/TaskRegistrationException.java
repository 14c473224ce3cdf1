package com.exifworker.core.exception;

/**
 * Thrown when a task is registered twice under the same name.
 */
public class TaskRegistrationException extends WorkerException {
    
    public static final String ERROR_CODE = "DUPLICATE_TASK";
    
    private final String taskName;
    
    public TaskRegistrationException(String taskName) {
        super(ERROR_CODE, String.format(
            "Task '%s' is already registered",
            taskName
        ));
        this.taskName = taskName;
    }
    
    public String getTaskName() {
        return taskName;
    }
}
