package com.exifworker.runtime;

import com.exifworker.core.model.TaskResult;

/**
 * Interface for task implementations.
 * Workers register one handler per task name.
 */
@FunctionalInterface
public interface TaskHandler {
    
    /**
     * Execute the task.
     * 
     * @param context Execution context providing the request
     * @return The task result
     * @throws TaskException if the task fails
     */
    TaskResult execute(TaskContext context) throws TaskException;
}
