package com.exifworker.runtime;

import com.exifworker.core.model.TaskResult;

import java.time.Duration;

/**
 * Callback notified after every dispatched task.
 * Exceptions thrown by an implementation are logged and otherwise ignored.
 */
public interface DispatchListener {
    
    default void taskCompleted(String taskName, TaskResult result, Duration elapsed) {
    }
    
    default void taskFailed(String taskName, String errorCode, Duration elapsed) {
    }
}
