package com.exifworker.runtime;

import com.exifworker.core.model.TaskMetadata;

/**
 * A task handler together with the name it is routed by and its metadata.
 */
public record RegisteredTask(
    String name,
    TaskHandler handler,
    TaskMetadata metadata
) {
    public RegisteredTask {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task name must not be empty");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Task handler must not be null");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("Task metadata must not be null");
        }
    }
}
