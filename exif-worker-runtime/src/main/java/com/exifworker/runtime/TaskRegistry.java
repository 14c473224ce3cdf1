package com.exifworker.runtime;

import com.exifworker.core.exception.TaskNotFoundException;
import com.exifworker.core.exception.TaskRegistrationException;
import com.exifworker.core.model.TaskMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tasks this worker can run, keyed by task name.
 * 
 * Registration is explicit and happens once during application startup:
 * <pre>
 * TaskRegistry registry = new TaskRegistry();
 * registry.register("exif-worker.tasks.extract_exif", exifToolTask, ExifToolTask.METADATA);
 * </pre>
 */
public class TaskRegistry {
    
    private static final Logger log = LoggerFactory.getLogger(TaskRegistry.class);
    
    private final Map<String, RegisteredTask> tasks = new ConcurrentHashMap<>();
    
    /**
     * Register a task handler.
     * 
     * @throws TaskRegistrationException if the name is already taken
     */
    public RegisteredTask register(String taskName, TaskHandler handler, TaskMetadata metadata) {
        RegisteredTask task = new RegisteredTask(taskName, handler, metadata);
        if (tasks.putIfAbsent(taskName, task) != null) {
            throw new TaskRegistrationException(taskName);
        }
        log.info("Registered task handler: {} ({})", taskName, metadata.displayName());
        return task;
    }
    
    /**
     * Look up a task by name.
     * 
     * @throws TaskNotFoundException if no task has that name
     */
    public RegisteredTask get(String taskName) {
        return find(taskName).orElseThrow(() -> new TaskNotFoundException(taskName));
    }
    
    public Optional<RegisteredTask> find(String taskName) {
        return Optional.ofNullable(taskName).map(tasks::get);
    }
    
    /**
     * All registered tasks, ordered by name.
     */
    public List<RegisteredTask> all() {
        return tasks.values().stream()
            .sorted(Comparator.comparing(RegisteredTask::name))
            .toList();
    }
}
