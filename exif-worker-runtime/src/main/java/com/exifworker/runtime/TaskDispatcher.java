package com.exifworker.runtime;

import com.exifworker.core.exception.PipeResultException;
import com.exifworker.core.exception.WorkerException;
import com.exifworker.core.model.TaskRequest;
import com.exifworker.core.model.TaskResult;
import com.exifworker.core.result.TaskResultCodec;
import com.exifworker.runtime.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Entry point the task queue calls into: runs the named task and reports
 * its outcome instead of throwing.
 * 
 * Every failure is permanent for the invocation; nothing is retried here.
 */
public class TaskDispatcher {
    
    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);
    
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
    
    private final TaskRegistry registry;
    private final TaskResultCodec codec;
    private final List<DispatchListener> listeners;
    
    public TaskDispatcher(TaskRegistry registry, TaskResultCodec codec) {
        this(registry, codec, List.of());
    }
    
    public TaskDispatcher(TaskRegistry registry, TaskResultCodec codec, List<DispatchListener> listeners) {
        this.registry = registry;
        this.codec = codec;
        this.listeners = List.copyOf(listeners);
    }
    
    /**
     * Run a task.
     * 
     * @param taskName Registered task name
     * @param request The invocation parameters
     * @return The encoded result, or the failure
     * @throws com.exifworker.core.exception.TaskNotFoundException if no such task is registered
     * @throws PipeResultException if the piped result of the request cannot be decoded
     */
    public TaskOutcome dispatch(String taskName, TaskRequest request) {
        RegisteredTask task = registry.get(taskName);
        
        try (var ctx = LoggingContext.forTask(request.workflowId(), taskName)) {
            log.info("Executing task {} for workflow {}", taskName, request.workflowId());
            long started = System.nanoTime();
            TaskResult result;
            TaskOutcome outcome;
            
            try {
                result = task.handler().execute(new TaskContext(taskName, request));
                outcome = TaskOutcome.success(taskName, codec.encode(result));
                
            } catch (TaskException e) {
                log.warn("Task {} failed: {} - {}", taskName, e.getErrorCode(), e.getMessage());
                result = null;
                outcome = TaskOutcome.failure(taskName, e);
                
            } catch (PipeResultException e) {
                log.warn("Task {} rejected: {}", taskName, e.getMessage());
                throw e;
                
            } catch (WorkerException e) {
                log.warn("Task {} failed: {} - {}", taskName, e.getErrorCode(), e.getMessage());
                result = null;
                outcome = TaskOutcome.failure(taskName, e.getErrorCode(), e.getMessage());
                
            } catch (RuntimeException e) {
                log.error("Task {} failed with unexpected error", taskName, e);
                result = null;
                outcome = TaskOutcome.failure(taskName, INTERNAL_ERROR, e.getMessage());
            }
            
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            if (outcome.succeeded()) {
                TaskResult completed = result;
                log.info("Task {} completed with {} output files in {} ms",
                    taskName, completed.outputFiles().size(), elapsed.toMillis());
                notifyListeners(listener -> listener.taskCompleted(taskName, completed, elapsed));
            } else {
                String errorCode = outcome.errorCode();
                notifyListeners(listener -> listener.taskFailed(taskName, errorCode, elapsed));
            }
            return outcome;
        }
    }
    
    // A failing listener never changes the outcome of the task.
    private void notifyListeners(Consumer<DispatchListener> notification) {
        for (DispatchListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Dispatch listener {} failed", listener.getClass().getName(), e);
            }
        }
    }
}
