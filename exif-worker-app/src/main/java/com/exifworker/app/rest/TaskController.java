package com.exifworker.app.rest;

import com.exifworker.app.config.WorkerProperties;
import com.exifworker.core.model.ConfigOption;
import com.exifworker.core.model.TaskRequest;
import com.exifworker.runtime.RegisteredTask;
import com.exifworker.runtime.TaskDispatcher;
import com.exifworker.runtime.TaskOutcome;
import com.exifworker.runtime.TaskRegistry;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for running tasks and publishing their configuration schema.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private final TaskRegistry taskRegistry;
    private final TaskDispatcher taskDispatcher;
    private final WorkerProperties properties;

    public TaskController(TaskRegistry taskRegistry, TaskDispatcher taskDispatcher,
                          WorkerProperties properties) {
        this.taskRegistry = taskRegistry;
        this.taskDispatcher = taskDispatcher;
        this.properties = properties;
    }

    /**
     * List registered tasks with their metadata.
     */
    @GetMapping
    public ResponseEntity<List<TaskResponse>> listTasks() {
        List<TaskResponse> tasks = taskRegistry.all().stream()
            .map(TaskResponse::from)
            .toList();
        return ResponseEntity.ok(tasks);
    }

    /**
     * Get a single task's metadata.
     */
    @GetMapping("/{taskName}")
    public ResponseEntity<TaskResponse> getTask(@PathVariable String taskName) {
        return ResponseEntity.ok(TaskResponse.from(taskRegistry.get(taskName)));
    }

    /**
     * Run a task synchronously.
     * Responds 200 with the encoded result, or 422 with the failure.
     */
    @PostMapping("/{taskName}/run")
    public ResponseEntity<TaskOutcome> runTask(
            @PathVariable String taskName,
            @RequestBody TaskRequest request) {

        TaskRequest effective = request.outputPath() != null ? request : new TaskRequest(
            request.pipeResult(),
            request.inputFiles(),
            properties.getDefaultOutputPath(),
            request.workflowId(),
            request.taskConfig());

        TaskOutcome outcome = taskDispatcher.dispatch(taskName, effective);
        HttpStatus status = outcome.succeeded() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(outcome);
    }

    // ========== DTOs ==========

    public record TaskResponse(
        String name,
        @JsonProperty("display_name") String displayName,
        String description,
        @JsonProperty("task_config") List<ConfigOption> taskConfig
    ) {
        public static TaskResponse from(RegisteredTask task) {
            return new TaskResponse(
                task.name(),
                task.metadata().displayName(),
                task.metadata().description(),
                task.metadata().taskConfig()
            );
        }
    }
}
