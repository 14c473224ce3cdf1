package com.exifworker.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The parameters a task is invoked with.
 *
 * When {@code pipeResult} is present it is the authoritative source of
 * input files and {@code inputFiles} is ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskRequest(
    @JsonProperty("pipe_result") String pipeResult,
    @JsonProperty("input_files") List<InputFile> inputFiles,
    @JsonProperty("output_path") String outputPath,
    @JsonProperty("workflow_id") String workflowId,
    @JsonProperty("task_config") TaskConfig taskConfig
) {
    public TaskRequest {
        inputFiles = inputFiles != null ? List.copyOf(inputFiles) : List.of();
        taskConfig = taskConfig != null ? taskConfig : TaskConfig.empty();
    }

    /**
     * Request without a piped result.
     */
    public static TaskRequest forFiles(List<InputFile> inputFiles, String outputPath,
                                       String workflowId, TaskConfig taskConfig) {
        return new TaskRequest(null, inputFiles, outputPath, workflowId, taskConfig);
    }
}
