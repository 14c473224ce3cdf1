package com.exifworker.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a task invocation, handed back to the orchestrator and piped
 * into the next stage of the workflow.
 *
 * Invariants:
 * - outputFiles holds the serialized form of every produced artifact
 * - command is the base command, without per-file arguments
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskResult(
    @JsonProperty("output_files") List<Map<String, Object>> outputFiles,
    @JsonProperty("workflow_id") String workflowId,
    @JsonProperty("command") String command,
    @JsonProperty("meta") Map<String, Object> meta
) {
    public TaskResult {
        outputFiles = outputFiles != null ? List.copyOf(outputFiles) : List.of();
        meta = meta != null ? Collections.unmodifiableMap(new LinkedHashMap<>(meta)) : Map.of();
    }
}
