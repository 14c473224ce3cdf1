package com.exifworker.core.result;

import com.exifworker.core.model.TaskResult;

import java.util.List;
import java.util.Map;

/**
 * Builds the result a task reports back to the orchestrator.
 */
@FunctionalInterface
public interface TaskResultBuilder {

    TaskResult build(List<Map<String, Object>> outputFiles, String workflowId,
                     String command, Map<String, Object> meta);
}
