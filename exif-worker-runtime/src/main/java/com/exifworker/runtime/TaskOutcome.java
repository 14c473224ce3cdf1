package com.exifworker.runtime;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a dispatched task: either the encoded result or a tagged failure.
 * 
 * Invariants:
 * - result set iff succeeded
 * - errorCode and errorMessage set iff not succeeded
 * - failingPath and stderr set only for tool execution failures
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskOutcome(
    String taskName,
    boolean succeeded,
    String result,
    String errorCode,
    String errorMessage,
    String failingPath,
    String stderr
) {
    public static TaskOutcome success(String taskName, String encodedResult) {
        return new TaskOutcome(taskName, true, encodedResult, null, null, null, null);
    }
    
    public static TaskOutcome failure(String taskName, TaskException e) {
        if (e instanceof ToolExecutionException toolFailure) {
            return new TaskOutcome(taskName, false, null, e.getErrorCode(), e.getMessage(),
                toolFailure.getInputPath(), toolFailure.getStderr());
        }
        return failure(taskName, e.getErrorCode(), e.getMessage());
    }
    
    public static TaskOutcome failure(String taskName, String errorCode, String errorMessage) {
        return new TaskOutcome(taskName, false, null, errorCode,
            errorMessage != null ? errorMessage : "", null, null);
    }
}
