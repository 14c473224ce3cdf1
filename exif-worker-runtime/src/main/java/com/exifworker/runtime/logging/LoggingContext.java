package com.exifworker.runtime.logging;

import org.slf4j.MDC;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures task logs carry the workflow and task they belong to.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(workflowId, taskName)) {
 *     log.info("Processing files"); // Automatically includes workflowId, taskName
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String WORKFLOW_ID = "workflowId";
    public static final String TASK_NAME = "taskName";
    public static final String INPUT_FILE = "inputFile";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for one task invocation.
     */
    public static LoggingContext forTask(String workflowId, String taskName) {
        LoggingContext ctx = new LoggingContext();
        if (workflowId != null) {
            MDC.put(WORKFLOW_ID, workflowId);
        }
        if (taskName != null) {
            MDC.put(TASK_NAME, taskName);
        }
        return ctx;
    }

    /**
     * Set the input file currently being processed.
     */
    public static void setInputFile(String path) {
        if (path != null) {
            MDC.put(INPUT_FILE, path);
        } else {
            MDC.remove(INPUT_FILE);
        }
    }

    /**
     * Get current workflow ID from context.
     */
    public static String getWorkflowId() {
        return MDC.get(WORKFLOW_ID);
    }

    public static String getTaskName() {
        return MDC.get(TASK_NAME);
    }

    @Override
    public void close() {
        MDC.remove(WORKFLOW_ID);
        MDC.remove(TASK_NAME);
        MDC.remove(INPUT_FILE);
    }
}
