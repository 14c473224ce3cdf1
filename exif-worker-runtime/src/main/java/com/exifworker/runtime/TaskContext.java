package com.exifworker.runtime;

import com.exifworker.core.model.InputFile;
import com.exifworker.core.model.TaskConfig;
import com.exifworker.core.model.TaskRequest;

import java.util.List;

/**
 * Context provided to task handlers during execution.
 */
public class TaskContext {
    
    private final String taskName;
    private final TaskRequest request;
    
    public TaskContext(String taskName, TaskRequest request) {
        this.taskName = taskName;
        this.request = request;
    }
    
    public String getTaskName() {
        return taskName;
    }
    
    /**
     * Encoded result of the previous stage, or null.
     */
    public String getPipeResult() {
        return request.pipeResult();
    }
    
    /**
     * Files passed explicitly by the caller. Ignored when a pipe result exists.
     */
    public List<InputFile> getInputFiles() {
        return request.inputFiles();
    }
    
    public String getOutputPath() {
        return request.outputPath();
    }
    
    public String getWorkflowId() {
        return request.workflowId();
    }
    
    /**
     * User configuration, never null.
     */
    public TaskConfig getTaskConfig() {
        return request.taskConfig();
    }
}
