package com.exifworker.runtime;

/**
 * Thrown when an external tool exits with a non-zero status.
 */
public class ToolExecutionException extends TaskException {
    
    public static final String ERROR_CODE = "TOOL_EXECUTION_FAILED";
    
    private final String inputPath;
    private final int exitCode;
    private final String stderr;
    
    public ToolExecutionException(String toolName, String inputPath, int exitCode, String stderr) {
        super(ERROR_CODE, String.format("%s failed for %s: %s", toolName, inputPath, stderr));
        this.inputPath = inputPath;
        this.exitCode = exitCode;
        this.stderr = stderr;
    }
    
    public String getInputPath() {
        return inputPath;
    }
    
    public int getExitCode() {
        return exitCode;
    }
    
    /**
     * Standard error of the failed process, exactly as captured.
     */
    public String getStderr() {
        return stderr;
    }
}
