package com.exifworker.app.task;

import com.exifworker.core.files.InputFileResolver;
import com.exifworker.core.files.OutputFileAllocator;
import com.exifworker.core.model.ConfigOption;
import com.exifworker.core.model.InputFile;
import com.exifworker.core.model.OutputFile;
import com.exifworker.core.model.TaskConfig;
import com.exifworker.core.model.TaskMetadata;
import com.exifworker.core.model.TaskResult;
import com.exifworker.core.result.TaskResultBuilder;
import com.exifworker.runtime.EmptyResultException;
import com.exifworker.runtime.TaskContext;
import com.exifworker.runtime.TaskException;
import com.exifworker.runtime.TaskHandler;
import com.exifworker.runtime.ToolExecutionException;
import com.exifworker.runtime.logging.LoggingContext;
import com.exifworker.runtime.process.ProcessOutcome;
import com.exifworker.runtime.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs ExifTool on every input file and registers its standard output as
 * one artifact per file.
 *
 * Files are processed one at a time, in order. The first failing file
 * aborts the task; files after it are not processed.
 */
public class ExifToolTask implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(ExifToolTask.class);

    public static final String TASK_NAME = "exif-worker.tasks.extract_exif";
    public static final String TOOL_NAME = "ExifTool";
    public static final String JSON_OUTPUT = "json_output";

    public static final String TOOL_START_FAILED = "TOOL_START_FAILED";
    public static final String TOOL_TIMEOUT = "TOOL_TIMEOUT";
    public static final String INTERRUPTED = "INTERRUPTED";

    public static final TaskMetadata METADATA = new TaskMetadata(
        "ExifTool Extractor",
        "Extracts EXIF metadata from files using ExifTool.",
        List.of(ConfigOption.checkbox(
            JSON_OUTPUT,
            "Output in JSON format",
            "If checked, ExifTool will output metadata in JSON format. "
                + "Output files will have a .json extension and 'application/json' MIME type.",
            false))
    );

    private final InputFileResolver inputFileResolver;
    private final OutputFileAllocator outputFileAllocator;
    private final TaskResultBuilder resultBuilder;
    private final ProcessRunner processRunner;
    private final String executable;
    private final Duration timeout;

    public ExifToolTask(InputFileResolver inputFileResolver,
                        OutputFileAllocator outputFileAllocator,
                        TaskResultBuilder resultBuilder,
                        ProcessRunner processRunner,
                        String executable,
                        Duration timeout) {
        this.inputFileResolver = inputFileResolver;
        this.outputFileAllocator = outputFileAllocator;
        this.resultBuilder = resultBuilder;
        this.processRunner = processRunner;
        this.executable = executable;
        this.timeout = timeout;
    }

    @Override
    public TaskResult execute(TaskContext context) throws TaskException {
        log.debug("Task {} invoked for workflow {}", context.getTaskName(), context.getWorkflowId());
        return run(
            context.getPipeResult(),
            context.getInputFiles(),
            context.getOutputPath(),
            context.getWorkflowId(),
            context.getTaskConfig());
    }

    /**
     * Extract metadata from the input files.
     *
     * @param pipeResult Encoded result of the previous stage; takes precedence over inputFiles
     * @param inputFiles Files to process when there is no piped result
     * @param outputPath Directory receiving the output artifacts
     * @param workflowId Passed through to the result unchanged
     * @param taskConfig User configuration, null for defaults
     * @return The result referencing one artifact per input file
     * @throws ToolExecutionException if ExifTool exits non-zero for any file
     * @throws EmptyResultException if no output file was produced
     */
    public TaskResult run(String pipeResult, List<InputFile> inputFiles, String outputPath,
                          String workflowId, TaskConfig taskConfig) throws TaskException {
        TaskConfig config = taskConfig != null ? taskConfig : TaskConfig.empty();
        List<InputFile> files = inputFileResolver.resolve(pipeResult, inputFiles);

        ExifToolCommand command = new ExifToolCommand(executable, config.getBoolean(JSON_OUTPUT, false));
        log.info("Extracting metadata from {} files with '{}'", files.size(), command.asString());

        List<Map<String, Object>> outputFiles = new ArrayList<>(files.size());
        try {
            for (InputFile inputFile : files) {
                LoggingContext.setInputFile(inputFile.path());
                OutputFile outputFile = outputFileAllocator.allocate(
                    outputPath, inputFile, command.extension(), command.dataType());

                extract(command, inputFile, outputFile);
                outputFiles.add(outputFile.toSerializable());
            }
        } finally {
            LoggingContext.setInputFile(null);
        }

        if (outputFiles.isEmpty()) {
            throw new EmptyResultException(
                "No input files were processed or ExifTool produced no output.");
        }

        return resultBuilder.build(outputFiles, workflowId, command.asString(), Map.of());
    }

    private void extract(ExifToolCommand command, InputFile inputFile, OutputFile outputFile)
            throws TaskException {
        ProcessOutcome outcome;
        try {
            outcome = processRunner.run(command.forFile(inputFile.path()), Path.of(outputFile.path()), timeout);
        } catch (IOException e) {
            throw new TaskException(TOOL_START_FAILED, String.format(
                "%s could not be run for %s: %s", TOOL_NAME, inputFile.path(), e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskException(INTERRUPTED, String.format(
                "Interrupted while running %s for %s", TOOL_NAME, inputFile.path()), e);
        }

        if (outcome.timedOut()) {
            throw TaskException.permanent(TOOL_TIMEOUT, String.format(
                "%s did not finish within %s for %s: %s", TOOL_NAME, timeout, inputFile.path(), outcome.stderr()));
        }
        if (outcome.exitCode() != 0) {
            throw new ToolExecutionException(TOOL_NAME, inputFile.path(), outcome.exitCode(), outcome.stderr());
        }

        log.debug("Wrote metadata of {} to {}", inputFile.path(), outputFile.path());
    }
}
