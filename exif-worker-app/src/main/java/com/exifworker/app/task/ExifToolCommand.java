package com.exifworker.app.task;

import java.util.ArrayList;
import java.util.List;

/**
 * ExifTool command line for one task invocation.
 *
 * The base arguments never contain the input path; {@link #forFile(String)}
 * appends it per file.
 */
public record ExifToolCommand(
    String executable,
    boolean jsonOutput
) {
    public static final String JSON_FLAG = "-json";

    public static final String JSON_EXTENSION = ".json";
    public static final String TEXT_EXTENSION = ".txt";
    public static final String JSON_DATA_TYPE = "application/json";
    public static final String TEXT_DATA_TYPE = "text/plain";

    public ExifToolCommand {
        if (executable == null || executable.isBlank()) {
            throw new IllegalArgumentException("ExifTool executable must not be empty");
        }
    }

    public List<String> baseArguments() {
        return jsonOutput ? List.of(executable, JSON_FLAG) : List.of(executable);
    }

    /**
     * Full argument list for one input file.
     */
    public List<String> forFile(String inputPath) {
        List<String> arguments = new ArrayList<>(baseArguments());
        arguments.add(inputPath);
        return arguments;
    }

    /**
     * The base command as reported in the task result.
     */
    public String asString() {
        return String.join(" ", baseArguments());
    }

    public String extension() {
        return jsonOutput ? JSON_EXTENSION : TEXT_EXTENSION;
    }

    public String dataType() {
        return jsonOutput ? JSON_DATA_TYPE : TEXT_DATA_TYPE;
    }
}
