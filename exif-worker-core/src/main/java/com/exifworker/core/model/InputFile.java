package com.exifworker.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A source file handed to a task, either directly by the caller or as an
 * output file of the previous stage in a workflow.
 *
 * Invariants:
 * - path is non-empty
 * - displayName defaults to the last path segment when not supplied
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InputFile(
    @JsonProperty("path") String path,
    @JsonProperty("display_name") String displayName,

    // Present when the file comes from a piped result
    @JsonProperty("id") String id,
    @JsonProperty("uuid") String uuid,
    @JsonProperty("extension") String extension,
    @JsonProperty("data_type") String dataType
) {
    public InputFile {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Input file path must not be empty");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = fileName(path);
        }
    }

    /**
     * Create an input file from a path and a display name.
     */
    public static InputFile of(String path, String displayName) {
        return new InputFile(path, displayName, null, null, null, null);
    }

    /**
     * Create an input file named after its path.
     */
    public static InputFile of(String path) {
        return of(path, null);
    }

    private static String fileName(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
