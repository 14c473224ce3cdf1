package com.exifworker.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An artifact produced by a task and registered with the orchestrator.
 *
 * The file at {@code path} is written exactly once, by the task that
 * allocated it, and is never modified afterwards.
 */
public record OutputFile(
    String uuid,
    String path,
    String displayName,
    String extension,
    String dataType,

    // Lineage, null when unknown
    String sourceFileId,
    String originalPath
) {
    public static final String UUID = "uuid";
    public static final String PATH = "path";
    public static final String DISPLAY_NAME = "display_name";
    public static final String EXTENSION = "extension";
    public static final String DATA_TYPE = "data_type";
    public static final String SOURCE_FILE_ID = "source_file_id";
    public static final String ORIGINAL_PATH = "original_path";

    /**
     * Serialized form as it appears in the {@code output_files} list of a task result.
     */
    public Map<String, Object> toSerializable() {
        Map<String, Object> serialized = new LinkedHashMap<>();
        serialized.put(UUID, uuid);
        serialized.put(DISPLAY_NAME, displayName);
        serialized.put(EXTENSION, extension);
        serialized.put(DATA_TYPE, dataType);
        serialized.put(PATH, path);
        serialized.put(ORIGINAL_PATH, originalPath);
        serialized.put(SOURCE_FILE_ID, sourceFileId);
        return serialized;
    }
}
