package com.exifworker.core.files;

import com.exifworker.core.model.InputFile;
import com.exifworker.core.model.OutputFile;

/**
 * Allocates output artifacts in a task's output directory.
 */
public interface OutputFileAllocator {

    /**
     * Allocate a new output file.
     *
     * @param outputDirectory Directory the file is created in
     * @param displayName Name shown to users, usually the source file's
     * @param extension File extension, with or without the leading dot
     * @param dataType MIME type of the content
     * @return A fresh output file with a writable path
     */
    OutputFile allocate(String outputDirectory, String displayName, String extension, String dataType);

    /**
     * Allocate a new output file derived from an input file.
     * Implementations may record the source for lineage.
     */
    default OutputFile allocate(String outputDirectory, InputFile source, String extension, String dataType) {
        return allocate(outputDirectory, source.displayName(), extension, dataType);
    }
}
