package com.exifworker.core.files;

import com.exifworker.core.model.InputFile;

import java.util.List;

/**
 * Resolves the files a task should process.
 */
@FunctionalInterface
public interface InputFileResolver {

    /**
     * Resolve the effective input files.
     *
     * @param pipeResult Encoded result of the previous stage, may be null
     * @param fallback Files to use when there is no piped result, may be null
     * @return The input files, in processing order
     */
    List<InputFile> resolve(String pipeResult, List<InputFile> fallback);
}
