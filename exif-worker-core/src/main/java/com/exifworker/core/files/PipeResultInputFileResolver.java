package com.exifworker.core.files;

import com.exifworker.core.exception.PipeResultException;
import com.exifworker.core.model.InputFile;
import com.exifworker.core.model.TaskResult;
import com.exifworker.core.result.TaskResultCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Takes input files from the piped result of the previous stage when one
 * is present, otherwise from the explicit list.
 */
public class PipeResultInputFileResolver implements InputFileResolver {

    private static final Logger log = LoggerFactory.getLogger(PipeResultInputFileResolver.class);

    private final TaskResultCodec codec;
    private final ObjectMapper objectMapper;

    public PipeResultInputFileResolver(TaskResultCodec codec, ObjectMapper objectMapper) {
        this.codec = codec;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<InputFile> resolve(String pipeResult, List<InputFile> fallback) {
        if (pipeResult == null || pipeResult.isBlank()) {
            return fallback != null ? List.copyOf(fallback) : List.of();
        }

        TaskResult previous = codec.decode(pipeResult);
        List<InputFile> files = new ArrayList<>(previous.outputFiles().size());
        for (Map<String, Object> outputFile : previous.outputFiles()) {
            try {
                files.add(objectMapper.convertValue(outputFile, InputFile.class));
            } catch (IllegalArgumentException e) {
                throw new PipeResultException("unreadable output file entry " + outputFile, e);
            }
        }

        log.debug("Resolved {} input files from piped result of workflow {}",
            files.size(), previous.workflowId());
        return List.copyOf(files);
    }
}
