package com.exifworker.core.result;

import com.exifworker.core.exception.PipeResultException;
import com.exifworker.core.model.TaskResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Builds task results and converts them to and from their wire form:
 * Base64 of the UTF-8 JSON document.
 */
public class TaskResultCodec implements TaskResultBuilder {

    private final ObjectMapper objectMapper;

    public TaskResultCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public TaskResult build(List<Map<String, Object>> outputFiles, String workflowId,
                            String command, Map<String, Object> meta) {
        return new TaskResult(outputFiles, workflowId, command, meta);
    }

    /**
     * Encode a result for the orchestrator.
     */
    public String encode(TaskResult result) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(result);
            return Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize task result", e);
        }
    }

    /**
     * Decode a result produced by {@link #encode(TaskResult)} or by any
     * other stage speaking the same format.
     *
     * @throws PipeResultException if the input is not Base64 encoded JSON of a result
     */
    public TaskResult decode(String encoded) {
        byte[] json;
        try {
            json = Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            throw new PipeResultException("not valid Base64", e);
        }
        TaskResult result;
        try {
            result = objectMapper.readValue(new String(json, StandardCharsets.UTF_8), TaskResult.class);
        } catch (JsonProcessingException e) {
            throw new PipeResultException("not a task result document", e);
        }
        if (result == null) {
            throw new PipeResultException("not a task result document", null);
        }
        return result;
    }
}
