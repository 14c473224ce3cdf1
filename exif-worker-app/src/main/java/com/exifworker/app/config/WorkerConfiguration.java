package com.exifworker.app.config;

import com.exifworker.app.task.ExifToolTask;
import com.exifworker.core.files.InputFileResolver;
import com.exifworker.core.files.OutputFileAllocator;
import com.exifworker.core.files.PipeResultInputFileResolver;
import com.exifworker.core.files.UuidOutputFileAllocator;
import com.exifworker.core.result.TaskResultCodec;
import com.exifworker.runtime.DispatchListener;
import com.exifworker.runtime.TaskDispatcher;
import com.exifworker.runtime.TaskRegistry;
import com.exifworker.runtime.process.ProcessRunner;
import com.exifworker.runtime.process.SystemProcessRunner;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the task runtime and registers the tasks this worker serves.
 */
@Configuration
public class WorkerConfiguration {

    @Bean
    public TaskResultCodec taskResultCodec(ObjectMapper objectMapper) {
        return new TaskResultCodec(objectMapper);
    }

    @Bean
    public InputFileResolver inputFileResolver(TaskResultCodec codec, ObjectMapper objectMapper) {
        return new PipeResultInputFileResolver(codec, objectMapper);
    }

    @Bean
    public OutputFileAllocator outputFileAllocator() {
        return new UuidOutputFileAllocator();
    }

    @Bean
    public ProcessRunner processRunner() {
        return new SystemProcessRunner();
    }

    @Bean
    public ExifToolTask exifToolTask(InputFileResolver inputFileResolver,
                                     OutputFileAllocator outputFileAllocator,
                                     TaskResultCodec codec,
                                     ProcessRunner processRunner,
                                     WorkerProperties properties) {
        return new ExifToolTask(
            inputFileResolver,
            outputFileAllocator,
            codec,
            processRunner,
            properties.getExiftool().getExecutable(),
            properties.getExiftool().getTimeout());
    }

    @Bean
    public TaskRegistry taskRegistry(ExifToolTask exifToolTask) {
        TaskRegistry registry = new TaskRegistry();
        registry.register(ExifToolTask.TASK_NAME, exifToolTask, ExifToolTask.METADATA);
        return registry;
    }

    @Bean
    public TaskDispatcher taskDispatcher(TaskRegistry registry, TaskResultCodec codec,
                                         ObjectProvider<DispatchListener> listeners) {
        return new TaskDispatcher(registry, codec, listeners.orderedStream().toList());
    }
}
