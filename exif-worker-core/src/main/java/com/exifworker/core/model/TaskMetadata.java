package com.exifworker.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Static metadata published for a registered task: what the UI shows and
 * which options it lets the user set.
 */
public record TaskMetadata(
    @JsonProperty("display_name") String displayName,
    @JsonProperty("description") String description,
    @JsonProperty("task_config") List<ConfigOption> taskConfig
) {
    public TaskMetadata {
        taskConfig = taskConfig != null ? List.copyOf(taskConfig) : List.of();
    }

    /**
     * Find a declared option by name.
     */
    public java.util.Optional<ConfigOption> option(String name) {
        return taskConfig.stream()
            .filter(option -> option.name().equals(name))
            .findFirst();
    }
}
