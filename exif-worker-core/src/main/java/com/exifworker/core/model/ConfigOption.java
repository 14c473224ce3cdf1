package com.exifworker.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Declarative description of one user facing task option.
 * Label and description are display metadata only.
 */
public record ConfigOption(
    @JsonProperty("name") String name,
    @JsonProperty("label") String label,
    @JsonProperty("description") String description,
    @JsonProperty("type") ConfigOptionType type,
    @JsonProperty("required") boolean required,
    @JsonProperty("default_value") Object defaultValue
) {
    public ConfigOption {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Config option name must not be empty");
        }
        if (type == null) {
            type = ConfigOptionType.TEXT;
        }
    }

    /**
     * Optional checkbox option.
     */
    public static ConfigOption checkbox(String name, String label, String description, boolean defaultValue) {
        return new ConfigOption(name, label, description, ConfigOptionType.CHECKBOX, false, defaultValue);
    }
}
