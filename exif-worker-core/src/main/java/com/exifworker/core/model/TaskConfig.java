package com.exifworker.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * User supplied configuration for a single task invocation.
 * A missing or empty configuration is equivalent to all defaults.
 */
public final class TaskConfig {

    private static final TaskConfig EMPTY = new TaskConfig(Map.of());

    private final Map<String, Object> values;

    private TaskConfig(Map<String, Object> values) {
        this.values = values;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static TaskConfig of(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new TaskConfig(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static TaskConfig empty() {
        return EMPTY;
    }

    /**
     * Read a boolean option. Accepts booleans and the strings "true"/"false".
     */
    public boolean getBoolean(String name, boolean defaultValue) {
        Object value = values.get(name);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s && !s.isBlank()) {
            return Boolean.parseBoolean(s.trim());
        }
        return defaultValue;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TaskConfig other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "TaskConfig" + values;
    }
}
