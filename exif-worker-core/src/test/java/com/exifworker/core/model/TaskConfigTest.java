package com.exifworker.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskConfigTest {

    @Test
    void of_withNull_shouldBeEmpty() {
        TaskConfig config = TaskConfig.of(null);

        assertTrue(config.isEmpty());
        assertSame(TaskConfig.empty(), config);
    }

    @Test
    void getBoolean_shouldReturnDefaultWhenAbsent() {
        TaskConfig config = TaskConfig.of(Map.of("other", 1));

        assertFalse(config.getBoolean("json_output", false));
        assertTrue(config.getBoolean("json_output", true));
    }

    @Test
    void getBoolean_shouldReadBooleanValues() {
        assertTrue(TaskConfig.of(Map.of("json_output", true)).getBoolean("json_output", false));
        assertFalse(TaskConfig.of(Map.of("json_output", false)).getBoolean("json_output", true));
    }

    @Test
    void getBoolean_shouldAcceptStringValues() {
        assertTrue(TaskConfig.of(Map.of("json_output", "true")).getBoolean("json_output", false));
        assertTrue(TaskConfig.of(Map.of("json_output", " TRUE ")).getBoolean("json_output", false));
        assertFalse(TaskConfig.of(Map.of("json_output", "false")).getBoolean("json_output", true));
    }

    @Test
    void getBoolean_withNullValue_shouldReturnDefault() {
        Map<String, Object> values = new HashMap<>();
        values.put("json_output", null);

        assertFalse(TaskConfig.of(values).getBoolean("json_output", false));
    }

    @Test
    void of_shouldCopyValues() {
        Map<String, Object> values = new HashMap<>();
        values.put("json_output", true);
        TaskConfig config = TaskConfig.of(values);

        values.put("json_output", false);

        assertTrue(config.getBoolean("json_output", false));
        assertThrows(UnsupportedOperationException.class, () -> config.asMap().put("x", 1));
    }
}
