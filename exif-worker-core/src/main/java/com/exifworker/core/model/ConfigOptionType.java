package com.exifworker.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Form control used to render a configuration option in the UI.
 */
public enum ConfigOptionType {
    CHECKBOX,
    TEXT,
    TEXTAREA,
    SELECT,
    AUTOCOMPLETE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
