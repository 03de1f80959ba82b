package com.druidio.query.definitions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Value type of a dimension's output column.
 */
public enum OutputType {
    STRING("STRING"),
    LONG("LONG"),
    FLOAT("FLOAT");

    private final String value;

    OutputType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a wire value to OutputType
     */
    @JsonCreator
    public static OutputType fromValue(String value) {
        for (OutputType candidate : OutputType.values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown OutputType value: " + value);
    }
}
