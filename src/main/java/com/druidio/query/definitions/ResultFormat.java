package com.druidio.query.definitions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Row layout of scan query results.
 */
public enum ResultFormat {
    LIST("list"),
    COMPACTED_LIST("compactedList"),
    VALUE_VECTOR("valueVector");

    private final String value;

    ResultFormat(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a wire value to ResultFormat
     */
    @JsonCreator
    public static ResultFormat fromValue(String value) {
        for (ResultFormat candidate : ResultFormat.values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ResultFormat value: " + value);
    }
}
