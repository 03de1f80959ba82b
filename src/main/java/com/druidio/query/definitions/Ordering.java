package com.druidio.query.definitions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Sort direction, used by order-by columns and by the scan query's time order.
 */
public enum Ordering {
    ASCENDING("ascending"),
    DESCENDING("descending"),
    NONE("none");

    private final String value;

    Ordering(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a wire value to Ordering
     */
    @JsonCreator
    public static Ordering fromValue(String value) {
        for (Ordering candidate : Ordering.values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown Ordering value: " + value);
    }
}
