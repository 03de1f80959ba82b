package com.druidio.query.definitions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which end(s) of a datasource's time range a time boundary query returns.
 * {@link #MIN_MAX_TIME} is the broker's default and is never written.
 */
public enum TimeBoundType {
    MAX_TIME("maxTime"),
    MIN_TIME("minTime"),
    MIN_MAX_TIME("minMaxTime");

    private final String value;

    TimeBoundType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isBoth() {
        return this == MIN_MAX_TIME;
    }

    @JsonCreator
    public static TimeBoundType fromValue(String value) {
        if (value == null) {
            return MIN_MAX_TIME;
        }
        for (TimeBoundType type : TimeBoundType.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown TimeBoundType value: " + value);
    }

    /**
     * Property filter for {@code @JsonInclude(CUSTOM)}: excludes the default bound.
     */
    public static class BothBoundsFilter {

        @Override
        public boolean equals(Object other) {
            return other == null || other == MIN_MAX_TIME;
        }

        @Override
        public int hashCode() {
            return MIN_MAX_TIME.hashCode();
        }
    }
}
