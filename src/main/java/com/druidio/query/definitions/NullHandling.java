package com.druidio.query.definitions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the stringFormat extraction function renders null input.
 */
public enum NullHandling {
    NULL_STRING("nullString"),
    EMPTY_STRING("emptyString"),
    RETURN_NULL("returnNull");

    private final String value;

    NullHandling(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a wire value to NullHandling
     */
    @JsonCreator
    public static NullHandling fromValue(String value) {
        for (NullHandling candidate : NullHandling.values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown NullHandling value: " + value);
    }
}
