package com.druidio.query.definitions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Target HLL sketch representation for the HLLSketchBuild aggregator.
 */
public enum HllType {
    HLL_4("HLL_4"),
    HLL_6("HLL_6"),
    HLL_8("HLL_8");

    private final String value;

    HllType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a wire value to HllType
     */
    @JsonCreator
    public static HllType fromValue(String value) {
        for (HllType candidate : HllType.values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown HllType value: " + value);
    }
}
