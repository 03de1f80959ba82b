package com.druidio.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum JoinType {
    INNER("INNER"),
    LEFT("LEFT");

    private final String value;

    JoinType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static JoinType fromValue(String value) {
        for (JoinType type : JoinType.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown JoinType value: " + value);
    }
}
