package com.druidio.query.definitions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Column analyses a segment metadata query may request.
 */
public enum AnalysisType {
    CARDINALITY("cardinality"),
    MINMAX("minmax"),
    SIZE("size"),
    INTERVAL("interval"),
    TIMESTAMP_SPEC("timestampSpec"),
    QUERY_GRANULARITY("queryGranularity"),
    AGGREGATORS("aggregators"),
    ROLLUP("rollup");

    private final String value;

    AnalysisType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a wire value to AnalysisType
     */
    @JsonCreator
    public static AnalysisType fromValue(String value) {
        for (AnalysisType candidate : AnalysisType.values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown AnalysisType value: " + value);
    }
}
