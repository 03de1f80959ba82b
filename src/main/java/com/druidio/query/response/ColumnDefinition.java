package com.druidio.query.response;

import com.druidio.query.JsonAny;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Analysis of one column in a segment metadata result. The optional fields are
 * only present for the analyses that were requested.
 */
public final class ColumnDefinition {

    @JsonProperty("type")
    private final String type;

    @JsonProperty("hasMultipleValues")
    private final boolean hasMultipleValues;

    @JsonProperty("size")
    private final long size;

    @JsonProperty("cardinality")
    private final Double cardinality;

    @JsonProperty("minValue")
    private final JsonAny minValue;

    @JsonProperty("maxValue")
    private final JsonAny maxValue;

    @JsonProperty("errorMessage")
    private final String errorMessage;

    @JsonCreator
    public ColumnDefinition(@JsonProperty("type") String type,
                            @JsonProperty("hasMultipleValues") boolean hasMultipleValues,
                            @JsonProperty("size") long size,
                            @JsonProperty("cardinality") Double cardinality,
                            @JsonProperty("minValue") JsonAny minValue,
                            @JsonProperty("maxValue") JsonAny maxValue,
                            @JsonProperty("errorMessage") String errorMessage) {
        this.type = type;
        this.hasMultipleValues = hasMultipleValues;
        this.size = size;
        this.cardinality = cardinality;
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.errorMessage = errorMessage;
    }

    public String getType() {
        return type;
    }

    public boolean hasMultipleValues() {
        return hasMultipleValues;
    }

    public long getSize() {
        return size;
    }

    public Double getCardinality() {
        return cardinality;
    }

    public JsonAny getMinValue() {
        return minValue;
    }

    public JsonAny getMaxValue() {
        return maxValue;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ColumnDefinition that = (ColumnDefinition) o;
        return hasMultipleValues == that.hasMultipleValues && size == that.size
            && Objects.equals(type, that.type) && Objects.equals(cardinality, that.cardinality)
            && Objects.equals(minValue, that.minValue) && Objects.equals(maxValue, that.maxValue)
            && Objects.equals(errorMessage, that.errorMessage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, hasMultipleValues, size, cardinality, minValue, maxValue, errorMessage);
    }
}
