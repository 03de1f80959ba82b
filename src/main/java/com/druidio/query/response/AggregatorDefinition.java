package com.druidio.query.response;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Ingestion-time aggregator of a segment, as reported by segment metadata.
 */
public final class AggregatorDefinition {

    @JsonProperty("type")
    private final String type;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("fieldName")
    private final String fieldName;

    @JsonProperty("expression")
    private final String expression;

    @JsonCreator
    public AggregatorDefinition(@JsonProperty("type") String type,
                                @JsonProperty("name") String name,
                                @JsonProperty("fieldName") String fieldName,
                                @JsonProperty("expression") String expression) {
        this.type = type;
        this.name = name;
        this.fieldName = fieldName;
        this.expression = expression;
    }

    public String getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AggregatorDefinition that = (AggregatorDefinition) o;
        return Objects.equals(type, that.type) && Objects.equals(name, that.name)
            && Objects.equals(fieldName, that.fieldName) && Objects.equals(expression, that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, fieldName, expression);
    }
}
