package com.druidio.query;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * A JSON number that remembers whether it was written as an integer or as a
 * floating point value.
 */
@JsonDeserialize(using = JsonNumber.Deserializer.class)
public final class JsonNumber {

    private final Number value;

    private JsonNumber(Number value) {
        this.value = value;
    }

    public static JsonNumber of(long value) {
        return new JsonNumber(value);
    }

    public static JsonNumber of(double value) {
        return new JsonNumber(value);
    }

    public boolean isInteger() {
        return value instanceof Long;
    }

    public long longValue() {
        return value.longValue();
    }

    public double doubleValue() {
        return value.doubleValue();
    }

    @JsonValue
    public Number getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonNumber && value.equals(((JsonNumber) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }

    public static class Deserializer extends StdDeserializer<JsonNumber> {

        public Deserializer() {
            super(JsonNumber.class);
        }

        @Override
        public JsonNumber deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return switch (p.currentToken()) {
                // integers beyond the long range decode as floating point
                case VALUE_NUMBER_INT -> p.getNumberType() == JsonParser.NumberType.BIG_INTEGER
                    ? of(p.getDoubleValue())
                    : of(p.getLongValue());
                case VALUE_NUMBER_FLOAT -> of(p.getDoubleValue());
                default -> (JsonNumber) ctxt.handleUnexpectedToken(JsonNumber.class, p);
            };
        }
    }
}
