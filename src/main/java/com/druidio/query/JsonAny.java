package com.druidio.query;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.Objects;

/**
 * A JSON scalar of any kind: floating point, integer, string or boolean.
 *
 * Used where the broker accepts heterogeneous values, such as post-aggregation
 * constants and having-spec thresholds. Numbers are recognized from the JSON token
 * before anything else, integers ahead of floating point, so a value survives an
 * encode/decode cycle with its kind intact.
 */
@JsonDeserialize(using = JsonAny.Deserializer.class)
public final class JsonAny {

    public enum Kind {
        FLOAT,
        INTEGER,
        STRING,
        BOOLEAN
    }

    private final Kind kind;
    private final Object value;

    private JsonAny(Kind kind, Object value) {
        this.kind = kind;
        this.value = Objects.requireNonNull(value, "value");
    }

    public static JsonAny of(double value) {
        return new JsonAny(Kind.FLOAT, value);
    }

    public static JsonAny of(long value) {
        return new JsonAny(Kind.INTEGER, value);
    }

    public static JsonAny of(String value) {
        return new JsonAny(Kind.STRING, value);
    }

    public static JsonAny of(boolean value) {
        return new JsonAny(Kind.BOOLEAN, value);
    }

    public static JsonAny of(JsonNumber number) {
        return number.isInteger() ? of(number.longValue()) : of(number.doubleValue());
    }

    public Kind getKind() {
        return kind;
    }

    @JsonValue
    public Object getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JsonAny that = (JsonAny) o;
        return kind == that.kind && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind + "(" + value + ")";
    }

    public static class Deserializer extends StdDeserializer<JsonAny> {

        public Deserializer() {
            super(JsonAny.class);
        }

        @Override
        public JsonAny deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return switch (p.currentToken()) {
                // integers beyond the long range decode as floating point
                case VALUE_NUMBER_INT -> p.getNumberType() == JsonParser.NumberType.BIG_INTEGER
                    ? of(p.getDoubleValue())
                    : of(p.getLongValue());
                case VALUE_NUMBER_FLOAT -> of(p.getDoubleValue());
                case VALUE_STRING -> of(p.getText());
                case VALUE_TRUE -> of(true);
                case VALUE_FALSE -> of(false);
                default -> (JsonAny) ctxt.handleUnexpectedToken(JsonAny.class, p);
            };
        }
    }
}
