package com.druidio.query.definitions;

import com.druidio.serialization.TaggedOrUntaggedDeserializer;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * Comparison used when ordering dimension values.
 *
 * The broker writes this either bare ({@code "numeric"}) or tagged
 * ({@code {"type": "numeric"}}); both decode. Types holding an ordering fall
 * back to {@link #LEXICOGRAPHIC} when it is absent.
 */
@JsonDeserialize(using = SortingOrder.Deserializer.class)
public enum SortingOrder {
    LEXICOGRAPHIC("lexicographic"),
    ALPHANUMERIC("alphanumeric"),
    STRLEN("strlen"),
    NUMERIC("numeric");

    private final String value;

    SortingOrder(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static SortingOrder fromValue(String value) {
        for (SortingOrder order : SortingOrder.values()) {
            if (order.value.equalsIgnoreCase(value)) {
                return order;
            }
        }
        throw new IllegalArgumentException("Unknown SortingOrder value: " + value);
    }

    public static class Deserializer extends TaggedOrUntaggedDeserializer<SortingOrder> {

        public Deserializer() {
            super(SortingOrder.class);
        }

        @Override
        protected SortingOrder fromName(String name) {
            return fromValue(name);
        }
    }
}
