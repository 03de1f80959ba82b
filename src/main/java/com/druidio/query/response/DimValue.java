package com.druidio.query.response;

import com.druidio.query.JsonAny;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A search hit: the matching value, the dimension it was found in and how many rows carry it.
 */
public final class DimValue {

    @JsonProperty("dimension")
    private final String dimension;

    @JsonProperty("value")
    private final JsonAny value;

    @JsonProperty("count")
    private final long count;

    @JsonCreator
    public DimValue(@JsonProperty("dimension") String dimension,
                    @JsonProperty("value") JsonAny value,
                    @JsonProperty("count") long count) {
        this.dimension = dimension;
        this.value = value;
        this.count = count;
    }

    public String getDimension() {
        return dimension;
    }

    public JsonAny getValue() {
        return value;
    }

    public long getCount() {
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DimValue that = (DimValue) o;
        return count == that.count && Objects.equals(dimension, that.dimension) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimension, value, count);
    }

    @Override
    public String toString() {
        return dimension + "=" + value + " (" + count + ")";
    }
}
