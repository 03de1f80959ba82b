package com.druidio.query.response;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Either bound is {@code null} when the query asked for the other one only.
 */
public final class MinMaxTime {

    @JsonProperty("maxTime")
    private final String maxTime;

    @JsonProperty("minTime")
    private final String minTime;

    @JsonCreator
    public MinMaxTime(@JsonProperty("maxTime") String maxTime, @JsonProperty("minTime") String minTime) {
        this.maxTime = maxTime;
        this.minTime = minTime;
    }

    public String getMaxTime() {
        return maxTime;
    }

    public String getMinTime() {
        return minTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MinMaxTime that = (MinMaxTime) o;
        return Objects.equals(maxTime, that.maxTime) && Objects.equals(minTime, that.minTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxTime, minTime);
    }

    @Override
    public String toString() {
        return "[" + minTime + ", " + maxTime + "]";
    }
}
