package com.druidio.query.response;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class TimeBoundaryResponse {

    @JsonProperty("timestamp")
    private final String timestamp;

    @JsonProperty("result")
    private final MinMaxTime result;

    @JsonCreator
    public TimeBoundaryResponse(@JsonProperty("timestamp") String timestamp,
                                @JsonProperty("result") MinMaxTime result) {
        this.timestamp = timestamp;
        this.result = result;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public MinMaxTime getResult() {
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimeBoundaryResponse that = (TimeBoundaryResponse) o;
        return Objects.equals(timestamp, that.timestamp) && Objects.equals(result, that.result);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, result);
    }
}
