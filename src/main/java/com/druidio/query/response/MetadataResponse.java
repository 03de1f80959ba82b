package com.druidio.query.response;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A timestamped single result, as returned by timeseries and data source metadata queries.
 */
public final class MetadataResponse<T> {

    @JsonProperty("timestamp")
    private final String timestamp;

    @JsonProperty("result")
    private final T result;

    @JsonCreator
    public MetadataResponse(@JsonProperty("timestamp") String timestamp, @JsonProperty("result") T result) {
        this.timestamp = timestamp;
        this.result = result;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public T getResult() {
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MetadataResponse<?> that = (MetadataResponse<?>) o;
        return Objects.equals(timestamp, that.timestamp) && Objects.equals(result, that.result);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, result);
    }

    @Override
    public String toString() {
        return "MetadataResponse{" + timestamp + ", " + result + "}";
    }
}
