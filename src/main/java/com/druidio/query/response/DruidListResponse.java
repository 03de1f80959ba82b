package com.druidio.query.response;

import com.druidio.serialization.NullToEmpty;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One time bucket of a topN or search result: a timestamp and its ranked rows.
 */
public final class DruidListResponse<T> {

    @JsonProperty("timestamp")
    private final String timestamp;

    @JsonProperty("result")
    private final List<T> result;

    @JsonCreator
    public DruidListResponse(@JsonProperty("timestamp") String timestamp,
                             @JsonProperty("result") List<T> result) {
        this.timestamp = timestamp;
        this.result = NullToEmpty.list(result);
    }

    public String getTimestamp() {
        return timestamp;
    }

    public List<T> getResult() {
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DruidListResponse<?> that = (DruidListResponse<?>) o;
        return Objects.equals(timestamp, that.timestamp) && result.equals(that.result);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, result);
    }

    @Override
    public String toString() {
        return "DruidListResponse{" + timestamp + ", rows=" + result.size() + "}";
    }
}
