package com.druidio.query.response;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class GroupByResponse<T> {

    @JsonProperty("timestamp")
    private final String timestamp;

    @JsonProperty("event")
    private final T event;

    @JsonCreator
    public GroupByResponse(@JsonProperty("timestamp") String timestamp, @JsonProperty("event") T event) {
        this.timestamp = timestamp;
        this.event = event;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public T getEvent() {
        return event;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GroupByResponse<?> that = (GroupByResponse<?>) o;
        return Objects.equals(timestamp, that.timestamp) && Objects.equals(event, that.event);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, event);
    }

    @Override
    public String toString() {
        return "GroupByResponse{" + timestamp + ", " + event + "}";
    }
}
