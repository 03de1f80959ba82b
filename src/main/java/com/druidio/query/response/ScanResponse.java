package com.druidio.query.response;

import com.druidio.serialization.NullToEmpty;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One batch of scanned rows from a single segment.
 */
public final class ScanResponse<T> {

    @JsonProperty("segmentId")
    private final String segmentId;

    @JsonProperty("columns")
    private final List<String> columns;

    @JsonProperty("events")
    private final List<T> events;

    @JsonCreator
    public ScanResponse(@JsonProperty("segmentId") String segmentId,
                        @JsonProperty("columns") List<String> columns,
                        @JsonProperty("events") List<T> events) {
        this.segmentId = segmentId;
        this.columns = NullToEmpty.list(columns);
        this.events = NullToEmpty.list(events);
    }

    public String getSegmentId() {
        return segmentId;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<T> getEvents() {
        return events;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScanResponse<?> that = (ScanResponse<?>) o;
        return Objects.equals(segmentId, that.segmentId) && columns.equals(that.columns)
            && events.equals(that.events);
    }

    @Override
    public int hashCode() {
        return Objects.hash(segmentId, columns, events);
    }

    @Override
    public String toString() {
        return "ScanResponse{" + segmentId + ", events=" + events.size() + "}";
    }
}
