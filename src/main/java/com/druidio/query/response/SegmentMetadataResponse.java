package com.druidio.query.response;

import com.druidio.serialization.NullToEmpty;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Metadata of one segment (or of all segments, when the query merged them).
 *
 * The broker answers {@code null} for {@code intervals} and {@code aggregators}
 * when those analyses were not requested; both decode as empty.
 */
public final class SegmentMetadataResponse {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("intervals")
    private final List<String> intervals;

    @JsonProperty("columns")
    private final Map<String, ColumnDefinition> columns;

    @JsonProperty("queryGranularity")
    private final JsonNode queryGranularity;

    @JsonProperty("rollup")
    private final Boolean rollup;

    @JsonProperty("size")
    private final Long size;

    @JsonProperty("numRows")
    private final Long numRows;

    @JsonProperty("timestampSpec")
    private final TimestampSpec timestampSpec;

    @JsonProperty("aggregators")
    private final Map<String, AggregatorDefinition> aggregators;

    @JsonCreator
    public SegmentMetadataResponse(@JsonProperty("id") String id,
                                   @JsonProperty("intervals") List<String> intervals,
                                   @JsonProperty("columns") Map<String, ColumnDefinition> columns,
                                   @JsonProperty("queryGranularity") JsonNode queryGranularity,
                                   @JsonProperty("rollup") Boolean rollup,
                                   @JsonProperty("size") Long size,
                                   @JsonProperty("numRows") Long numRows,
                                   @JsonProperty("timestampSpec") TimestampSpec timestampSpec,
                                   @JsonProperty("aggregators") Map<String, AggregatorDefinition> aggregators) {
        this.id = id;
        this.intervals = NullToEmpty.list(intervals);
        this.columns = NullToEmpty.map(columns);
        this.queryGranularity = queryGranularity == null || queryGranularity.isNull() ? null : queryGranularity;
        this.rollup = rollup;
        this.size = size;
        this.numRows = numRows;
        this.timestampSpec = timestampSpec;
        this.aggregators = NullToEmpty.map(aggregators);
    }

    public String getId() {
        return id;
    }

    public List<String> getIntervals() {
        return intervals;
    }

    public Map<String, ColumnDefinition> getColumns() {
        return columns;
    }

    /**
     * Raw granularity the segment was ingested with, {@code null} when not analysed.
     */
    public JsonNode getQueryGranularity() {
        return queryGranularity;
    }

    public Boolean getRollup() {
        return rollup;
    }

    public Long getSize() {
        return size;
    }

    public Long getNumRows() {
        return numRows;
    }

    public TimestampSpec getTimestampSpec() {
        return timestampSpec;
    }

    public Map<String, AggregatorDefinition> getAggregators() {
        return aggregators;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SegmentMetadataResponse that = (SegmentMetadataResponse) o;
        return Objects.equals(id, that.id) && intervals.equals(that.intervals) && columns.equals(that.columns)
            && Objects.equals(queryGranularity, that.queryGranularity) && Objects.equals(rollup, that.rollup)
            && Objects.equals(size, that.size) && Objects.equals(numRows, that.numRows)
            && Objects.equals(timestampSpec, that.timestampSpec) && aggregators.equals(that.aggregators);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, intervals, columns, queryGranularity, rollup, size, numRows, timestampSpec,
            aggregators);
    }

    @Override
    public String toString() {
        return "SegmentMetadataResponse{" + id + ", columns=" + columns.keySet() + "}";
    }
}
