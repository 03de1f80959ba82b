package com.druidio.query;

import com.druidio.query.definitions.AnalysisType;
import com.druidio.query.definitions.ToInclude;
import com.druidio.serialization.NullToEmpty;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Per-segment column and size information of a data source.
 */
public final class SegmentMetadata implements Query {

    @JsonProperty("dataSource")
    private final DataSource dataSource;

    @JsonProperty("intervals")
    private final List<String> intervals;

    @JsonProperty("toInclude")
    private final ToInclude toInclude;

    @JsonProperty("merge")
    private final boolean merge;

    // empty is omitted, so the broker runs its default analyses
    @JsonProperty("analysisTypes")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private final List<AnalysisType> analysisTypes;

    @JsonProperty("lenientAggregatorMerge")
    private final boolean lenientAggregatorMerge;

    @JsonCreator
    public SegmentMetadata(@JsonProperty("dataSource") DataSource dataSource,
                           @JsonProperty("intervals") List<String> intervals,
                           @JsonProperty("toInclude") ToInclude toInclude,
                           @JsonProperty("merge") boolean merge,
                           @JsonProperty("analysisTypes") List<AnalysisType> analysisTypes,
                           @JsonProperty("lenientAggregatorMerge") boolean lenientAggregatorMerge) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.intervals = NullToEmpty.list(intervals);
        this.toInclude = toInclude == null ? ToInclude.all() : toInclude;
        this.merge = merge;
        this.analysisTypes = NullToEmpty.list(analysisTypes);
        this.lenientAggregatorMerge = lenientAggregatorMerge;
    }

    @Override
    public DataSource getDataSource() {
        return dataSource;
    }

    public List<String> getIntervals() {
        return intervals;
    }

    public ToInclude getToInclude() {
        return toInclude;
    }

    public boolean isMerge() {
        return merge;
    }

    public List<AnalysisType> getAnalysisTypes() {
        return analysisTypes;
    }

    public boolean isLenientAggregatorMerge() {
        return lenientAggregatorMerge;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SegmentMetadata that = (SegmentMetadata) o;
        return merge == that.merge && lenientAggregatorMerge == that.lenientAggregatorMerge
            && dataSource.equals(that.dataSource) && intervals.equals(that.intervals)
            && toInclude.equals(that.toInclude) && analysisTypes.equals(that.analysisTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataSource, intervals, toInclude, merge, analysisTypes, lenientAggregatorMerge);
    }

    @Override
    public String toString() {
        return "SegmentMetadata{" + dataSource + ", intervals=" + intervals + "}";
    }
}
