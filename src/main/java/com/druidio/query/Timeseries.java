package com.druidio.query;

import com.druidio.query.definitions.Aggregation;
import com.druidio.query.definitions.Filter;
import com.druidio.query.definitions.Granularity;
import com.druidio.query.definitions.PostAggregation;
import com.druidio.serialization.NullToEmpty;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregations bucketed by {@code granularity} over time.
 */
public final class Timeseries implements Query {

    @JsonProperty("dataSource")
    private final DataSource dataSource;

    @JsonProperty("granularity")
    private final Granularity granularity;

    @JsonProperty("descending")
    private final boolean descending;

    @JsonProperty("intervals")
    private final List<String> intervals;

    @JsonProperty("filter")
    private final Filter filter;

    @JsonProperty("aggregations")
    private final List<Aggregation> aggregations;

    @JsonProperty("postAggregations")
    private final List<PostAggregation> postAggregations;

    @JsonProperty("limit")
    private final Integer limit;

    @JsonProperty("context")
    private final Map<String, String> context;

    @JsonCreator
    public Timeseries(@JsonProperty("dataSource") DataSource dataSource,
                      @JsonProperty("granularity") Granularity granularity,
                      @JsonProperty("descending") boolean descending,
                      @JsonProperty("intervals") List<String> intervals,
                      @JsonProperty("filter") Filter filter,
                      @JsonProperty("aggregations") List<Aggregation> aggregations,
                      @JsonProperty("postAggregations") List<PostAggregation> postAggregations,
                      @JsonProperty("limit") Integer limit,
                      @JsonProperty("context") Map<String, String> context) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.granularity = granularity == null ? Granularity.ALL : granularity;
        this.descending = descending;
        this.intervals = NullToEmpty.list(intervals);
        this.filter = filter;
        this.aggregations = NullToEmpty.list(aggregations);
        this.postAggregations = NullToEmpty.list(postAggregations);
        this.limit = limit;
        this.context = NullToEmpty.map(context);
    }

    @Override
    public DataSource getDataSource() {
        return dataSource;
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public boolean isDescending() {
        return descending;
    }

    public List<String> getIntervals() {
        return intervals;
    }

    public Filter getFilter() {
        return filter;
    }

    public List<Aggregation> getAggregations() {
        return aggregations;
    }

    public List<PostAggregation> getPostAggregations() {
        return postAggregations;
    }

    public Integer getLimit() {
        return limit;
    }

    public Map<String, String> getContext() {
        return context;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Timeseries that = (Timeseries) o;
        return descending == that.descending && dataSource.equals(that.dataSource)
            && granularity.equals(that.granularity) && intervals.equals(that.intervals)
            && Objects.equals(filter, that.filter) && aggregations.equals(that.aggregations)
            && postAggregations.equals(that.postAggregations) && Objects.equals(limit, that.limit)
            && context.equals(that.context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataSource, granularity, descending, intervals, filter, aggregations,
            postAggregations, limit, context);
    }

    @Override
    public String toString() {
        return "Timeseries{" + dataSource + ", " + granularity + ", intervals=" + intervals + "}";
    }
}
