package com.druidio.query;

import com.druidio.query.definitions.Filter;
import com.druidio.query.definitions.TimeBoundType;
import com.druidio.serialization.NullToEmpty;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * Earliest and/or latest timestamp of a data source.
 */
public final class TimeBoundary implements Query {

    @JsonProperty("dataSource")
    private final DataSource dataSource;

    // the broker defaults to both bounds and rejects an explicit minMaxTime
    @JsonProperty("bound")
    @JsonInclude(value = JsonInclude.Include.CUSTOM, valueFilter = TimeBoundType.BothBoundsFilter.class)
    private final TimeBoundType bound;

    @JsonProperty("filter")
    private final Filter filter;

    @JsonProperty("context")
    private final Map<String, String> context;

    @JsonCreator
    public TimeBoundary(@JsonProperty("dataSource") DataSource dataSource,
                        @JsonProperty("bound") TimeBoundType bound,
                        @JsonProperty("filter") Filter filter,
                        @JsonProperty("context") Map<String, String> context) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.bound = bound == null ? TimeBoundType.MIN_MAX_TIME : bound;
        this.filter = filter;
        this.context = NullToEmpty.map(context);
    }

    public TimeBoundary(DataSource dataSource, TimeBoundType bound) {
        this(dataSource, bound, null, null);
    }

    @Override
    public DataSource getDataSource() {
        return dataSource;
    }

    public TimeBoundType getBound() {
        return bound;
    }

    public Filter getFilter() {
        return filter;
    }

    public Map<String, String> getContext() {
        return context;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimeBoundary that = (TimeBoundary) o;
        return dataSource.equals(that.dataSource) && bound == that.bound
            && Objects.equals(filter, that.filter) && context.equals(that.context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataSource, bound, filter, context);
    }

    @Override
    public String toString() {
        return "TimeBoundary{" + dataSource + ", " + bound.getValue() + "}";
    }
}
