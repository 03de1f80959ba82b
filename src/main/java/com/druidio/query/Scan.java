package com.druidio.query;

import com.druidio.query.definitions.Filter;
import com.druidio.query.definitions.Ordering;
import com.druidio.query.definitions.ResultFormat;
import com.druidio.serialization.NullToEmpty;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Raw rows of a data source, streamed back in batches of {@code batchSize}.
 */
public final class Scan implements Query {

    @JsonProperty("dataSource")
    private final DataSource dataSource;

    @JsonProperty("intervals")
    private final List<String> intervals;

    @JsonProperty("resultFormat")
    private final ResultFormat resultFormat;

    @JsonProperty("filter")
    private final Filter filter;

    @JsonProperty("columns")
    private final List<String> columns;

    @JsonProperty("batchSize")
    private final Integer batchSize;

    @JsonProperty("limit")
    private final Long limit;

    @JsonProperty("offset")
    private final Long offset;

    @JsonProperty("order")
    private final Ordering order;

    @JsonProperty("context")
    private final Map<String, String> context;

    @JsonCreator
    public Scan(@JsonProperty("dataSource") DataSource dataSource,
                @JsonProperty("intervals") List<String> intervals,
                @JsonProperty("resultFormat") ResultFormat resultFormat,
                @JsonProperty("filter") Filter filter,
                @JsonProperty("columns") List<String> columns,
                @JsonProperty("batchSize") Integer batchSize,
                @JsonProperty("limit") Long limit,
                @JsonProperty("offset") Long offset,
                @JsonProperty("order") Ordering order,
                @JsonProperty("context") Map<String, String> context) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.intervals = NullToEmpty.list(intervals);
        this.resultFormat = resultFormat == null ? ResultFormat.LIST : resultFormat;
        this.filter = filter;
        this.columns = NullToEmpty.list(columns);
        this.batchSize = batchSize;
        this.limit = limit;
        this.offset = offset;
        this.order = order;
        this.context = NullToEmpty.map(context);
    }

    @Override
    public DataSource getDataSource() {
        return dataSource;
    }

    public List<String> getIntervals() {
        return intervals;
    }

    public ResultFormat getResultFormat() {
        return resultFormat;
    }

    public Filter getFilter() {
        return filter;
    }

    public List<String> getColumns() {
        return columns;
    }

    public Integer getBatchSize() {
        return batchSize;
    }

    public Long getLimit() {
        return limit;
    }

    public Long getOffset() {
        return offset;
    }

    public Ordering getOrder() {
        return order;
    }

    public Map<String, String> getContext() {
        return context;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Scan that = (Scan) o;
        return dataSource.equals(that.dataSource) && intervals.equals(that.intervals)
            && resultFormat == that.resultFormat && Objects.equals(filter, that.filter)
            && columns.equals(that.columns) && Objects.equals(batchSize, that.batchSize)
            && Objects.equals(limit, that.limit) && Objects.equals(offset, that.offset)
            && order == that.order && context.equals(that.context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataSource, intervals, resultFormat, filter, columns, batchSize, limit, offset,
            order, context);
    }

    @Override
    public String toString() {
        return "Scan{" + dataSource + ", intervals=" + intervals + ", limit=" + limit + "}";
    }
}
