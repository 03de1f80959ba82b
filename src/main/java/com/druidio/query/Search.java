package com.druidio.query;

import com.druidio.query.definitions.Filter;
import com.druidio.query.definitions.Granularity;
import com.druidio.query.definitions.SearchQuerySpec;
import com.druidio.query.definitions.SortingOrder;
import com.druidio.serialization.NullToEmpty;
import com.druidio.serialization.TypeTagSerializer;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dimension values matching {@code query}, with their row counts.
 */
public final class Search implements Query {

    @JsonProperty("dataSource")
    private final DataSource dataSource;

    @JsonProperty("granularity")
    private final Granularity granularity;

    @JsonProperty("filter")
    private final Filter filter;

    @JsonProperty("limit")
    private final Integer limit;

    @JsonProperty("intervals")
    private final List<String> intervals;

    @JsonProperty("searchDimensions")
    private final List<String> searchDimensions;

    @JsonProperty("query")
    private final SearchQuerySpec query;

    @JsonProperty("sort")
    @JsonSerialize(using = TypeTagSerializer.class)
    private final SortingOrder sort;

    @JsonProperty("context")
    private final Map<String, String> context;

    @JsonCreator
    public Search(@JsonProperty("dataSource") DataSource dataSource,
                  @JsonProperty("granularity") Granularity granularity,
                  @JsonProperty("filter") Filter filter,
                  @JsonProperty("limit") Integer limit,
                  @JsonProperty("intervals") List<String> intervals,
                  @JsonProperty("searchDimensions") List<String> searchDimensions,
                  @JsonProperty("query") SearchQuerySpec query,
                  @JsonProperty("sort") SortingOrder sort,
                  @JsonProperty("context") Map<String, String> context) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.granularity = granularity == null ? Granularity.ALL : granularity;
        this.filter = filter;
        this.limit = limit;
        this.intervals = NullToEmpty.list(intervals);
        this.searchDimensions = NullToEmpty.list(searchDimensions);
        this.query = Objects.requireNonNull(query, "query");
        this.sort = sort == null ? SortingOrder.LEXICOGRAPHIC : sort;
        this.context = NullToEmpty.map(context);
    }

    @Override
    public DataSource getDataSource() {
        return dataSource;
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public Filter getFilter() {
        return filter;
    }

    public Integer getLimit() {
        return limit;
    }

    public List<String> getIntervals() {
        return intervals;
    }

    public List<String> getSearchDimensions() {
        return searchDimensions;
    }

    public SearchQuerySpec getQuery() {
        return query;
    }

    public SortingOrder getSort() {
        return sort;
    }

    public Map<String, String> getContext() {
        return context;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Search that = (Search) o;
        return dataSource.equals(that.dataSource) && granularity.equals(that.granularity)
            && Objects.equals(filter, that.filter) && Objects.equals(limit, that.limit)
            && intervals.equals(that.intervals) && searchDimensions.equals(that.searchDimensions)
            && query.equals(that.query) && sort == that.sort && context.equals(that.context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataSource, granularity, filter, limit, intervals, searchDimensions, query, sort,
            context);
    }

    @Override
    public String toString() {
        return "Search{" + dataSource + ", dimensions=" + searchDimensions + "}";
    }
}
