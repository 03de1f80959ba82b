package com.druidio.query;

import com.druidio.query.definitions.Aggregation;
import com.druidio.query.definitions.Dimension;
import com.druidio.query.definitions.Filter;
import com.druidio.query.definitions.Granularity;
import com.druidio.query.definitions.HavingSpec;
import com.druidio.query.definitions.LimitSpec;
import com.druidio.query.definitions.PostAggregation;
import com.druidio.serialization.NullToEmpty;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregates rows grouped by {@code dimensions}. Build with {@link GroupByBuilder}.
 */
public final class GroupBy implements Query {

    @JsonProperty("dataSource")
    private final DataSource dataSource;

    @JsonProperty("dimensions")
    private final List<Dimension> dimensions;

    @JsonProperty("limitSpec")
    private final LimitSpec limitSpec;

    @JsonProperty("having")
    private final HavingSpec having;

    @JsonProperty("granularity")
    private final Granularity granularity;

    @JsonProperty("filter")
    private final Filter filter;

    @JsonProperty("aggregations")
    private final List<Aggregation> aggregations;

    @JsonProperty("postAggregations")
    private final List<PostAggregation> postAggregations;

    @JsonProperty("intervals")
    private final List<String> intervals;

    @JsonProperty("subtotalsSpec")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private final List<List<String>> subtotalsSpec;

    @JsonProperty("context")
    private final Map<String, String> context;

    @JsonCreator
    public GroupBy(@JsonProperty("dataSource") DataSource dataSource,
                   @JsonProperty("dimensions") List<Dimension> dimensions,
                   @JsonProperty("limitSpec") LimitSpec limitSpec,
                   @JsonProperty("having") HavingSpec having,
                   @JsonProperty("granularity") Granularity granularity,
                   @JsonProperty("filter") Filter filter,
                   @JsonProperty("aggregations") List<Aggregation> aggregations,
                   @JsonProperty("postAggregations") List<PostAggregation> postAggregations,
                   @JsonProperty("intervals") List<String> intervals,
                   @JsonProperty("subtotalsSpec") List<List<String>> subtotalsSpec,
                   @JsonProperty("context") Map<String, String> context) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.dimensions = NullToEmpty.list(dimensions);
        this.limitSpec = limitSpec;
        this.having = having;
        this.granularity = granularity == null ? Granularity.ALL : granularity;
        this.filter = filter;
        this.aggregations = NullToEmpty.list(aggregations);
        this.postAggregations = NullToEmpty.list(postAggregations);
        this.intervals = NullToEmpty.list(intervals);
        this.subtotalsSpec = NullToEmpty.nestedList(subtotalsSpec);
        this.context = NullToEmpty.map(context);
    }

    public static GroupByBuilder builder(DataSource dataSource) {
        return GroupByBuilder.of(dataSource);
    }

    @Override
    public DataSource getDataSource() {
        return dataSource;
    }

    public List<Dimension> getDimensions() {
        return dimensions;
    }

    public LimitSpec getLimitSpec() {
        return limitSpec;
    }

    public HavingSpec getHaving() {
        return having;
    }

    public Granularity getGranularity() {
        return granularity;
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

    public List<String> getIntervals() {
        return intervals;
    }

    public List<List<String>> getSubtotalsSpec() {
        return subtotalsSpec;
    }

    public Map<String, String> getContext() {
        return context;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GroupBy that = (GroupBy) o;
        return dataSource.equals(that.dataSource) && dimensions.equals(that.dimensions)
            && Objects.equals(limitSpec, that.limitSpec) && Objects.equals(having, that.having)
            && granularity.equals(that.granularity) && Objects.equals(filter, that.filter)
            && aggregations.equals(that.aggregations) && postAggregations.equals(that.postAggregations)
            && intervals.equals(that.intervals) && subtotalsSpec.equals(that.subtotalsSpec)
            && context.equals(that.context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataSource, dimensions, limitSpec, having, granularity, filter, aggregations,
            postAggregations, intervals, subtotalsSpec, context);
    }

    @Override
    public String toString() {
        return "GroupBy{" + dataSource + ", dimensions=" + dimensions.size()
            + ", aggregations=" + aggregations.size() + ", intervals=" + intervals + "}";
    }
}
