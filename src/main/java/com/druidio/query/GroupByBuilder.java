package com.druidio.query;

import com.druidio.query.definitions.Aggregation;
import com.druidio.query.definitions.Dimension;
import com.druidio.query.definitions.Filter;
import com.druidio.query.definitions.Granularity;
import com.druidio.query.definitions.HavingSpec;
import com.druidio.query.definitions.LimitSpec;
import com.druidio.query.definitions.PostAggregation;
import com.druidio.serialization.NullToEmpty;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable builder for {@link GroupBy}.
 *
 * Each setter returns a new builder and leaves the receiver untouched. Defaults:
 * granularity {@code all}, no filter, having or limit, everything else empty.
 * {@link #build()} refuses a query without intervals.
 */
public final class GroupByBuilder {

    private final DataSource dataSource;
    private final List<Dimension> dimensions;
    private final LimitSpec limitSpec;
    private final HavingSpec having;
    private final Granularity granularity;
    private final Filter filter;
    private final List<Aggregation> aggregations;
    private final List<PostAggregation> postAggregations;
    private final List<String> intervals;
    private final List<List<String>> subtotalsSpec;
    private final Map<String, String> context;

    private GroupByBuilder(DataSource dataSource, List<Dimension> dimensions, LimitSpec limitSpec,
                           HavingSpec having, Granularity granularity, Filter filter,
                           List<Aggregation> aggregations, List<PostAggregation> postAggregations,
                           List<String> intervals, List<List<String>> subtotalsSpec,
                           Map<String, String> context) {
        this.dataSource = dataSource;
        this.dimensions = NullToEmpty.list(dimensions);
        this.limitSpec = limitSpec;
        this.having = having;
        this.granularity = granularity;
        this.filter = filter;
        this.aggregations = NullToEmpty.list(aggregations);
        this.postAggregations = NullToEmpty.list(postAggregations);
        this.intervals = NullToEmpty.list(intervals);
        this.subtotalsSpec = NullToEmpty.nestedList(subtotalsSpec);
        this.context = NullToEmpty.map(context);
    }

    public static GroupByBuilder of(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        return new GroupByBuilder(dataSource, null, null, null, Granularity.ALL, null,
            null, null, null, null, null);
    }

    public GroupByBuilder dimensions(List<Dimension> dimensions) {
        return new GroupByBuilder(dataSource, dimensions, limitSpec, having, granularity, filter,
            aggregations, postAggregations, intervals, subtotalsSpec, context);
    }

    public GroupByBuilder dimensions(Dimension... dimensions) {
        return dimensions(Arrays.asList(dimensions));
    }

    public GroupByBuilder limit(LimitSpec limitSpec) {
        return new GroupByBuilder(dataSource, dimensions, limitSpec, having, granularity, filter,
            aggregations, postAggregations, intervals, subtotalsSpec, context);
    }

    public GroupByBuilder having(HavingSpec having) {
        return new GroupByBuilder(dataSource, dimensions, limitSpec, having, granularity, filter,
            aggregations, postAggregations, intervals, subtotalsSpec, context);
    }

    public GroupByBuilder granularity(Granularity granularity) {
        return new GroupByBuilder(dataSource, dimensions, limitSpec, having,
            granularity == null ? Granularity.ALL : granularity, filter,
            aggregations, postAggregations, intervals, subtotalsSpec, context);
    }

    public GroupByBuilder filter(Filter filter) {
        return new GroupByBuilder(dataSource, dimensions, limitSpec, having, granularity, filter,
            aggregations, postAggregations, intervals, subtotalsSpec, context);
    }

    public GroupByBuilder aggregations(List<Aggregation> aggregations) {
        return new GroupByBuilder(dataSource, dimensions, limitSpec, having, granularity, filter,
            aggregations, postAggregations, intervals, subtotalsSpec, context);
    }

    public GroupByBuilder aggregations(Aggregation... aggregations) {
        return aggregations(Arrays.asList(aggregations));
    }

    public GroupByBuilder postAggregations(List<PostAggregation> postAggregations) {
        return new GroupByBuilder(dataSource, dimensions, limitSpec, having, granularity, filter,
            aggregations, postAggregations, intervals, subtotalsSpec, context);
    }

    public GroupByBuilder intervals(List<String> intervals) {
        return new GroupByBuilder(dataSource, dimensions, limitSpec, having, granularity, filter,
            aggregations, postAggregations, intervals, subtotalsSpec, context);
    }

    public GroupByBuilder intervals(String... intervals) {
        return intervals(Arrays.asList(intervals));
    }

    public GroupByBuilder subtotalsSpec(List<List<String>> subtotalsSpec) {
        return new GroupByBuilder(dataSource, dimensions, limitSpec, having, granularity, filter,
            aggregations, postAggregations, intervals, subtotalsSpec, context);
    }

    public GroupByBuilder context(Map<String, String> context) {
        return new GroupByBuilder(dataSource, dimensions, limitSpec, having, granularity, filter,
            aggregations, postAggregations, intervals, subtotalsSpec, context);
    }

    public GroupByBuilder addContext(String key, String value) {
        Map<String, String> merged = new LinkedHashMap<>(context);
        merged.put(key, value);
        return context(merged);
    }

    /**
     * @throws IllegalStateException if no interval was given
     */
    public GroupBy build() {
        if (intervals.isEmpty()) {
            throw new IllegalStateException("GroupBy query on " + dataSource + " has no intervals");
        }
        return new GroupBy(dataSource, dimensions, limitSpec, having, granularity, filter,
            aggregations, postAggregations, intervals, subtotalsSpec, context);
    }
}
