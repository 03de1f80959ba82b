package com.druidio.query;

import com.druidio.query.definitions.Aggregation;
import com.druidio.query.definitions.Dimension;
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
 * Top {@code threshold} values of one dimension ranked by {@code metric}.
 */
public final class TopN implements Query {

    @JsonProperty("dataSource")
    private final DataSource dataSource;

    @JsonProperty("dimension")
    private final Dimension dimension;

    @JsonProperty("threshold")
    private final int threshold;

    @JsonProperty("metric")
    private final String metric;

    @JsonProperty("aggregations")
    private final List<Aggregation> aggregations;

    @JsonProperty("postAggregations")
    private final List<PostAggregation> postAggregations;

    @JsonProperty("intervals")
    private final List<String> intervals;

    @JsonProperty("granularity")
    private final Granularity granularity;

    @JsonProperty("filter")
    private final Filter filter;

    @JsonProperty("context")
    private final Map<String, String> context;

    @JsonCreator
    public TopN(@JsonProperty("dataSource") DataSource dataSource,
                @JsonProperty("dimension") Dimension dimension,
                @JsonProperty("threshold") int threshold,
                @JsonProperty("metric") String metric,
                @JsonProperty("aggregations") List<Aggregation> aggregations,
                @JsonProperty("postAggregations") List<PostAggregation> postAggregations,
                @JsonProperty("intervals") List<String> intervals,
                @JsonProperty("granularity") Granularity granularity,
                @JsonProperty("filter") Filter filter,
                @JsonProperty("context") Map<String, String> context) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.dimension = Objects.requireNonNull(dimension, "dimension");
        this.threshold = threshold;
        this.metric = Objects.requireNonNull(metric, "metric");
        this.aggregations = NullToEmpty.list(aggregations);
        this.postAggregations = NullToEmpty.list(postAggregations);
        this.intervals = NullToEmpty.list(intervals);
        this.granularity = granularity == null ? Granularity.ALL : granularity;
        this.filter = filter;
        this.context = NullToEmpty.map(context);
    }

    public TopN(DataSource dataSource, Dimension dimension, int threshold, String metric,
                List<Aggregation> aggregations, List<String> intervals, Granularity granularity) {
        this(dataSource, dimension, threshold, metric, aggregations, null, intervals, granularity, null, null);
    }

    @Override
    public DataSource getDataSource() {
        return dataSource;
    }

    public Dimension getDimension() {
        return dimension;
    }

    public int getThreshold() {
        return threshold;
    }

    public String getMetric() {
        return metric;
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

    public Granularity getGranularity() {
        return granularity;
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
        TopN that = (TopN) o;
        return threshold == that.threshold && dataSource.equals(that.dataSource)
            && dimension.equals(that.dimension) && metric.equals(that.metric)
            && aggregations.equals(that.aggregations) && postAggregations.equals(that.postAggregations)
            && intervals.equals(that.intervals) && granularity.equals(that.granularity)
            && Objects.equals(filter, that.filter) && context.equals(that.context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataSource, dimension, threshold, metric, aggregations, postAggregations,
            intervals, granularity, filter, context);
    }

    @Override
    public String toString() {
        return "TopN{" + dataSource + ", " + dimension + ", threshold=" + threshold + ", metric=" + metric + "}";
    }
}
