package com.druidio.query.definitions;

import com.druidio.serialization.NullToEmpty;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Boolean predicate over rows. {@link And}, {@link Or} and {@link Not} nest other filters.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Filter.Selector.class, name = "selector"),
    @JsonSubTypes.Type(value = Filter.ColumnComparison.class, name = "columnComparison"),
    @JsonSubTypes.Type(value = Filter.Regex.class, name = "regex"),
    @JsonSubTypes.Type(value = Filter.And.class, name = "and"),
    @JsonSubTypes.Type(value = Filter.Or.class, name = "or"),
    @JsonSubTypes.Type(value = Filter.Not.class, name = "not"),
    @JsonSubTypes.Type(value = Filter.Javascript.class, name = "javascript"),
    @JsonSubTypes.Type(value = Filter.Search.class, name = "search"),
    @JsonSubTypes.Type(value = Filter.In.class, name = "in"),
    @JsonSubTypes.Type(value = Filter.Like.class, name = "like"),
    @JsonSubTypes.Type(value = Filter.Bound.class, name = "bound"),
    @JsonSubTypes.Type(value = Filter.Interval.class, name = "interval"),
    @JsonSubTypes.Type(value = Filter.True.class, name = "true")
})
public interface Filter {

    static Filter selector(String dimension, String value) {
        return new Selector(dimension, value, null);
    }

    static Filter columnComparison(List<String> dimensions) {
        return new ColumnComparison(dimensions);
    }

    static Filter regex(String dimension, String pattern) {
        return new Regex(dimension, pattern);
    }

    static Filter javascript(String dimension, String function) {
        return new Javascript(dimension, function);
    }

    static Filter in(String dimension, List<String> values) {
        return new In(dimension, values);
    }

    static Filter like(String dimension, String pattern) {
        return new Like(dimension, pattern, null, null);
    }

    static Filter and(Filter... fields) {
        return new And(Arrays.asList(fields));
    }

    static Filter or(Filter... fields) {
        return new Or(Arrays.asList(fields));
    }

    static Filter not(Filter field) {
        return new Not(field);
    }

    static Filter alwaysTrue() {
        return new True();
    }

    final class Selector implements Filter {
        @JsonProperty("dimension")
        private final String dimension;
        @JsonProperty("value")
        private final String value;
        @JsonProperty("extractionFn")
        private final ExtractionFn extractionFn;

        @JsonCreator
        public Selector(@JsonProperty("dimension") String dimension,
                        @JsonProperty("value") String value,
                        @JsonProperty("extractionFn") ExtractionFn extractionFn) {
            this.dimension = Objects.requireNonNull(dimension, "dimension");
            this.value = value;
            this.extractionFn = extractionFn;
        }

        public String getDimension() {
            return dimension;
        }

        public String getValue() {
            return value;
        }

        public ExtractionFn getExtractionFn() {
            return extractionFn;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Selector that = (Selector) o;
            return dimension.equals(that.dimension) && Objects.equals(value, that.value)
                && Objects.equals(extractionFn, that.extractionFn);
        }

        @Override
        public int hashCode() {
            return Objects.hash(dimension, value, extractionFn);
        }
    }

    final class ColumnComparison implements Filter {
        @JsonProperty("dimensions")
        private final List<String> dimensions;

        @JsonCreator
        public ColumnComparison(@JsonProperty("dimensions") List<String> dimensions) {
            this.dimensions = NullToEmpty.list(dimensions);
        }

        public List<String> getDimensions() {
            return dimensions;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ColumnComparison && dimensions.equals(((ColumnComparison) o).dimensions);
        }

        @Override
        public int hashCode() {
            return dimensions.hashCode();
        }
    }

    final class Regex implements Filter {
        @JsonProperty("dimension")
        private final String dimension;
        @JsonProperty("pattern")
        private final String pattern;

        @JsonCreator
        public Regex(@JsonProperty("dimension") String dimension, @JsonProperty("pattern") String pattern) {
            this.dimension = Objects.requireNonNull(dimension, "dimension");
            this.pattern = Objects.requireNonNull(pattern, "pattern");
        }

        public String getDimension() {
            return dimension;
        }

        public String getPattern() {
            return pattern;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Regex that = (Regex) o;
            return dimension.equals(that.dimension) && pattern.equals(that.pattern);
        }

        @Override
        public int hashCode() {
            return Objects.hash(dimension, pattern);
        }
    }

    /**
     * Conjunction. An empty field list is passed through to the engine as is.
     */
    final class And implements Filter {
        @JsonProperty("fields")
        private final List<Filter> fields;

        @JsonCreator
        public And(@JsonProperty("fields") List<Filter> fields) {
            this.fields = NullToEmpty.list(fields);
        }

        public List<Filter> getFields() {
            return fields;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof And && fields.equals(((And) o).fields);
        }

        @Override
        public int hashCode() {
            return Objects.hash(And.class, fields);
        }
    }

    final class Or implements Filter {
        @JsonProperty("fields")
        private final List<Filter> fields;

        @JsonCreator
        public Or(@JsonProperty("fields") List<Filter> fields) {
            this.fields = NullToEmpty.list(fields);
        }

        public List<Filter> getFields() {
            return fields;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Or && fields.equals(((Or) o).fields);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Or.class, fields);
        }
    }

    final class Not implements Filter {
        @JsonProperty("field")
        private final Filter field;

        @JsonCreator
        public Not(@JsonProperty("field") Filter field) {
            this.field = Objects.requireNonNull(field, "field");
        }

        public Filter getField() {
            return field;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Not && field.equals(((Not) o).field);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Not.class, field);
        }
    }

    final class Javascript implements Filter {
        @JsonProperty("dimension")
        private final String dimension;
        @JsonProperty("function")
        private final String function;

        @JsonCreator
        public Javascript(@JsonProperty("dimension") String dimension,
                          @JsonProperty("function") String function) {
            this.dimension = Objects.requireNonNull(dimension, "dimension");
            this.function = Objects.requireNonNull(function, "function");
        }

        public String getDimension() {
            return dimension;
        }

        public String getFunction() {
            return function;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Javascript that = (Javascript) o;
            return dimension.equals(that.dimension) && function.equals(that.function);
        }

        @Override
        public int hashCode() {
            return Objects.hash(dimension, function);
        }
    }

    final class Search implements Filter {
        @JsonProperty("dimension")
        private final String dimension;
        @JsonProperty("query")
        private final SearchQuerySpec query;

        @JsonCreator
        public Search(@JsonProperty("dimension") String dimension,
                      @JsonProperty("query") SearchQuerySpec query) {
            this.dimension = Objects.requireNonNull(dimension, "dimension");
            this.query = Objects.requireNonNull(query, "query");
        }

        public String getDimension() {
            return dimension;
        }

        public SearchQuerySpec getQuery() {
            return query;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Search that = (Search) o;
            return dimension.equals(that.dimension) && query.equals(that.query);
        }

        @Override
        public int hashCode() {
            return Objects.hash(dimension, query);
        }
    }

    final class In implements Filter {
        @JsonProperty("dimension")
        private final String dimension;
        @JsonProperty("values")
        private final List<String> values;

        @JsonCreator
        public In(@JsonProperty("dimension") String dimension, @JsonProperty("values") List<String> values) {
            this.dimension = Objects.requireNonNull(dimension, "dimension");
            this.values = NullToEmpty.list(values);
        }

        public String getDimension() {
            return dimension;
        }

        public List<String> getValues() {
            return values;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            In that = (In) o;
            return dimension.equals(that.dimension) && values.equals(that.values);
        }

        @Override
        public int hashCode() {
            return Objects.hash(dimension, values);
        }
    }

    /**
     * SQL LIKE match; {@code %} and {@code _} are the wildcards, {@code escape} overrides the escape character.
     */
    final class Like implements Filter {
        @JsonProperty("dimension")
        private final String dimension;
        @JsonProperty("pattern")
        private final String pattern;
        @JsonProperty("escape")
        private final String escape;
        @JsonProperty("extractionFn")
        private final ExtractionFn extractionFn;

        @JsonCreator
        public Like(@JsonProperty("dimension") String dimension,
                    @JsonProperty("pattern") String pattern,
                    @JsonProperty("escape") String escape,
                    @JsonProperty("extractionFn") ExtractionFn extractionFn) {
            this.dimension = Objects.requireNonNull(dimension, "dimension");
            this.pattern = Objects.requireNonNull(pattern, "pattern");
            this.escape = escape;
            this.extractionFn = extractionFn;
        }

        public String getDimension() {
            return dimension;
        }

        public String getPattern() {
            return pattern;
        }

        public String getEscape() {
            return escape;
        }

        public ExtractionFn getExtractionFn() {
            return extractionFn;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Like that = (Like) o;
            return dimension.equals(that.dimension) && pattern.equals(that.pattern)
                && Objects.equals(escape, that.escape) && Objects.equals(extractionFn, that.extractionFn);
        }

        @Override
        public int hashCode() {
            return Objects.hash(dimension, pattern, escape, extractionFn);
        }
    }

    /**
     * Range match. Bounds are compared with {@code ordering}; a strict bound excludes the endpoint.
     */
    final class Bound implements Filter {
        @JsonProperty("dimension")
        private final String dimension;
        @JsonProperty("lower")
        private final String lower;
        @JsonProperty("upper")
        private final String upper;
        @JsonProperty("lowerStrict")
        private final boolean lowerStrict;
        @JsonProperty("upperStrict")
        private final boolean upperStrict;
        @JsonProperty("ordering")
        private final SortingOrder ordering;
        @JsonProperty("extractionFn")
        private final ExtractionFn extractionFn;

        @JsonCreator
        public Bound(@JsonProperty("dimension") String dimension,
                     @JsonProperty("lower") String lower,
                     @JsonProperty("upper") String upper,
                     @JsonProperty("lowerStrict") boolean lowerStrict,
                     @JsonProperty("upperStrict") boolean upperStrict,
                     @JsonProperty("ordering") SortingOrder ordering,
                     @JsonProperty("extractionFn") ExtractionFn extractionFn) {
            this.dimension = Objects.requireNonNull(dimension, "dimension");
            this.lower = lower;
            this.upper = upper;
            this.lowerStrict = lowerStrict;
            this.upperStrict = upperStrict;
            this.ordering = ordering == null ? SortingOrder.LEXICOGRAPHIC : ordering;
            this.extractionFn = extractionFn;
        }

        public String getDimension() {
            return dimension;
        }

        public String getLower() {
            return lower;
        }

        public String getUpper() {
            return upper;
        }

        public boolean isLowerStrict() {
            return lowerStrict;
        }

        public boolean isUpperStrict() {
            return upperStrict;
        }

        public SortingOrder getOrdering() {
            return ordering;
        }

        public ExtractionFn getExtractionFn() {
            return extractionFn;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Bound that = (Bound) o;
            return lowerStrict == that.lowerStrict && upperStrict == that.upperStrict
                && dimension.equals(that.dimension) && Objects.equals(lower, that.lower)
                && Objects.equals(upper, that.upper) && ordering == that.ordering
                && Objects.equals(extractionFn, that.extractionFn);
        }

        @Override
        public int hashCode() {
            return Objects.hash(dimension, lower, upper, lowerStrict, upperStrict, ordering, extractionFn);
        }
    }

    /**
     * Matches time values inside any of the ISO-8601 {@code intervals}.
     */
    final class Interval implements Filter {
        @JsonProperty("dimension")
        private final String dimension;
        @JsonProperty("intervals")
        private final List<String> intervals;
        @JsonProperty("extractionFn")
        private final ExtractionFn extractionFn;

        @JsonCreator
        public Interval(@JsonProperty("dimension") String dimension,
                        @JsonProperty("intervals") List<String> intervals,
                        @JsonProperty("extractionFn") ExtractionFn extractionFn) {
            this.dimension = Objects.requireNonNull(dimension, "dimension");
            this.intervals = NullToEmpty.list(intervals);
            this.extractionFn = extractionFn;
        }

        public String getDimension() {
            return dimension;
        }

        public List<String> getIntervals() {
            return intervals;
        }

        public ExtractionFn getExtractionFn() {
            return extractionFn;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Interval that = (Interval) o;
            return dimension.equals(that.dimension) && intervals.equals(that.intervals)
                && Objects.equals(extractionFn, that.extractionFn);
        }

        @Override
        public int hashCode() {
            return Objects.hash(dimension, intervals, extractionFn);
        }
    }

    final class True implements Filter {
        @Override
        public boolean equals(Object o) {
            return o instanceof True;
        }

        @Override
        public int hashCode() {
            return True.class.hashCode();
        }
    }
}
