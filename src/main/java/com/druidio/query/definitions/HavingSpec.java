package com.druidio.query.definitions;

import com.druidio.query.JsonAny;
import com.druidio.query.JsonNumber;
import com.druidio.serialization.NullToEmpty;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Filter applied to grouped rows after aggregation.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = HavingSpec.FilterHaving.class, name = "filter"),
    @JsonSubTypes.Type(value = HavingSpec.GreaterThan.class, name = "greaterThan"),
    @JsonSubTypes.Type(value = HavingSpec.EqualTo.class, name = "equalTo"),
    @JsonSubTypes.Type(value = HavingSpec.LessThan.class, name = "lessThan"),
    @JsonSubTypes.Type(value = HavingSpec.DimSelector.class, name = "dimSelector"),
    @JsonSubTypes.Type(value = HavingSpec.And.class, name = "and"),
    @JsonSubTypes.Type(value = HavingSpec.Or.class, name = "or"),
    @JsonSubTypes.Type(value = HavingSpec.Not.class, name = "not")
})
public interface HavingSpec {

    static HavingSpec filter(Filter filter) {
        return new FilterHaving(filter);
    }

    static HavingSpec greaterThan(String aggregation, JsonNumber value) {
        return new GreaterThan(aggregation, value);
    }

    static HavingSpec equalTo(String aggregation, JsonNumber value) {
        return new EqualTo(aggregation, value);
    }

    static HavingSpec lessThan(String aggregation, JsonNumber value) {
        return new LessThan(aggregation, value);
    }

    static HavingSpec and(HavingSpec... specs) {
        return new And(Arrays.asList(specs));
    }

    static HavingSpec or(HavingSpec... specs) {
        return new Or(Arrays.asList(specs));
    }

    static HavingSpec not(HavingSpec spec) {
        return new Not(spec);
    }

    final class FilterHaving implements HavingSpec {
        @JsonProperty("filter")
        private final Filter filter;

        @JsonCreator
        public FilterHaving(@JsonProperty("filter") Filter filter) {
            this.filter = Objects.requireNonNull(filter, "filter");
        }

        public Filter getFilter() {
            return filter;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof FilterHaving && filter.equals(((FilterHaving) o).filter);
        }

        @Override
        public int hashCode() {
            return filter.hashCode();
        }
    }

    /**
     * Base of the numeric comparisons against an aggregation output.
     */
    abstract class Comparison implements HavingSpec {
        @JsonProperty("aggregation")
        private final String aggregation;
        @JsonProperty("value")
        private final JsonNumber value;

        Comparison(String aggregation, JsonNumber value) {
            this.aggregation = Objects.requireNonNull(aggregation, "aggregation");
            this.value = Objects.requireNonNull(value, "value");
        }

        public String getAggregation() {
            return aggregation;
        }

        public JsonNumber getValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Comparison that = (Comparison) o;
            return aggregation.equals(that.aggregation) && value.equals(that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getClass(), aggregation, value);
        }
    }

    final class GreaterThan extends Comparison {
        @JsonCreator
        public GreaterThan(@JsonProperty("aggregation") String aggregation, @JsonProperty("value") JsonNumber value) {
            super(aggregation, value);
        }
    }

    final class EqualTo extends Comparison {
        @JsonCreator
        public EqualTo(@JsonProperty("aggregation") String aggregation, @JsonProperty("value") JsonNumber value) {
            super(aggregation, value);
        }
    }

    final class LessThan extends Comparison {
        @JsonCreator
        public LessThan(@JsonProperty("aggregation") String aggregation, @JsonProperty("value") JsonNumber value) {
            super(aggregation, value);
        }
    }

    final class DimSelector implements HavingSpec {
        @JsonProperty("dimension")
        private final String dimension;
        @JsonProperty("value")
        private final JsonAny value;

        @JsonCreator
        public DimSelector(@JsonProperty("dimension") String dimension, @JsonProperty("value") JsonAny value) {
            this.dimension = Objects.requireNonNull(dimension, "dimension");
            this.value = value;
        }

        public String getDimension() {
            return dimension;
        }

        public JsonAny getValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            DimSelector that = (DimSelector) o;
            return dimension.equals(that.dimension) && Objects.equals(value, that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(dimension, value);
        }
    }

    final class And implements HavingSpec {
        @JsonProperty("havingSpecs")
        private final List<HavingSpec> havingSpecs;

        @JsonCreator
        public And(@JsonProperty("havingSpecs") List<HavingSpec> havingSpecs) {
            this.havingSpecs = NullToEmpty.list(havingSpecs);
        }

        public List<HavingSpec> getHavingSpecs() {
            return havingSpecs;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof And && havingSpecs.equals(((And) o).havingSpecs);
        }

        @Override
        public int hashCode() {
            return Objects.hash(And.class, havingSpecs);
        }
    }

    final class Or implements HavingSpec {
        @JsonProperty("havingSpecs")
        private final List<HavingSpec> havingSpecs;

        @JsonCreator
        public Or(@JsonProperty("havingSpecs") List<HavingSpec> havingSpecs) {
            this.havingSpecs = NullToEmpty.list(havingSpecs);
        }

        public List<HavingSpec> getHavingSpecs() {
            return havingSpecs;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Or && havingSpecs.equals(((Or) o).havingSpecs);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Or.class, havingSpecs);
        }
    }

    final class Not implements HavingSpec {
        @JsonProperty("havingSpec")
        private final HavingSpec havingSpec;

        @JsonCreator
        public Not(@JsonProperty("havingSpec") HavingSpec havingSpec) {
            this.havingSpec = Objects.requireNonNull(havingSpec, "havingSpec");
        }

        public HavingSpec getHavingSpec() {
            return havingSpec;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Not && havingSpec.equals(((Not) o).havingSpec);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Not.class, havingSpec);
        }
    }
}
