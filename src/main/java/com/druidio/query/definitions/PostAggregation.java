package com.druidio.query.definitions;

import com.druidio.serialization.NullToEmpty;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

/**
 * Named value computed from aggregation outputs after aggregation has finished.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = PostAggregation.Arithmetic.class, name = "arithmetic"),
    @JsonSubTypes.Type(value = PostAggregation.DoubleGreatest.class, name = "doubleGreatest"),
    @JsonSubTypes.Type(value = PostAggregation.LongGreatest.class, name = "longGreatest"),
    @JsonSubTypes.Type(value = PostAggregation.LongLeast.class, name = "longLeast"),
    @JsonSubTypes.Type(value = PostAggregation.DoubleLeast.class, name = "doubleLeast"),
    @JsonSubTypes.Type(value = PostAggregation.Javascript.class, name = "javascript")
})
public interface PostAggregation {

    String getName();

    static PostAggregation arithmetic(String name, String fn, List<PostAggregator> fields) {
        return new Arithmetic(name, fn, fields, null);
    }

    /**
     * Applies {@code fn} (one of {@code + - * / quotient}) left to right over {@code fields}.
     */
    final class Arithmetic implements PostAggregation {
        @JsonProperty("name")
        private final String name;
        @JsonProperty("fn")
        private final String fn;
        @JsonProperty("fields")
        private final List<PostAggregator> fields;
        @JsonProperty("ordering")
        private final String ordering;

        @JsonCreator
        public Arithmetic(@JsonProperty("name") String name,
                          @JsonProperty("fn") String fn,
                          @JsonProperty("fields") List<PostAggregator> fields,
                          @JsonProperty("ordering") String ordering) {
            this.name = Objects.requireNonNull(name, "name");
            this.fn = Objects.requireNonNull(fn, "fn");
            this.fields = NullToEmpty.list(fields);
            this.ordering = ordering;
        }

        @Override
        public String getName() {
            return name;
        }

        public String getFn() {
            return fn;
        }

        public List<PostAggregator> getFields() {
            return fields;
        }

        public String getOrdering() {
            return ordering;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Arithmetic that = (Arithmetic) o;
            return name.equals(that.name) && fn.equals(that.fn) && fields.equals(that.fields)
                && Objects.equals(ordering, that.ordering);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, fn, fields, ordering);
        }
    }

    /**
     * Base of the greatest/least combinators; the concrete class picks the function.
     */
    abstract class Extremum implements PostAggregation {
        @JsonProperty("name")
        private final String name;
        @JsonProperty("fields")
        private final List<PostAggregation> fields;

        Extremum(String name, List<PostAggregation> fields) {
            this.name = Objects.requireNonNull(name, "name");
            this.fields = NullToEmpty.list(fields);
        }

        @Override
        public String getName() {
            return name;
        }

        public List<PostAggregation> getFields() {
            return fields;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Extremum that = (Extremum) o;
            return name.equals(that.name) && fields.equals(that.fields);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getClass(), name, fields);
        }
    }

    final class DoubleGreatest extends Extremum {
        @JsonCreator
        public DoubleGreatest(@JsonProperty("name") String name,
                              @JsonProperty("fields") List<PostAggregation> fields) {
            super(name, fields);
        }
    }

    final class LongGreatest extends Extremum {
        @JsonCreator
        public LongGreatest(@JsonProperty("name") String name,
                            @JsonProperty("fields") List<PostAggregation> fields) {
            super(name, fields);
        }
    }

    final class LongLeast extends Extremum {
        @JsonCreator
        public LongLeast(@JsonProperty("name") String name,
                         @JsonProperty("fields") List<PostAggregation> fields) {
            super(name, fields);
        }
    }

    final class DoubleLeast extends Extremum {
        @JsonCreator
        public DoubleLeast(@JsonProperty("name") String name,
                           @JsonProperty("fields") List<PostAggregation> fields) {
            super(name, fields);
        }
    }

    final class Javascript implements PostAggregation {
        @JsonProperty("name")
        private final String name;
        @JsonProperty("fieldNames")
        private final List<String> fieldNames;
        @JsonProperty("function")
        private final String function;

        @JsonCreator
        public Javascript(@JsonProperty("name") String name,
                          @JsonProperty("fieldNames") List<String> fieldNames,
                          @JsonProperty("function") String function) {
            this.name = Objects.requireNonNull(name, "name");
            this.fieldNames = NullToEmpty.list(fieldNames);
            this.function = Objects.requireNonNull(function, "function");
        }

        @Override
        public String getName() {
            return name;
        }

        public List<String> getFieldNames() {
            return fieldNames;
        }

        public String getFunction() {
            return function;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Javascript that = (Javascript) o;
            return name.equals(that.name) && fieldNames.equals(that.fieldNames) && function.equals(that.function);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, fieldNames, function);
        }
    }
}
