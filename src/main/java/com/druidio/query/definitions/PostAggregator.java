package com.druidio.query.definitions;

import com.druidio.query.JsonAny;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;

/**
 * Operand of an arithmetic post-aggregation: an aggregation output or a constant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = PostAggregator.FieldAccess.class, name = "fieldAccess"),
    @JsonSubTypes.Type(value = PostAggregator.FinalizingFieldAccess.class, name = "finalizingFieldAccess"),
    @JsonSubTypes.Type(value = PostAggregator.Constant.class, name = "constant"),
    @JsonSubTypes.Type(value = PostAggregator.HyperUniqueCardinality.class, name = "hyperUniqueCardinality")
})
public interface PostAggregator {

    static PostAggregator fieldAccess(String name, String fieldName) {
        return new FieldAccess(name, fieldName);
    }

    static PostAggregator finalizingFieldAccess(String name, String fieldName) {
        return new FinalizingFieldAccess(name, fieldName);
    }

    static PostAggregator constant(String name, JsonAny value) {
        return new Constant(name, value);
    }

    static PostAggregator hyperUniqueCardinality(String fieldName) {
        return new HyperUniqueCardinality(fieldName);
    }

    final class FieldAccess implements PostAggregator {
        @JsonProperty("name")
        private final String name;
        @JsonProperty("fieldName")
        private final String fieldName;

        @JsonCreator
        public FieldAccess(@JsonProperty("name") String name, @JsonProperty("fieldName") String fieldName) {
            this.name = name;
            this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
        }

        public String getName() {
            return name;
        }

        public String getFieldName() {
            return fieldName;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            FieldAccess that = (FieldAccess) o;
            return Objects.equals(name, that.name) && fieldName.equals(that.fieldName);
        }

        @Override
        public int hashCode() {
            return Objects.hash(FieldAccess.class, name, fieldName);
        }
    }

    /**
     * Like {@link FieldAccess}, but reads the finalized value of complex aggregations such as sketches.
     */
    final class FinalizingFieldAccess implements PostAggregator {
        @JsonProperty("name")
        private final String name;
        @JsonProperty("fieldName")
        private final String fieldName;

        @JsonCreator
        public FinalizingFieldAccess(@JsonProperty("name") String name,
                                     @JsonProperty("fieldName") String fieldName) {
            this.name = name;
            this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
        }

        public String getName() {
            return name;
        }

        public String getFieldName() {
            return fieldName;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            FinalizingFieldAccess that = (FinalizingFieldAccess) o;
            return Objects.equals(name, that.name) && fieldName.equals(that.fieldName);
        }

        @Override
        public int hashCode() {
            return Objects.hash(FinalizingFieldAccess.class, name, fieldName);
        }
    }

    final class Constant implements PostAggregator {
        @JsonProperty("name")
        private final String name;
        @JsonProperty("value")
        private final JsonAny value;

        @JsonCreator
        public Constant(@JsonProperty("name") String name, @JsonProperty("value") JsonAny value) {
            this.name = name;
            this.value = Objects.requireNonNull(value, "value");
        }

        public String getName() {
            return name;
        }

        public JsonAny getValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Constant that = (Constant) o;
            return Objects.equals(name, that.name) && value.equals(that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, value);
        }
    }

    final class HyperUniqueCardinality implements PostAggregator {
        @JsonProperty("fieldName")
        private final String fieldName;

        @JsonCreator
        public HyperUniqueCardinality(@JsonProperty("fieldName") String fieldName) {
            this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
        }

        public String getFieldName() {
            return fieldName;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof HyperUniqueCardinality && fieldName.equals(((HyperUniqueCardinality) o).fieldName);
        }

        @Override
        public int hashCode() {
            return fieldName.hashCode();
        }
    }
}
