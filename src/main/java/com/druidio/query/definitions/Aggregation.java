package com.druidio.query.definitions;

import com.druidio.serialization.NullToEmpty;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

/**
 * Reducer computed per result row. {@link #getName()} is the key the value is reported under.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Aggregation.Count.class, name = "count"),
    @JsonSubTypes.Type(value = Aggregation.LongSum.class, name = "longSum"),
    @JsonSubTypes.Type(value = Aggregation.DoubleSum.class, name = "doubleSum"),
    @JsonSubTypes.Type(value = Aggregation.FloatSum.class, name = "floatSum"),
    @JsonSubTypes.Type(value = Aggregation.LongMax.class, name = "longMax"),
    @JsonSubTypes.Type(value = Aggregation.DoubleMax.class, name = "doubleMax"),
    @JsonSubTypes.Type(value = Aggregation.FloatMax.class, name = "floatMax"),
    @JsonSubTypes.Type(value = Aggregation.LongMin.class, name = "longMin"),
    @JsonSubTypes.Type(value = Aggregation.DoubleMin.class, name = "doubleMin"),
    @JsonSubTypes.Type(value = Aggregation.FloatMin.class, name = "floatMin"),
    @JsonSubTypes.Type(value = Aggregation.LongFirst.class, name = "longFirst"),
    @JsonSubTypes.Type(value = Aggregation.DoubleFirst.class, name = "doubleFirst"),
    @JsonSubTypes.Type(value = Aggregation.FloatFirst.class, name = "floatFirst"),
    @JsonSubTypes.Type(value = Aggregation.LongLast.class, name = "longLast"),
    @JsonSubTypes.Type(value = Aggregation.DoubleLast.class, name = "doubleLast"),
    @JsonSubTypes.Type(value = Aggregation.FloatLast.class, name = "floatLast"),
    @JsonSubTypes.Type(value = Aggregation.DoubleAny.class, name = "doubleAny"),
    @JsonSubTypes.Type(value = Aggregation.FloatAny.class, name = "floatAny"),
    @JsonSubTypes.Type(value = Aggregation.LongAny.class, name = "longAny"),
    @JsonSubTypes.Type(value = Aggregation.StringAny.class, name = "stringAny"),
    @JsonSubTypes.Type(value = Aggregation.StringFirst.class, name = "stringFirst"),
    @JsonSubTypes.Type(value = Aggregation.StringLast.class, name = "stringLast"),
    @JsonSubTypes.Type(value = Aggregation.Javascript.class, name = "javascript"),
    @JsonSubTypes.Type(value = Aggregation.ThetaSketch.class, name = "thetaSketch"),
    @JsonSubTypes.Type(value = Aggregation.HllSketchBuild.class, name = "HLLSketchBuild"),
    @JsonSubTypes.Type(value = Aggregation.Cardinality.class, name = "cardinality"),
    @JsonSubTypes.Type(value = Aggregation.HyperUnique.class, name = "hyperUnique"),
    @JsonSubTypes.Type(value = Aggregation.Filtered.class, name = "filtered")
})
public interface Aggregation {

    String getName();

    static Aggregation count(String name) {
        return new Count(name);
    }

    static Aggregation longSum(String name, String fieldName) {
        return new LongSum(name, fieldName);
    }

    static Aggregation doubleSum(String name, String fieldName) {
        return new DoubleSum(name, fieldName);
    }

    static Aggregation floatSum(String name, String fieldName) {
        return new FloatSum(name, fieldName);
    }

    static Aggregation longMax(String name, String fieldName) {
        return new LongMax(name, fieldName);
    }

    static Aggregation doubleMax(String name, String fieldName) {
        return new DoubleMax(name, fieldName);
    }

    static Aggregation floatMax(String name, String fieldName) {
        return new FloatMax(name, fieldName);
    }

    static Aggregation longMin(String name, String fieldName) {
        return new LongMin(name, fieldName);
    }

    static Aggregation doubleMin(String name, String fieldName) {
        return new DoubleMin(name, fieldName);
    }

    static Aggregation floatMin(String name, String fieldName) {
        return new FloatMin(name, fieldName);
    }

    static Aggregation longFirst(String name, String fieldName) {
        return new LongFirst(name, fieldName);
    }

    static Aggregation doubleFirst(String name, String fieldName) {
        return new DoubleFirst(name, fieldName);
    }

    static Aggregation floatFirst(String name, String fieldName) {
        return new FloatFirst(name, fieldName);
    }

    static Aggregation longLast(String name, String fieldName) {
        return new LongLast(name, fieldName);
    }

    static Aggregation doubleLast(String name, String fieldName) {
        return new DoubleLast(name, fieldName);
    }

    static Aggregation floatLast(String name, String fieldName) {
        return new FloatLast(name, fieldName);
    }

    static Aggregation doubleAny(String name, String fieldName) {
        return new DoubleAny(name, fieldName);
    }

    static Aggregation floatAny(String name, String fieldName) {
        return new FloatAny(name, fieldName);
    }

    static Aggregation longAny(String name, String fieldName) {
        return new LongAny(name, fieldName);
    }

    static Aggregation stringAny(String name, String fieldName) {
        return new StringAny(name, fieldName);
    }

    static Aggregation stringFirst(String name, String fieldName, Integer maxStringBytes) {
        return new StringFirst(name, fieldName, maxStringBytes);
    }

    static Aggregation stringLast(String name, String fieldName, Integer maxStringBytes) {
        return new StringLast(name, fieldName, maxStringBytes);
    }

    static Aggregation filtered(Filter filter, Aggregation aggregator) {
        return new Filtered(null, filter, aggregator);
    }

    /**
     * Base of the aggregations that read a single column.
     */
    abstract class FieldAggregation implements Aggregation {
        @JsonProperty("name")
        private final String name;
        @JsonProperty("fieldName")
        private final String fieldName;

        FieldAggregation(String name, String fieldName) {
            this.name = Objects.requireNonNull(name, "name");
            this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
        }

        @Override
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
            FieldAggregation that = (FieldAggregation) o;
            return name.equals(that.name) && fieldName.equals(that.fieldName);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getClass(), name, fieldName);
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "{" + name + " <- " + fieldName + "}";
        }
    }

    final class Count implements Aggregation {
        @JsonProperty("name")
        private final String name;

        @JsonCreator
        public Count(@JsonProperty("name") String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Count && name.equals(((Count) o).name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Count.class, name);
        }
    }

    final class LongSum extends FieldAggregation {
        @JsonCreator
        public LongSum(@JsonProperty("name") String name, @JsonProperty("fieldName") String fieldName) {
            super(name, fieldName);
        }
    }

    final class DoubleSum extends FieldAggregation {
        @JsonCreator
        public DoubleSum(@JsonProperty("name") String name, @JsonProperty("fieldName") String fieldName) {
            super(name, fieldName);
        }
    }

    final class FloatSum extends FieldAggregation {
        @JsonCreator
        public FloatSum(@JsonProperty("name") String name, @JsonProperty("fieldName") String fieldName) {
            super(name, fieldName);
        }
    }

    final class LongMax extends FieldAggregation {
        @JsonCreator
        public LongMax(@JsonProperty("name") String name, @JsonProperty("fieldName") String fieldName) {
            super(name, fieldName);
        }
    }

    final class DoubleMax extends FieldAggregation {
        @JsonCreator
        public DoubleMax(@JsonProperty("name") String name, @JsonProperty("fieldName") String fieldName) {
            super(name, fieldName);
        }
    }

    final class FloatMax extends FieldAggregation {
        @JsonCreator
        public FloatMax(@JsonProperty("name") String name, @JsonProperty("fieldName") String fieldName) {
            super(name, fieldName);
        }
    }

    final class LongMin extends FieldAggregation {
        @JsonCreator
        public LongMin(@JsonProperty("name") String name, @JsonProperty("fieldName") String fieldName) {
            super(name, fieldName);
        }
    }

    final class DoubleMin extends FieldAggregation {
        @JsonCreator
        public DoubleMin(@JsonProperty("name") String name, @JsonProperty("fieldName") String fieldName) {
            super(name, fieldName);
        }
    }

    final class FloatMin extends FieldAggregation {
        @JsonCreator
        public FloatMin(@JsonProperty("name") String name, @JsonProperty("fieldName") String fieldName) {
            super(name, fieldName);
        }
    }

    final class LongFirst extends FieldAggregation {
        @JsonCreator
        public LongFirst(@JsonProperty("name") String name, @JsonProperty("fieldName") String fieldName) {
            super(name, fieldName);
        }
    }

    final class DoubleFirst extends FieldAggregation {
        @JsonCreator
        public DoubleFirst(@JsonProperty("name") String name, @JsonProperty("fieldName") String fieldName) {
            super(name, fieldName);
        }
    }

    final class FloatFirst extends FieldAggregation {
        @JsonCreator
        public FloatFirst(@JsonProperty("name") String name, @JsonProperty("fieldName") String fieldName) {
            super(name, fieldName);
        }
    }

    final class LongLast extends FieldAggregation {
        @JsonCreator
        public LongLast(@JsonProperty("name") String name, @JsonProperty("fieldName") String fieldName) {
            super(name, fieldName);
        }
    }

    final class DoubleLast extends FieldAggregation {
        @JsonCreator
        public DoubleLast(@JsonProperty("name") String name, @JsonProperty("fieldName") String fieldName) {
            super(name, fieldName);
        }
    }

    final class FloatLast extends FieldAggregation {
        @JsonCreator
        public FloatLast(@JsonProperty("name") String name, @JsonProperty("fieldName") String fieldName) {
            super(name, fieldName);
        }
    }

    final class DoubleAny extends FieldAggregation {
        @JsonCreator
        public DoubleAny(@JsonProperty("name") String name, @JsonProperty("fieldName") String fieldName) {
            super(name, fieldName);
        }
    }

    final class FloatAny extends FieldAggregation {
        @JsonCreator
        public FloatAny(@JsonProperty("name") String name, @JsonProperty("fieldName") String fieldName) {
            super(name, fieldName);
        }
    }

    final class LongAny extends FieldAggregation {
        @JsonCreator
        public LongAny(@JsonProperty("name") String name, @JsonProperty("fieldName") String fieldName) {
            super(name, fieldName);
        }
    }

    final class StringAny extends FieldAggregation {
        @JsonCreator
        public StringAny(@JsonProperty("name") String name, @JsonProperty("fieldName") String fieldName) {
            super(name, fieldName);
        }
    }

    final class StringFirst extends FieldAggregation {
        @JsonProperty("maxStringBytes")
        private final Integer maxStringBytes;

        @JsonCreator
        public StringFirst(@JsonProperty("name") String name,
                           @JsonProperty("fieldName") String fieldName,
                           @JsonProperty("maxStringBytes") Integer maxStringBytes) {
            super(name, fieldName);
            this.maxStringBytes = maxStringBytes;
        }

        public Integer getMaxStringBytes() {
            return maxStringBytes;
        }

        @Override
        public boolean equals(Object o) {
            return super.equals(o) && Objects.equals(maxStringBytes, ((StringFirst) o).maxStringBytes);
        }

        @Override
        public int hashCode() {
            return Objects.hash(super.hashCode(), maxStringBytes);
        }
    }

    final class StringLast extends FieldAggregation {
        @JsonProperty("maxStringBytes")
        private final Integer maxStringBytes;

        @JsonCreator
        public StringLast(@JsonProperty("name") String name,
                          @JsonProperty("fieldName") String fieldName,
                          @JsonProperty("maxStringBytes") Integer maxStringBytes) {
            super(name, fieldName);
            this.maxStringBytes = maxStringBytes;
        }

        public Integer getMaxStringBytes() {
            return maxStringBytes;
        }

        @Override
        public boolean equals(Object o) {
            return super.equals(o) && Objects.equals(maxStringBytes, ((StringLast) o).maxStringBytes);
        }

        @Override
        public int hashCode() {
            return Objects.hash(super.hashCode(), maxStringBytes);
        }
    }

    /**
     * Aggregation written as three JavaScript functions over {@code fieldNames}.
     */
    final class Javascript implements Aggregation {
        @JsonProperty("name")
        private final String name;
        @JsonProperty("fieldNames")
        private final List<String> fieldNames;
        @JsonProperty("fnAggregate")
        private final String fnAggregate;
        @JsonProperty("fnCombine")
        private final String fnCombine;
        @JsonProperty("fnReset")
        private final String fnReset;

        @JsonCreator
        public Javascript(@JsonProperty("name") String name,
                          @JsonProperty("fieldNames") List<String> fieldNames,
                          @JsonProperty("fnAggregate") String fnAggregate,
                          @JsonProperty("fnCombine") String fnCombine,
                          @JsonProperty("fnReset") String fnReset) {
            this.name = Objects.requireNonNull(name, "name");
            this.fieldNames = NullToEmpty.list(fieldNames);
            this.fnAggregate = fnAggregate;
            this.fnCombine = fnCombine;
            this.fnReset = fnReset;
        }

        @Override
        public String getName() {
            return name;
        }

        public List<String> getFieldNames() {
            return fieldNames;
        }

        public String getFnAggregate() {
            return fnAggregate;
        }

        public String getFnCombine() {
            return fnCombine;
        }

        public String getFnReset() {
            return fnReset;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Javascript that = (Javascript) o;
            return name.equals(that.name) && fieldNames.equals(that.fieldNames)
                && Objects.equals(fnAggregate, that.fnAggregate) && Objects.equals(fnCombine, that.fnCombine)
                && Objects.equals(fnReset, that.fnReset);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, fieldNames, fnAggregate, fnCombine, fnReset);
        }
    }

    final class ThetaSketch extends FieldAggregation {
        @JsonProperty("isInputThetaSketch")
        private final boolean inputThetaSketch;
        @JsonProperty("size")
        private final Integer size;

        @JsonCreator
        public ThetaSketch(@JsonProperty("name") String name,
                           @JsonProperty("fieldName") String fieldName,
                           @JsonProperty("isInputThetaSketch") boolean inputThetaSketch,
                           @JsonProperty("size") Integer size) {
            super(name, fieldName);
            this.inputThetaSketch = inputThetaSketch;
            this.size = size;
        }

        public boolean isInputThetaSketch() {
            return inputThetaSketch;
        }

        public Integer getSize() {
            return size;
        }

        @Override
        public boolean equals(Object o) {
            if (!super.equals(o)) return false;
            ThetaSketch that = (ThetaSketch) o;
            return inputThetaSketch == that.inputThetaSketch && Objects.equals(size, that.size);
        }

        @Override
        public int hashCode() {
            return Objects.hash(super.hashCode(), inputThetaSketch, size);
        }
    }

    /**
     * DataSketches HLL build aggregator; {@code lgK} is log2 of the sketch size.
     */
    final class HllSketchBuild extends FieldAggregation {
        @JsonProperty("lgK")
        private final Integer lgK;
        @JsonProperty("tgtHllType")
        private final HllType tgtHllType;
        @JsonProperty("round")
        private final boolean round;

        @JsonCreator
        public HllSketchBuild(@JsonProperty("name") String name,
                              @JsonProperty("fieldName") String fieldName,
                              @JsonProperty("lgK") Integer lgK,
                              @JsonProperty("tgtHllType") HllType tgtHllType,
                              @JsonProperty("round") boolean round) {
            super(name, fieldName);
            this.lgK = lgK;
            this.tgtHllType = tgtHllType;
            this.round = round;
        }

        public Integer getLgK() {
            return lgK;
        }

        public HllType getTgtHllType() {
            return tgtHllType;
        }

        public boolean isRound() {
            return round;
        }

        @Override
        public boolean equals(Object o) {
            if (!super.equals(o)) return false;
            HllSketchBuild that = (HllSketchBuild) o;
            return round == that.round && Objects.equals(lgK, that.lgK) && tgtHllType == that.tgtHllType;
        }

        @Override
        public int hashCode() {
            return Objects.hash(super.hashCode(), lgK, tgtHllType, round);
        }
    }

    final class Cardinality implements Aggregation {
        @JsonProperty("name")
        private final String name;
        @JsonProperty("fields")
        private final List<String> fields;
        @JsonProperty("byRow")
        private final boolean byRow;
        @JsonProperty("round")
        private final boolean round;

        @JsonCreator
        public Cardinality(@JsonProperty("name") String name,
                           @JsonProperty("fields") List<String> fields,
                           @JsonProperty("byRow") boolean byRow,
                           @JsonProperty("round") boolean round) {
            this.name = Objects.requireNonNull(name, "name");
            this.fields = NullToEmpty.list(fields);
            this.byRow = byRow;
            this.round = round;
        }

        @Override
        public String getName() {
            return name;
        }

        public List<String> getFields() {
            return fields;
        }

        public boolean isByRow() {
            return byRow;
        }

        public boolean isRound() {
            return round;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Cardinality that = (Cardinality) o;
            return byRow == that.byRow && round == that.round && name.equals(that.name) && fields.equals(that.fields);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, fields, byRow, round);
        }
    }

    final class HyperUnique extends FieldAggregation {
        @JsonProperty("isInputHyperUnique")
        private final boolean inputHyperUnique;
        @JsonProperty("round")
        private final boolean round;

        @JsonCreator
        public HyperUnique(@JsonProperty("name") String name,
                           @JsonProperty("fieldName") String fieldName,
                           @JsonProperty("isInputHyperUnique") boolean inputHyperUnique,
                           @JsonProperty("round") boolean round) {
            super(name, fieldName);
            this.inputHyperUnique = inputHyperUnique;
            this.round = round;
        }

        public boolean isInputHyperUnique() {
            return inputHyperUnique;
        }

        public boolean isRound() {
            return round;
        }

        @Override
        public boolean equals(Object o) {
            if (!super.equals(o)) return false;
            HyperUnique that = (HyperUnique) o;
            return inputHyperUnique == that.inputHyperUnique && round == that.round;
        }

        @Override
        public int hashCode() {
            return Objects.hash(super.hashCode(), inputHyperUnique, round);
        }
    }

    /**
     * Applies {@code aggregator} only to rows matching {@code filter}.
     * Reported under the wrapped aggregator's name unless one is given.
     */
    final class Filtered implements Aggregation {
        @JsonProperty("name")
        private final String name;
        @JsonProperty("filter")
        private final Filter filter;
        @JsonProperty("aggregator")
        private final Aggregation aggregator;

        @JsonCreator
        public Filtered(@JsonProperty("name") String name,
                        @JsonProperty("filter") Filter filter,
                        @JsonProperty("aggregator") Aggregation aggregator) {
            this.filter = Objects.requireNonNull(filter, "filter");
            this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
            this.name = name == null ? aggregator.getName() : name;
        }

        @Override
        public String getName() {
            return name;
        }

        public Filter getFilter() {
            return filter;
        }

        public Aggregation getAggregator() {
            return aggregator;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Filtered that = (Filtered) o;
            return name.equals(that.name) && filter.equals(that.filter) && aggregator.equals(that.aggregator);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, filter, aggregator);
        }
    }
}
