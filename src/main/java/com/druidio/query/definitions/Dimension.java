package com.druidio.query.definitions;

import com.druidio.serialization.NullToEmpty;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Grouping or output column of a query.
 *
 * The filtered forms wrap a delegate dimension and only let through the values
 * they accept. Both lookup forms share the {@code "lookup"} tag on the wire; see
 * {@link LookupDimension}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Dimension.Default.class, name = "default"),
    @JsonSubTypes.Type(value = Dimension.Extraction.class, name = "extraction"),
    @JsonSubTypes.Type(value = Dimension.ListFiltered.class, name = "listFiltered"),
    @JsonSubTypes.Type(value = Dimension.RegexFiltered.class, name = "regexFiltered"),
    @JsonSubTypes.Type(value = Dimension.PrefixFiltered.class, name = "prefixFiltered"),
    @JsonSubTypes.Type(value = Dimension.LookupDimension.class, name = "lookup")
})
public interface Dimension {

    /**
     * Raw column passthrough named after the column itself, typed as a string.
     */
    static Dimension of(String dimension) {
        return new Default(dimension, dimension, OutputType.STRING);
    }

    static Dimension regex(Dimension delegate, String pattern) {
        return new RegexFiltered(delegate, pattern);
    }

    static Dimension prefix(Dimension delegate, String prefix) {
        return new PrefixFiltered(delegate, prefix);
    }

    static Dimension list(Dimension delegate, List<String> values, boolean whitelist) {
        return new ListFiltered(delegate, values, whitelist);
    }

    final class Default implements Dimension {
        @JsonProperty("dimension")
        private final String dimension;
        @JsonProperty("outputName")
        private final String outputName;
        @JsonProperty("outputType")
        private final OutputType outputType;

        @JsonCreator
        public Default(@JsonProperty("dimension") String dimension,
                       @JsonProperty("outputName") String outputName,
                       @JsonProperty("outputType") OutputType outputType) {
            this.dimension = Objects.requireNonNull(dimension, "dimension");
            this.outputName = outputName == null ? dimension : outputName;
            this.outputType = outputType == null ? OutputType.STRING : outputType;
        }

        public String getDimension() {
            return dimension;
        }

        public String getOutputName() {
            return outputName;
        }

        public OutputType getOutputType() {
            return outputType;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Default that = (Default) o;
            return dimension.equals(that.dimension) && outputName.equals(that.outputName)
                && outputType == that.outputType;
        }

        @Override
        public int hashCode() {
            return Objects.hash(dimension, outputName, outputType);
        }

        @Override
        public String toString() {
            return "Default{" + dimension + " as " + outputName + ":" + outputType + "}";
        }
    }

    final class Extraction implements Dimension {
        @JsonProperty("dimension")
        private final String dimension;
        @JsonProperty("outputName")
        private final String outputName;
        @JsonProperty("outputType")
        private final OutputType outputType;
        @JsonProperty("extractionFn")
        private final ExtractionFn extractionFn;

        @JsonCreator
        public Extraction(@JsonProperty("dimension") String dimension,
                          @JsonProperty("outputName") String outputName,
                          @JsonProperty("outputType") OutputType outputType,
                          @JsonProperty("extractionFn") ExtractionFn extractionFn) {
            this.dimension = Objects.requireNonNull(dimension, "dimension");
            this.outputName = outputName == null ? dimension : outputName;
            this.outputType = outputType == null ? OutputType.STRING : outputType;
            this.extractionFn = Objects.requireNonNull(extractionFn, "extractionFn");
        }

        public String getDimension() {
            return dimension;
        }

        public String getOutputName() {
            return outputName;
        }

        public OutputType getOutputType() {
            return outputType;
        }

        public ExtractionFn getExtractionFn() {
            return extractionFn;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Extraction that = (Extraction) o;
            return dimension.equals(that.dimension) && outputName.equals(that.outputName)
                && outputType == that.outputType && extractionFn.equals(that.extractionFn);
        }

        @Override
        public int hashCode() {
            return Objects.hash(dimension, outputName, outputType, extractionFn);
        }
    }

    /**
     * Keeps ({@code isWhitelist}) or drops the listed values of the delegate.
     */
    final class ListFiltered implements Dimension {
        @JsonProperty("delegate")
        private final Dimension delegate;
        @JsonProperty("values")
        private final List<String> values;
        @JsonProperty("isWhitelist")
        private final boolean whitelist;

        @JsonCreator
        public ListFiltered(@JsonProperty("delegate") Dimension delegate,
                            @JsonProperty("values") List<String> values,
                            @JsonProperty("isWhitelist") boolean whitelist) {
            this.delegate = Objects.requireNonNull(delegate, "delegate");
            this.values = NullToEmpty.list(values);
            this.whitelist = whitelist;
        }

        public Dimension getDelegate() {
            return delegate;
        }

        public List<String> getValues() {
            return values;
        }

        public boolean isWhitelist() {
            return whitelist;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ListFiltered that = (ListFiltered) o;
            return whitelist == that.whitelist && delegate.equals(that.delegate) && values.equals(that.values);
        }

        @Override
        public int hashCode() {
            return Objects.hash(delegate, values, whitelist);
        }
    }

    final class RegexFiltered implements Dimension {
        @JsonProperty("delegate")
        private final Dimension delegate;
        @JsonProperty("pattern")
        private final String pattern;

        @JsonCreator
        public RegexFiltered(@JsonProperty("delegate") Dimension delegate,
                             @JsonProperty("pattern") String pattern) {
            this.delegate = Objects.requireNonNull(delegate, "delegate");
            this.pattern = Objects.requireNonNull(pattern, "pattern");
        }

        public Dimension getDelegate() {
            return delegate;
        }

        public String getPattern() {
            return pattern;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            RegexFiltered that = (RegexFiltered) o;
            return delegate.equals(that.delegate) && pattern.equals(that.pattern);
        }

        @Override
        public int hashCode() {
            return Objects.hash(delegate, pattern);
        }
    }

    final class PrefixFiltered implements Dimension {
        @JsonProperty("delegate")
        private final Dimension delegate;
        @JsonProperty("prefix")
        private final String prefix;

        @JsonCreator
        public PrefixFiltered(@JsonProperty("delegate") Dimension delegate,
                              @JsonProperty("prefix") String prefix) {
            this.delegate = Objects.requireNonNull(delegate, "delegate");
            this.prefix = Objects.requireNonNull(prefix, "prefix");
        }

        public Dimension getDelegate() {
            return delegate;
        }

        public String getPrefix() {
            return prefix;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            PrefixFiltered that = (PrefixFiltered) o;
            return delegate.equals(that.delegate) && prefix.equals(that.prefix);
        }

        @Override
        public int hashCode() {
            return Objects.hash(delegate, prefix);
        }
    }

    /**
     * Common parent of the two {@code "lookup"} dimensions.
     *
     * A registered lookup is referenced by {@code name}; a map lookup carries its
     * table inline. The decoder tells them apart by the presence of {@code name}.
     */
    @JsonDeserialize(using = LookupDimensionDeserializer.class)
    abstract class LookupDimension implements Dimension {
        @JsonProperty("dimension")
        private final String dimension;
        @JsonProperty("outputName")
        private final String outputName;

        LookupDimension(String dimension, String outputName) {
            this.dimension = Objects.requireNonNull(dimension, "dimension");
            this.outputName = outputName == null ? dimension : outputName;
        }

        public String getDimension() {
            return dimension;
        }

        public String getOutputName() {
            return outputName;
        }
    }

    @JsonTypeName("lookup")
    final class LookupMap extends LookupDimension {
        @JsonProperty("replaceMissingValueWith")
        private final String replaceMissingValueWith;
        @JsonProperty("retainMissingValue")
        private final boolean retainMissingValue;
        @JsonProperty("lookup")
        private final MapLookup lookup;

        public LookupMap(String dimension, String outputName, String replaceMissingValueWith,
                         boolean retainMissingValue, MapLookup lookup) {
            super(dimension, outputName);
            this.replaceMissingValueWith = replaceMissingValueWith;
            this.retainMissingValue = retainMissingValue;
            this.lookup = Objects.requireNonNull(lookup, "lookup");
        }

        public String getReplaceMissingValueWith() {
            return replaceMissingValueWith;
        }

        public boolean isRetainMissingValue() {
            return retainMissingValue;
        }

        public MapLookup getLookup() {
            return lookup;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            LookupMap that = (LookupMap) o;
            return retainMissingValue == that.retainMissingValue
                && getDimension().equals(that.getDimension()) && getOutputName().equals(that.getOutputName())
                && Objects.equals(replaceMissingValueWith, that.replaceMissingValueWith)
                && lookup.equals(that.lookup);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getDimension(), getOutputName(), replaceMissingValueWith, retainMissingValue, lookup);
        }
    }

    @JsonTypeName("lookup")
    final class Lookup extends LookupDimension {
        @JsonProperty("name")
        private final String name;

        public Lookup(String dimension, String outputName, String name) {
            super(dimension, outputName);
            this.name = Objects.requireNonNull(name, "name");
        }

        public String getName() {
            return name;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Lookup that = (Lookup) o;
            return getDimension().equals(that.getDimension()) && getOutputName().equals(that.getOutputName())
                && name.equals(that.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getDimension(), getOutputName(), name);
        }
    }

    class LookupDimensionDeserializer extends StdDeserializer<LookupDimension> {

        public LookupDimensionDeserializer() {
            super(LookupDimension.class);
        }

        @Override
        public LookupDimension deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = ctxt.readTree(p);
            String dimension = text(node, "dimension");
            if (dimension == null) {
                return ctxt.reportInputMismatch(this, "lookup dimension without 'dimension'");
            }
            String outputName = text(node, "outputName");
            if (node.hasNonNull("name")) {
                return new Lookup(dimension, outputName, node.get("name").asText());
            }
            JsonNode lookup = node.get("lookup");
            if (lookup == null || lookup.isNull()) {
                return ctxt.reportInputMismatch(this, "lookup dimension needs either 'name' or 'lookup'");
            }
            return new LookupMap(dimension, outputName,
                text(node, "replaceMissingValueWith"),
                node.path("retainMissingValue").asBoolean(false),
                ctxt.readTreeAsValue(lookup, MapLookup.class));
        }

        private static String text(JsonNode node, String field) {
            JsonNode value = node.get(field);
            return value == null || value.isNull() ? null : value.asText();
        }
    }
}
