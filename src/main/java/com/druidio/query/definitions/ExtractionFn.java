package com.druidio.query.definitions;

import com.druidio.serialization.NullToEmpty;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

/**
 * Transform applied to a dimension's raw value before it is grouped, filtered or returned.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ExtractionFn.Regex.class, name = "regex"),
    @JsonSubTypes.Type(value = ExtractionFn.Partial.class, name = "partial"),
    @JsonSubTypes.Type(value = ExtractionFn.Substring.class, name = "substring"),
    @JsonSubTypes.Type(value = ExtractionFn.Strlen.class, name = "strlen"),
    @JsonSubTypes.Type(value = ExtractionFn.TimeFormat.class, name = "timeFormat"),
    @JsonSubTypes.Type(value = ExtractionFn.Time.class, name = "time"),
    @JsonSubTypes.Type(value = ExtractionFn.Javascript.class, name = "javascript"),
    @JsonSubTypes.Type(value = ExtractionFn.RegisteredLookup.class, name = "registeredLookup"),
    @JsonSubTypes.Type(value = ExtractionFn.Lookup.class, name = "lookup"),
    @JsonSubTypes.Type(value = ExtractionFn.Cascade.class, name = "cascade"),
    @JsonSubTypes.Type(value = ExtractionFn.StringFormat.class, name = "stringFormat"),
    @JsonSubTypes.Type(value = ExtractionFn.Upper.class, name = "upper"),
    @JsonSubTypes.Type(value = ExtractionFn.Lower.class, name = "lower"),
    @JsonSubTypes.Type(value = ExtractionFn.Bucket.class, name = "bucket")
})
public interface ExtractionFn {

    /**
     * Returns the {@code index}-th capture group of the first match of {@code expr}.
     */
    final class Regex implements ExtractionFn {
        @JsonProperty("expr")
        private final String expr;
        @JsonProperty("index")
        private final int index;
        @JsonProperty("replaceMissingValue")
        private final boolean replaceMissingValue;
        @JsonProperty("replaceMissingValueWith")
        private final String replaceMissingValueWith;

        @JsonCreator
        public Regex(@JsonProperty("expr") String expr,
                     @JsonProperty("index") int index,
                     @JsonProperty("replaceMissingValue") boolean replaceMissingValue,
                     @JsonProperty("replaceMissingValueWith") String replaceMissingValueWith) {
            this.expr = Objects.requireNonNull(expr, "expr");
            this.index = index;
            this.replaceMissingValue = replaceMissingValue;
            this.replaceMissingValueWith = replaceMissingValueWith;
        }

        public String getExpr() {
            return expr;
        }

        public int getIndex() {
            return index;
        }

        public boolean isReplaceMissingValue() {
            return replaceMissingValue;
        }

        public String getReplaceMissingValueWith() {
            return replaceMissingValueWith;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Regex that = (Regex) o;
            return index == that.index && replaceMissingValue == that.replaceMissingValue
                && expr.equals(that.expr) && Objects.equals(replaceMissingValueWith, that.replaceMissingValueWith);
        }

        @Override
        public int hashCode() {
            return Objects.hash(expr, index, replaceMissingValue, replaceMissingValueWith);
        }
    }

    /**
     * Passes the value through when {@code expr} matches, null otherwise.
     */
    final class Partial implements ExtractionFn {
        @JsonProperty("expr")
        private final String expr;

        @JsonCreator
        public Partial(@JsonProperty("expr") String expr) {
            this.expr = Objects.requireNonNull(expr, "expr");
        }

        public String getExpr() {
            return expr;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Partial && expr.equals(((Partial) o).expr);
        }

        @Override
        public int hashCode() {
            return expr.hashCode();
        }
    }

    final class Substring implements ExtractionFn {
        @JsonProperty("index")
        private final int index;
        @JsonProperty("length")
        private final Integer length;

        @JsonCreator
        public Substring(@JsonProperty("index") int index, @JsonProperty("length") Integer length) {
            this.index = index;
            this.length = length;
        }

        public int getIndex() {
            return index;
        }

        public Integer getLength() {
            return length;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Substring that = (Substring) o;
            return index == that.index && Objects.equals(length, that.length);
        }

        @Override
        public int hashCode() {
            return Objects.hash(index, length);
        }
    }

    final class Strlen implements ExtractionFn {
        @Override
        public boolean equals(Object o) {
            return o instanceof Strlen;
        }

        @Override
        public int hashCode() {
            return Strlen.class.hashCode();
        }
    }

    /**
     * Formats a timestamp value with a Joda pattern, optionally truncated to a granularity.
     */
    final class TimeFormat implements ExtractionFn {
        @JsonProperty("format")
        private final String format;
        @JsonProperty("timeZone")
        private final String timeZone;
        @JsonProperty("locale")
        private final String locale;
        @JsonProperty("granularity")
        private final Granularity granularity;
        @JsonProperty("asMillis")
        private final boolean asMillis;

        @JsonCreator
        public TimeFormat(@JsonProperty("format") String format,
                          @JsonProperty("timeZone") String timeZone,
                          @JsonProperty("locale") String locale,
                          @JsonProperty("granularity") Granularity granularity,
                          @JsonProperty("asMillis") boolean asMillis) {
            this.format = format;
            this.timeZone = timeZone;
            this.locale = locale;
            this.granularity = granularity;
            this.asMillis = asMillis;
        }

        public String getFormat() {
            return format;
        }

        public String getTimeZone() {
            return timeZone;
        }

        public String getLocale() {
            return locale;
        }

        public Granularity getGranularity() {
            return granularity;
        }

        public boolean isAsMillis() {
            return asMillis;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            TimeFormat that = (TimeFormat) o;
            return asMillis == that.asMillis && Objects.equals(format, that.format)
                && Objects.equals(timeZone, that.timeZone) && Objects.equals(locale, that.locale)
                && Objects.equals(granularity, that.granularity);
        }

        @Override
        public int hashCode() {
            return Objects.hash(format, timeZone, locale, granularity, asMillis);
        }
    }

    /**
     * Re-parses a string timestamp from {@code timeFormat} into {@code resultFormat}.
     */
    final class Time implements ExtractionFn {
        @JsonProperty("timeFormat")
        private final String timeFormat;
        @JsonProperty("resultFormat")
        private final String resultFormat;
        @JsonProperty("joda")
        private final boolean joda;

        @JsonCreator
        public Time(@JsonProperty("timeFormat") String timeFormat,
                    @JsonProperty("resultFormat") String resultFormat,
                    @JsonProperty("joda") boolean joda) {
            this.timeFormat = timeFormat;
            this.resultFormat = resultFormat;
            this.joda = joda;
        }

        public String getTimeFormat() {
            return timeFormat;
        }

        public String getResultFormat() {
            return resultFormat;
        }

        public boolean isJoda() {
            return joda;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Time that = (Time) o;
            return joda == that.joda && Objects.equals(timeFormat, that.timeFormat)
                && Objects.equals(resultFormat, that.resultFormat);
        }

        @Override
        public int hashCode() {
            return Objects.hash(timeFormat, resultFormat, joda);
        }
    }

    final class Javascript implements ExtractionFn {
        @JsonProperty("function")
        private final String function;

        @JsonCreator
        public Javascript(@JsonProperty("function") String function) {
            this.function = Objects.requireNonNull(function, "function");
        }

        public String getFunction() {
            return function;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Javascript && function.equals(((Javascript) o).function);
        }

        @Override
        public int hashCode() {
            return function.hashCode();
        }
    }

    /**
     * Maps values through a lookup registered on the cluster by name.
     */
    final class RegisteredLookup implements ExtractionFn {
        @JsonProperty("lookup")
        private final String lookup;
        @JsonProperty("retainMissingValue")
        private final boolean retainMissingValue;

        @JsonCreator
        public RegisteredLookup(@JsonProperty("lookup") String lookup,
                                @JsonProperty("retainMissingValue") boolean retainMissingValue) {
            this.lookup = Objects.requireNonNull(lookup, "lookup");
            this.retainMissingValue = retainMissingValue;
        }

        public String getLookup() {
            return lookup;
        }

        public boolean isRetainMissingValue() {
            return retainMissingValue;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            RegisteredLookup that = (RegisteredLookup) o;
            return retainMissingValue == that.retainMissingValue && lookup.equals(that.lookup);
        }

        @Override
        public int hashCode() {
            return Objects.hash(lookup, retainMissingValue);
        }
    }

    /**
     * Maps values through an inline {@link MapLookup}.
     */
    final class Lookup implements ExtractionFn {
        @JsonProperty("lookup")
        private final MapLookup lookup;
        @JsonProperty("retainMissingValue")
        private final boolean retainMissingValue;
        @JsonProperty("injective")
        private final boolean injective;
        @JsonProperty("replaceMissingValueWith")
        private final String replaceMissingValueWith;

        @JsonCreator
        public Lookup(@JsonProperty("lookup") MapLookup lookup,
                      @JsonProperty("retainMissingValue") boolean retainMissingValue,
                      @JsonProperty("injective") boolean injective,
                      @JsonProperty("replaceMissingValueWith") String replaceMissingValueWith) {
            this.lookup = Objects.requireNonNull(lookup, "lookup");
            this.retainMissingValue = retainMissingValue;
            this.injective = injective;
            this.replaceMissingValueWith = replaceMissingValueWith;
        }

        public MapLookup getLookup() {
            return lookup;
        }

        public boolean isRetainMissingValue() {
            return retainMissingValue;
        }

        public boolean isInjective() {
            return injective;
        }

        public String getReplaceMissingValueWith() {
            return replaceMissingValueWith;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Lookup that = (Lookup) o;
            return retainMissingValue == that.retainMissingValue && injective == that.injective
                && lookup.equals(that.lookup) && Objects.equals(replaceMissingValueWith, that.replaceMissingValueWith);
        }

        @Override
        public int hashCode() {
            return Objects.hash(lookup, retainMissingValue, injective, replaceMissingValueWith);
        }
    }

    /**
     * Applies each function in order, feeding one's output into the next.
     */
    final class Cascade implements ExtractionFn {
        @JsonProperty("extractionFns")
        private final List<ExtractionFn> extractionFns;

        @JsonCreator
        public Cascade(@JsonProperty("extractionFns") List<ExtractionFn> extractionFns) {
            this.extractionFns = NullToEmpty.list(extractionFns);
        }

        public List<ExtractionFn> getExtractionFns() {
            return extractionFns;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Cascade && extractionFns.equals(((Cascade) o).extractionFns);
        }

        @Override
        public int hashCode() {
            return extractionFns.hashCode();
        }
    }

    final class StringFormat implements ExtractionFn {
        @JsonProperty("format")
        private final String format;
        @JsonProperty("nullHandling")
        private final NullHandling nullHandling;

        @JsonCreator
        public StringFormat(@JsonProperty("format") String format,
                            @JsonProperty("nullHandling") NullHandling nullHandling) {
            this.format = Objects.requireNonNull(format, "format");
            this.nullHandling = nullHandling;
        }

        public String getFormat() {
            return format;
        }

        public NullHandling getNullHandling() {
            return nullHandling;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            StringFormat that = (StringFormat) o;
            return format.equals(that.format) && nullHandling == that.nullHandling;
        }

        @Override
        public int hashCode() {
            return Objects.hash(format, nullHandling);
        }
    }

    final class Upper implements ExtractionFn {
        @JsonProperty("locale")
        private final String locale;

        @JsonCreator
        public Upper(@JsonProperty("locale") String locale) {
            this.locale = locale;
        }

        public String getLocale() {
            return locale;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Upper && Objects.equals(locale, ((Upper) o).locale);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Upper.class, locale);
        }
    }

    final class Lower implements ExtractionFn {
        @JsonProperty("locale")
        private final String locale;

        @JsonCreator
        public Lower(@JsonProperty("locale") String locale) {
            this.locale = locale;
        }

        public String getLocale() {
            return locale;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Lower && Objects.equals(locale, ((Lower) o).locale);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Lower.class, locale);
        }
    }

    /**
     * Buckets numeric values into ranges of {@code size} starting at {@code offset}.
     */
    final class Bucket implements ExtractionFn {
        @JsonProperty("size")
        private final long size;
        @JsonProperty("offset")
        private final long offset;

        @JsonCreator
        public Bucket(@JsonProperty("size") long size, @JsonProperty("offset") long offset) {
            this.size = size;
            this.offset = offset;
        }

        public long getSize() {
            return size;
        }

        public long getOffset() {
            return offset;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Bucket that = (Bucket) o;
            return size == that.size && offset == that.offset;
        }

        @Override
        public int hashCode() {
            return Objects.hash(size, offset);
        }
    }
}
