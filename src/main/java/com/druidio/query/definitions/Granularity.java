package com.druidio.query.definitions;

import com.druidio.serialization.TaggedOrUntaggedDeserializer;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Time bucketing applied to a query.
 *
 * Simple granularities are written as bare names ({@code "day"}); a duration
 * granularity is written as {@code {"type": "duration", "duration": millis}}.
 */
@JsonDeserialize(using = Granularity.Deserializer.class)
public final class Granularity {

    public static final Granularity ALL = new Granularity("all", null);
    public static final Granularity NONE = new Granularity("none", null);
    public static final Granularity SECOND = new Granularity("second", null);
    public static final Granularity MINUTE = new Granularity("minute", null);
    public static final Granularity FIFTEEN_MINUTE = new Granularity("fifteen_minute", null);
    public static final Granularity THIRTY_MINUTE = new Granularity("thirty_minute", null);
    public static final Granularity HOUR = new Granularity("hour", null);
    public static final Granularity DAY = new Granularity("day", null);
    public static final Granularity WEEK = new Granularity("week", null);
    public static final Granularity MONTH = new Granularity("month", null);
    public static final Granularity QUARTER = new Granularity("quarter", null);
    public static final Granularity YEAR = new Granularity("year", null);

    private static final String DURATION = "duration";

    private static final Granularity[] SIMPLE = {
        ALL, NONE, SECOND, MINUTE, FIFTEEN_MINUTE, THIRTY_MINUTE, HOUR, DAY, WEEK, MONTH, QUARTER, YEAR
    };

    private final String name;
    private final Long durationMillis;

    private Granularity(String name, Long durationMillis) {
        this.name = name;
        this.durationMillis = durationMillis;
    }

    /**
     * Fixed-length buckets of the given size.
     */
    public static Granularity duration(long millis) {
        if (millis <= 0) {
            throw new IllegalArgumentException("Duration granularity must be positive: " + millis);
        }
        return new Granularity(DURATION, millis);
    }

    /**
     * Look up a simple granularity by its wire name, case-insensitively.
     */
    public static Granularity fromValue(String value) {
        for (Granularity granularity : SIMPLE) {
            if (granularity.name.equalsIgnoreCase(value)) {
                return granularity;
            }
        }
        throw new IllegalArgumentException("Unknown Granularity value: " + value);
    }

    public String getName() {
        return name;
    }

    public boolean isDuration() {
        return durationMillis != null;
    }

    /**
     * @return bucket size in milliseconds, or {@code null} for simple granularities
     */
    public Long getDurationMillis() {
        return durationMillis;
    }

    @JsonValue
    public Object toJson() {
        if (durationMillis == null) {
            return name;
        }
        Map<String, Object> json = new LinkedHashMap<>();
        json.put(TaggedOrUntaggedDeserializer.TYPE_FIELD, DURATION);
        json.put(DURATION, durationMillis);
        return json;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Granularity that = (Granularity) o;
        return name.equals(that.name) && Objects.equals(durationMillis, that.durationMillis);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, durationMillis);
    }

    @Override
    public String toString() {
        return durationMillis == null ? name : DURATION + "(" + durationMillis + "ms)";
    }

    public static class Deserializer extends TaggedOrUntaggedDeserializer<Granularity> {

        public Deserializer() {
            super(Granularity.class);
        }

        @Override
        protected Granularity fromName(String name) {
            return fromValue(name);
        }

        @Override
        protected Granularity fromObject(String type, JsonNode node, DeserializationContext ctxt) throws IOException {
            if (!DURATION.equals(type.toLowerCase(Locale.ROOT))) {
                return fromName(type);
            }
            JsonNode millis = node.get(DURATION);
            if (millis == null || !millis.canConvertToLong()) {
                return ctxt.reportInputMismatch(this, "Duration granularity requires a numeric `%s` field", DURATION);
            }
            return duration(millis.asLong());
        }
    }
}
