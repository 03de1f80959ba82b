package com.druidio.query.response;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class TimestampSpec {

    @JsonProperty("column")
    private final String column;

    @JsonProperty("format")
    private final String format;

    @JsonProperty("missingValue")
    private final String missingValue;

    @JsonCreator
    public TimestampSpec(@JsonProperty("column") String column,
                         @JsonProperty("format") String format,
                         @JsonProperty("missingValue") String missingValue) {
        this.column = column;
        this.format = format;
        this.missingValue = missingValue;
    }

    public String getColumn() {
        return column;
    }

    public String getFormat() {
        return format;
    }

    public String getMissingValue() {
        return missingValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimestampSpec that = (TimestampSpec) o;
        return Objects.equals(column, that.column) && Objects.equals(format, that.format)
            && Objects.equals(missingValue, that.missingValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, format, missingValue);
    }
}
