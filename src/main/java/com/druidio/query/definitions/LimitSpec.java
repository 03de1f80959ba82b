package com.druidio.query.definitions;

import com.druidio.serialization.NullToEmpty;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;
import java.util.Objects;

/**
 * Sorting and limiting of group-by results, {@code {"type": "default", ...}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type", defaultImpl = LimitSpec.class)
@JsonTypeName("default")
public final class LimitSpec {

    @JsonProperty("limit")
    private final Integer limit;

    @JsonProperty("offset")
    private final Integer offset;

    @JsonProperty("columns")
    private final List<OrderByColumnSpec> columns;

    @JsonCreator
    public LimitSpec(@JsonProperty("limit") Integer limit,
                     @JsonProperty("offset") Integer offset,
                     @JsonProperty("columns") List<OrderByColumnSpec> columns) {
        this.limit = limit;
        this.offset = offset;
        this.columns = NullToEmpty.list(columns);
    }

    public LimitSpec(int limit, List<OrderByColumnSpec> columns) {
        this(limit, null, columns);
    }

    public Integer getLimit() {
        return limit;
    }

    public Integer getOffset() {
        return offset;
    }

    public List<OrderByColumnSpec> getColumns() {
        return columns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LimitSpec that = (LimitSpec) o;
        return Objects.equals(limit, that.limit) && Objects.equals(offset, that.offset)
            && columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(limit, offset, columns);
    }
}
