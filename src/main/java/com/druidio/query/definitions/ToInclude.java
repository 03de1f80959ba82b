package com.druidio.query.definitions;

import com.druidio.serialization.NullToEmpty;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

/**
 * Columns a segment metadata query reports on.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ToInclude.All.class, name = "all"),
    @JsonSubTypes.Type(value = ToInclude.None.class, name = "none"),
    @JsonSubTypes.Type(value = ToInclude.ColumnList.class, name = "list")
})
public interface ToInclude {

    static ToInclude all() {
        return new All();
    }

    static ToInclude none() {
        return new None();
    }

    static ToInclude columns(List<String> columns) {
        return new ColumnList(columns);
    }

    final class All implements ToInclude {
        @Override
        public boolean equals(Object o) {
            return o instanceof All;
        }

        @Override
        public int hashCode() {
            return All.class.hashCode();
        }
    }

    final class None implements ToInclude {
        @Override
        public boolean equals(Object o) {
            return o instanceof None;
        }

        @Override
        public int hashCode() {
            return None.class.hashCode();
        }
    }

    final class ColumnList implements ToInclude {
        @JsonProperty("columns")
        private final List<String> columns;

        @JsonCreator
        public ColumnList(@JsonProperty("columns") List<String> columns) {
            this.columns = NullToEmpty.list(columns);
        }

        public List<String> getColumns() {
            return columns;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ColumnList && columns.equals(((ColumnList) o).columns);
        }

        @Override
        public int hashCode() {
            return Objects.hash(ColumnList.class, columns);
        }
    }
}
