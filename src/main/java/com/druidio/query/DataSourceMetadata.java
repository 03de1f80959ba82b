package com.druidio.query;

import com.druidio.serialization.NullToEmpty;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * Timestamp of the latest ingested event of a data source.
 */
public final class DataSourceMetadata implements Query {

    @JsonProperty("dataSource")
    private final DataSource dataSource;

    @JsonProperty("context")
    private final Map<String, String> context;

    @JsonCreator
    public DataSourceMetadata(@JsonProperty("dataSource") DataSource dataSource,
                              @JsonProperty("context") Map<String, String> context) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.context = NullToEmpty.map(context);
    }

    public DataSourceMetadata(DataSource dataSource) {
        this(dataSource, null);
    }

    @Override
    public DataSource getDataSource() {
        return dataSource;
    }

    public Map<String, String> getContext() {
        return context;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DataSourceMetadata that = (DataSourceMetadata) o;
        return dataSource.equals(that.dataSource) && context.equals(that.context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataSource, context);
    }

    @Override
    public String toString() {
        return "DataSourceMetadata{" + dataSource + "}";
    }
}
