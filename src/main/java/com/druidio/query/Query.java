package com.druidio.query;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A native query, tagged on the wire by {@code queryType}.
 *
 * Any query can also be the input of another one through {@link DataSource#query(Query)}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "queryType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TopN.class, name = "topN"),
    @JsonSubTypes.Type(value = GroupBy.class, name = "groupBy"),
    @JsonSubTypes.Type(value = Scan.class, name = "scan"),
    @JsonSubTypes.Type(value = Search.class, name = "search"),
    @JsonSubTypes.Type(value = TimeBoundary.class, name = "timeBoundary"),
    @JsonSubTypes.Type(value = SegmentMetadata.class, name = "segmentMetadata"),
    @JsonSubTypes.Type(value = Timeseries.class, name = "timeseries"),
    @JsonSubTypes.Type(value = DataSourceMetadata.class, name = "dataSourceMetadata")
})
public interface Query {

    DataSource getDataSource();
}
