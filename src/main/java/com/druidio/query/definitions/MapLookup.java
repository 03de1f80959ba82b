package com.druidio.query.definitions;

import com.druidio.serialization.NullToEmpty;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.Map;
import java.util.Objects;

/**
 * Inline key/value lookup table, {@code {"type": "map", ...}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type", defaultImpl = MapLookup.class)
@JsonTypeName("map")
public final class MapLookup {

    @JsonProperty("map")
    private final Map<String, String> map;

    @JsonProperty("isOneToOne")
    private final boolean oneToOne;

    @JsonCreator
    public MapLookup(@JsonProperty("map") Map<String, String> map,
                     @JsonProperty("isOneToOne") boolean oneToOne) {
        this.map = NullToEmpty.map(map);
        this.oneToOne = oneToOne;
    }

    public Map<String, String> getMap() {
        return map;
    }

    public boolean isOneToOne() {
        return oneToOne;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MapLookup that = (MapLookup) o;
        return oneToOne == that.oneToOne && map.equals(that.map);
    }

    @Override
    public int hashCode() {
        return Objects.hash(map, oneToOne);
    }
}
