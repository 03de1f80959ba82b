package com.druidio.query.definitions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One sort key of a {@link LimitSpec}.
 */
public final class OrderByColumnSpec {

    @JsonProperty("dimension")
    private final String dimension;

    @JsonProperty("direction")
    private final Ordering direction;

    @JsonProperty("dimensionOrder")
    private final SortingOrder dimensionOrder;

    @JsonCreator
    public OrderByColumnSpec(@JsonProperty("dimension") String dimension,
                             @JsonProperty("direction") Ordering direction,
                             @JsonProperty("dimensionOrder") SortingOrder dimensionOrder) {
        this.dimension = Objects.requireNonNull(dimension, "dimension");
        this.direction = direction == null ? Ordering.ASCENDING : direction;
        this.dimensionOrder = dimensionOrder == null ? SortingOrder.LEXICOGRAPHIC : dimensionOrder;
    }

    public static OrderByColumnSpec of(String dimension, Ordering direction, SortingOrder dimensionOrder) {
        return new OrderByColumnSpec(dimension, direction, dimensionOrder);
    }

    public String getDimension() {
        return dimension;
    }

    public Ordering getDirection() {
        return direction;
    }

    public SortingOrder getDimensionOrder() {
        return dimensionOrder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrderByColumnSpec that = (OrderByColumnSpec) o;
        return dimension.equals(that.dimension) && direction == that.direction
            && dimensionOrder == that.dimensionOrder;
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimension, direction, dimensionOrder);
    }
}
