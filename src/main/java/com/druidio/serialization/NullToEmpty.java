package com.druidio.serialization;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes collection-typed values so that a missing or JSON {@code null}
 * collection is indistinguishable from an empty one.
 *
 * The broker is known to answer {@code null} where an empty array is meant,
 * so every model constructor routes its collections through these helpers.
 */
public final class NullToEmpty {

    private NullToEmpty() {
    }

    /**
     * Immutable copy of the list, or an empty list for {@code null}.
     */
    public static <T> List<T> list(List<T> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * Immutable copy of a list of lists; inner {@code null} lists become empty.
     */
    public static <T> List<List<T>> nestedList(List<List<T>> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        List<List<T>> copy = new ArrayList<>(values.size());
        for (List<T> inner : values) {
            copy.add(list(inner));
        }
        return Collections.unmodifiableList(copy);
    }

    /**
     * Immutable, insertion-ordered copy of the map, or an empty map for {@code null}.
     */
    public static <K, V> Map<K, V> map(Map<K, V> values) {
        if (values == null || values.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
