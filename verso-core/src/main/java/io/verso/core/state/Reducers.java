package io.verso.core.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Built-in reducers for the four {@link FieldShape}s.
///
/// The collection reducers return fresh unmodifiable lists and maps. {@link StateField}
/// freezes every reduced value before it is stored, so a stored value can never be
/// changed through a reference held by the node that produced it.
public final class Reducers {

    private Reducers() {}

    /// Overwrites the current value with the update.
    public static <V> Reducer<V, V> replace() {
        return (current, update) -> update;
    }

    /// Concatenates the update list onto the current list.
    public static <E> Reducer<List<E>, List<E>> appendList() {
        return (current, update) -> {
            List<E> merged = new ArrayList<>(sizeOf(current) + update.size());
            if (current != null) {
                merged.addAll(current);
            }
            merged.addAll(update);
            return Collections.unmodifiableList(merged);
        };
    }

    /// Appends a single element to the current list.
    public static <E> Reducer<List<E>, E> appendSingle() {
        return (current, update) -> {
            List<E> merged = new ArrayList<>(sizeOf(current) + 1);
            if (current != null) {
                merged.addAll(current);
            }
            merged.add(update);
            return Collections.unmodifiableList(merged);
        };
    }

    /// Shallow-merges the update into the current mapping; update keys win on collision.
    public static Reducer<Map<String, Object>, Map<String, Object>> mergeObject() {
        return (current, update) -> {
            Map<String, Object> merged = new LinkedHashMap<>();
            if (current != null) {
                merged.putAll(current);
            }
            merged.putAll(update);
            return Collections.unmodifiableMap(merged);
        };
    }

    /// Returns an unmodifiable shallow copy of lists and maps, other values unchanged.
    static Object freeze(Object value) {
        if (value instanceof List<?> list) {
            return Collections.unmodifiableList(new ArrayList<>(list));
        }
        if (value instanceof Map<?, ?> map) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(map));
        }
        return value;
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }
}
