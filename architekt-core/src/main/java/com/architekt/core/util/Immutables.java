package com.architekt.core.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Unmodifiable copies used by the model records so that a loaded aggregate can never be
 * mutated in place.
 */
public final class Immutables {

    private Immutables() {
        // Utility class
    }

    /**
     * Copies a list, dropping null elements.
     *
     * @param values source list, may be null
     * @param <T> element type
     * @return unmodifiable copy (never null)
     */
    public static <T> List<T> list(List<T> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptyList();
        }
        return values.stream().filter(Objects::nonNull).toList();
    }

    /**
     * Copies a map keeping its iteration order, dropping null keys and values.
     *
     * @param values source map, may be null
     * @param <V> value type
     * @return unmodifiable insertion-ordered copy (never null)
     */
    public static <V> Map<String, V> orderedMap(Map<String, V> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, V> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Returns a copy of {@code values} with {@code key} bound to {@code value}.
     *
     * @param values source map
     * @param key key to put
     * @param value value to put
     * @param <V> value type
     * @return unmodifiable insertion-ordered copy
     */
    public static <V> Map<String, V> with(Map<String, V> values, String key, V value) {
        Map<String, V> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Returns a copy of {@code values} without the given keys.
     *
     * @param values source map
     * @param keys keys to drop
     * @param <V> value type
     * @return unmodifiable insertion-ordered copy
     */
    public static <V> Map<String, V> without(Map<String, V> values, Iterable<String> keys) {
        Map<String, V> copy = new LinkedHashMap<>(values);
        keys.forEach(copy::remove);
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Trims a string, mapping blank input to null.
     *
     * @param value raw value
     * @return trimmed value or null when blank
     */
    public static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Checks whether a string is null or contains only whitespace.
     *
     * @param value value to check
     * @return true if blank
     */
    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
