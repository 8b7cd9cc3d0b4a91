package com.architekt.core.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Normalization helpers for free-form string collections such as tags and id sets.
 */
public final class Tags {

    private Tags() {
        // Utility class
    }

    /**
     * Trims every value, drops null or blank values and removes duplicates while keeping
     * first-seen order.
     *
     * @param values raw values, may be null
     * @return unmodifiable normalized list (never null)
     */
    public static List<String> normalize(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptyList();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                unique.add(trimmed);
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(unique));
    }

    /**
     * Splits a comma or newline separated string and normalizes the parts.
     *
     * @param raw raw user input, may be null
     * @return unmodifiable normalized list (never null)
     */
    public static List<String> split(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return normalize(List.of(raw.split("[,\\n]")));
    }

    /**
     * Checks whether {@code values} contains every entry of {@code required}.
     *
     * @param values values to check
     * @param required values that must all be present
     * @return true when all required values are present
     */
    public static boolean containsAll(Collection<String> values, Collection<String> required) {
        if (required == null || required.isEmpty()) {
            return true;
        }
        return values != null && values.containsAll(required);
    }
}
