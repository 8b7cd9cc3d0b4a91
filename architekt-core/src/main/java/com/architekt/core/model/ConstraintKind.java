package com.architekt.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discriminator of a {@link Constraint}. An attribute holds at most one constraint per kind.
 */
public enum ConstraintKind {
    REGEX("regex"),
    MIN_LENGTH("minLength"),
    MAX_LENGTH("maxLength"),
    MIN("min"),
    MAX("max"),
    ENUM("enum");

    private final String jsonName;

    ConstraintKind(String jsonName) {
        this.jsonName = jsonName;
    }

    @JsonValue
    public String jsonName() {
        return jsonName;
    }

    /**
     * Parses a kind from its JSON name (case-insensitive).
     *
     * @param value JSON name such as "minLength"
     * @return matching kind
     * @throws IllegalArgumentException if the value names no known kind
     */
    @JsonCreator
    public static ConstraintKind fromJson(String value) {
        if (value != null) {
            for (ConstraintKind kind : values()) {
                if (kind.jsonName.equalsIgnoreCase(value.trim())) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown constraint kind: " + value);
    }
}
