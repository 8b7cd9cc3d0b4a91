package com.architekt.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Value type of an {@link Attribute}.
 */
public enum AttributeType {
    STRING,
    NUMBER,
    INTEGER,
    BOOLEAN,
    OBJECT,
    ARRAY,
    DATE;

    /**
     * Returns the lower-case JSON name of this type.
     *
     * @return JSON name (e.g., "string")
     */
    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a type name case-insensitively.
     *
     * @param value type name, may be null or blank
     * @return matching type, or null when the value is blank
     * @throws IllegalArgumentException if the value names no known type
     */
    @JsonCreator
    public static AttributeType fromJson(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (AttributeType type : values()) {
            if (type.jsonName().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown attribute type: " + value);
    }
}
