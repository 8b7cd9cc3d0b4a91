package com.architekt.core.model;

import com.architekt.core.util.Immutables;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

/**
 * Validation rule attached to an {@link Attribute}, discriminated by {@link ConstraintKind}.
 *
 * <p>Serialized with a {@code type} property, e.g. {@code {"type":"minLength","value":3}} or
 * {@code {"type":"enum","values":["draft","published"]}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Constraint.Regex.class, name = "regex"),
    @JsonSubTypes.Type(value = Constraint.MinLength.class, name = "minLength"),
    @JsonSubTypes.Type(value = Constraint.MaxLength.class, name = "maxLength"),
    @JsonSubTypes.Type(value = Constraint.Min.class, name = "min"),
    @JsonSubTypes.Type(value = Constraint.Max.class, name = "max"),
    @JsonSubTypes.Type(value = Constraint.Enumeration.class, name = "enum")
})
public sealed interface Constraint
    permits Constraint.Regex, Constraint.MinLength, Constraint.MaxLength,
            Constraint.Min, Constraint.Max, Constraint.Enumeration {

    /**
     * Returns the kind of this constraint.
     *
     * @return constraint kind
     */
    @JsonIgnore
    ConstraintKind kind();

    /**
     * Raw regular expression, stored verbatim.
     *
     * @param value pattern source
     */
    record Regex(String value) implements Constraint {
        public Regex {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public ConstraintKind kind() {
            return ConstraintKind.REGEX;
        }
    }

    /**
     * Minimum string length.
     *
     * @param value minimum length
     */
    record MinLength(int value) implements Constraint {
        @Override
        public ConstraintKind kind() {
            return ConstraintKind.MIN_LENGTH;
        }
    }

    /**
     * Maximum string length.
     *
     * @param value maximum length
     */
    record MaxLength(int value) implements Constraint {
        @Override
        public ConstraintKind kind() {
            return ConstraintKind.MAX_LENGTH;
        }
    }

    /**
     * Minimum numeric value.
     *
     * @param value lower bound
     */
    record Min(double value) implements Constraint {
        @Override
        public ConstraintKind kind() {
            return ConstraintKind.MIN;
        }
    }

    /**
     * Maximum numeric value.
     *
     * @param value upper bound
     */
    record Max(double value) implements Constraint {
        @Override
        public ConstraintKind kind() {
            return ConstraintKind.MAX;
        }
    }

    /**
     * Closed set of allowed values.
     *
     * @param values allowed values
     */
    record Enumeration(List<String> values) implements Constraint {
        public Enumeration {
            values = Immutables.list(values);
        }

        @Override
        public ConstraintKind kind() {
            return ConstraintKind.ENUM;
        }
    }
}
