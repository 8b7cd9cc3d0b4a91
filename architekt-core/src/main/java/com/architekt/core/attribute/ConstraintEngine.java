package com.architekt.core.attribute;

import com.architekt.core.error.ValidationException;
import com.architekt.core.model.Attribute;
import com.architekt.core.model.AttributeType;
import com.architekt.core.model.Constraint;
import com.architekt.core.model.ConstraintKind;
import com.architekt.core.util.Tags;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Type-dependent constraint rules for attributes.
 *
 * <p>Legal kinds per type:
 * <ul>
 *   <li>{@code string}: regex, minLength, maxLength, enum</li>
 *   <li>{@code number}, {@code integer}: min, max, enum</li>
 *   <li>any other type: enum</li>
 * </ul>
 *
 * <p>Authoring operations ({@link #parse}, {@link #addConstraint}) fail fast with a
 * {@link ValidationException}; {@link #validate} collects every problem of an existing
 * attribute.
 */
public final class ConstraintEngine {

    private ConstraintEngine() {
        // Utility class
    }

    /**
     * Returns the constraint kinds legal for a type.
     *
     * @param type attribute type, may be null for an incomplete draft
     * @return legal kinds (empty when the type is null)
     */
    public static Set<ConstraintKind> legalConstraintKinds(AttributeType type) {
        if (type == null) {
            return Collections.unmodifiableSet(EnumSet.noneOf(ConstraintKind.class));
        }
        EnumSet<ConstraintKind> kinds = switch (type) {
            case STRING -> EnumSet.of(ConstraintKind.REGEX, ConstraintKind.MIN_LENGTH, ConstraintKind.MAX_LENGTH);
            case NUMBER, INTEGER -> EnumSet.of(ConstraintKind.MIN, ConstraintKind.MAX);
            default -> EnumSet.noneOf(ConstraintKind.class);
        };
        kinds.add(ConstraintKind.ENUM);
        return Collections.unmodifiableSet(kinds);
    }

    /**
     * Checks whether a constraint kind is legal for a type.
     *
     * @param type attribute type
     * @param kind constraint kind
     * @return true when legal
     */
    public static boolean isLegal(AttributeType type, ConstraintKind kind) {
        return legalConstraintKinds(type).contains(kind);
    }

    /**
     * Builds a constraint from a raw form value.
     *
     * <p>{@code regex} keeps the pattern verbatim; {@code minLength}/{@code maxLength} need a
     * non-negative integer; {@code min}/{@code max} need a finite number; {@code enum} splits on
     * commas or newlines, trims and de-duplicates, and needs at least one value.
     *
     * @param kind constraint kind
     * @param rawValue raw input
     * @return constraint
     * @throws ValidationException if the value is invalid for the kind
     */
    public static Constraint parse(ConstraintKind kind, String rawValue) {
        Objects.requireNonNull(kind, "kind must not be null");
        return switch (kind) {
            case REGEX -> {
                if (rawValue == null || rawValue.isEmpty()) {
                    throw ValidationException.of("Regex pattern is required.");
                }
                yield new Constraint.Regex(rawValue);
            }
            case MIN_LENGTH -> new Constraint.MinLength(requireLength(rawValue, "Minimum length"));
            case MAX_LENGTH -> new Constraint.MaxLength(requireLength(rawValue, "Maximum length"));
            case MIN -> new Constraint.Min(requireFinite(rawValue, "Minimum value"));
            case MAX -> new Constraint.Max(requireFinite(rawValue, "Maximum value"));
            case ENUM -> {
                List<String> values = Tags.split(rawValue);
                if (values.isEmpty()) {
                    throw ValidationException.of("Enum requires at least one value.");
                }
                yield new Constraint.Enumeration(values);
            }
        };
    }

    /**
     * Attaches a constraint to an attribute.
     *
     * @param attribute attribute to modify
     * @param constraint constraint to attach
     * @return attribute with the constraint appended
     * @throws ValidationException if the kind is illegal for the attribute's type, already
     *         present, or the value is invalid
     */
    public static Attribute addConstraint(Attribute attribute, Constraint constraint) {
        Objects.requireNonNull(constraint, "constraint must not be null");
        ConstraintKind kind = constraint.kind();
        if (!isLegal(attribute.type(), kind)) {
            throw ValidationException.of(illegalMessage(attribute.type(), kind));
        }
        if (find(attribute, kind).isPresent()) {
            throw ValidationException.of(duplicateMessage(kind));
        }
        validateValue(constraint).ifPresent(message -> {
            throw ValidationException.of(message);
        });
        List<Constraint> constraints = new ArrayList<>(attribute.constraints());
        constraints.add(constraint);
        return attribute.withConstraints(constraints);
    }

    /**
     * Detaches the constraint of the given kind, if any.
     *
     * @param attribute attribute to modify
     * @param kind kind to remove
     * @return attribute without a constraint of that kind
     */
    public static Attribute removeConstraint(Attribute attribute, ConstraintKind kind) {
        return attribute.withConstraints(attribute.constraints().stream()
            .filter(constraint -> constraint.kind() != kind)
            .toList());
    }

    /**
     * Changes an attribute's type.
     *
     * <p>Clears every constraint and drops the element definition unless the new type is
     * {@code array}.
     *
     * @param attribute attribute to modify
     * @param newType new type
     * @return retyped attribute, or the same attribute if the type is unchanged
     */
    public static Attribute changeType(Attribute attribute, AttributeType newType) {
        if (attribute.type() == newType) {
            return attribute;
        }
        Attribute retyped = attribute.withType(newType).withConstraints(List.of());
        if (newType != AttributeType.ARRAY) {
            retyped = retyped.withElement(null);
        }
        return retyped;
    }

    /**
     * Returns the constraint of a kind attached to an attribute.
     *
     * @param attribute attribute to inspect
     * @param kind kind to look up
     * @return constraint, empty if none
     */
    public static Optional<Constraint> find(Attribute attribute, ConstraintKind kind) {
        return attribute.constraints().stream()
            .filter(constraint -> constraint.kind() == kind)
            .findFirst();
    }

    /**
     * Checks the constraints of one attribute (not its children).
     *
     * @param attribute attribute to check
     * @return every problem found, empty when valid
     */
    public static List<String> validate(Attribute attribute) {
        List<String> errors = new ArrayList<>();
        Set<ConstraintKind> seen = EnumSet.noneOf(ConstraintKind.class);
        for (Constraint constraint : attribute.constraints()) {
            ConstraintKind kind = constraint.kind();
            if (!seen.add(kind)) {
                errors.add(duplicateMessage(kind));
                continue;
            }
            if (attribute.type() != null && !isLegal(attribute.type(), kind)) {
                errors.add(illegalMessage(attribute.type(), kind));
            }
            validateValue(constraint).ifPresent(errors::add);
        }

        Optional<Constraint> minLength = find(attribute, ConstraintKind.MIN_LENGTH);
        Optional<Constraint> maxLength = find(attribute, ConstraintKind.MAX_LENGTH);
        if (minLength.isPresent() && maxLength.isPresent()
            && ((Constraint.MinLength) minLength.get()).value() > ((Constraint.MaxLength) maxLength.get()).value()) {
            errors.add("Minimum length cannot exceed maximum length.");
        }
        Optional<Constraint> min = find(attribute, ConstraintKind.MIN);
        Optional<Constraint> max = find(attribute, ConstraintKind.MAX);
        if (min.isPresent() && max.isPresent()
            && ((Constraint.Min) min.get()).value() > ((Constraint.Max) max.get()).value()) {
            errors.add("Minimum value cannot exceed maximum value.");
        }
        return errors;
    }

    private static Optional<String> validateValue(Constraint constraint) {
        if (constraint instanceof Constraint.Regex regex) {
            return regex.value().isEmpty() ? Optional.of("Regex pattern is required.") : Optional.empty();
        }
        if (constraint instanceof Constraint.MinLength minLength && minLength.value() < 0) {
            return Optional.of("Minimum length must be a non-negative integer.");
        }
        if (constraint instanceof Constraint.MaxLength maxLength && maxLength.value() < 0) {
            return Optional.of("Maximum length must be a non-negative integer.");
        }
        if (constraint instanceof Constraint.Min min && !Double.isFinite(min.value())) {
            return Optional.of("Minimum value must be a finite number.");
        }
        if (constraint instanceof Constraint.Max max && !Double.isFinite(max.value())) {
            return Optional.of("Maximum value must be a finite number.");
        }
        if (constraint instanceof Constraint.Enumeration enumeration && Tags.normalize(enumeration.values()).isEmpty()) {
            return Optional.of("Enum requires at least one value.");
        }
        return Optional.empty();
    }

    private static int requireLength(String rawValue, String label) {
        Integer value = NumericInput.parseInteger(rawValue);
        if (value == null || value < 0) {
            throw ValidationException.of(label + " must be a non-negative integer.");
        }
        return value;
    }

    private static double requireFinite(String rawValue, String label) {
        Double value = NumericInput.parseFinite(rawValue);
        if (value == null) {
            throw ValidationException.of(label + " must be a finite number.");
        }
        return value;
    }

    private static String illegalMessage(AttributeType type, ConstraintKind kind) {
        String typeName = type == null ? "untyped" : type.jsonName();
        return "Constraint '" + kind.jsonName() + "' is not allowed for " + typeName + " attributes.";
    }

    private static String duplicateMessage(ConstraintKind kind) {
        return "Only one '" + kind.jsonName() + "' constraint is allowed per attribute.";
    }
}
