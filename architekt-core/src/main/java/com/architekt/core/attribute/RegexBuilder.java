package com.architekt.core.attribute;

import com.architekt.core.error.ValidationException;
import com.architekt.core.model.Constraint;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Builds simple anchored patterns of the form {@code ^[classes]quantifier$} for a
 * {@code regex} constraint.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * String pattern = RegexBuilder.build(RegexOptions.range(
 *     EnumSet.of(CharacterClass.LOWERCASE, CharacterClass.DIGITS), "3", "8"));
 * // ^[a-z0-9]{3,8}$
 * }</pre>
 */
public final class RegexBuilder {

    private RegexBuilder() {
        // Utility class
    }

    /**
     * Builds the pattern.
     *
     * @param options builder input
     * @return anchored pattern
     * @throws ValidationException if no class is selected or the length bounds are invalid
     */
    public static String build(RegexOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        if (options.characterClasses().isEmpty()) {
            throw ValidationException.of("Select at least one character option.");
        }

        String quantifier = quantifier(options);

        Set<String> fragments = new LinkedHashSet<>();
        for (CharacterClass characterClass : CharacterClass.values()) {
            if (options.characterClasses().contains(characterClass)) {
                fragments.add(characterClass.fragment());
            }
        }
        return "^[" + String.join("", fragments) + "]" + quantifier + "$";
    }

    /**
     * Builds the pattern and wraps it in a regex constraint.
     *
     * @param options builder input
     * @return regex constraint
     * @throws ValidationException if the options are invalid
     */
    public static Constraint.Regex toConstraint(RegexOptions options) {
        return new Constraint.Regex(build(options));
    }

    private static String quantifier(RegexOptions options) {
        return switch (options.lengthMode()) {
            case NONE -> "+";
            case EXACT -> {
                Integer exact = NumericInput.parseInteger(options.exactLength());
                if (exact == null || exact <= 0) {
                    throw ValidationException.of("Enter a positive integer for exact length.");
                }
                yield "{" + exact + "}";
            }
            case RANGE -> {
                String rawMin = options.minLength() == null ? "" : options.minLength().trim();
                String rawMax = options.maxLength() == null ? "" : options.maxLength().trim();

                Integer min = rawMin.isEmpty() ? Integer.valueOf(0) : NumericInput.parseInteger(rawMin);
                if (min == null || min < 0) {
                    throw ValidationException.of("Enter a non-negative integer for minimum length.");
                }
                if (rawMax.isEmpty()) {
                    yield "{" + min + ",}";
                }
                Integer max = NumericInput.parseInteger(rawMax);
                if (max == null || max < min) {
                    throw ValidationException.of(
                        "Maximum length must be an integer greater than or equal to minimum length.");
                }
                yield "{" + min + "," + max + "}";
            }
        };
    }
}
