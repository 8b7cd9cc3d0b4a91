package com.architekt.core.attribute;

import java.util.Objects;
import java.util.Set;

/**
 * Input of the {@link RegexBuilder}, as typed into an authoring form.
 *
 * <p>Lengths are kept as raw strings so that malformed input can be reported with the
 * builder's own messages.
 *
 * @param characterClasses selected character classes
 * @param lengthMode quantifier style
 * @param exactLength length for {@link LengthMode#EXACT}
 * @param minLength lower bound for {@link LengthMode#RANGE}; blank means 0
 * @param maxLength optional upper bound for {@link LengthMode#RANGE}
 */
public record RegexOptions(
    Set<CharacterClass> characterClasses,
    LengthMode lengthMode,
    String exactLength,
    String minLength,
    String maxLength
) {
    /**
     * Compact constructor with defaults.
     */
    public RegexOptions {
        characterClasses = characterClasses == null ? Set.of() : Set.copyOf(characterClasses);
        lengthMode = Objects.requireNonNullElse(lengthMode, LengthMode.NONE);
    }

    public static RegexOptions unbounded(Set<CharacterClass> characterClasses) {
        return new RegexOptions(characterClasses, LengthMode.NONE, null, null, null);
    }

    public static RegexOptions exact(Set<CharacterClass> characterClasses, String length) {
        return new RegexOptions(characterClasses, LengthMode.EXACT, length, null, null);
    }

    public static RegexOptions range(Set<CharacterClass> characterClasses, String min, String max) {
        return new RegexOptions(characterClasses, LengthMode.RANGE, null, min, max);
    }
}
