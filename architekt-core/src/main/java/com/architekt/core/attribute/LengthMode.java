package com.architekt.core.attribute;

/**
 * Quantifier style produced by the {@link RegexBuilder}.
 */
public enum LengthMode {
    /** One or more characters ({@code +}). */
    NONE,
    /** Exactly n characters ({@code {n}}). */
    EXACT,
    /** Between min and an optional max characters ({@code {min,}} or {@code {min,max}}). */
    RANGE
}
