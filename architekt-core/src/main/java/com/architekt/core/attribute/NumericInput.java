package com.architekt.core.attribute;

import java.math.BigDecimal;

/**
 * Parses numbers typed into authoring forms.
 */
final class NumericInput {

    private NumericInput() {
        // Utility class
    }

    /**
     * Parses an integral value such as {@code "3"} or {@code "3.0"}.
     *
     * @param raw raw input
     * @return parsed value, or null if blank, fractional, malformed or out of int range
     */
    static Integer parseInteger(String raw) {
        BigDecimal value = parseDecimal(raw);
        if (value == null) {
            return null;
        }
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    /**
     * Parses a finite number.
     *
     * @param raw raw input
     * @return parsed value, or null if blank, malformed or not finite
     */
    static Double parseFinite(String raw) {
        BigDecimal value = parseDecimal(raw);
        if (value == null) {
            return null;
        }
        double result = value.doubleValue();
        return Double.isFinite(result) ? result : null;
    }

    private static BigDecimal parseDecimal(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
