package com.architekt.core.attribute;

/**
 * Character ranges offered by the {@link RegexBuilder}, in the order they are merged.
 */
public enum CharacterClass {
    LOWERCASE("a-z"),
    UPPERCASE("A-Z"),
    DIGITS("0-9"),
    HEXADECIMAL("A-Fa-f0-9"),
    PRINTABLE_ASCII("\\x20-\\x7E");

    private final String fragment;

    CharacterClass(String fragment) {
        this.fragment = fragment;
    }

    /**
     * Returns the range as written inside a bracket expression.
     *
     * @return range fragment (e.g., "a-z")
     */
    public String fragment() {
        return fragment;
    }
}
