package com.architekt.core.util;

import java.util.UUID;

/**
 * Mints identifiers for every entity in a project aggregate.
 *
 * <p>Identifiers are random UUIDs. They are never derived from names and never reused
 * after the entity they identified has been deleted.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * String systemId = IdGenerator.newId();
 * }</pre>
 */
public final class IdGenerator {

    private IdGenerator() {
        // Utility class
    }

    /**
     * Generates a new random identifier.
     *
     * @return 36 character UUID string
     */
    public static String newId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Returns the given id when it is usable, otherwise mints a new one.
     *
     * @param candidate existing id, may be null or blank
     * @return candidate when non-blank, a fresh id otherwise
     */
    public static String orNew(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return newId();
        }
        return candidate;
    }
}
