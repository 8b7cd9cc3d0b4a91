package com.architekt.core.error;

/**
 * Base type of the errors raised by the consistency engine.
 *
 * <p>Each subtype declares the HTTP status an API boundary is expected to answer with,
 * so callers can translate errors without inspecting their messages.
 */
public abstract class ArchitektException extends RuntimeException {

    protected ArchitektException(String message) {
        super(message);
    }

    /**
     * Returns the HTTP status this error maps to at the API boundary.
     *
     * @return HTTP status code
     */
    public abstract int httpStatus();
}
