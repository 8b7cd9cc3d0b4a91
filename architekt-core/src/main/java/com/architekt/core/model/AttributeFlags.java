package com.architekt.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Boolean markers of an {@link Attribute}.
 *
 * @param required value must be present
 * @param unique value must be unique across instances
 * @param readOnly value cannot be written by clients
 * @param encrypted value is stored encrypted
 * @param isPrivate value is never exposed externally (JSON key {@code private})
 */
public record AttributeFlags(
    @JsonProperty("required") boolean required,
    @JsonProperty("unique") boolean unique,
    @JsonProperty("readOnly") boolean readOnly,
    @JsonProperty("encrypted") boolean encrypted,
    @JsonProperty("private") boolean isPrivate
) {
    private static final AttributeFlags NONE = new AttributeFlags(false, false, false, false, false);

    /**
     * Returns flags with every marker unset.
     *
     * @return empty flags
     */
    public static AttributeFlags none() {
        return NONE;
    }
}
