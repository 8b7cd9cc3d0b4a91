package com.architekt.core.persistence;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared Jackson configuration for aggregate documents.
 */
public final class AggregateJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private AggregateJson() {
        // Utility class
    }

    /**
     * Returns the mapper used for aggregate documents and model JSON files.
     *
     * @return shared, thread-safe mapper
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
