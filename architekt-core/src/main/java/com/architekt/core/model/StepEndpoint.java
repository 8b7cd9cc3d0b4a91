package com.architekt.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Source or target of a {@link Step}.
 *
 * <p>A step endpoint is either a system of the project or an entry point of a component.
 * Serialized with a {@code kind} property:
 * <pre>{@code
 * {"kind": "system", "systemId": "..."}
 * {"kind": "entryPoint", "componentId": "...", "entryPointId": "..."}
 * }</pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = StepEndpoint.SystemRef.class, name = "system"),
    @JsonSubTypes.Type(value = StepEndpoint.EntryPointRef.class, name = "entryPoint")
})
public sealed interface StepEndpoint permits StepEndpoint.SystemRef, StepEndpoint.EntryPointRef {

    /**
     * Creates a system endpoint.
     *
     * @param systemId referenced system id
     * @return endpoint
     */
    static StepEndpoint system(String systemId) {
        return new SystemRef(systemId);
    }

    /**
     * Creates a component endpoint, optionally narrowed to one of its entry points.
     *
     * @param componentId referenced component id
     * @param entryPointId referenced entry point id, may be null
     * @return endpoint
     */
    static StepEndpoint entryPoint(String componentId, String entryPointId) {
        return new EntryPointRef(componentId, entryPointId);
    }

    /**
     * Reference to a system.
     *
     * @param systemId referenced system id
     */
    record SystemRef(String systemId) implements StepEndpoint {
    }

    /**
     * Reference to a component and, optionally, one of its entry points.
     *
     * @param componentId referenced component id
     * @param entryPointId referenced entry point id, may be null
     */
    record EntryPointRef(String componentId, String entryPointId) implements StepEndpoint {
    }
}
