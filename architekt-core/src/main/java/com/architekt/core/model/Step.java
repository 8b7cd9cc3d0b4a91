package com.architekt.core.model;

import com.architekt.core.util.Tags;

import java.util.List;

/**
 * One interaction of a {@link Flow}.
 *
 * @param id step id, null until the flow is first saved
 * @param name step name, unique within its flow (trimmed, case-insensitive)
 * @param description optional description
 * @param tags normalized tags
 * @param source source endpoint, null while unset
 * @param target target endpoint, null while unset
 * @param alternateFlowIds ids of flows taken as branch or fallback paths
 */
public record Step(
    String id,
    String name,
    String description,
    List<String> tags,
    StepEndpoint source,
    StepEndpoint target,
    List<String> alternateFlowIds
) {
    /**
     * Compact constructor with defaults.
     */
    public Step {
        tags = Tags.normalize(tags);
        alternateFlowIds = Tags.normalize(alternateFlowIds);
    }

    /**
     * Creates an unsaved step between two systems.
     *
     * @param name step name
     * @param sourceSystemId source system id
     * @param targetSystemId target system id
     * @return new draft step
     */
    public static Step between(String name, String sourceSystemId, String targetSystemId) {
        return new Step(null, name, null, List.of(),
            StepEndpoint.system(sourceSystemId), StepEndpoint.system(targetSystemId), List.of());
    }

    public Step withId(String newId) {
        return new Step(newId, name, description, tags, source, target, alternateFlowIds);
    }

    public Step withName(String newName) {
        return new Step(id, newName, description, tags, source, target, alternateFlowIds);
    }

    public Step withAlternateFlowIds(List<String> newAlternateFlowIds) {
        return new Step(id, name, description, tags, source, target, newAlternateFlowIds);
    }
}
